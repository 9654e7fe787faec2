package villagecompute.webapp.services;

import io.quarkus.qute.Location;
import io.quarkus.qute.Template;
import io.quarkus.qute.TemplateData;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.webapp.api.types.SitemapEntryType;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Renders sitemaps.org 0.9 XML documents with Qute.
 *
 * <p>
 * Templates live in {@code templates/sitemap/}. Both produce deterministic output for the same input: no generation
 * timestamp is written, so regenerated documents are byte-identical to cached ones.
 *
 * <p>
 * <b>Formats:</b>
 * <ul>
 * <li>{@code <lastmod>}: ISO 8601 date (YYYY-MM-DD) in UTC</li>
 * <li>{@code <priority>}: one or two decimals, locale independent (1.0, 0.9, 0.85)</li>
 * <li>{@code <changefreq>}: lowercase protocol value</li>
 * </ul>
 */
@ApplicationScoped
public class SitemapXmlWriter {

    private static final Logger LOG = Logger.getLogger(SitemapXmlWriter.class);

    private static final DateTimeFormatter ISO_DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd")
            .withZone(ZoneOffset.UTC);

    @Inject
    @Location("sitemap/urlset.xml")
    Template urlsetTemplate;

    @Inject
    @Location("sitemap/sitemapindex.xml")
    Template sitemapIndexTemplate;

    /**
     * Renders a {@code <urlset>} document.
     *
     * @param entries
     *            entries in output order
     * @return sitemap XML
     */
    public String writeUrlSet(List<SitemapEntryType> entries) {
        List<UrlView> urls = entries.stream().map(SitemapXmlWriter::toView).toList();
        String xml = urlsetTemplate.data("urls", urls).render();
        LOG.debugf("Rendered sitemap with %d URLs (%d chars)", urls.size(), xml.length());
        return xml;
    }

    /**
     * Renders a {@code <sitemapindex>} document.
     *
     * @param sitemapUrls
     *            absolute URLs of the referenced sitemaps
     * @return sitemap index XML
     */
    public String writeSitemapIndex(List<String> sitemapUrls) {
        String xml = sitemapIndexTemplate.data("sitemapUrls", sitemapUrls).render();
        LOG.debugf("Rendered sitemap index referencing %d sitemaps", sitemapUrls.size());
        return xml;
    }

    private static UrlView toView(SitemapEntryType entry) {
        return new UrlView(entry.location(), formatDate(entry.lastModified()),
                entry.changeFrequency() == null ? null : entry.changeFrequency().value(),
                formatPriority(entry.priority()));
    }

    private static String formatDate(Instant instant) {
        return instant == null ? null : ISO_DATE_FORMATTER.format(instant);
    }

    static String formatPriority(Double priority) {
        if (priority == null) {
            return null;
        }
        // DecimalFormat is not thread-safe
        return new DecimalFormat("0.0#", DecimalFormatSymbols.getInstance(Locale.ROOT)).format(priority);
    }

    /**
     * Preformatted values of one {@code <url>} element; null fields are omitted from the output.
     */
    @TemplateData
    public record UrlView(String loc, String lastmod, String changefreq, String priority) {
    }
}
