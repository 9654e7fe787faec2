package villagecompute.webapp.services;

import com.fasterxml.jackson.core.type.TypeReference;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.webapp.api.types.SitemapDocumentSetType;
import villagecompute.webapp.api.types.SitemapEntryType;
import villagecompute.webapp.config.CacheProfileConfig;
import villagecompute.webapp.config.CacheProfileName;
import villagecompute.webapp.exceptions.CacheAccessException;
import villagecompute.webapp.integration.cache.CacheEntryOptions;
import villagecompute.webapp.integration.cache.JsonCacheClient;
import villagecompute.webapp.routing.Route;
import villagecompute.webapp.routing.RouteUrlResolver;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Serves the sitemap XML of the site using a cache-aside strategy.
 * <p>
 * The whole set of sitemap documents is cached as one unit under {@link #CACHE_KEY} with a sliding expiration taken
 * from the {@code sitemap-nodes} cache profile. Caching the set rather than single documents keeps the index and the
 * sitemaps it links to in sync when the number of documents changes.
 * <p>
 * <b>Document layout:</b>
 * <ul>
 * <li>Up to 25,000 URLs: one {@code <urlset>} document at index 0</li>
 * <li>More than 25,000 URLs: a {@code <sitemapindex>} at index 0 linking to {@code /sitemap.xml?index=1..n}, followed
 * by the n partial sitemaps</li>
 * </ul>
 * <p>
 * <b>Concurrency:</b> population is not locked. Concurrent misses each regenerate and the last write wins; output is a
 * deterministic function of configuration, so the only cost is redundant work.
 * <p>
 * <b>Failure handling:</b> a cache that cannot be read is treated as a miss, and a failed write only loses the
 * caching. Both are logged at WARN and counted in {@code sitemap.cache.errors}.
 *
 * @see <a href="https://www.sitemaps.org/protocol.html">sitemaps.org protocol</a>
 */
@ApplicationScoped
public class SitemapService {

    private static final Logger LOG = Logger.getLogger(SitemapService.class);

    /**
     * Cache key of the serialized document set.
     */
    static final String CACHE_KEY = "SitemapNodes";

    static final int MAX_URLS_PER_SITEMAP = 25000;

    private static final TypeReference<List<String>> DOCUMENTS_TYPE = new TypeReference<>() {
    };

    @Inject
    SitemapEntryCollector entryCollector;

    @Inject
    SitemapXmlWriter xmlWriter;

    @Inject
    JsonCacheClient cacheClient;

    @Inject
    RouteUrlResolver routeUrlResolver;

    @Inject
    CacheProfileConfig cacheProfileConfig;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    Tracer tracer;

    /**
     * Gets the sitemap XML for the current site.
     * <p>
     * Without an index the root document is returned: the sitemap index when the site has more than 25,000 URLs,
     * otherwise the single sitemap. With an index the document at that position is returned.
     *
     * @param index
     *            zero-based document index, or null for the root document
     * @return the XML, or empty if {@code index} is out of range
     */
    public Optional<String> getSitemapXml(Integer index) {
        Span span = tracer.spanBuilder("sitemap.get_document").startSpan();

        try (Scope ignored = span.makeCurrent()) {
            SitemapDocumentSetType documents = getSitemapDocuments();
            span.setAttribute("document_count", documents.size());

            if (index != null && !documents.contains(index)) {
                LOG.debugf("Sitemap index %d out of range (%d documents)", index.intValue(), documents.size());
                span.setAttribute("found", false);
                return Optional.empty();
            }

            span.setAttribute("found", true);
            return Optional.of(documents.document(index == null ? 0 : index));

        } finally {
            span.end();
        }
    }

    /**
     * Returns the cached document set, generating and caching it on a miss.
     *
     * @return document set (never empty)
     */
    SitemapDocumentSetType getSitemapDocuments() {
        Optional<List<String>> cached = readCachedDocuments();
        if (cached.isPresent() && !cached.get().isEmpty()) {
            meterRegistry.counter("sitemap.cache.hit").increment();
            return new SitemapDocumentSetType(cached.get());
        }

        meterRegistry.counter("sitemap.cache.miss").increment();
        List<SitemapEntryType> entries = entryCollector.collectEntries();
        SitemapDocumentSetType documents = buildDocuments(entries);
        writeCachedDocuments(documents);

        LOG.infof("Generated %d sitemap document(s) for %d URLs", documents.size(), entries.size());
        return documents;
    }

    /**
     * Partitions entries into sitemap documents and renders them.
     *
     * @param entries
     *            all sitemap entries in output order
     * @return rendered document set
     */
    SitemapDocumentSetType buildDocuments(List<SitemapEntryType> entries) {
        Span span = tracer.spanBuilder("sitemap.generate").setAttribute("url_count", entries.size()).startSpan();

        try (Scope ignored = span.makeCurrent()) {
            if (entries.size() <= MAX_URLS_PER_SITEMAP) {
                span.setAttribute("split", false);
                return new SitemapDocumentSetType(List.of(xmlWriter.writeUrlSet(entries)));
            }

            int chunks = (int) Math.ceil((double) entries.size() / MAX_URLS_PER_SITEMAP);
            span.setAttribute("split", true);
            span.setAttribute("sitemap_count", chunks);
            LOG.infof("Splitting %d URLs into %d sitemap files", entries.size(), chunks);

            List<String> sitemapUrls = new ArrayList<>(chunks);
            List<String> sitemaps = new ArrayList<>(chunks);
            for (int i = 0; i < chunks; i++) {
                int fromIndex = i * MAX_URLS_PER_SITEMAP;
                int toIndex = Math.min(fromIndex + MAX_URLS_PER_SITEMAP, entries.size());
                sitemaps.add(xmlWriter.writeUrlSet(entries.subList(fromIndex, toIndex)));
                // index 0 is the sitemap index itself
                sitemapUrls.add(routeUrlResolver.toAbsoluteUrl(Route.SITEMAP_XML, Map.of("index", i + 1)));
            }

            List<String> documents = new ArrayList<>(chunks + 1);
            documents.add(xmlWriter.writeSitemapIndex(sitemapUrls));
            documents.addAll(sitemaps);
            return new SitemapDocumentSetType(documents);

        } finally {
            span.end();
        }
    }

    /**
     * @return sliding expiration of the sitemap cache profile
     */
    Duration cacheSlidingExpiration() {
        return cacheProfileConfig.profile(CacheProfileName.SITEMAP_NODES).duration();
    }

    private Optional<List<String>> readCachedDocuments() {
        try {
            return cacheClient.tryGet(CACHE_KEY, DOCUMENTS_TYPE);
        } catch (CacheAccessException e) {
            meterRegistry.counter("sitemap.cache.errors", "operation", "read").increment();
            LOG.warnf(e, "Sitemap cache read failed, regenerating: %s", e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCachedDocuments(SitemapDocumentSetType documents) {
        try {
            cacheClient.set(CACHE_KEY, documents.documents(), CacheEntryOptions.sliding(cacheSlidingExpiration()));
        } catch (CacheAccessException e) {
            meterRegistry.counter("sitemap.cache.errors", "operation", "write").increment();
            LOG.warnf(e, "Sitemap cache write failed, serving uncached documents: %s", e.getMessage());
        }
    }
}
