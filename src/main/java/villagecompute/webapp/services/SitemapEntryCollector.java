package villagecompute.webapp.services;

import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.arc.All;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.webapp.api.types.SitemapEntryType;
import villagecompute.webapp.routing.RouteUrlResolver;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the sitemap entries of the site from every {@link SitemapEntrySource}.
 *
 * <p>
 * Entries are resolved one at a time. A node whose URL cannot be built (or whose values are out of range) is logged at
 * WARN and left out, so one broken route never takes the whole sitemap down. The same holds for a source that fails
 * outright: its nodes are skipped and the remaining sources are still consulted.
 */
@ApplicationScoped
public class SitemapEntryCollector {

    private static final Logger LOG = Logger.getLogger(SitemapEntryCollector.class);

    @Inject
    @All
    List<SitemapEntrySource> sources;

    @Inject
    RouteUrlResolver routeUrlResolver;

    @Inject
    MeterRegistry meterRegistry;

    /**
     * Builds the sitemap entries in source order.
     *
     * @return entries with absolute URLs; never null, possibly empty
     */
    public List<SitemapEntryType> collectEntries() {
        List<SitemapEntryType> entries = new ArrayList<>();
        int skipped = 0;

        for (SitemapEntrySource source : sources) {
            List<SitemapRouteNode> nodes;
            try {
                nodes = source.nodes();
            } catch (RuntimeException e) {
                LOG.warnf(e, "Sitemap source %s failed, skipping its entries: %s", source.getClass().getSimpleName(),
                        e.getMessage());
                meterRegistry.counter("sitemap.sources.failed").increment();
                continue;
            }
            if (nodes == null) {
                LOG.warnf("Sitemap source %s returned no node list, skipping it", source.getClass().getSimpleName());
                meterRegistry.counter("sitemap.sources.failed").increment();
                continue;
            }

            for (SitemapRouteNode node : nodes) {
                try {
                    String location = routeUrlResolver.toAbsoluteUrl(node.route(), node.routeValues());
                    entries.add(new SitemapEntryType(location, node.priority(), node.lastModified(),
                            node.changeFrequency()));
                } catch (RuntimeException e) {
                    skipped++;
                    LOG.warnf(e, "Skipping sitemap entry for route %s: %s", node.route(), e.getMessage());
                }
            }
        }

        if (skipped > 0) {
            meterRegistry.counter("sitemap.entries.skipped").increment(skipped);
        }
        LOG.debugf("Collected %d sitemap entries (%d skipped)", entries.size(), skipped);
        return entries;
    }
}
