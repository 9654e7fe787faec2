package villagecompute.webapp.services;

import java.util.List;

/**
 * Contributes pages to the sitemap.
 *
 * <p>
 * Implement as a CDI bean to publish more pages, e.g. one node per catalog product. Sources are consulted in
 * {@code @Priority} order (highest first) and their nodes keep the order in which they are returned.
 *
 * @see SitemapEntryCollector
 */
public interface SitemapEntrySource {

    /**
     * @return pages to list; must not be null
     */
    List<SitemapRouteNode> nodes();
}
