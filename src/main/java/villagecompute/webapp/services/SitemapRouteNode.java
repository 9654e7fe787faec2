package villagecompute.webapp.services;

import villagecompute.webapp.api.types.ChangeFrequency;
import villagecompute.webapp.routing.Route;

import java.time.Instant;
import java.util.Map;

/**
 * A sitemap entry before its absolute URL is resolved.
 *
 * @param route
 *            route of the page
 * @param routeValues
 *            route values (query parameters) identifying the page
 * @param priority
 *            page importance (0.0 to 1.0), or null
 * @param lastModified
 *            last modification instant, or null
 * @param changeFrequency
 *            expected change frequency, or null
 */
public record SitemapRouteNode(Route route, Map<String, ?> routeValues, Double priority, Instant lastModified,
        ChangeFrequency changeFrequency) {

    public SitemapRouteNode {
        routeValues = routeValues == null ? Map.of() : Map.copyOf(routeValues);
    }

    public static SitemapRouteNode of(Route route, double priority) {
        return new SitemapRouteNode(route, Map.of(), priority, null, null);
    }
}
