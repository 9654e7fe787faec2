package villagecompute.webapp.routing;

import java.util.Map;

/**
 * Resolves named routes to absolute URLs.
 */
public interface RouteUrlResolver {

    /**
     * Builds the absolute URL of a route.
     *
     * @param route
     *            the route
     * @param routeValues
     *            query parameters appended to the route path, in key order
     * @return absolute URL
     * @throws IllegalArgumentException
     *             if the result is not an absolute http(s) URL
     */
    String toAbsoluteUrl(Route route, Map<String, ?> routeValues);

    default String toAbsoluteUrl(Route route) {
        return toAbsoluteUrl(route, Map.of());
    }
}
