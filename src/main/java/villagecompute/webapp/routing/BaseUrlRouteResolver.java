package villagecompute.webapp.routing;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.webapp.config.SiteConfig;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * {@link RouteUrlResolver} that prefixes route paths with the configured public base URL.
 *
 * <p>
 * Route values become URL-encoded query parameters sorted by name, so the same inputs always yield the same URL. The
 * base URL may or may not end with a slash.
 *
 * @see SiteConfig#baseUrl()
 */
@ApplicationScoped
public class BaseUrlRouteResolver implements RouteUrlResolver {

    @Inject
    SiteConfig siteConfig;

    @Override
    public String toAbsoluteUrl(Route route, Map<String, ?> routeValues) {
        String baseUrl = siteConfig.baseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("villagecompute.webapp.base-url is not configured");
        }
        String origin = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;

        StringBuilder url = new StringBuilder(origin).append(route.path());
        if (routeValues != null && !routeValues.isEmpty()) {
            StringJoiner query = new StringJoiner("&", "?", "");
            new TreeMap<String, Object>(routeValues).forEach((name, value) -> {
                if (value == null) {
                    throw new IllegalArgumentException("Route value '" + name + "' of " + route + " is null");
                }
                query.add(encode(name) + "=" + encode(value.toString()));
            });
            url.append(query);
        }

        URI uri = URI.create(url.toString());
        if (!("http".equals(uri.getScheme()) || "https".equals(uri.getScheme())) || uri.getHost() == null) {
            throw new IllegalArgumentException("Route " + route + " did not resolve to an absolute http(s) URL: " + uri);
        }
        return uri.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
