package villagecompute.webapp.api.types;

import java.net.URI;
import java.time.Instant;

/**
 * DTO for sitemap URL entries.
 * <p>
 * Represents a single URL entry in a sitemap XML file conforming to sitemaps.org protocol. Instances are immutable and
 * validated on construction, so a malformed entry never reaches the XML writer.
 *
 * @param location
 *            Absolute URL (must start with http:// or https://)
 * @param priority
 *            Page importance (0.0 to 1.0), {@code null} to omit the element
 * @param lastModified
 *            Last modification instant, {@code null} to omit the element
 * @param changeFrequency
 *            Expected change frequency, {@code null} to omit the element
 */
public record SitemapEntryType(String location, Double priority, Instant lastModified,
        ChangeFrequency changeFrequency) {

    public SitemapEntryType {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("Sitemap location must not be blank");
        }
        URI uri = URI.create(location);
        if (!uri.isAbsolute() || !("http".equals(uri.getScheme()) || "https".equals(uri.getScheme()))) {
            throw new IllegalArgumentException("Sitemap location must be an absolute http(s) URL: " + location);
        }
        if (priority != null && (priority.isNaN() || priority < 0.0 || priority > 1.0)) {
            throw new IllegalArgumentException("Sitemap priority must be between 0.0 and 1.0: " + priority);
        }
    }

    /**
     * Creates an entry with only a location and priority.
     */
    public static SitemapEntryType of(String location, double priority) {
        return new SitemapEntryType(location, priority, null, null);
    }
}
