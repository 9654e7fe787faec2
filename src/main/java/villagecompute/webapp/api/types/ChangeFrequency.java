package villagecompute.webapp.api.types;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Expected change frequency of a sitemap URL, as defined by the sitemaps.org protocol.
 *
 * <p>
 * Crawlers treat the value as a hint only. The lowercase {@link #value()} is what appears inside
 * {@code <changefreq>}.
 */
public enum ChangeFrequency {
    ALWAYS, HOURLY, DAILY, WEEKLY, MONTHLY, YEARLY, NEVER;

    /**
     * @return protocol value (e.g., "daily")
     */
    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
