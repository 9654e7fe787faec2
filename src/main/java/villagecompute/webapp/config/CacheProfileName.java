package villagecompute.webapp.config;

/**
 * Names of the cache profiles declared under {@code villagecompute.cache.profiles}.
 */
public final class CacheProfileName {

    /**
     * Serialized sitemap documents.
     */
    public static final String SITEMAP_NODES = "sitemap-nodes";

    private CacheProfileName() {
    }
}
