package villagecompute.webapp.api.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import villagecompute.webapp.config.CacheProfileConfig;
import villagecompute.webapp.config.CacheProfileName;
import villagecompute.webapp.observability.LoggingConfig;
import villagecompute.webapp.routing.Route;
import villagecompute.webapp.routing.RouteUrlResolver;
import villagecompute.webapp.services.SitemapService;

import java.util.Optional;

/**
 * Crawler-facing endpoints.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>GET /sitemap.xml – root sitemap or sitemap index</li>
 * <li>GET /sitemap.xml?index={n} – one document of a split sitemap (404 when out of range)</li>
 * <li>GET /robots.txt – allows all crawlers and advertises the sitemap</li>
 * </ul>
 *
 * <p>
 * Responses carry {@code Cache-Control: public, max-age} from the {@code sitemap-nodes} cache profile.
 */
@Path("/")
public class SitemapResource {

    private static final Logger LOG = Logger.getLogger(SitemapResource.class);

    @Inject
    SitemapService sitemapService;

    @Inject
    RouteUrlResolver routeUrlResolver;

    @Inject
    CacheProfileConfig cacheProfileConfig;

    /**
     * Returns sitemap XML.
     *
     * @param index
     *            zero-based document index; absent for the root document. Negative, non-numeric and overflowing
     *            values yield 404.
     * @return 200 with XML, or 404
     */
    @GET
    @Path("sitemap.xml")
    @Produces(MediaType.APPLICATION_XML)
    public Response getSitemapXml(@QueryParam("index") String index) {
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setRequestOrigin(Route.SITEMAP_XML.path());
        try {
            Integer documentIndex = null;
            if (index != null && !index.isBlank()) {
                try {
                    documentIndex = Integer.valueOf(index.trim());
                } catch (NumberFormatException e) {
                    LOG.debugf("Rejecting sitemap index '%s': not an int", index);
                    return Response.status(Response.Status.NOT_FOUND).build();
                }
            }

            Optional<String> xml = sitemapService.getSitemapXml(documentIndex);
            if (xml.isEmpty()) {
                return Response.status(Response.Status.NOT_FOUND).build();
            }
            return Response.ok(xml.get(), MediaType.APPLICATION_XML_TYPE.withCharset("UTF-8"))
                    .header(HttpHeaders.CACHE_CONTROL, publicCacheControl()).build();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    /**
     * Returns robots.txt pointing crawlers at the sitemap.
     *
     * @return plain text robots file
     */
    @GET
    @Path("robots.txt")
    @Produces(MediaType.TEXT_PLAIN)
    public Response getRobotsTxt() {
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setRequestOrigin(Route.ROBOTS_TXT.path());
        try {
            String robots = "User-agent: *\nDisallow:\nSitemap: " + routeUrlResolver.toAbsoluteUrl(Route.SITEMAP_XML)
                    + "\n";
            return Response.ok(robots, MediaType.TEXT_PLAIN_TYPE.withCharset("UTF-8"))
                    .header(HttpHeaders.CACHE_CONTROL, publicCacheControl()).build();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    private String publicCacheControl() {
        long maxAge = cacheProfileConfig.profile(CacheProfileName.SITEMAP_NODES).duration().getSeconds();
        return "public, max-age=" + maxAge;
    }
}
