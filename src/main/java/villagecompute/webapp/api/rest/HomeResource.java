package villagecompute.webapp.api.rest;

import io.quarkus.qute.CheckedTemplate;
import io.quarkus.qute.TemplateData;
import io.quarkus.qute.TemplateInstance;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;
import villagecompute.webapp.config.SiteConfig;
import villagecompute.webapp.observability.LoggingConfig;
import villagecompute.webapp.routing.Route;
import villagecompute.webapp.routing.RouteUrlResolver;

/**
 * Server-rendered static pages.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>GET / – home page</li>
 * <li>GET /about – about page</li>
 * <li>GET /contact – contact page</li>
 * </ul>
 *
 * <p>
 * Every page carries a canonical link built by {@link RouteUrlResolver}, the same URL the sitemap lists.
 */
@Path("/")
public class HomeResource {

    private static final Logger LOG = Logger.getLogger(HomeResource.class);

    @Inject
    SiteConfig siteConfig;

    @Inject
    RouteUrlResolver routeUrlResolver;

    /**
     * Type-safe Qute templates.
     */
    @CheckedTemplate(
            requireTypeSafeExpressions = false)
    public static class Templates {
        public static native TemplateInstance index(PageData page);

        public static native TemplateInstance about(PageData page);

        public static native TemplateInstance contact(PageData page);
    }

    @GET
    @Produces(MediaType.TEXT_HTML)
    public TemplateInstance index() {
        return Templates.index(pageData(Route.HOME, "Home"));
    }

    @GET
    @Path("about")
    @Produces(MediaType.TEXT_HTML)
    public TemplateInstance about() {
        return Templates.about(pageData(Route.ABOUT, "About"));
    }

    @GET
    @Path("contact")
    @Produces(MediaType.TEXT_HTML)
    public TemplateInstance contact() {
        return Templates.contact(pageData(Route.CONTACT, "Contact"));
    }

    private PageData pageData(Route route, String title) {
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setRequestOrigin(route.path());
        try {
            LOG.debugf("Rendering %s page", route);
            return new PageData(siteConfig.siteName(), title, routeUrlResolver.toAbsoluteUrl(route),
                    siteConfig.contactEmail());
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    /**
     * Data shared by all static page templates.
     *
     * @param siteName
     *            site display name
     * @param title
     *            page title
     * @param canonicalUrl
     *            absolute URL of the page
     * @param contactEmail
     *            public contact address
     */
    @TemplateData
    public record PageData(String siteName, String title, String canonicalUrl, String contactEmail) {
    }
}
