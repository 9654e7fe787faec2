package villagecompute.webapp.services;

import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.webapp.routing.Route;

import java.util.List;

/**
 * Lists the static pages of the site: home (1.0), about (0.9) and contact (0.9).
 */
@ApplicationScoped
@Priority(1000)
public class StaticPageSitemapSource implements SitemapEntrySource {

    @Override
    public List<SitemapRouteNode> nodes() {
        return List.of(SitemapRouteNode.of(Route.HOME, 1.0), SitemapRouteNode.of(Route.ABOUT, 0.9),
                SitemapRouteNode.of(Route.CONTACT, 0.9));
    }
}
