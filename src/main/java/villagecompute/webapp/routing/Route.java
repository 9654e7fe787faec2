package villagecompute.webapp.routing;

/**
 * Named application routes. Resources declare their {@code @Path} with the same literals.
 */
public enum Route {
    HOME("/"), ABOUT("/about"), CONTACT("/contact"), SITEMAP_XML("/sitemap.xml"), ROBOTS_TXT("/robots.txt");

    private final String path;

    Route(String path) {
        this.path = path;
    }

    public String path() {
        return path;
    }
}
