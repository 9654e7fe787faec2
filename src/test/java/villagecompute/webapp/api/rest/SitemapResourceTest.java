package villagecompute.webapp.api.rest;

import static io.restassured.RestAssured.given;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

import io.quarkus.test.junit.QuarkusTest;
import villagecompute.webapp.routing.Route;

/**
 * HTTP tests for {@link SitemapResource}.
 *
 * <p>
 * The test profile sets {@code villagecompute.webapp.base-url=https://www.example.test} and a one hour
 * {@code sitemap-nodes} cache profile.
 */
@QuarkusTest
class SitemapResourceTest {

    @Test
    void testGetSitemapXml_rootDocument() {
        given().when().get("/sitemap.xml").then().statusCode(200).contentType(containsString("application/xml"))
                .header("Cache-Control", equalTo("public, max-age=3600"))
                .body(containsString("<urlset xmlns=\"http://www.sitemaps.org/schemas/sitemap/0.9\">"))
                .body(containsString("<loc>https://www.example.test/</loc>"))
                .body(containsString("<loc>https://www.example.test/about</loc>"))
                .body(containsString("<loc>https://www.example.test/contact</loc>"))
                .body(containsString("<priority>1.0</priority>")).body(not(containsString("<sitemapindex")));
    }

    @Test
    void testGetSitemapXml_indexZeroMatchesRoot() {
        String root = given().when().get("/sitemap.xml").then().statusCode(200).extract().asString();
        String indexZero = given().queryParam("index", 0).when().get("/sitemap.xml").then().statusCode(200).extract()
                .asString();

        assertEquals(root, indexZero, "index=0 is the root document");
    }

    @Test
    void testGetSitemapXml_repeatedRequestsAreIdentical() {
        String first = given().when().get("/sitemap.xml").then().statusCode(200).extract().asString();
        String second = given().when().get("/sitemap.xml").then().statusCode(200).extract().asString();

        assertEquals(first, second);
    }

    @Test
    void testGetSitemapXml_indexBeyondSingleSitemapNotFound() {
        given().queryParam("index", 1).when().get("/sitemap.xml").then().statusCode(404);
    }

    @Test
    void testGetSitemapXml_negativeIndexNotFound() {
        given().queryParam("index", -1).when().get("/sitemap.xml").then().statusCode(404);
    }

    @Test
    void testGetSitemapXml_nonNumericIndexNotFound() {
        given().queryParam("index", "abc").when().get("/sitemap.xml").then().statusCode(404);
    }

    @Test
    void testGetSitemapXml_overflowingIndexNotFound() {
        given().queryParam("index", "99999999999").when().get("/sitemap.xml").then().statusCode(404);
    }

    @Test
    void testGetRobotsTxt_advertisesSitemap() {
        given().when().get(Route.ROBOTS_TXT.path()).then().statusCode(200).contentType(containsString("text/plain"))
                .header("Cache-Control", equalTo("public, max-age=3600")).body(containsString("User-agent: *"))
                .body(containsString("Sitemap: https://www.example.test" + Route.SITEMAP_XML.path()));
    }
}
