package villagecompute.webapp.api.rest;

import static io.restassured.RestAssured.given;
import static org.hamcrest.CoreMatchers.containsString;

import org.junit.jupiter.api.Test;

import io.quarkus.test.junit.QuarkusTest;

/**
 * Tests for the public pages rendered by {@link HomeResource}.
 */
@QuarkusTest
class HomeResourceTest {

    @Test
    void testHome_rendersCanonicalLink() {
        given().when().get("/").then().statusCode(200).contentType(containsString("text/html"))
                .body(containsString("<title>Home | Village Webapp</title>"))
                .body(containsString("<link rel=\"canonical\" href=\"https://www.example.test/\">"));
    }

    @Test
    void testAbout_rendersCanonicalLink() {
        given().when().get("/about").then().statusCode(200)
                .body(containsString("<link rel=\"canonical\" href=\"https://www.example.test/about\">"));
    }

    @Test
    void testContact_showsContactEmail() {
        given().when().get("/contact").then().statusCode(200)
                .body(containsString("<link rel=\"canonical\" href=\"https://www.example.test/contact\">"))
                .body(containsString("mailto:hello@villagecompute.com"));
    }
}
