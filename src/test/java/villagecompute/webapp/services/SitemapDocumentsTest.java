package villagecompute.webapp.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import villagecompute.webapp.api.types.SitemapEntryType;
import villagecompute.webapp.config.CacheProfileConfig;
import villagecompute.webapp.integration.cache.CaffeineDistributedCache;
import villagecompute.webapp.integration.cache.JsonCacheClient;
import villagecompute.webapp.routing.RouteUrlResolver;

/**
 * End-to-end document generation with the real XML writer, route resolver and cache profile.
 *
 * <p>
 * Entries are supplied by a mocked collector and time by a manual ticker, so large sites and expiration can be
 * exercised without a running crawler or sleeping.
 */
@QuarkusTest
class SitemapDocumentsTest {

    @Inject
    SitemapXmlWriter xmlWriter;

    @Inject
    RouteUrlResolver routeUrlResolver;

    @Inject
    CacheProfileConfig cacheProfileConfig;

    private final AtomicLong nanos = new AtomicLong();
    private SitemapEntryCollector entryCollector;
    private SitemapService service;

    @BeforeEach
    void setUp() {
        entryCollector = mock(SitemapEntryCollector.class);

        service = new SitemapService();
        service.entryCollector = entryCollector;
        service.xmlWriter = xmlWriter;
        service.cacheClient = new JsonCacheClient(new CaffeineDistributedCache(nanos::get, 100), new ObjectMapper());
        service.routeUrlResolver = routeUrlResolver;
        service.cacheProfileConfig = cacheProfileConfig;
        service.meterRegistry = new SimpleMeterRegistry();
        service.tracer = OpenTelemetry.noop().getTracer("test");
    }

    @Test
    void testSmallSite_singleUrlset() {
        // Given
        when(entryCollector.collectEntries()).thenReturn(List.of(SitemapEntryType.of("https://www.example.test/", 1.0),
                SitemapEntryType.of("https://www.example.test/about", 0.9),
                SitemapEntryType.of("https://www.example.test/contact", 0.9)));

        // When
        String xml = service.getSitemapXml(null).orElseThrow();

        // Then
        assertTrue(xml.contains("<urlset"), "Small sites get a plain urlset");
        assertEquals(3, count(xml, "<url>"));
        assertTrue(xml.indexOf("/about</loc>") < xml.indexOf("/contact</loc>"));
        assertEquals(Optional.of(xml), service.getSitemapXml(0));
        assertTrue(service.getSitemapXml(1).isEmpty());
    }

    @Test
    void testLargeSite_indexFollowedBySitemaps() {
        // Given
        when(entryCollector.collectEntries()).thenReturn(entries(50_001));

        // When
        String index = service.getSitemapXml(null).orElseThrow();

        // Then
        assertTrue(index.contains("<sitemapindex"), "Large sites start with a sitemap index");
        assertEquals(3, count(index, "<sitemap>"));
        assertTrue(index.contains("<loc>https://www.example.test/sitemap.xml?index=1</loc>"));
        assertTrue(index.contains("<loc>https://www.example.test/sitemap.xml?index=3</loc>"));

        assertEquals(25_000, count(service.getSitemapXml(1).orElseThrow(), "<url>"));
        assertEquals(25_000, count(service.getSitemapXml(2).orElseThrow(), "<url>"));
        String last = service.getSitemapXml(3).orElseThrow();
        assertEquals(1, count(last, "<url>"));
        assertTrue(last.contains("<loc>https://www.example.test/page/50000</loc>"));
        assertTrue(service.getSitemapXml(4).isEmpty());
    }

    @Test
    void testRegeneration_isByteIdentical() {
        // Given
        when(entryCollector.collectEntries()).thenReturn(entries(10));
        String first = service.getSitemapXml(null).orElseThrow();

        // When
        nanos.addAndGet(cacheProfileConfig.profile("sitemap-nodes").duration().plusSeconds(1).toNanos());
        String second = service.getSitemapXml(null).orElseThrow();

        // Then
        verify(entryCollector, times(2)).collectEntries();
        assertEquals(first, second, "Regenerated sitemap must match the previous output");
    }

    private static List<SitemapEntryType> entries(int count) {
        List<SitemapEntryType> entries = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            entries.add(SitemapEntryType.of("https://www.example.test/page/" + i, 0.5));
        }
        return entries;
    }

    private static int count(String text, String token) {
        int occurrences = 0;
        for (int i = text.indexOf(token); i >= 0; i = text.indexOf(token, i + token.length())) {
            occurrences++;
        }
        return occurrences;
    }
}
