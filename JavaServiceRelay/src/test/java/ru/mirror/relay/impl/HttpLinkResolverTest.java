package ru.mirror.relay.impl;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.mirror.relay.impl.settings.LinkSettings;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HttpLinkResolverTest {
    private static final List<String> MARKERS = List.of("/dp/", "/gp/");

    private HttpServer server;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/short", exchange -> {
            exchange.getResponseHeaders().add("Location", "/dp/X?tag=y");
            exchange.sendResponseHeaders(301, -1);
            exchange.close();
        });
        server.createContext("/hop", exchange -> {
            exchange.getResponseHeaders().add("Location", "/short");
            exchange.sendResponseHeaders(302, -1);
            exchange.close();
        });
        server.createContext("/", exchange -> {
            byte[] body = "ok".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void testProductLinkLosesQuery() {
        assertEquals("https://www.amazon.com/dp/B0ABC12345",
                HttpLinkResolver.canonicalize("https://www.amazon.com/dp/B0ABC12345?tag=x&ref=y", MARKERS));
        assertEquals("https://www.amazon.com/gp/product/B0ABC12345",
                HttpLinkResolver.canonicalize("https://www.amazon.com/gp/product/B0ABC12345?psc=1", MARKERS));
    }

    @Test
    void testOtherLinksAreKept() {
        assertEquals("https://example.com/item?id=5",
                HttpLinkResolver.canonicalize("https://example.com/item?id=5", MARKERS));
        assertEquals("https://www.amazon.com/dp/B0ABC12345",
                HttpLinkResolver.canonicalize("https://www.amazon.com/dp/B0ABC12345", MARKERS));
    }

    @Test
    void testMarkerInsideQueryIsIgnored() {
        assertEquals("https://h/search?q=/dp/",
                HttpLinkResolver.canonicalize("https://h/search?q=/dp/", MARKERS));
    }

    /**
     * Редирект на страницу товара: берется последний адрес, параметры отбрасываются
     */
    @Test
    void testRedirectIsFollowedToProductPage() throws IOException {
        try (HttpLinkResolver resolver = new HttpLinkResolver(linkSettings(5))) {
            assertEquals(baseUrl + "/dp/X", resolver.resolve(baseUrl + "/short"));
            assertEquals(baseUrl + "/dp/X", resolver.resolve(baseUrl + "/hop"));
        }
    }

    @Test
    void testLinkWithoutRedirectIsKept() throws IOException {
        try (HttpLinkResolver resolver = new HttpLinkResolver(linkSettings(5))) {
            assertEquals(baseUrl + "/plain?id=5", resolver.resolve(baseUrl + "/plain?id=5"));
        }
    }

    /**
     * Недоступный адрес и мусор вместо адреса возвращаются без изменений
     */
    @Test
    void testFailureReturnsOriginal() throws IOException {
        try (HttpLinkResolver resolver = new HttpLinkResolver(linkSettings(1))) {
            assertEquals("http://127.0.0.1:1/x", resolver.resolve("http://127.0.0.1:1/x"));
            assertEquals("not a url", resolver.resolve("not a url"));
        }
    }

    private static LinkSettings linkSettings(int timeoutSec) {
        return LinkSettings.builder()
                .timeoutSec(timeoutSec)
                .userAgent("test")
                .productMarkers(MARKERS)
                .build();
    }
}
