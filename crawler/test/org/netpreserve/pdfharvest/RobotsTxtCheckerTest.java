package org.netpreserve.pdfharvest;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.netpreserve.pdfharvest.util.Url;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RobotsTxtCheckerTest {
    private HttpServer server;
    private final AtomicInteger fetches = new AtomicInteger();
    private volatile int status = 200;
    private volatile String body = "";
    private volatile String userAgentSeen;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/robots.txt", exchange -> {
            fetches.incrementAndGet();
            userAgentSeen = exchange.getRequestHeaders().getFirst("User-Agent");
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "text/plain");
            exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
            if (bytes.length > 0) exchange.getResponseBody().write(bytes);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private String base() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    private RobotsTxtChecker checker() {
        return new RobotsTxtChecker(HttpClient.newHttpClient(), "pdfharvest");
    }

    @Test
    void honoursRulesForOurAgent() throws Exception {
        body = """
                User-agent: pdfharvest
                Disallow: /private/

                User-agent: *
                Disallow: /
                """;
        var checker = checker();
        assertTrue(checker.checkAllowed(new Url(base() + "/news/1")));
        assertFalse(checker.checkAllowed(new Url(base() + "/private/secret")));
        assertEquals("pdfharvest", userAgentSeen);
    }

    @Test
    void fetchesOncePerOrigin() throws Exception {
        body = "User-agent: *\nDisallow: /x\n";
        var checker = checker();
        checker.checkAllowed(new Url(base() + "/a"));
        checker.checkAllowed(new Url(base() + "/b"));
        checker.checkAllowed(new Url(base() + "/x/c"));
        assertEquals(1, fetches.get());
    }

    @Test
    void notFoundAllowsAll() throws Exception {
        status = 404;
        assertTrue(checker().checkAllowed(new Url(base() + "/anything")));
    }

    @Test
    void serverErrorAllowsAll() throws Exception {
        status = 503;
        assertTrue(checker().checkAllowed(new Url(base() + "/anything")));
    }

    @Test
    void forbiddenDisallowsAll() throws Exception {
        status = 403;
        assertFalse(checker().checkAllowed(new Url(base() + "/anything")));
    }

    @Test
    void unreachableHostAllowsAll() throws Exception {
        int port;
        try (var socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        var checker = checker();
        assertTrue(checker.checkAllowed(new Url("http://127.0.0.1:" + port + "/page")));
        var robots = checker.fetch(new Url("http://127.0.0.1:" + port + "/robots.txt"));
        assertEquals(-1, robots.status());
    }
}
