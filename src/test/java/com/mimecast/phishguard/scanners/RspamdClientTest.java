package com.mimecast.phishguard.scanners;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RspamdClient.
 * <p>
 * These tests use MockWebServer to simulate Rspamd API responses without requiring
 * a real Rspamd installation.
 */
class RspamdClientTest {

    private static final String SPAM_RESPONSE = "{\"action\": \"reject\", \"score\": 15.5, \"required_score\": 7.0}";
    private static final String HAM_RESPONSE = "{\"action\": \"no action\", \"score\": -1.2, \"required_score\": 7.0}";

    private MockWebServer mockWebServer;
    private RspamdClient client;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        client = new RspamdClient("localhost", mockWebServer.getPort(), 5);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void testPingWithServerAvailable() {
        mockWebServer.enqueue(new MockResponse()
                .setStatus("HTTP/1.1 200 OK")
                .setBody("pong"));

        assertTrue(client.ping(), "Rspamd server should be available");
    }

    @Test
    void testPingWithServerError() {
        mockWebServer.enqueue(new MockResponse()
                .setStatus("HTTP/1.1 500 Internal Server Error"));

        assertFalse(client.ping());
    }

    @Test
    void testPingWithServerUnavailable() throws IOException {
        mockWebServer.shutdown();

        assertFalse(client.ping(), "Rspamd server should be unavailable");
    }

    @Test
    void testScanText() throws Exception {
        mockWebServer.enqueue(new MockResponse()
                .setStatus("HTTP/1.1 200 OK")
                .setBody(SPAM_RESPONSE));

        Map<String, Object> result = client.scanText("Win a free prize now");

        assertEquals(15.5, RspamdClient.getScore(result));
        assertTrue(RspamdClient.isFlagged(result));

        RecordedRequest request = mockWebServer.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/checkv2", request.getPath());
        assertTrue(request.getHeader("Content-Type").startsWith("message/rfc822"));
        String body = request.getBody().readUtf8();
        assertTrue(body.startsWith("Content-Type: text/plain; charset=utf-8\r\n\r\n"));
        assertTrue(body.endsWith("Win a free prize now"));
    }

    @Test
    void testScanHam() throws IOException {
        mockWebServer.enqueue(new MockResponse()
                .setStatus("HTTP/1.1 200 OK")
                .setBody(HAM_RESPONSE));

        Map<String, Object> result = client.scanBytes("hello".getBytes());

        assertEquals(-1.2, RspamdClient.getScore(result));
        assertFalse(RspamdClient.isFlagged(result));
    }

    @Test
    void testScanServerError() {
        mockWebServer.enqueue(new MockResponse()
                .setStatus("HTTP/1.1 503 Service Unavailable"));

        IOException e = assertThrows(IOException.class, () -> client.scanText("hello"));
        assertEquals("Rspamd scan failed with status: 503", e.getMessage());
    }

    @Test
    void testScanInvalidJson() {
        mockWebServer.enqueue(new MockResponse()
                .setStatus("HTTP/1.1 200 OK")
                .setBody("not json"));

        assertThrows(IOException.class, () -> client.scanText("hello"));
    }

    @Test
    void testFlags() {
        Map<String, Object> result = new HashMap<>();
        assertFalse(RspamdClient.isFlagged(result));
        assertFalse(RspamdClient.isFlagged(null));
        assertEquals(0.0, RspamdClient.getScore(null));

        result.put("is_spam", true);
        assertTrue(RspamdClient.isFlagged(result));

        result.clear();
        result.put("spam", true);
        assertTrue(RspamdClient.isFlagged(result));

        result.clear();
        result.put("score", "high");
        assertEquals(0.0, RspamdClient.getScore(result));
    }
}
