package com.mimecast.phishguard.scanners;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.mimecast.phishguard.config.RspamdConfig;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Rspamd scanner client.
 * <p>
 * Submits content to the Rspamd daemon through its HTTP API and returns the parsed {@code /checkv2} response.
 * <br>Instances hold no per scan state and may be shared between threads.
 */
public class RspamdClient {
    private static final Logger log = LogManager.getLogger(RspamdClient.class);

    private static final String DEFAULT_HOST = "localhost";
    private static final int DEFAULT_PORT = 11333;
    private static final String SCHEME = "http";
    private static final String SCAN_ENDPOINT = "/checkv2";
    private static final MediaType MESSAGE_RFC822 = MediaType.parse("message/rfc822");
    private static final int DEFAULT_TIMEOUT_SECONDS = 30;

    private final String baseUrl;
    private final OkHttpClient httpClient;
    private final Gson gson;

    /**
     * Constructor with default host and port.
     * <p>
     * Uses localhost:11333 which is the default for Rspamd daemon.
     */
    public RspamdClient() {
        this(DEFAULT_HOST, DEFAULT_PORT, DEFAULT_TIMEOUT_SECONDS);
    }

    /**
     * Constructor from configuration.
     *
     * @param config RspamdConfig instance.
     */
    public RspamdClient(RspamdConfig config) {
        this(config.getHost(), config.getPort(), config.getTimeout());
    }

    /**
     * Constructor with specific host, port and timeout.
     *
     * @param host    The Rspamd server host.
     * @param port    The Rspamd server port.
     * @param timeout Connect, read and write timeout in seconds.
     */
    public RspamdClient(String host, int port, int timeout) {
        this.baseUrl = String.format("%s://%s:%d", SCHEME, host, port);
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(timeout, TimeUnit.SECONDS)
                .readTimeout(timeout, TimeUnit.SECONDS)
                .writeTimeout(timeout, TimeUnit.SECONDS)
                .build();
        this.gson = new Gson();
        log.debug("Rspamd client initialized with {}:{}", host, port);
    }

    /**
     * Ping the Rspamd server to check if it's available.
     *
     * @return True if the server responded successfully, false otherwise.
     */
    public boolean ping() {
        try {
            Request request = new Request.Builder()
                    .url(baseUrl + "/ping")
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                boolean success = response.isSuccessful();
                if (success) {
                    log.debug("Rspamd server ping successful");
                } else {
                    log.error("Rspamd server ping failed with status: {}", response.code());
                }
                return success;
            }
        } catch (Exception e) {
            log.error("Failed to ping Rspamd server: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Scan plain text.
     * <p>
     * The text is wrapped as a minimal header-less MIME part so Rspamd runs its text rules over it.
     *
     * @param text The text to scan.
     * @return The scan result as a Map.
     * @throws IOException If the server cannot be reached or returns an unusable response.
     */
    public Map<String, Object> scanText(String text) throws IOException {
        String message = "Content-Type: text/plain; charset=utf-8\r\n\r\n" + text;
        return scanBytes(message.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Scan a byte array.
     *
     * @param bytes The content to scan.
     * @return The scan result as a Map.
     * @throws IOException If the server cannot be reached or returns an unusable response.
     */
    public Map<String, Object> scanBytes(byte[] bytes) throws IOException {
        log.debug("Scanning byte array of {} bytes", bytes.length);

        Request request = new Request.Builder()
                .url(baseUrl + SCAN_ENDPOINT)
                .post(RequestBody.create(bytes, MESSAGE_RFC822))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Rspamd scan failed with status: " + response.code());
            }

            String responseBody = response.body() != null ? response.body().string() : "{}";
            @SuppressWarnings("unchecked")
            Map<String, Object> result = gson.fromJson(responseBody, Map.class);
            log.debug("Scan result: {}", result);
            return result != null ? result : Collections.emptyMap();
        } catch (JsonParseException e) {
            throw new IOException("Unable to parse Rspamd response: " + e.getMessage(), e);
        }
    }

    /**
     * Get the spam score from a scan result.
     *
     * @param result The scan result map.
     * @return The spam score or 0.0 if missing.
     */
    public static double getScore(Map<String, Object> result) {
        Object score = result != null ? result.get("score") : null;
        if (score instanceof Number) {
            return ((Number) score).doubleValue();
        }
        return 0.0;
    }

    /**
     * Check if a scan result is flagged as spam by Rspamd itself.
     * <p>
     * Either a true {@code spam} or {@code is_spam} flag or a {@code reject} action.
     *
     * @param result The scan result map.
     * @return True if flagged, false otherwise.
     */
    public static boolean isFlagged(Map<String, Object> result) {
        if (result == null) {
            return false;
        }
        return Boolean.TRUE.equals(result.get("spam")) ||
                Boolean.TRUE.equals(result.get("is_spam")) ||
                "reject".equals(result.get("action"));
    }
}
