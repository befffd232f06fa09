package com.mimecast.phishguard.http;

import com.mimecast.phishguard.config.FetchConfig;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import okio.BufferedSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * OkHttp image downloader.
 *
 * <p>Fetching can be disabled in configuration, in which case every call fails.
 * <br>Bodies larger than the configured limit are rejected without being read in full.
 */
public class OkHttpImageFetcher implements ImageFetcher {
    private static final Logger log = LogManager.getLogger(OkHttpImageFetcher.class);

    private final OkHttpClient httpClient;
    private final boolean enabled;
    private final long maxBytes;

    /**
     * Constructs a new OkHttpImageFetcher instance.
     *
     * @param config FetchConfig instance.
     */
    public OkHttpImageFetcher(FetchConfig config) {
        this.enabled = config.isEnabled();
        this.maxBytes = config.getMaxBytes();
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(config.getTimeout(), TimeUnit.SECONDS)
                .readTimeout(config.getTimeout(), TimeUnit.SECONDS)
                .writeTimeout(config.getTimeout(), TimeUnit.SECONDS)
                .followRedirects(true)
                .build();
    }

    @Override
    public byte[] fetch(String url) throws IOException {
        if (!enabled) {
            throw new IOException("Remote image fetching is disabled");
        }

        HttpUrl httpUrl = HttpUrl.parse(url);
        if (httpUrl == null) {
            throw new IOException("Invalid image URL: " + url);
        }

        Request request = new Request.Builder()
                .url(httpUrl)
                .get()
                .build();

        log.debug("Fetching image from {}", httpUrl.host());
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Image download failed with status: " + response.code());
            }

            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("Image download returned no body");
            }
            if (body.contentLength() > maxBytes) {
                throw new IOException("Image larger than " + maxBytes + " bytes");
            }

            BufferedSource source = body.source();
            Buffer buffer = new Buffer();
            while (buffer.size() <= maxBytes) {
                if (source.read(buffer, 8192) == -1) {
                    return buffer.readByteArray();
                }
            }
            throw new IOException("Image larger than " + maxBytes + " bytes");
        }
    }
}
