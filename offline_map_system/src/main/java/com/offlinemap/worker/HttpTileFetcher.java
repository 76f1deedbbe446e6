package com.offlinemap.worker;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URL;
import java.time.Duration;

/**
 * Downloads tiles over HTTP. Only a 200 response counts as success.
 */
public class HttpTileFetcher implements TileFetcher {
    private final String userAgent;
    private final Duration connectTimeout;
    private final Duration readTimeout;

    public HttpTileFetcher(String userAgent, Duration connectTimeout, Duration readTimeout) {
        this.userAgent = userAgent;
        this.connectTimeout = connectTimeout;
        this.readTimeout = readTimeout;
    }

    @Override
    public byte[] fetch(String url) throws IOException {
        URL tileUrl = URI.create(url).toURL();
        HttpURLConnection connection = (HttpURLConnection) tileUrl.openConnection();
        connection.setRequestProperty("User-Agent", userAgent);
        connection.setConnectTimeout((int) connectTimeout.toMillis());
        connection.setReadTimeout((int) readTimeout.toMillis());
        try {
            int status = connection.getResponseCode();
            if (status != HttpURLConnection.HTTP_OK) {
                throw new IOException("HTTP " + status + " for " + url);
            }
            try (InputStream in = connection.getInputStream();
                 ByteArrayOutputStream out = new ByteArrayOutputStream()) {
                byte[] buffer = new byte[4096];
                int bytesRead;
                while ((bytesRead = in.read(buffer)) != -1) {
                    out.write(buffer, 0, bytesRead);
                }
                return out.toByteArray();
            }
        } finally {
            connection.disconnect();
        }
    }
}
