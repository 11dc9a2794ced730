package com.docpulse.pipeline.client;

import com.docpulse.pipeline.model.WorkItem;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.TimeUnit;

/**
 * Fetches documents over HTTP(S) into a download directory. Local paths and
 * {@code file:} URIs are returned in place without copying.
 *
 * <p>Thread-safe: each download writes to its own temp file before moving
 * it into place.</p>
 */
public class HttpDocumentFetcher implements DocumentFetcher {

    private static final Logger logger = LoggerFactory.getLogger(HttpDocumentFetcher.class);

    private static final String DEFAULT_EXTENSION = ".pdf";

    private final OkHttpClient httpClient;
    private final Path downloadDir;

    public HttpDocumentFetcher(Path downloadDir) {
        this(downloadDir, defaultHttpClient());
    }

    public HttpDocumentFetcher(Path downloadDir, OkHttpClient httpClient) {
        this.downloadDir = downloadDir;
        this.httpClient = httpClient;
    }

    private static OkHttpClient defaultHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(120, TimeUnit.SECONDS)
                .followRedirects(true)
                .build();
    }

    @Override
    public Path fetch(WorkItem item) throws IOException {
        if (!item.hasSource()) {
            throw new FetchException("Item " + item.id() + " has no source location", 0, false);
        }
        String location = item.sourceLocation().trim();

        if (location.startsWith("http://") || location.startsWith("https://")) {
            return download(item, location);
        }

        Path local = location.startsWith("file:") ? Path.of(URI.create(location)) : Path.of(location);
        if (!Files.isRegularFile(local)) {
            throw new FetchException("Local source not found: " + local, 0, false);
        }
        return local;
    }

    Path download(WorkItem item, String url) throws IOException {
        Request request = new Request.Builder().url(url).get().build();

        try (Response response = httpClient.newCall(request).execute()) {
            int statusCode = response.code();
            logger.info("GET {} {}", statusCode, url);

            if (statusCode < 200 || statusCode >= 300) {
                boolean retryable = statusCode >= 500 || statusCode == 429 || statusCode == 408;
                throw new FetchException("Download failed with " + statusCode + " for " + url,
                        statusCode, retryable);
            }

            ResponseBody body = response.body();
            if (body == null) {
                throw new FetchException("Empty response body for " + url, statusCode, true);
            }

            Files.createDirectories(downloadDir);
            Path target = downloadDir.resolve(fileNameFor(item.id(), url));
            Path temp = Files.createTempFile(downloadDir, ".download-", ".tmp");
            try (InputStream in = body.byteStream()) {
                Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
            logger.debug("Saved {} to {}", url, target);
            return target;
        }
    }

    /**
     * File name derived from the item id, keeping the URL's extension when it has one.
     */
    static String fileNameFor(String itemId, String url) {
        String safeId = itemId.replaceAll("[^A-Za-z0-9._-]", "_");
        String path = URI.create(url).getPath();
        String extension = DEFAULT_EXTENSION;
        if (path != null) {
            int slash = path.lastIndexOf('/');
            int dot = path.lastIndexOf('.');
            if (dot > slash && path.length() - dot <= 6) {
                extension = path.substring(dot).toLowerCase();
            }
        }
        return safeId + extension;
    }
}
