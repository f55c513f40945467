package com.openapi.simpleSDK.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openapi.simpleSDK.http.exceptions.DocumentFetchException;
import com.openapi.simpleSDK.http.exceptions.DocumentNotFoundException;
import com.openapi.simpleSDK.http.exceptions.SdkGenException;
import com.openapi.simpleSDK.http.retry.ExponentialBackoffStrategy;
import com.openapi.simpleSDK.http.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;

/**
 * Fetches remote OpenAPI documents over HTTP and keeps a decoded copy on disk.
 * Each URL maps to {@code <sha256(url)>.json} in the cache directory, holding
 * {@code {"url": ..., "content": ...}}. The directory is created on first write.
 */
public class HttpDocumentCache implements DocumentFetcher {
    private static final Logger logger = LoggerFactory.getLogger(HttpDocumentCache.class);

    public static final Path DEFAULT_CACHE_DIR = Paths.get(System.getProperty("user.home"), ".sdkgen", "cache");
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private static final String ACCEPT = "application/json, application/yaml;q=0.9, */*;q=0.8";

    private final Path cacheDir;
    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final RetryPolicy retryPolicy;
    private final ExponentialBackoffStrategy backoffStrategy;
    private final DocumentReader reader;
    private final ObjectMapper objectMapper;

    public HttpDocumentCache() {
        this(DEFAULT_CACHE_DIR);
    }

    public HttpDocumentCache(Path cacheDir) {
        this(cacheDir, DEFAULT_TIMEOUT, RetryPolicy.SINGLE_ATTEMPT);
    }

    public HttpDocumentCache(Path cacheDir, Duration requestTimeout, RetryPolicy retryPolicy) {
        this(cacheDir,
            HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(),
            requestTimeout,
            retryPolicy,
            new ExponentialBackoffStrategy());
    }

    HttpDocumentCache(Path cacheDir, HttpClient httpClient, Duration requestTimeout,
                      RetryPolicy retryPolicy, ExponentialBackoffStrategy backoffStrategy) {
        this.cacheDir = cacheDir;
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
        this.retryPolicy = retryPolicy;
        this.backoffStrategy = backoffStrategy;
        this.reader = new DocumentReader();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public JsonNode fetch(String url) throws SdkGenException {
        return fetch(url, false);
    }

    /**
     * Returns the cached document for {@code url}, downloading it when there is no usable
     * entry or when {@code force} is set.
     */
    public JsonNode fetch(String url, boolean force) throws SdkGenException {
        Path cachePath = getCachePath(url);

        if (!force && Files.isRegularFile(cachePath)) {
            JsonNode cached = readCacheEntry(cachePath, url);
            if (cached != null) {
                logger.debug("Cache hit for {}", url);
                return cached;
            }
        }

        logger.info("Fetching {}", url);
        HttpCallResult result = download(url);
        DocumentFormat format = DocumentFormat.fromContentType(result.header("Content-Type"), url);
        JsonNode content = reader.parse(result.body(), format, url);
        writeCacheEntry(cachePath, url, content);
        return content;
    }

    /** Removes every cache entry. */
    public void clear() throws SdkGenException {
        if (!Files.isDirectory(cacheDir)) {
            return;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(cacheDir, "*.json")) {
            for (Path entry : entries) {
                Files.deleteIfExists(entry);
            }
        } catch (IOException e) {
            throw new DocumentFetchException("Failed to clear cache directory " + cacheDir, cacheDir.toString(), e);
        }
    }

    /** Removes the entry of a single URL, if there is one. */
    public void clearUrl(String url) throws SdkGenException {
        Path cachePath = getCachePath(url);
        try {
            Files.deleteIfExists(cachePath);
        } catch (IOException e) {
            throw new DocumentFetchException("Failed to remove cache entry " + cachePath, url, e);
        }
    }

    Path getCachePath(String url) {
        return cacheDir.resolve(sha256(url) + ".json");
    }

    private HttpCallResult download(String url) throws SdkGenException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                .timeout(requestTimeout)
                .header("Accept", ACCEPT)
                .GET()
                .build();
        } catch (IllegalArgumentException e) {
            throw new DocumentFetchException("Invalid URL: " + url, url, e);
        }

        for (int attempt = 1; ; attempt++) {
            try {
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                HttpCallResult result = HttpCallResult.fromHttpResponse(response);

                if (result.statusCode() == 404) {
                    throw new DocumentNotFoundException("Document not found: " + url, url);
                }
                if (result.isError()) {
                    if (retryPolicy.isRetryableStatus(result.statusCode()) && retryPolicy.allowsAttemptAfter(attempt)) {
                        logger.warn("HTTP {} fetching {} (attempt {}/{}), retrying",
                            result.statusCode(), url, attempt, retryPolicy.getMaxAttempts());
                        sleepBeforeRetry(attempt, result.header("Retry-After"), url);
                        continue;
                    }
                    throw new DocumentFetchException("HTTP " + result.statusCode() + " fetching " + url, url, result.statusCode());
                }
                return result;
            } catch (HttpTimeoutException e) {
                if (!retryPolicy.allowsAttemptAfter(attempt)) {
                    throw new DocumentFetchException("Timed out fetching " + url, url, e);
                }
                logger.warn("Timed out fetching {} (attempt {}/{}), retrying", url, attempt, retryPolicy.getMaxAttempts());
                sleepBeforeRetry(attempt, null, url);
            } catch (IOException e) {
                if (!retryPolicy.allowsAttemptAfter(attempt)) {
                    throw new DocumentFetchException("Network error fetching " + url + ": " + e.getMessage(), url, e);
                }
                logger.warn("Network error fetching {} (attempt {}/{}), retrying", url, attempt, retryPolicy.getMaxAttempts());
                sleepBeforeRetry(attempt, null, url);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DocumentFetchException("Interrupted while fetching " + url, url, e);
            }
        }
    }

    private void sleepBeforeRetry(int attempt, String retryAfter, String url) throws SdkGenException {
        try {
            Duration delay = backoffStrategy.delayAfter(attempt, retryPolicy, retryAfter);
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DocumentFetchException("Retry delay was interrupted", url, e);
        }
    }

    private JsonNode readCacheEntry(Path cachePath, String url) {
        try {
            JsonNode entry = objectMapper.readTree(cachePath.toFile());
            JsonNode content = entry == null ? null : entry.get("content");
            if (content == null || content.isNull()) {
                logger.warn("Ignoring cache entry {} without content", cachePath);
                return null;
            }
            return content;
        } catch (IOException e) {
            logger.warn("Ignoring unreadable cache entry {} for {}: {}", cachePath, url, e.getMessage());
            return null;
        }
    }

    private void writeCacheEntry(Path cachePath, String url, JsonNode content) {
        ObjectNode entry = objectMapper.createObjectNode();
        entry.put("url", url);
        entry.set("content", content);
        try {
            Files.createDirectories(cacheDir);
            objectMapper.writeValue(cachePath.toFile(), entry);
        } catch (IOException e) {
            logger.warn("Could not write cache entry {} for {}", cachePath, url, e);
        }
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
