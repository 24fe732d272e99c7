package io.defcheck.cli.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.defcheck.cli.config.CheckerConfig;
import io.defcheck.cli.config.SchemaSourceConfig;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDK {@link HttpClient}-based Swagger downloader with an on-disk cache.
 *
 * <p>
 * A cached copy is used whenever it exists and caching is requested; otherwise
 * the document is downloaded and written to the cache file. The cache never
 * expires on its own: {@code --refresh} deletes it.
 *
 * <p>
 * This class is thread-safe: the underlying {@link HttpClient} is thread-safe
 * and designed for concurrent use.
 */
public final class SchemaFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaFetcher.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient httpClient;
    private final Path cacheDir;
    private final Duration readTimeout;

    /**
     * Creates a fetcher with the cache directory resolved against the process
     * working directory.
     *
     * @param config checker configuration
     */
    public SchemaFetcher(CheckerConfig config) {
        this(config, Path.of("").toAbsolutePath());
    }

    /**
     * Creates a fetcher for the cache directory and timeouts of the configuration.
     *
     * @param config     checker configuration
     * @param workingDir directory a relative {@code cache.dir} resolves against
     */
    public SchemaFetcher(CheckerConfig config, Path workingDir) {
        this.cacheDir = workingDir.resolve(config.cacheDir());
        this.readTimeout = Duration.ofMillis(config.readTimeoutMs());
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(config.connectTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();

        LOG.debug("SchemaFetcher initialized: cacheDir={}", cacheDir.toAbsolutePath());
    }

    /** Location of the cache file of a schema source. */
    public Path cachePath(SchemaSourceConfig source) {
        return cacheDir.resolve(source.cacheFile());
    }

    /**
     * Returns the Swagger document of a source.
     *
     * @param source   schema source
     * @param useCache read the cache file if present
     * @return the parsed Swagger JSON
     * @throws SchemaFetchException if the document cannot be downloaded, parsed or cached
     */
    public JsonNode fetch(SchemaSourceConfig source, boolean useCache) {
        Path cachePath = cachePath(source);
        if (useCache && Files.exists(cachePath)) {
            LOG.debug("Using cached {} from {}", source.label(), cachePath);
            try {
                return MAPPER.readTree(cachePath.toFile());
            } catch (IOException e) {
                throw new SchemaFetchException("Cannot read cached schema " + cachePath, source.url(), e);
            }
        }

        LOG.info("Downloading {} from {} ...", source.label(), source.url());
        String body = download(source);

        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (IOException e) {
            throw new SchemaFetchException("Response is not valid JSON: " + source.url(), source.url(), e);
        }

        try {
            Files.createDirectories(cacheDir);
            Files.writeString(cachePath, body, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SchemaFetchException("Cannot write schema cache " + cachePath, source.url(), e);
        }
        LOG.info("Cached to {} ({} definitions)", cachePath, root.path("definitions").size());
        return root;
    }

    /**
     * Deletes the cache files of the given sources.
     *
     * @return number of files deleted
     */
    public int clearCache(List<SchemaSourceConfig> sources) {
        int deleted = 0;
        for (SchemaSourceConfig source : sources) {
            Path cachePath = cachePath(source);
            try {
                if (Files.deleteIfExists(cachePath)) {
                    LOG.info("Deleted cached schema {}", cachePath);
                    deleted++;
                }
            } catch (IOException e) {
                throw new SchemaFetchException("Cannot delete schema cache " + cachePath, source.url(), e);
            }
        }
        return deleted;
    }

    private String download(SchemaSourceConfig source) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(source.url()))
                .timeout(readTimeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new SchemaFetchException("Timeout downloading " + source.url(), source.url(), e);
        } catch (IOException e) {
            throw new SchemaFetchException(
                    "Failed to download " + source.url() + ": " + e.getMessage(), source.url(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SchemaFetchException("Interrupted while downloading " + source.url(), source.url(), e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new SchemaFetchException(
                    "Download of " + source.url() + " returned HTTP " + response.statusCode(), source.url());
        }
        return response.body();
    }
}
