package io.defcheck.cli.config;

import java.util.List;
import java.util.Objects;

/**
 * One Swagger document to validate against.
 *
 * @param key       short identifier, also used for the default cache file name
 * @param label     human-readable name printed in reports
 * @param url       where the Swagger JSON is downloaded from
 * @param cacheFile cache file name, relative to the configured cache directory
 */
public record SchemaSourceConfig(String key, String label, String url, String cacheFile) {

    /** GS1 firstbase Product API (data recipient) and Catalogue Item API (data sender). */
    public static final List<SchemaSourceConfig> FIRSTBASE_DEFAULTS = List.of(
            new SchemaSourceConfig(
                    "product",
                    "Product API (recipient)",
                    "https://test-productapi-firstbase.gs1.ch/docs/v01/productApi",
                    ".swagger_cache_product.json"),
            new SchemaSourceConfig(
                    "catalogue",
                    "Catalogue Item API (sender)",
                    "https://test-webapi-firstbase.gs1.ch:5443/docs/v01/catalogueItemApi",
                    ".swagger_cache_catalogue.json"));

    public SchemaSourceConfig {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(url, "url must not be null");
        if (label == null || label.isBlank()) {
            label = key;
        }
        if (cacheFile == null || cacheFile.isBlank()) {
            cacheFile = defaultCacheFile(key);
        }
    }

    /** {@code .swagger_cache_{key}.json} */
    public static String defaultCacheFile(String key) {
        return ".swagger_cache_" + key + ".json";
    }
}
