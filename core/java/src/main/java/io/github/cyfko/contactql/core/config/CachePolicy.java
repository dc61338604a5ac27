package io.github.cyfko.contactql.core.config;

/**
 * Caching of parsed queries.
 * <p>
 * Parsed trees are immutable and independent of any organization, so the same text parsed with
 * the same options can be reused across calls and threads. Dynamic group re-evaluation parses
 * the same few saved queries over and over, which is where the cache pays off.
 * </p>
 *
 * @param cacheEnabled whether parsed queries are cached
 * @param cacheSize    maximum number of cached queries, least recently used evicted first
 * @since 1.0.0
 */
public record CachePolicy(boolean cacheEnabled, int cacheSize) {

    public CachePolicy {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got: " + cacheSize);
        }
    }

    public static CachePolicy defaults() {
        return new CachePolicy(true, 1000);
    }

    public static CachePolicy none() {
        return new CachePolicy(false, 1);
    }

    public static CachePolicy custom(int cacheSize) {
        return new CachePolicy(true, cacheSize);
    }
}
