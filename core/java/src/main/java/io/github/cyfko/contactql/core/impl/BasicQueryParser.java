package io.github.cyfko.contactql.core.impl;

import io.github.cyfko.contactql.core.api.QueryParser;
import io.github.cyfko.contactql.core.cache.QueryCache;
import io.github.cyfko.contactql.core.config.CachePolicy;
import io.github.cyfko.contactql.core.config.QueryPolicy;
import io.github.cyfko.contactql.core.exception.SearchException;
import io.github.cyfko.contactql.core.parsing.QueryGrammar;
import io.github.cyfko.contactql.core.tree.ContactQuery;

import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Default {@link QueryParser}: tokenizes, parses with {@link QueryGrammar} and optionally
 * optimizes.
 *
 * <h2>Phone number queries</h2>
 * <p>
 * In non-anonymous organizations a query made only of phone number characters
 * ({@code +250 788-123 (456)}) is stripped down to its digits first, so it becomes a single
 * {@code tel ~ digits} term instead of several implicit terms.
 * </p>
 *
 * <h2>Caching</h2>
 * <p>
 * Parsed queries are immutable and organization-independent, so they are cached by
 * {@code (text, asAnon, optimize)} in a bounded LRU cache when the {@link CachePolicy} enables it.
 * Failed parses are never cached.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * QueryParser parser = new BasicQueryParser();
 * ContactQuery query = parser.parse("age > 18 and gender = male", org.anon());
 *
 * // Public search box
 * QueryParser strict = new BasicQueryParser(QueryPolicy.strict(), CachePolicy.none());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicQueryParser implements QueryParser {

    private static final Logger log = Logger.getLogger(BasicQueryParser.class.getName());

    private static final Pattern PHONE_QUERY = Pattern.compile("^[+ \\d\\-()]+$");
    private static final Pattern PHONE_SPECIAL_CHARS = Pattern.compile("[+ \\-()]");

    private final QueryPolicy queryPolicy;
    private final CachePolicy cachePolicy;
    protected final QueryCache<CacheKey, ContactQuery> cache;

    /**
     * Creates a parser with {@link QueryPolicy#defaults()} and {@link CachePolicy#defaults()}.
     */
    public BasicQueryParser() {
        this(QueryPolicy.defaults(), CachePolicy.defaults());
    }

    public BasicQueryParser(QueryPolicy queryPolicy) {
        this(queryPolicy, CachePolicy.defaults());
    }

    /**
     * @param queryPolicy the parsing limits
     * @param cachePolicy the cache settings
     * @throws IllegalArgumentException if a policy is null
     */
    public BasicQueryParser(QueryPolicy queryPolicy, CachePolicy cachePolicy) {
        if (queryPolicy == null) {
            throw new IllegalArgumentException("Query policy is required");
        }
        if (cachePolicy == null) {
            throw new IllegalArgumentException("Cache policy is required");
        }

        this.queryPolicy = queryPolicy;
        this.cachePolicy = cachePolicy;
        this.cache = cachePolicy.cacheEnabled() ? new QueryCache<>(cachePolicy.cacheSize()) : null;
    }

    @Override
    public ContactQuery parse(String text, boolean asAnon, boolean optimize) throws SearchException {
        Objects.requireNonNull(text, "Query text cannot be null");

        String trimmed = text.strip();
        if (trimmed.length() > queryPolicy.maxQueryLength()) {
            throw new SearchException(String.format(
                    "Query too long: %d characters, %s allows at most %d",
                    trimmed.length(), queryPolicy.policyName(), queryPolicy.maxQueryLength()));
        }

        if (cache == null) {
            return doParse(trimmed, asAnon, optimize);
        }

        CacheKey key = new CacheKey(trimmed, asAnon, optimize);
        ContactQuery cached = cache.get(key);
        if (cached != null) {
            log.fine(() -> String.format("Query cache hit: %s", trimmed));
            return cached;
        }
        return cache.computeIfAbsent(key, k -> doParse(k.text(), k.asAnon(), k.optimize()));
    }

    private ContactQuery doParse(String text, boolean asAnon, boolean optimize) {
        String source = text;
        if (!asAnon && queryPolicy.cleanPhoneQueries() && PHONE_QUERY.matcher(text).matches()) {
            source = PHONE_SPECIAL_CHARS.matcher(text).replaceAll("");
            final String cleaned = source;
            log.fine(() -> String.format("Phone number query '%s' cleaned to '%s'", text, cleaned));
        }

        ContactQuery query = new ContactQuery(QueryGrammar.parse(source, asAnon));
        return optimize ? query.optimized() : query;
    }

    public QueryPolicy getQueryPolicy() {
        return queryPolicy;
    }

    public CachePolicy getCachePolicy() {
        return cachePolicy;
    }

    /**
     * @return the number of cached queries, 0 when caching is disabled
     */
    public int cacheSize() {
        return cache == null ? 0 : cache.size();
    }

    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    protected record CacheKey(String text, boolean asAnon, boolean optimize) {}
}
