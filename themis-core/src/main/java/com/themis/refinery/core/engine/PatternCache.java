package com.themis.refinery.core.engine;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Bounded cache of compiled rule patterns.
 *
 * <p>Invalid patterns are cached as failures as well, so a broken rule is
 * reported once per pattern instead of once per document.
 */
public final class PatternCache {
    private static final Logger logger = Logger.getLogger(PatternCache.class.getName());

    private static final long DEFAULT_MAXIMUM_SIZE = 10_000;

    private final LoadingCache<Key, Compiled> cache;

    public PatternCache() {
        this(DEFAULT_MAXIMUM_SIZE);
    }

    public PatternCache(long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build(PatternCache::compile);
    }

    /**
     * @return the compiled pattern, or empty when the regex does not compile
     */
    public Optional<Pattern> get(String regex, int flags) {
        return Optional.ofNullable(cache.get(new Key(regex, flags)).pattern());
    }

    /**
     * Compilation error for the pattern, if any.
     */
    public Optional<String> error(String regex, int flags) {
        return Optional.ofNullable(cache.get(new Key(regex, flags)).error());
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static Compiled compile(Key key) {
        try {
            return new Compiled(Pattern.compile(key.regex(), key.flags()), null);
        } catch (PatternSyntaxException e) {
            logger.warning("Invalid rule pattern '" + key.regex() + "': " + e.getDescription());
            return new Compiled(null, e.getDescription());
        }
    }

    private record Key(String regex, int flags) {
    }

    private record Compiled(Pattern pattern, String error) {
    }
}
