package io.github.flameyossnowy.tabula.sql.internals.query;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Statements that only depend on the mapping, keyed by purpose and table.
 */
public final class QueryStringCache {
    private final Map<String, String> cache;

    public QueryStringCache(int initialCapacity) {
        this.cache = new ConcurrentHashMap<>(initialCapacity);
    }

    public String computeIfAbsent(String key, Function<String, String> mappingFunction) {
        return cache.computeIfAbsent(key, mappingFunction);
    }
}
