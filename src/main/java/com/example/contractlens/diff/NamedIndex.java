package com.example.contractlens.diff;

import com.example.contractlens.domain.Named;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Name-keyed lookup over an entity list. A later entry replaces an earlier one with
 * the same key but keeps the earlier one's position. Entries without a usable key
 * are counted in {@link #skipped()} and left out.
 */
public final class NamedIndex<T> {
    private final Map<String, T> entries;
    private final int skipped;

    private NamedIndex(Map<String, T> entries, int skipped) {
        this.entries = entries;
        this.skipped = skipped;
    }

    public static <T extends Named> NamedIndex<T> of(List<T> items) {
        return by(items, Named::key);
    }

    public static <T> NamedIndex<T> by(List<T> items, Function<T, String> keyFunction) {
        Map<String, T> entries = new LinkedHashMap<>();
        int skipped = 0;
        for (T item : items) {
            String key = keyFunction.apply(item);
            if (key == null || key.isBlank()) {
                skipped++;
                continue;
            }
            entries.put(key, item);
        }
        return new NamedIndex<>(entries, skipped);
    }

    public T get(String key) {
        return entries.get(key);
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public Collection<T> values() {
        return entries.values();
    }

    public Set<Map.Entry<String, T>> entries() {
        return entries.entrySet();
    }

    public int skipped() {
        return skipped;
    }
}
