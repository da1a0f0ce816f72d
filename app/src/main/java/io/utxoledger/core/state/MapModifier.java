package io.utxoledger.core.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Diff over a base map: a set of insertions and a set of deletions.
 * A key is never in both. Lookups consult the diff first and fall through
 * to the base; the base itself is never touched.
 *
 * Not thread-safe: one writer per instance.
 */
public final class MapModifier<K, V> {
    private final Map<K, V> insertions;
    private final Set<K> deletions;

    private MapModifier(Map<K, V> insertions, Set<K> deletions) {
        this.insertions = insertions;
        this.deletions = deletions;
    }

    public static <K, V> MapModifier<K, V> empty() {
        return new MapModifier<>(new LinkedHashMap<>(), new LinkedHashSet<>());
    }

    public Optional<V> lookup(Function<K, Optional<V>> base, K key) {
        if (deletions.contains(key)) return Optional.empty();
        V inserted = insertions.get(key);
        if (inserted != null) return Optional.of(inserted);
        return base.apply(key);
    }

    public void insert(K key, V value) {
        deletions.remove(key);
        insertions.put(key, value);
    }

    public void delete(K key) {
        insertions.remove(key);
        deletions.add(key);
    }

    /** This diff followed by {@code next}, as a new modifier. */
    public MapModifier<K, V> andThen(MapModifier<K, V> next) {
        MapModifier<K, V> out = copy();
        for (K key : next.deletions) out.delete(key);
        for (Map.Entry<K, V> e : next.insertions.entrySet()) out.insert(e.getKey(), e.getValue());
        return out;
    }

    public MapModifier<K, V> copy() {
        return new MapModifier<>(new LinkedHashMap<>(insertions), new LinkedHashSet<>(deletions));
    }

    public Map<K, V> insertions() { return Collections.unmodifiableMap(insertions); }
    public Set<K> deletions() { return Collections.unmodifiableSet(deletions); }
    public boolean isEmpty() { return insertions.isEmpty() && deletions.isEmpty(); }

    @Override public String toString() {
        return "MapModifier{+" + insertions.size() + ", -" + deletions.size() + "}";
    }
}
