package mc.orchestrator.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Small in-memory cache with a fixed time-to-live per entry.
 * Private to one orchestrator process; nothing here coordinates across processes.
 */
public class TtlCache<K, V> {
    private final Duration ttl;
    private final Clock clock;
    private final Map<K, Entry<V>> entries = new ConcurrentHashMap<>();

    public TtlCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    public V get(K key, Supplier<V> loader) {
        Instant now = clock.instant();
        Entry<V> cached = entries.get(key);
        if (cached != null && !isExpired(cached, now)) {
            return cached.value();
        }
        entries.values().removeIf(entry -> isExpired(entry, now));
        V value = loader.get();
        entries.put(key, new Entry<>(value, now));
        return value;
    }

    public void invalidate(K key) {
        entries.remove(key);
    }

    /**
     * Drops every entry whose key is not in {@code keys}.
     */
    public void retainKeys(Collection<K> keys) {
        entries.keySet().retainAll(keys);
    }

    public void invalidateAll() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private boolean isExpired(Entry<V> entry, Instant now) {
        return Duration.between(entry.loadedAt(), now).compareTo(ttl) > 0;
    }

    private record Entry<V>(V value, Instant loadedAt) {
    }
}
