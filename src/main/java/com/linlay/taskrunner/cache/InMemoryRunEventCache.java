package com.linlay.taskrunner.cache;

import com.linlay.taskrunner.config.RunCacheProperties;
import com.linlay.taskrunner.model.AgentEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Access-ordered LRU with a time-to-live per entry.
 */
public class InMemoryRunEventCache implements RunEventCache {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRunEventCache.class);

    private final RunCacheProperties properties;
    private final Clock clock;
    private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>(16, 0.75f, true);

    public InMemoryRunEventCache(RunCacheProperties properties) {
        this(properties, Clock.systemUTC());
    }

    public InMemoryRunEventCache(RunCacheProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public synchronized Optional<List<AgentEvent>> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry)) {
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(entry.events());
    }

    @Override
    public synchronized void put(String key, List<AgentEvent> events) {
        if (key == null || events == null || events.isEmpty()) {
            return;
        }
        entries.put(key, new Entry(List.copyOf(events), clock.millis()));
        evict();
    }

    @Override
    public synchronized void invalidate(String key) {
        entries.remove(key);
    }

    @Override
    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    private void evict() {
        Iterator<Map.Entry<String, Entry>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            if (isExpired(iterator.next().getValue())) {
                iterator.remove();
            }
        }
        int maxEntries = Math.max(1, properties.getMaxEntries());
        iterator = entries.entrySet().iterator();
        while (entries.size() > maxEntries && iterator.hasNext()) {
            String evicted = iterator.next().getKey();
            iterator.remove();
            log.debug("Evicted run cache entry {}", evicted);
        }
    }

    private boolean isExpired(Entry entry) {
        long ttlMs = properties.getTtlSeconds() * 1000L;
        return ttlMs > 0 && clock.millis() - entry.storedAt() >= ttlMs;
    }

    private record Entry(List<AgentEvent> events, long storedAt) {
    }
}
