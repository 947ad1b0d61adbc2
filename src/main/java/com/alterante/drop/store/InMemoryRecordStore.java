package com.alterante.drop.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * {@link RecordStore} over a {@link ConcurrentHashMap}. Per-key atomicity comes
 * from {@code compute}/{@code computeIfPresent}.
 */
public class InMemoryRecordStore<V> implements RecordStore<V> {

    protected final Map<String, V> records = new ConcurrentHashMap<>();

    @Override
    public Optional<V> get(String key) {
        return Optional.ofNullable(records.get(key));
    }

    @Override
    public boolean insertIfAbsent(String key, V value) {
        AtomicBoolean inserted = new AtomicBoolean(false);
        records.compute(key, (k, current) -> {
            if (current != null) {
                return current;
            }
            beforePublish(k, value);
            inserted.set(true);
            return value;
        });
        return inserted.get();
    }

    @Override
    public V upsert(String key, Function<Optional<V>, V> merge) {
        return records.compute(key, (k, current) -> {
            V next = merge.apply(Optional.ofNullable(current));
            beforePublish(k, next);
            return next;
        });
    }

    @Override
    public Optional<V> updateIf(String key, Predicate<V> condition, UnaryOperator<V> update) {
        AtomicBoolean applied = new AtomicBoolean(false);
        V result = records.computeIfPresent(key, (k, current) -> {
            if (!condition.test(current)) {
                return current;
            }
            V next = update.apply(current);
            beforePublish(k, next);
            applied.set(true);
            return next;
        });
        if (!applied.get()) {
            return Optional.empty();
        }
        return Optional.ofNullable(result);
    }

    @Override
    public List<V> query(Predicate<V> filter) {
        List<V> out = new ArrayList<>();
        for (V v : records.values()) {
            if (filter.test(v)) {
                out.add(v);
            }
        }
        return out;
    }

    @Override
    public int size() {
        return records.size();
    }

    /**
     * Called with the key's lock held, before {@code next} becomes visible. An
     * exception aborts the mutation and leaves the previous value in place.
     */
    protected void beforePublish(String key, V next) {
    }
}
