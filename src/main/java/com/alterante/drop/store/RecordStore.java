package com.alterante.drop.store;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Minimal keyed record store: the durability engine seen by the presence tracker
 * and the delivery queue. Every mutation is atomic per key; there is no
 * cross-key transaction.
 *
 * @param <V> immutable record type
 */
public interface RecordStore<V> {

    Optional<V> get(String key);

    /**
     * Store {@code value} unless the key is already present.
     *
     * @return true if the value was stored
     */
    boolean insertIfAbsent(String key, V value);

    /**
     * Create or replace the record under {@code key}. The merge function receives
     * the current record (empty when absent) and returns the new one.
     */
    V upsert(String key, Function<Optional<V>, V> merge);

    /**
     * Conditional update. Applies {@code update} only if the record exists and
     * {@code condition} holds for its current value, atomically with the check.
     *
     * @return the updated record, or empty if the record is missing or the
     *         condition did not hold
     */
    Optional<V> updateIf(String key, Predicate<V> condition, UnaryOperator<V> update);

    /** Unconditional update of an existing record; empty if absent. */
    default Optional<V> update(String key, UnaryOperator<V> update) {
        return updateIf(key, v -> true, update);
    }

    /** All records matching {@code filter}, in no particular order. */
    List<V> query(Predicate<V> filter);

    int size();
}
