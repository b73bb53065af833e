package com.questrail.statechart.mapping;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * HandleIndex
 * -----------------------------------------------------------------------------
 * {@code HandleIndex} defines the mapping between semantic keys (event names,
 * field names, stable vertex and transition identifiers) and the dense,
 * 0-based integer handles used by the model arena and by runtime storage.
 *
 * <h2>Why this exists</h2>
 * The semantic model is stored as flat arrays referenced by small integer
 * handles so that runtime bookkeeping (active cursors, history slots, timer
 * slots, join arrival bits) can be sized once and addressed without lookups.
 * Names are only needed at the edges: when a model is built, when an event is
 * submitted by name, and when traces are rendered. This interface isolates
 * that edge so that:
 * <ul>
 *   <li>Dispatch code never resolves names</li>
 *   <li>Handles remain dense and suitable for array or BitSet addressing</li>
 *   <li>Stable identifiers can be changed without touching runtime storage</li>
 * </ul>
 *
 * <h2>Handle semantics</h2>
 * The handle returned by {@link #handleOf(Object)} is always:
 * <ul>
 *   <li>0-based</li>
 *   <li>Dense: every value in {@code [0, size())} is in use</li>
 *   <li>Stable within a given {@code HandleIndex} instance</li>
 * </ul>
 */
public interface HandleIndex<K>
{
    /**
     * Returns the number of keys in the universe.
     */
    int size();

    /**
     * Returns the handle of the given key.
     *
     * @throws IllegalArgumentException if the key is unknown to this index
     */
    int handleOf(K key);

    /**
     * Reverse lookup: returns the key stored at the given handle.
     *
     * @throws IndexOutOfBoundsException if the handle is out of range
     */
    K keyAt(int handle);

    /**
     * Returns all keys in handle order.
     */
    List<K> keys();

    /**
     * Returns the handle of the given key if present.
     */
    default OptionalInt find(K key) {
        Objects.requireNonNull(key, "key");
        try {
            return OptionalInt.of(handleOf(key));
        } catch (IllegalArgumentException ex) {
            return OptionalInt.empty();
        }
    }

    default boolean contains(K key) {
        return find(key).isPresent();
    }
}
