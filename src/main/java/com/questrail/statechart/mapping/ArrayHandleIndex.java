package com.questrail.statechart.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ArrayHandleIndex
 * -----------------------------------------------------------------------------
 * The default {@link HandleIndex}: a list for handle -> key and a hash map for
 * key -> handle. Keys are assigned handles in the order they are given.
 */
public final class ArrayHandleIndex<K> implements HandleIndex<K>
{
    private final List<K> keyByHandle;
    private final Map<K, Integer> handleByKey;

    /**
     * Creates an index from keys in handle order. An empty index is permitted;
     * a machine may legitimately declare no events or no context fields.
     *
     * @throws IllegalArgumentException on duplicate keys
     */
    public ArrayHandleIndex(List<K> keysInHandleOrder) {
        Objects.requireNonNull(keysInHandleOrder, "keysInHandleOrder");

        List<K> keys = new ArrayList<>(keysInHandleOrder.size());
        Map<K, Integer> tmp = new HashMap<>(keysInHandleOrder.size() * 2);
        for (int i = 0; i < keysInHandleOrder.size(); i++) {
            K key = Objects.requireNonNull(keysInHandleOrder.get(i), "key at handle " + i);
            Integer prev = tmp.put(key, i);
            if (prev != null) {
                throw new IllegalArgumentException("Duplicate key in index: " + key);
            }
            keys.add(key);
        }
        this.keyByHandle = Collections.unmodifiableList(keys);
        this.handleByKey = Collections.unmodifiableMap(tmp);
    }

    @Override
    public int size() {
        return keyByHandle.size();
    }

    @Override
    public int handleOf(K key) {
        Objects.requireNonNull(key, "key");
        Integer handle = handleByKey.get(key);
        if (handle == null) {
            throw new IllegalArgumentException("Unknown key: " + key);
        }
        return handle;
    }

    @Override
    public K keyAt(int handle) {
        if (handle < 0 || handle >= keyByHandle.size()) {
            throw new IndexOutOfBoundsException("handle=" + handle + ", size=" + keyByHandle.size());
        }
        return keyByHandle.get(handle);
    }

    @Override
    public List<K> keys() {
        return keyByHandle;
    }
}
