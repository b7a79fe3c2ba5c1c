package com.couchtv.core.cache;

import java.util.HashSet;
import java.util.Set;

/**
 * Keys with a worker in flight. A key stays here from spawn until its result is drained.
 */
public class PendingSet<K> {

    private final Set<K> keys = new HashSet<>();

    /**
     * @return false if the key was already pending
     */
    public boolean add(K key) {
        return keys.add(key);
    }

    public boolean contains(K key) {
        return keys.contains(key);
    }

    public void remove(K key) {
        keys.remove(key);
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    public int size() {
        return keys.size();
    }

    public void clear() {
        keys.clear();
    }
}
