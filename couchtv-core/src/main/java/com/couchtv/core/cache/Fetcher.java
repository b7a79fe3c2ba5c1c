package com.couchtv.core.cache;

/**
 * Produces the value for one key. Runs on a worker thread and may block on I/O.
 * Implementations must not touch coordinator state; any internal retry stays inside the fetcher.
 */
@FunctionalInterface
public interface Fetcher<K, V> {

    /**
     * Fetch the value for a key.
     *
     * @return the value, never null
     * @throws FetchException if the value could not be produced
     */
    V fetch(K key) throws FetchException;
}
