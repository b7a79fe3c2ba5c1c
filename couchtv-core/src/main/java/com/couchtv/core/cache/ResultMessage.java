package com.couchtv.core.cache;

/**
 * Outcome of one worker, sent exactly once and drained exactly once.
 * The generation is the coordinator generation the worker was spawned under.
 */
public sealed interface ResultMessage<K, V> {

    K key();

    long generation();

    record Loaded<K, V>(K key, V value, long generation) implements ResultMessage<K, V> {}

    record Failed<K, V>(K key, FetchException error, long generation) implements ResultMessage<K, V> {}
}
