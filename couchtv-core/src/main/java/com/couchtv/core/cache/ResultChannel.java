package com.couchtv.core.cache;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;

/**
 * Unbounded many-producer, single-consumer queue between workers and the consumer thread.
 * Sends after {@link #close()} are dropped.
 */
public class ResultChannel<K, V> {

    private final Queue<ResultMessage<K, V>> queue = new ConcurrentLinkedQueue<>();
    private volatile boolean closed = false;

    /**
     * Enqueue a message. Safe from any thread.
     *
     * @return false if the channel was closed and the message dropped
     */
    public boolean send(ResultMessage<K, V> message) {
        if (closed) {
            return false;
        }
        queue.offer(message);
        return true;
    }

    /**
     * Hand every queued message to the handler without waiting for more.
     *
     * @return number of messages handled
     */
    public int drain(Consumer<ResultMessage<K, V>> handler) {
        int count = 0;
        ResultMessage<K, V> message;
        while ((message = queue.poll()) != null) {
            handler.accept(message);
            count++;
        }
        return count;
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    public void close() {
        closed = true;
        queue.clear();
    }

    public boolean isClosed() {
        return closed;
    }
}
