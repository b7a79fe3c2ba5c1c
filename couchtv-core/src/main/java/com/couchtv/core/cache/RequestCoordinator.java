package com.couchtv.core.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Background content cache with request coalescing.
 *
 * Serves cached values immediately, keeps at most one fetch in flight per key,
 * backs off from failed keys for a cooldown, and hands results to the consumer
 * thread through a {@link ResultChannel}. Typical use from a render loop:
 * <pre>
 * coordinator.processPending();          // once per frame
 * coordinator.request(key);              // cheap when fresh, pending or cooling down
 * coordinator.get(key).ifPresent(...);   // stale values are still returned
 * </pre>
 *
 * All methods except the worker body are meant for a single consumer thread and never block.
 * The only state shared with workers is the channel.
 */
public class RequestCoordinator<K, V> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RequestCoordinator.class);

    private final String name;
    private final Fetcher<K, V> fetcher;
    private final Clock clock;
    private final WorkerLauncher launcher;

    private final CacheStore<K, V> store;
    private final PendingSet<K> pending = new PendingSet<>();
    private final CooldownMap<K> cooldowns;
    private final ResultChannel<K, V> channel = new ResultChannel<>();

    private BooleanSupplier availability = () -> true;
    private String unavailableMessage;

    private String lastError;
    private long generation = 0;

    public RequestCoordinator(String name, Fetcher<K, V> fetcher, CachePolicy policy) {
        this(name, fetcher, policy, Clock.systemUTC(), WorkerLauncher.daemonThreads());
    }

    public RequestCoordinator(String name, Fetcher<K, V> fetcher, CachePolicy policy,
                              Clock clock, WorkerLauncher launcher) {
        this.name = Objects.requireNonNull(name, "name");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.store = new CacheStore<>(policy.ttl());
        this.cooldowns = new CooldownMap<>(policy.cooldown());
    }

    /**
     * Only fetch while the check passes. Otherwise {@link #request} records the message as last error.
     */
    public RequestCoordinator<K, V> withAvailability(BooleanSupplier check, String messageWhenUnavailable) {
        this.availability = Objects.requireNonNull(check, "check");
        this.unavailableMessage = messageWhenUnavailable;
        return this;
    }

    // ==================== Consumer API ====================

    /**
     * Make sure a fresh value for the key is cached or on its way. Returns immediately.
     */
    public void request(K key) {
        Objects.requireNonNull(key, "key");
        if (channel.isClosed()) {
            return;
        }
        if (!availability.getAsBoolean()) {
            lastError = unavailableMessage;
            return;
        }

        Instant now = clock.instant();
        if (store.isFresh(key, now)) {
            return;
        }
        if (cooldowns.isCoolingDown(key, now)) {
            return;
        }
        if (!pending.add(key)) {
            return;
        }

        long spawnedUnder = generation;
        log.debug("[{}] Fetching {}", name, key);
        launcher.launch(name + "-" + key, () -> runWorker(key, spawnedUnder));
    }

    public void requestAll(Collection<? extends K> keys) {
        for (K key : keys) {
            request(key);
        }
    }

    public boolean isLoading(K key) {
        return pending.contains(key);
    }

    public boolean isAnyLoading() {
        return !pending.isEmpty();
    }

    /**
     * Cached value regardless of freshness.
     */
    public Optional<V> get(K key) {
        return store.get(key);
    }

    public Optional<CacheEntry<K, V>> entry(K key) {
        return store.entry(key);
    }

    public boolean isFresh(K key) {
        return store.isFresh(key, clock.instant());
    }

    /**
     * Apply every result already queued. Never waits for outstanding workers.
     *
     * @return number of messages drained
     */
    public int processPending() {
        return channel.drain(this::apply);
    }

    public Optional<String> lastError() {
        return Optional.ofNullable(lastError);
    }

    /**
     * Forget one cached value so the next request fetches again. Cooldown still applies.
     */
    public void invalidate(K key) {
        store.remove(key);
    }

    /**
     * Keep cached values readable but let the next request of each key refresh it.
     */
    public void markAllStale() {
        store.markAllStale();
    }

    /**
     * Empty the cache, pending set, cooldowns and last error.
     * Workers already running finish; their results are dropped when drained.
     */
    public void clear() {
        store.clear();
        pending.clear();
        cooldowns.clear();
        lastError = null;
        generation++;
    }

    public Set<K> cachedKeys() {
        return store.keys();
    }

    public int size() {
        return store.size();
    }

    public String name() {
        return name;
    }

    /**
     * Stop accepting work. Outstanding workers still run; their sends become no-ops.
     */
    @Override
    public void close() {
        channel.close();
        clear();
    }

    // ==================== Internals ====================

    private void apply(ResultMessage<K, V> message) {
        K key = message.key();
        if (message.generation() != generation) {
            log.debug("[{}] Dropping result for {} from before the last clear", name, key);
            return;
        }

        Instant now = clock.instant();
        pending.remove(key);
        if (message instanceof ResultMessage.Loaded<K, V> loaded) {
            store.put(key, loaded.value(), now);
            cooldowns.remove(key);
            lastError = null;
        } else if (message instanceof ResultMessage.Failed<K, V> failed) {
            cooldowns.recordFailure(key, now);
            lastError = failed.error().getMessage();
        }
    }

    /**
     * Worker body: exactly one fetch, exactly one send.
     */
    private void runWorker(K key, long spawnedUnder) {
        ResultMessage<K, V> message;
        try {
            V value = fetcher.fetch(key);
            if (value == null) {
                throw new FetchException(FetchException.ErrorType.UNKNOWN, "No data returned");
            }
            message = new ResultMessage.Loaded<>(key, value, spawnedUnder);
            log.debug("[{}] Loaded {}", name, key);
        } catch (FetchException e) {
            log.warn("[{}] Failed to load {}: {}", name, key, e.getMessage());
            message = new ResultMessage.Failed<>(key, e, spawnedUnder);
        } catch (RuntimeException e) {
            log.warn("[{}] Unexpected error loading {}", name, key, e);
            String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            message = new ResultMessage.Failed<>(key,
                new FetchException(FetchException.ErrorType.UNKNOWN, "Unexpected error: " + detail, e),
                spawnedUnder);
        }

        if (!channel.send(message)) {
            log.debug("[{}] Result for {} discarded, cache closed", name, key);
        }
    }
}
