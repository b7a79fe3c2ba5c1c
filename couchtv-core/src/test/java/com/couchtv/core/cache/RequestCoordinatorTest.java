package com.couchtv.core.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RequestCoordinator gating, draining and failure handling.
 */
class RequestCoordinatorTest {

    private static final Duration TTL = Duration.ofSeconds(300);
    private static final Duration COOLDOWN = Duration.ofSeconds(30);
    private static final Duration EPSILON = Duration.ofMillis(1);

    private MutableClock clock;
    private QueuedLauncher launcher;
    private ScriptedFetcher fetcher;
    private RequestCoordinator<String, String> coordinator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-10-19T12:00:00Z"));
        launcher = new QueuedLauncher();
        fetcher = new ScriptedFetcher();
        coordinator = new RequestCoordinator<>("regions", fetcher, new CachePolicy(TTL, COOLDOWN), clock, launcher);
    }

    /** Loads a value for the key through a full request/run/drain cycle. */
    private void load(String key, String value) {
        fetcher.succeed(key, value);
        coordinator.request(key);
        launcher.runAll();
        coordinator.processPending();
    }

    private void failOnce(String key, String message) {
        fetcher.fail(key, message);
        coordinator.request(key);
        launcher.runAll();
        coordinator.processPending();
    }

    @Nested
    @DisplayName("Cold start")
    class ColdStart {

        @Test
        @DisplayName("Request marks the key loading until its result is drained")
        void requestThenDrain() {
            // Given
            fetcher.succeed("us", "United States");

            // When
            coordinator.request("us");

            // Then
            assertTrue(coordinator.isLoading("us"));
            assertEquals(Optional.empty(), coordinator.get("us"));

            // When the worker finishes and the frame drains
            launcher.runAll();
            assertTrue(coordinator.isLoading("us"), "Still loading until drained");
            coordinator.processPending();

            // Then
            assertEquals(Optional.of("United States"), coordinator.get("us"));
            assertFalse(coordinator.isLoading("us"));
            assertFalse(coordinator.isAnyLoading());
        }

        @Test
        @DisplayName("Worker is named after the cache and key")
        void workerName() {
            fetcher.succeed("us", "United States");

            coordinator.request("us");

            assertEquals(List.of("regions-us"), launcher.launchedNames());
        }
    }

    @Nested
    @DisplayName("At most one fetch in flight")
    class Coalescing {

        @Test
        @DisplayName("Repeated requests before draining spawn exactly one worker")
        void repeatedRequestsSpawnOnce() {
            fetcher.succeed("us", "United States");

            for (int i = 0; i < 25; i++) {
                coordinator.request("us");
            }

            assertEquals(1, launcher.launchedCount());
        }

        @Test
        @DisplayName("Finished but undrained worker still blocks a second spawn")
        void undrainedResultKeepsKeyPending() {
            fetcher.succeed("us", "United States");

            coordinator.request("us");
            launcher.runAll();
            coordinator.request("us");

            assertEquals(1, launcher.launchedCount());
        }

        @Test
        @DisplayName("Different keys fetch independently")
        void differentKeysIndependent() {
            fetcher.succeed("us", "United States");
            fetcher.succeed("de", "Germany");

            coordinator.requestAll(List.of("us", "de", "us"));

            assertEquals(2, launcher.launchedCount());
            assertTrue(coordinator.isLoading("us"));
            assertTrue(coordinator.isLoading("de"));
        }
    }

    @Nested
    @DisplayName("TTL gating")
    class TtlGating {

        @Test
        @DisplayName("Fresh value is not refetched just before the TTL elapses")
        void freshValueNotRefetched() {
            load("us", "v1");

            clock.advance(TTL.minus(EPSILON));
            coordinator.request("us");

            assertEquals(1, launcher.launchedCount());
            assertTrue(coordinator.isFresh("us"));
        }

        @Test
        @DisplayName("Value is refetched once the TTL has elapsed")
        void staleValueRefetched() {
            load("us", "v1");

            clock.advance(TTL.plus(EPSILON));
            fetcher.succeed("us", "v2");
            coordinator.request("us");

            assertEquals(2, launcher.launchedCount());
            assertEquals(Optional.of("v1"), coordinator.get("us"), "Stale value stays readable while refreshing");

            launcher.runAll();
            coordinator.processPending();
            assertEquals(Optional.of("v2"), coordinator.get("us"));
        }

        @Test
        @DisplayName("Exactly at the TTL the value is no longer fresh")
        void boundaryIsStale() {
            load("us", "v1");

            clock.advance(TTL);
            coordinator.request("us");

            assertEquals(2, launcher.launchedCount());
        }

        @Test
        @DisplayName("Fetched-at is the drain time")
        void fetchedAtIsDrainTime() {
            fetcher.succeed("us", "v1");
            coordinator.request("us");
            launcher.runAll();
            clock.advance(Duration.ofSeconds(5));
            Instant drainedAt = clock.instant();

            coordinator.processPending();

            assertEquals(drainedAt, coordinator.entry("us").orElseThrow().fetchedAt());
        }

        @Test
        @DisplayName("Marking all stale keeps values but allows refresh")
        void markAllStale() {
            load("us", "v1");
            load("de", "v1");

            coordinator.markAllStale();
            coordinator.requestAll(coordinator.cachedKeys());

            assertEquals(4, launcher.launchedCount());
            assertEquals(Optional.of("v1"), coordinator.get("us"));
        }
    }

    @Nested
    @DisplayName("Cooldown gating")
    class CooldownGating {

        @Test
        @DisplayName("Failed key is not retried before the cooldown elapses")
        void noRetryDuringCooldown() {
            failOnce("us", "Unable to connect");

            clock.advance(COOLDOWN.minus(EPSILON));
            coordinator.request("us");

            assertEquals(1, launcher.launchedCount());
            assertFalse(coordinator.isLoading("us"));
        }

        @Test
        @DisplayName("Failed key is retried after the cooldown elapses")
        void retryAfterCooldown() {
            failOnce("us", "Unable to connect");

            clock.advance(COOLDOWN.plus(EPSILON));
            fetcher.succeed("us", "United States");
            coordinator.request("us");

            assertEquals(2, launcher.launchedCount());
        }

        @Test
        @DisplayName("Success clears the cooldown and the last error")
        void successClearsCooldown() {
            failOnce("us", "Unable to connect");
            clock.advance(COOLDOWN.plus(EPSILON));
            load("us", "United States");

            assertEquals(Optional.empty(), coordinator.lastError());

            // A later invalidation refetches immediately, no leftover cooldown
            coordinator.invalidate("us");
            coordinator.request("us");
            assertEquals(3, launcher.launchedCount());
        }

        @Test
        @DisplayName("Invalidating a failed key does not bypass its cooldown")
        void invalidateRespectsCooldown() {
            failOnce("us", "Unable to connect");

            coordinator.invalidate("us");
            coordinator.request("us");

            assertEquals(1, launcher.launchedCount());
        }
    }

    @Nested
    @DisplayName("Failure handling")
    class FailureHandling {

        @Test
        @DisplayName("Failed refresh keeps the previous value")
        void failedRefreshKeepsValue() {
            load("us", "v1");
            clock.advance(TTL.plus(EPSILON));

            failOnce("us", "API error: 503");

            assertEquals(Optional.of("v1"), coordinator.get("us"));
            assertEquals(Optional.of("API error: 503"), coordinator.lastError());
            assertFalse(coordinator.isLoading("us"));
        }

        @Test
        @DisplayName("Failure on a cold key leaves nothing cached")
        void failedColdKey() {
            failOnce("us", "Unable to connect");

            assertEquals(Optional.empty(), coordinator.get("us"));
            assertEquals(0, coordinator.size());
        }

        @Test
        @DisplayName("Null value from a fetcher counts as a failure")
        void nullValueIsFailure() {
            fetcher.succeed("us", null);

            coordinator.request("us");
            launcher.runAll();
            coordinator.processPending();

            assertEquals(Optional.empty(), coordinator.get("us"));
            assertEquals(Optional.of("No data returned"), coordinator.lastError());
        }

        @Test
        @DisplayName("Runtime exception in a fetcher is delivered as a failure")
        void runtimeExceptionIsFailure() {
            RequestCoordinator<String, String> throwing = new RequestCoordinator<>("broken",
                key -> { throw new IllegalStateException("boom"); },
                new CachePolicy(TTL, COOLDOWN), clock, launcher);

            throwing.request("us");
            assertDoesNotThrow(launcher::runAll);
            throwing.processPending();

            assertEquals(Optional.of("Unexpected error: boom"), throwing.lastError());
            assertFalse(throwing.isLoading("us"));
        }
    }

    @Nested
    @DisplayName("Draining")
    class Draining {

        @Test
        @DisplayName("One call drains every queued message")
        void drainsAllQueued() {
            List<String> keys = List.of("us", "de", "fr", "it", "es");
            keys.forEach(k -> fetcher.succeed(k, k.toUpperCase()));
            coordinator.requestAll(keys);
            launcher.runAll();

            int drained = coordinator.processPending();

            assertEquals(5, drained);
            assertEquals(0, coordinator.processPending(), "Channel left empty");
            keys.forEach(k -> assertEquals(Optional.of(k.toUpperCase()), coordinator.get(k)));
        }

        @Test
        @DisplayName("Draining with nothing queued returns immediately")
        void drainEmpty() {
            assertEquals(0, coordinator.processPending());
        }

        @Test
        @DisplayName("Mixed results apply per key")
        void mixedResults() {
            fetcher.succeed("us", "United States");
            fetcher.fail("de", "TMDB: Invalid API key");
            coordinator.requestAll(List.of("us", "de"));
            launcher.runAll();

            coordinator.processPending();

            assertEquals(Optional.of("United States"), coordinator.get("us"));
            assertEquals(Optional.empty(), coordinator.get("de"));
            assertEquals(Optional.of("TMDB: Invalid API key"), coordinator.lastError());
        }
    }

    @Nested
    @DisplayName("Clear")
    class Clear {

        @Test
        @DisplayName("Clear empties cache, pending, cooldowns and last error")
        void clearResetsEverything() {
            load("us", "v1");
            failOnce("de", "Unable to connect");
            fetcher.succeed("fr", "France");
            coordinator.request("fr");

            coordinator.clear();

            assertEquals(Optional.empty(), coordinator.get("us"));
            assertFalse(coordinator.isLoading("fr"));
            assertEquals(Optional.empty(), coordinator.lastError());

            // Cooldown forgotten: the failed key may be fetched again right away
            fetcher.succeed("de", "Germany");
            coordinator.request("de");
            assertTrue(coordinator.isLoading("de"));
        }

        @Test
        @DisplayName("Result from a worker spawned before clear is dropped")
        void staleDeliveryDropped() {
            fetcher.succeed("us", "before clear");
            coordinator.request("us");

            coordinator.clear();
            launcher.runAll();
            coordinator.processPending();

            assertEquals(Optional.empty(), coordinator.get("us"));
        }

        @Test
        @DisplayName("Worker spawned after clear is not blocked by the older one")
        void newWorkerAfterClear() {
            fetcher.succeed("us", "value");
            coordinator.request("us");
            coordinator.clear();
            coordinator.request("us");

            launcher.runAll();
            coordinator.processPending();

            assertEquals(2, launcher.launchedCount());
            assertEquals(Optional.of("value"), coordinator.get("us"));
            assertFalse(coordinator.isLoading("us"));
        }
    }

    @Nested
    @DisplayName("Availability and shutdown")
    class AvailabilityAndShutdown {

        @Test
        @DisplayName("Unavailable source records its message and spawns nothing")
        void unavailableSource() {
            coordinator.withAvailability(() -> false, "Configure TMDB API key in settings");

            coordinator.request("us");

            assertEquals(0, launcher.launchedCount());
            assertEquals(Optional.of("Configure TMDB API key in settings"), coordinator.lastError());
        }

        @Test
        @DisplayName("Closed coordinator ignores requests and late results")
        void closedCoordinator() {
            fetcher.succeed("us", "United States");
            coordinator.request("us");

            coordinator.close();
            launcher.runAll();
            coordinator.request("de");

            assertEquals(0, coordinator.processPending());
            assertEquals(1, launcher.launchedCount());
        }
    }

    @Test
    @DisplayName("Daemon thread workers deliver through the channel")
    void realWorkerThreads() throws Exception {
        // Given
        CountDownLatch fetched = new CountDownLatch(1);
        RequestCoordinator<String, String> threaded = new RequestCoordinator<>("threaded", key -> {
            fetched.countDown();
            return "value-" + key;
        }, new CachePolicy(TTL, COOLDOWN));

        // When
        threaded.request("us");
        assertTrue(fetched.await(5, TimeUnit.SECONDS));

        // Then: poll like a render loop until the message shows up
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (threaded.get("us").isEmpty() && System.nanoTime() < deadline) {
            threaded.processPending();
            Thread.sleep(5);
        }
        assertEquals(Optional.of("value-us"), threaded.get("us"));
        assertFalse(threaded.isLoading("us"));
    }

    /**
     * Fetcher whose outcome per key is set by the test.
     */
    private static class ScriptedFetcher implements Fetcher<String, String> {

        private final Map<String, Object> outcomes = new ConcurrentHashMap<>();
        private static final Object NULL_VALUE = new Object();

        void succeed(String key, String value) {
            outcomes.put(key, value != null ? value : NULL_VALUE);
        }

        void fail(String key, String message) {
            outcomes.put(key, new FetchException(FetchException.ErrorType.NETWORK, message));
        }

        @Override
        public String fetch(String key) throws FetchException {
            Object outcome = outcomes.get(key);
            if (outcome instanceof FetchException e) {
                throw e;
            }
            if (outcome == null || outcome == NULL_VALUE) {
                return null;
            }
            return (String) outcome;
        }
    }
}
