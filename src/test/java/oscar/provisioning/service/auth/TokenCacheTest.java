package oscar.provisioning.service.auth;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TokenCacheTest {

    private static final UserIdentity ALICE = new UserIdentity("alice", List.of("vo-a"));
    private static final UserIdentity BOB = new UserIdentity("bob", List.of());

    @Nested
    @DisplayName("Sweeps")
    class SweepTests {

        @Test
        @DisplayName("Should evict tokens that no longer verify when another token is inserted")
        void shouldEvictInvalidTokensOnInsert() {
            Set<String> revoked = ConcurrentHashMap.newKeySet();
            TokenCache cache = new TokenCache(token -> !revoked.contains(token));

            cache.put("token-a", ALICE);
            revoked.add("token-a");
            assertThat(cache.get("token-a")).contains(ALICE);

            cache.put("token-b", BOB);

            assertThat(cache.get("token-a")).isEmpty();
            assertThat(cache.get("token-b")).contains(BOB);
            assertThat(cache.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should re-verify every cached token on each sweep")
        void shouldReverifyAllTokens() {
            AtomicInteger checks = new AtomicInteger();
            TokenCache cache = new TokenCache(token -> {
                checks.incrementAndGet();
                return true;
            });

            cache.put("token-a", ALICE);
            cache.put("token-b", BOB);

            // first sweep checks one token, second sweep checks two
            assertThat(checks).hasValue(3);
        }

        @Test
        @DisplayName("Should defer sweeps requested before the minimum interval elapsed")
        void shouldRespectMinimumInterval() {
            MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
            Set<String> revoked = ConcurrentHashMap.newKeySet();
            TokenCache cache = new TokenCache(token -> !revoked.contains(token), Duration.ofSeconds(30), clock);

            cache.put("token-a", ALICE);
            revoked.add("token-a");

            clock.advance(Duration.ofSeconds(10));
            cache.put("token-b", BOB);
            assertThat(cache.get("token-a")).as("sweep deferred").contains(ALICE);

            clock.advance(Duration.ofSeconds(30));
            cache.put("token-c", BOB);
            assertThat(cache.get("token-a")).isEmpty();
            assertThat(cache.size()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("Should keep every valid entry under concurrent insertions")
        void shouldKeepEntriesUnderConcurrentInsertions() throws Exception {
            TokenCache cache = new TokenCache(token -> true);
            ExecutorService executor = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            try {
                for (int i = 0; i < 200; i++) {
                    String token = "token-" + i;
                    executor.submit(() -> {
                        start.await();
                        cache.put(token, ALICE);
                        return null;
                    });
                }
                start.countDown();
                executor.shutdown();
                assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
            } finally {
                executor.shutdownNow();
            }

            assertThat(cache.size()).isEqualTo(200);
        }
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
