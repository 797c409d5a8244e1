package oscar.provisioning.service.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolved identities keyed by raw bearer token.
 *
 * <p>Entries are only evicted by sweeps: every insertion requests a sweep that re-verifies every
 * cached token and drops those that no longer pass. At most one thread sweeps at a time; an
 * insertion that arrives while a sweep is running is picked up by a follow-up pass of the running
 * sweeper instead of blocking. With a non-zero minimum interval, requests arriving too soon after
 * the previous sweep stay pending until the next insertion.</p>
 */
@Slf4j
public class TokenCache {

    private final Map<String, UserIdentity> entries = new ConcurrentHashMap<>();
    private final AtomicBoolean sweeping = new AtomicBoolean(false);
    private final AtomicBoolean sweepRequested = new AtomicBoolean(false);
    private final Predicate<String> stillValid;
    private final Duration minSweepInterval;
    private final Clock clock;

    private volatile Instant lastSweep = Instant.EPOCH;

    public TokenCache(Predicate<String> stillValid) {
        this(stillValid, Duration.ZERO, Clock.systemUTC());
    }

    public TokenCache(Predicate<String> stillValid, Duration minSweepInterval, Clock clock) {
        this.stillValid = stillValid;
        this.minSweepInterval = minSweepInterval != null ? minSweepInterval : Duration.ZERO;
        this.clock = clock;
    }

    public Optional<UserIdentity> get(String rawToken) {
        return Optional.ofNullable(entries.get(rawToken));
    }

    public void put(String rawToken, UserIdentity identity) {
        entries.put(rawToken, identity);
        sweepRequested.set(true);
        drainSweepRequests();
    }

    public int size() {
        return entries.size();
    }

    private void drainSweepRequests() {
        while (sweepRequested.get() && sweeping.compareAndSet(false, true)) {
            try {
                Instant now = clock.instant();
                if (now.isBefore(lastSweep.plus(minSweepInterval))) {
                    return;
                }
                sweepRequested.set(false);
                sweep();
                lastSweep = now;
            } finally {
                sweeping.set(false);
            }
        }
    }

    private void sweep() {
        int evicted = 0;
        for (String rawToken : entries.keySet()) {
            if (!stillValid.test(rawToken)) {
                entries.remove(rawToken);
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} expired tokens from the identity cache", evicted);
        }
    }
}
