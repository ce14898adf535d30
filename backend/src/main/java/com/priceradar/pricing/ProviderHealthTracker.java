package com.priceradar.pricing;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-provider circuit breaker. Single level: no half-open probing. After the cooldown the provider is simply
 * tried again; another failure burst re-opens it through the same counting rule.
 * <p>
 * State is created lazily on the first failure and discarded on any success.
 */
@Slf4j
public class ProviderHealthTracker {

    /** Mutable per-provider state; only touched while holding the tracker's lock. */
    static final class ProviderHealth {
        private int failureCount;
        private Instant windowStartedAt;
        private Instant cooldownUntil;

        ProviderHealth(Instant windowStartedAt) {
            this.windowStartedAt = windowStartedAt;
        }
    }

    private final int failThreshold;
    private final Duration failWindow;
    private final Duration cooldown;
    private final Clock clock;
    private final Object lock = new Object();
    private final Map<String, ProviderHealth> states = new HashMap<>();

    public ProviderHealthTracker(int failThreshold, Duration failWindow, Duration cooldown, Clock clock) {
        if (failThreshold <= 0) {
            throw new IllegalArgumentException("failThreshold must be positive");
        }
        this.failThreshold = failThreshold;
        this.failWindow = failWindow;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    /**
     * True when the provider has no recorded failures or its cooldown has passed.
     */
    public boolean isAvailable(String providerName) {
        synchronized (lock) {
            ProviderHealth state = states.get(providerName);
            if (state == null || state.cooldownUntil == null) {
                return true;
            }
            return clock.instant().isAfter(state.cooldownUntil);
        }
    }

    public void recordFailure(String providerName) {
        synchronized (lock) {
            Instant now = clock.instant();
            ProviderHealth state = states.computeIfAbsent(providerName, k -> new ProviderHealth(now));
            if (now.isAfter(state.windowStartedAt.plus(failWindow))) {
                state.failureCount = 0;
                state.windowStartedAt = now;
            }
            state.failureCount++;
            if (state.failureCount >= failThreshold) {
                boolean alreadyOpen = state.cooldownUntil != null && !now.isAfter(state.cooldownUntil);
                state.cooldownUntil = now.plus(cooldown);
                if (!alreadyOpen) {
                    log.info("Circuit open for {} until {} after {} failures", providerName, state.cooldownUntil,
                            state.failureCount);
                }
            }
        }
    }

    public void recordSuccess(String providerName) {
        synchronized (lock) {
            states.remove(providerName);
        }
    }

    int failureCount(String providerName) {
        synchronized (lock) {
            ProviderHealth state = states.get(providerName);
            return state == null ? 0 : state.failureCount;
        }
    }
}
