package com.priceradar.pricing;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.priceradar.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderHealthTrackerTest {

    private MutableClock clock;
    private ProviderHealthTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T01:30:00Z"));
        tracker = new ProviderHealthTracker(3, Duration.ofSeconds(60), Duration.ofSeconds(120), clock);
    }

    @Test
    @DisplayName("unknown provider is available")
    void unknownProviderAvailable() {
        assertThat(tracker.isAvailable("Eastmoney")).isTrue();
    }

    @Test
    @DisplayName("threshold failures within the window open the circuit for the cooldown")
    void opensAtThreshold() {
        tracker.recordFailure("Eastmoney");
        tracker.recordFailure("Eastmoney");
        assertThat(tracker.isAvailable("Eastmoney")).isTrue();

        tracker.recordFailure("Eastmoney");
        assertThat(tracker.isAvailable("Eastmoney")).isFalse();

        clock.advance(Duration.ofSeconds(120));
        assertThat(tracker.isAvailable("Eastmoney")).isFalse();
        clock.advance(Duration.ofMillis(1));
        assertThat(tracker.isAvailable("Eastmoney")).isTrue();
    }

    @Test
    @DisplayName("failures older than the window do not compound with a fresh burst")
    void windowResets() {
        tracker.recordFailure("Sina Finance");
        tracker.recordFailure("Sina Finance");
        clock.advance(Duration.ofSeconds(61));

        tracker.recordFailure("Sina Finance");
        tracker.recordFailure("Sina Finance");

        assertThat(tracker.failureCount("Sina Finance")).isEqualTo(2);
        assertThat(tracker.isAvailable("Sina Finance")).isTrue();
    }

    @Test
    @DisplayName("success clears all failure state")
    void successClears() {
        tracker.recordFailure("Tencent Finance");
        tracker.recordFailure("Tencent Finance");
        tracker.recordSuccess("Tencent Finance");
        tracker.recordFailure("Tencent Finance");

        assertThat(tracker.failureCount("Tencent Finance")).isEqualTo(1);
        assertThat(tracker.isAvailable("Tencent Finance")).isTrue();
    }

    @Test
    @DisplayName("providers are tracked independently")
    void independentProviders() {
        for (int i = 0; i < 3; i++) {
            tracker.recordFailure("Yahoo Finance");
        }
        assertThat(tracker.isAvailable("Yahoo Finance")).isFalse();
        assertThat(tracker.isAvailable("Yahoo Finance (HK Connect)")).isTrue();
    }

    @Test
    @DisplayName("after cooldown a single failure reopens nothing until the count is reached again")
    void failureAfterCooldownCountsFromFreshWindow() {
        for (int i = 0; i < 3; i++) {
            tracker.recordFailure("Eastmoney");
        }
        clock.advance(Duration.ofSeconds(121));
        tracker.recordFailure("Eastmoney");

        assertThat(tracker.failureCount("Eastmoney")).isEqualTo(1);
        assertThat(tracker.isAvailable("Eastmoney")).isTrue();
    }

    @Test
    @DisplayName("circuit-open is logged once per opening, not for failures recorded while already open")
    void logsOpeningOnce() {
        Logger logger = (Logger) LoggerFactory.getLogger(ProviderHealthTracker.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            for (int i = 0; i < 5; i++) {
                tracker.recordFailure("Sina Finance");
            }
            assertThat(openEvents(appender)).hasSize(1);

            clock.advance(Duration.ofSeconds(121));
            for (int i = 0; i < 3; i++) {
                tracker.recordFailure("Sina Finance");
            }
            assertThat(openEvents(appender)).hasSize(2);
        } finally {
            logger.detachAppender(appender);
        }
    }

    private static List<ILoggingEvent> openEvents(ListAppender<ILoggingEvent> appender) {
        return appender.list.stream()
                .filter(e -> e.getFormattedMessage().startsWith("Circuit open for Sina Finance"))
                .toList();
    }

    @Test
    @DisplayName("non-positive threshold is rejected")
    void rejectsNonPositiveThreshold() {
        assertThatThrownBy(() -> new ProviderHealthTracker(0, Duration.ofSeconds(60), Duration.ofSeconds(120), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
