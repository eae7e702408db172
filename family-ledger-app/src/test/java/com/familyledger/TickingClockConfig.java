package com.familyledger;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Replaces the system clock with one that moves a full second on every read, so each
 * mutation gets its own distinct timestamp.
 */
@TestConfiguration
public class TickingClockConfig {

    @Bean
    @Primary
    public Clock tickingClock() {
        return new TickingClock(Instant.parse("2024-01-01T00:00:00Z"), Duration.ofSeconds(1));
    }

    static final class TickingClock extends Clock {

        private final AtomicReference<Instant> next;
        private final Duration tick;

        TickingClock(Instant start, Duration tick) {
            this.next = new AtomicReference<>(start);
            this.tick = tick;
        }

        @Override
        public Instant instant() {
            return next.getAndUpdate(current -> current.plus(tick));
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            throw new UnsupportedOperationException("The ticking clock is UTC only");
        }
    }
}
