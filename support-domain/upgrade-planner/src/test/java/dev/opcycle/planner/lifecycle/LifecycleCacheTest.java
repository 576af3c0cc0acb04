package dev.opcycle.planner.lifecycle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.opcycle.planner.model.LifecycleInfo;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

class LifecycleCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-15T00:00:00Z"));

    @Test
    void entriesExpireAfterTtl() {
        var cache = new LifecycleCache(clock, Duration.ofHours(1));
        var info = LifecycleInfo.defaults("quay-operator", "3.10.1");
        cache.put("quay-operator", "3.10.1", info);

        clock.advance(Duration.ofMinutes(59));
        assertEquals(info, cache.get("quay-operator", "3.10.1").orElseThrow());

        clock.advance(Duration.ofMinutes(1));
        assertTrue(cache.get("quay-operator", "3.10.1").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void keysIncludeVersion() {
        var cache = new LifecycleCache(clock, Duration.ofHours(1));
        cache.put("quay-operator", "3.10.1", LifecycleInfo.defaults("quay-operator", "3.10.1"));

        assertTrue(cache.get("quay-operator", "3.11.0").isEmpty());
    }

    @Test
    void zeroTtlDisablesCaching() {
        var cache = new LifecycleCache(clock, Duration.ZERO);
        cache.put("quay-operator", "3.10.1", LifecycleInfo.defaults("quay-operator", "3.10.1"));

        assertEquals(0, cache.size());
    }

    static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
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
