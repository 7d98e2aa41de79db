package com.example.contractlens.application;

import com.example.contractlens.domain.ContractVersion;
import com.example.contractlens.domain.DiffResult;
import com.example.contractlens.domain.DiffStats;
import com.example.contractlens.domain.DiffSummary;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ComparisonCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

    @Test
    void returnsStoredResultUntilTtlElapses() {
        ComparisonCache cache = new ComparisonCache(clock, Duration.ofDays(7), 10);
        DiffResult result = result("Vault");
        cache.put("k", result);

        clock.advance(Duration.ofDays(6));
        assertSame(result, cache.get("k").orElseThrow());

        clock.advance(Duration.ofDays(1));
        assertTrue(cache.get("k").isEmpty(), "Entries older than the ttl should not be served");
        assertEquals(0, cache.size());
    }

    @Test
    void evictsOldestEntryWhenFull() {
        ComparisonCache cache = new ComparisonCache(clock, Duration.ofHours(1), 2);
        cache.put("first", result("A"));
        clock.advance(Duration.ofSeconds(1));
        cache.put("second", result("B"));
        clock.advance(Duration.ofSeconds(1));
        cache.put("third", result("C"));

        assertEquals(2, cache.size());
        assertTrue(cache.get("first").isEmpty());
        assertTrue(cache.get("second").isPresent());
        assertTrue(cache.get("third").isPresent());
    }

    @Test
    void replacingAnEntryRefreshesIt() {
        ComparisonCache cache = new ComparisonCache(clock, Duration.ofMinutes(10), 5);
        cache.put("k", result("Old"));
        clock.advance(Duration.ofMinutes(8));
        DiffResult fresh = result("New");
        cache.put("k", fresh);
        clock.advance(Duration.ofMinutes(8));

        assertSame(fresh, cache.get("k").orElseThrow());
        assertEquals(1, cache.size());
    }

    @Test
    void keyIgnoresAddressCaseAndSeparatesSemanticResults() {
        String plain = ComparisonCache.key("0xABC", "0xDef", "Mainnet", "contract A {}", "contract B {}", false);

        assertTrue(plain.startsWith("0xabc-0xdef-mainnet@"));
        assertEquals(plain, ComparisonCache.key("0xabc", "0xDEF", "mainnet", "contract A {}", "contract B {}", false));
        assertNotEquals(plain, ComparisonCache.key("0xabc", "0xdef", "mainnet", "contract A {}", "contract B {}", true));
    }

    @Test
    void keyChangesWhenEitherSourceChanges() {
        String original = ComparisonCache.key("0xa", "0xb", "mainnet", "contract A {}", "contract B {}", false);

        assertNotEquals(original, ComparisonCache.key("0xa", "0xb", "mainnet", "contract A { }", "contract B {}", false));
        assertNotEquals(original, ComparisonCache.key("0xa", "0xb", "mainnet", "contract A {}", "contract B { }", false));
        // moving text between the two sources must not collide
        assertNotEquals(
                ComparisonCache.key("0xa", "0xb", "mainnet", "ab", "c", false),
                ComparisonCache.key("0xa", "0xb", "mainnet", "a", "bc", false));
    }

    private static DiffResult result(String name) {
        ContractVersion version = new ContractVersion("0x1", name, "contract " + name + " {}", "mainnet");
        return new DiffResult(
                version, version, List.of(), new DiffSummary(0, 0, 0, 0, 0, "0 change(s) detected: 0 breaking."),
                new DiffStats());
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
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
