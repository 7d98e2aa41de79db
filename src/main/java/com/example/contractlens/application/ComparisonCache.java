package com.example.contractlens.application;

import com.example.contractlens.domain.DiffResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Time-bounded store of finished comparisons, keyed by the two addresses, the
 * network and a digest of both sources. Only the web layer consults it; the comparison pipeline itself never does.
 * When full, the oldest entry is evicted.
 */
public class ComparisonCache {
    private static final Logger log = LogManager.getLogger(ComparisonCache.class);

    private final Clock clock;
    private final Duration ttl;
    private final int maxEntries;
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public ComparisonCache(Clock clock, Duration ttl, int maxEntries) {
        this.clock = clock;
        this.ttl = ttl;
        this.maxEntries = Math.max(1, maxEntries);
    }

    /**
     * Enriched and rule-only results for the same pair are cached separately. The
     * source digest keeps a redeployed or edited contract from hitting a stale entry.
     */
    public static String key(String addressA, String addressB, String network,
                             String sourceA, String sourceB, boolean semantic) {
        String base = (addressA + "-" + addressB + "-" + network).toLowerCase(Locale.ROOT)
                + "@" + sourceDigest(sourceA, sourceB);
        return semantic ? base + ":semantic" : base;
    }

    static String sourceDigest(String sourceA, String sourceB) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            md.update(sourceA.getBytes(StandardCharsets.UTF_8));
            md.update((byte) 0);
            md.update(sourceB.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : md.digest()) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public synchronized Optional<DiffResult> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry, clock.instant())) {
            entries.remove(key);
            log.debug("Cached comparison {} expired", key);
            return Optional.empty();
        }
        return Optional.of(entry.result());
    }

    public synchronized void put(String key, DiffResult result) {
        Instant now = clock.instant();
        entries.values().removeIf(entry -> isExpired(entry, now));
        entries.remove(key);
        entries.put(key, new Entry(result, now));
        Iterator<String> oldest = entries.keySet().iterator();
        while (entries.size() > maxEntries && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
    }

    public synchronized int size() {
        return entries.size();
    }

    private boolean isExpired(Entry entry, Instant now) {
        return !entry.storedAt().plus(ttl).isAfter(now);
    }

    private record Entry(DiffResult result, Instant storedAt) {}
}
