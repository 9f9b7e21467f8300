package dev.nuclr.plugin.core.zip.viewer.cache;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * LRU that trades memory for hit rate. Every {@link #ADJUST_INTERVAL} puts it
 * averages the last {@link #WINDOW} hit-rate observations, grows by
 * {@link #STEP} when the average is low and shrinks by {@link #STEP} when it
 * is very high, staying within [{@link #MIN_CAPACITY}, {@link #MAX_CAPACITY}].
 */
@Slf4j
class AdaptiveLruStrategy extends LruStrategy {

    static final int    MIN_CAPACITY    = 10;
    static final int    MAX_CAPACITY    = 200;
    static final int    STEP            = 5;
    static final int    ADJUST_INTERVAL = 10;
    static final int    WINDOW          = 5;
    static final double LOW_HIT_RATE    = 0.7;
    static final double HIGH_HIT_RATE   = 0.9;

    private final Deque<Double> recentHitRates = new ArrayDeque<>();
    private long accesses;
    private long hits;
    private long puts;

    AdaptiveLruStrategy(int capacity) {
        super(capacity);
    }

    @Override
    public EvictionPolicy policy() {
        return EvictionPolicy.ADAPTIVE;
    }

    @Override
    public void recordAccess(boolean hit) {
        accesses++;
        if (hit) hits++;
    }

    @Override
    public List<CacheEntry> put(CacheKey key, DecodedImage image) {
        List<CacheEntry> evicted = new ArrayList<>();
        if (accesses > 0) {
            recentHitRates.addLast((double) hits / accesses);
            while (recentHitRates.size() > WINDOW) recentHitRates.removeFirst();
        }
        puts++;
        if (puts % ADJUST_INTERVAL == 0 && recentHitRates.size() >= WINDOW) {
            evicted.addAll(adjustCapacity());
        }
        evicted.addAll(super.put(key, image));
        return evicted;
    }

    double averageHitRate() {
        return recentHitRates.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private List<CacheEntry> adjustCapacity() {
        double average = averageHitRate();
        int current = capacity();
        if (average < LOW_HIT_RATE && current < MAX_CAPACITY) {
            int grown = Math.min(current + STEP, MAX_CAPACITY);
            log.debug("Adaptive cache: hit rate {} -> capacity {} -> {}", average, current, grown);
            return resize(grown);
        }
        if (average > HIGH_HIT_RATE && current > MIN_CAPACITY) {
            int shrunk = Math.max(current - STEP, MIN_CAPACITY);
            log.debug("Adaptive cache: hit rate {} -> capacity {} -> {}", average, current, shrunk);
            return resize(shrunk);
        }
        return List.of();
    }
}
