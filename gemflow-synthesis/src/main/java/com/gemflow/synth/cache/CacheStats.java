package com.gemflow.synth.cache;

/**
 * 缓存统计信息
 */
public final class CacheStats {
    public static final CacheStats EMPTY = new CacheStats(0, 0, 0, 0, 0, 0);

    private final long hitCount;
    private final long missCount;
    private final long loadCount;
    private final long evictionCount;
    private final long estimatedSize;
    private final long maximumSize;

    public CacheStats(long hitCount, long missCount, long loadCount,
                      long evictionCount, long estimatedSize, long maximumSize) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.loadCount = loadCount;
        this.evictionCount = evictionCount;
        this.estimatedSize = estimatedSize;
        this.maximumSize = maximumSize;
    }

    public long getHitCount() { return hitCount; }
    public long getMissCount() { return missCount; }
    public long getLoadCount() { return loadCount; }
    public long getEvictionCount() { return evictionCount; }
    public long getEstimatedSize() { return estimatedSize; }
    public long getMaximumSize() { return maximumSize; }

    public double getHitRate() {
        long total = hitCount + missCount;
        return total > 0 ? (double) hitCount / total : 0.0;
    }

    /** 合并两个缓存的统计 */
    public CacheStats plus(CacheStats other) {
        return new CacheStats(hitCount + other.hitCount, missCount + other.missCount,
                loadCount + other.loadCount, evictionCount + other.evictionCount,
                estimatedSize + other.estimatedSize, maximumSize + other.maximumSize);
    }

    @Override
    public String toString() {
        return String.format("hits=%d, misses=%d, hitRate=%.2f%%, loads=%d, evictions=%d, size=%d/%d",
                hitCount, missCount, getHitRate() * 100, loadCount, evictionCount, estimatedSize, maximumSize);
    }
}
