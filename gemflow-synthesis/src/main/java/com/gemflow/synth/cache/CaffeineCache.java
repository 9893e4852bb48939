package com.gemflow.synth.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.concurrent.atomic.LongAdder;

/**
 * 基于 Caffeine 的缓存实现
 *
 * <p>线程安全。只使用 {@code getIfPresent} 与 {@code asMap().putIfAbsent}，
 * 不调用 {@code Cache.get(key, fn)}：展开过程中会递归查询同一缓存，
 * 原地计算会触发 Caffeine 的递归更新检测。</p>
 */
public final class CaffeineCache<K, V> implements BoundedCache<K, V> {

    private final Cache<K, V> cache;
    private final long maximumSize;
    private final LongAdder loads = new LongAdder();

    /**
     * @param maximumSize 最大条目数
     */
    public CaffeineCache(long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.maximumSize = maximumSize;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    @Override
    public V get(K key) {
        return cache.getIfPresent(key);
    }

    @Override
    public V putIfAbsent(K key, V value) {
        loads.increment();
        V previous = cache.asMap().putIfAbsent(key, value);
        return previous != null ? previous : value;
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }

    @Override
    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                loads.sum(),
                caffeineStats.evictionCount(),
                cache.estimatedSize(),
                maximumSize
        );
    }

    /**
     * 手动触发清理（通常不需要，Caffeine 会自动异步清理）
     */
    public void cleanUp() {
        cache.cleanUp();
    }
}
