package com.gemflow.synth.cache;

import java.util.function.Function;

/**
 * 有界缓存接口
 *
 * <p>展开本身会递归查询其它锚点的展开，因此这里不提供“原地计算”语义：
 * {@link #getOrLoad} 先查后算再放入，竞争时以先放入者为准，后算出的结果被丢弃。</p>
 */
public interface BoundedCache<K, V> {

    /**
     * 获取缓存值
     *
     * @return 缓存值，不存在则返回 null
     */
    V get(K key);

    /**
     * 放入缓存（已存在时保留旧值）
     *
     * @return 缓存中最终关联的值
     */
    V putIfAbsent(K key, V value);

    /**
     * 查找，不存在时在锁外计算后放入
     *
     * @param loader 计算函数，不得返回 null
     */
    default V getOrLoad(K key, Function<? super K, ? extends V> loader) {
        V value = get(key);
        if (value != null) return value;
        return putIfAbsent(key, loader.apply(key));
    }

    /**
     * 获取缓存大小
     */
    long size();

    /**
     * 清空缓存
     */
    void clear();

    /**
     * 获取缓存统计
     */
    CacheStats getStats();

    /** 不缓存任何内容，每次都重新计算 */
    static <K, V> BoundedCache<K, V> disabled() {
        return new BoundedCache<K, V>() {
            @Override
            public V get(K key) {
                return null;
            }

            @Override
            public V putIfAbsent(K key, V value) {
                return value;
            }

            @Override
            public long size() {
                return 0;
            }

            @Override
            public void clear() {
            }

            @Override
            public CacheStats getStats() {
                return CacheStats.EMPTY;
            }
        };
    }
}
