package io.github.davidhlp.spring.cache.rediscluster.store;

/** 缓存定义的作用范围。 */
public enum StoreMode {
    APPLICATION,
    SESSION,
    REQUEST
}
