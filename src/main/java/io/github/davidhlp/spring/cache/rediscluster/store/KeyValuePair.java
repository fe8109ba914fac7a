package io.github.davidhlp.spring.cache.rediscluster.store;

/** 批量写入时的一条键值。 */
public record KeyValuePair(String key, Object value) {}
