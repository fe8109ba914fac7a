package io.github.davidhlp.spring.cache.rediscluster.store;

import io.github.davidhlp.spring.cache.rediscluster.command.BackendOperationException;
import io.github.davidhlp.spring.cache.rediscluster.command.RetryingCommandExecutor;
import io.github.davidhlp.spring.cache.rediscluster.config.StoreConfig;
import io.github.davidhlp.spring.cache.rediscluster.config.StoreConfigResolver;
import io.github.davidhlp.spring.cache.rediscluster.connection.BackendClient;
import io.github.davidhlp.spring.cache.rediscluster.connection.ClusterConnector;
import io.github.davidhlp.spring.cache.rediscluster.lock.KeyLockManager;
import io.github.davidhlp.spring.cache.rediscluster.purge.PurgeStrategies;
import io.github.davidhlp.spring.cache.rediscluster.purge.PurgeStrategy;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import org.springframework.lang.Nullable;
import org.springframework.util.Assert;
import org.springframework.util.ClassUtils;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Redis Cluster 缓存存储
 *
 * <p>每个缓存定义对应一张远端哈希表，缓存键是哈希字段。所有命令都经过 {@link RetryingCommandExecutor}。
 *
 * <p>生命周期：
 * 1. 构造时解析配置并建立连接，未配置 server 时不连接，存储保持未就绪
 * 2. {@link #initialise(CacheDefinition)} 绑定缓存定义
 * 3. {@link #close()} 释放连接；{@link #instanceDeleted()} 先清空再释放
 *
 * <p>非线程安全，每个实例同一时间只服务一个调用方。
 *
 * @author David
 */
@Slf4j
public class RedisClusterStore implements AutoCloseable {

    private static final String PONG = "PONG";

    @Getter
    private final String name;

    @Getter
    @Nullable
    private final StoreConfig config;

    @Nullable
    private BackendClient client;

    @Nullable
    private RetryingCommandExecutor executor;

    @Nullable
    private PurgeStrategy purgeStrategy;

    @Nullable
    private KeyLockManager lockManager;

    @Getter
    @Nullable
    private CacheDefinition definition;

    @Getter
    @Nullable
    private BucketHandle bucket;

    private boolean ready = false;

    /**
     * @param name          存储名称，是键前缀的一部分
     * @param configuration 配置映射，键见 {@link StoreConfigResolver}
     * @param connector     集群连接器
     * @throws io.github.davidhlp.spring.cache.rediscluster.connection.CacheStoreUnavailableException 无法连接
     */
    public RedisClusterStore(String name, Map<String, ?> configuration, ClusterConnector connector) {
        this(name, StringUtils.hasText(asText(configuration.get(StoreConfigResolver.SERVER)))
                ? StoreConfigResolver.resolve(configuration)
                : null, connector);
    }

    public RedisClusterStore(String name, @Nullable StoreConfig config, ClusterConnector connector) {
        this.name = name;
        this.config = config;
        if (config == null || !StringUtils.hasText(config.getServer())) {
            log.debug("No server configured for store '{}', store stays unusable", name);
            return;
        }
        connect(connector);
    }

    private void connect(ClusterConnector connector) {
        this.ready = false;
        BackendClient connected = connector.connect(config, name);
        this.client = connected;
        this.executor = new RetryingCommandExecutor(connected);
        this.purgeStrategy = PurgeStrategies.forMode(config.getPurgeMode(), executor);
        this.lockManager = new KeyLockManager(executor);
        this.ready = true;
        log.info("Redis cluster store '{}' ready, prefix: {}, purge mode: {}",
                name, connected.keyPrefix(), config.getPurgeMode().getValue());
    }

    public static boolean areRequirementsMet() {
        ClassLoader classLoader = RedisClusterStore.class.getClassLoader();
        return ClassUtils.isPresent("io.lettuce.core.cluster.RedisClusterClient", classLoader)
                && ClassUtils.isPresent("org.springframework.data.redis.core.RedisTemplate", classLoader);
    }

    public static Set<StoreFeature> supportedFeatures() {
        return EnumSet.of(StoreFeature.DATA_GUARANTEE, StoreFeature.DEREFERENCES_OBJECTS);
    }

    public static Set<StoreMode> supportedModes() {
        return EnumSet.of(StoreMode.APPLICATION);
    }

    public static boolean isSupportedMode(StoreMode mode) {
        return mode == StoreMode.APPLICATION;
    }

    public String myName() {
        return name;
    }

    /**
     * 绑定缓存定义，确定远端哈希表。
     *
     * @return 总是返回 true
     */
    public boolean initialise(CacheDefinition definition) {
        Assert.notNull(definition, "definition must not be null");
        Assert.state(this.definition == null || this.definition.equals(definition),
                () -> "Store '" + name + "' is already bound to definition " + this.definition.id());
        String prefix = client != null ? client.keyPrefix() : "";
        this.definition = definition;
        this.bucket = new BucketHandle(prefix, definition.generateDefinitionHash());
        log.debug("Store '{}' initialised for definition {}, hash: {}",
                name, definition.id(), bucket.definitionHash());
        return true;
    }

    public boolean isInitialised() {
        return definition != null;
    }

    public boolean isReady() {
        return ready;
    }

    /**
     * @return 缓存值，不存在时返回 {@code null}
     * @throws BackendOperationException 命令失败
     */
    @Nullable
    public Object get(String key) {
        String hash = hash();
        return executor().execute("HGET", redis -> redis.hGet(hash, key));
    }

    /**
     * 批量读取。命令失败时不抛出异常，所有键都按不存在处理。
     *
     * @return 与 {@code keys} 顺序和数量一致的值列表，不存在的键为 {@code null}
     */
    public List<Object> getMany(List<String> keys) {
        List<Object> result = new ArrayList<>(Collections.nCopies(keys.size(), null));
        if (keys.isEmpty()) {
            return result;
        }

        String hash = hash();
        try {
            List<Object> values = executor().execute("HMGET", redis -> redis.hMGet(hash, keys));
            if (values != null) {
                for (int i = 0; i < Math.min(values.size(), keys.size()); i++) {
                    result.set(i, values.get(i));
                }
            }
        } catch (BackendOperationException e) {
            log.warn("Bulk read failed for store '{}', treating {} keys as missing: {}",
                    name, keys.size(), e.getMostSpecificCause().getMessage());
        }
        return result;
    }

    /**
     * @return 写入被确认时返回 true
     */
    public boolean set(String key, Object value) {
        Assert.notNull(value, "Cache value must not be null");
        String hash = hash();
        return Boolean.TRUE.equals(executor().execute("HSET", redis -> redis.hSet(hash, key, value)));
    }

    /**
     * 批量写入。重复的键以最后一次为准。
     *
     * @return 发送的键值数量，写入未被确认时返回 0
     */
    public int setMany(Collection<KeyValuePair> pairs) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (KeyValuePair pair : pairs) {
            Assert.notNull(pair.value(), "Cache value must not be null");
            values.put(pair.key(), pair.value());
        }
        if (values.isEmpty()) {
            return 0;
        }

        String hash = hash();
        boolean written = Boolean.TRUE.equals(executor().execute("HMSET", redis -> redis.hMSet(hash, values)));
        return written ? values.size() : 0;
    }

    /**
     * @return 字段被删除时返回 true
     */
    public boolean delete(String key) {
        String hash = hash();
        Long removed = executor().execute("HDEL", redis -> redis.hDel(hash, key));
        return removed != null && removed > 0;
    }

    /**
     * @return 实际删除的字段数量
     */
    public long deleteMany(Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        String hash = hash();
        String[] fields = keys.toArray(String[]::new);
        Long removed = executor().execute("HDEL", redis -> redis.hDel(hash, fields));
        return removed != null ? removed : 0L;
    }

    public boolean has(String key) {
        String hash = hash();
        return Boolean.TRUE.equals(executor().execute("HEXISTS", redis -> redis.hExists(hash, key)));
    }

    /**
     * 逐个检查，命中第一个存在的键即返回。最坏情况下每个键一次往返。
     */
    public boolean hasAny(Collection<String> keys) {
        for (String key : keys) {
            if (has(key)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 逐个检查，遇到第一个不存在的键即返回。
     */
    public boolean hasAll(Collection<String> keys) {
        for (String key : keys) {
            if (!has(key)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 按配置的清空方式清空整个缓存桶。
     */
    public boolean purge() {
        BucketHandle target = requireBucket();
        Assert.state(purgeStrategy != null, () -> "Store '" + name + "' is not ready");
        boolean purged = purgeStrategy.purge(target);
        log.debug("Purged store '{}' with mode {}: {}", name, purgeStrategy.mode().getValue(), purged);
        return purged;
    }

    public boolean acquireLock(String key, String ownerId) {
        return lockManager().acquire(key, ownerId);
    }

    /**
     * @return 持有者一致返回 {@code TRUE}，锁不存在返回 {@code null}，否则返回 {@code FALSE}
     */
    @Nullable
    public Boolean checkLockState(String key, String ownerId) {
        return lockManager().check(key, ownerId);
    }

    public boolean releaseLock(String key, String ownerId) {
        return lockManager().release(key, ownerId);
    }

    /**
     * PING 集群。
     *
     * @return 收到 PONG 时返回 true，任何失败都返回 false
     */
    public boolean ping() {
        if (executor == null) {
            return false;
        }
        try {
            return PONG.equalsIgnoreCase(executor.execute("PING", BackendClient::ping));
        } catch (BackendOperationException e) {
            log.debug("Ping failed for store '{}': {}", name, e.getMostSpecificCause().getMessage());
            return false;
        }
    }

    /** 实例被移除：先清空缓存桶，再释放连接。清空失败时连接同样会被释放，异常继续抛出。 */
    public void instanceDeleted() {
        try {
            if (bucket != null && ready) {
                purge();
            }
        } finally {
            close();
        }
    }

    /** 只释放连接，不清空数据。 */
    @Override
    public void close() {
        if (client != null) {
            client.close();
            log.info("Redis cluster store '{}' closed", name);
        }
        client = null;
        executor = null;
        purgeStrategy = null;
        lockManager = null;
        ready = false;
    }

    private RetryingCommandExecutor executor() {
        Assert.state(executor != null, () -> "Store '" + name + "' is not ready");
        return executor;
    }

    private KeyLockManager lockManager() {
        Assert.state(lockManager != null, () -> "Store '" + name + "' is not ready");
        return lockManager;
    }

    private BucketHandle requireBucket() {
        Assert.state(bucket != null, () -> "Store '" + name + "' is not initialised");
        return bucket;
    }

    private String hash() {
        return requireBucket().definitionHash();
    }

    @Nullable
    private static String asText(@Nullable Object value) {
        return value != null ? value.toString() : null;
    }
}
