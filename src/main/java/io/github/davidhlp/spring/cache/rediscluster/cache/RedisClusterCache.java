package io.github.davidhlp.spring.cache.rediscluster.cache;

import io.github.davidhlp.spring.cache.rediscluster.command.Sleeper;
import io.github.davidhlp.spring.cache.rediscluster.store.RedisClusterStore;

import lombok.extern.slf4j.Slf4j;

import org.springframework.cache.support.AbstractValueAdaptingCache;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * 把 {@link RedisClusterStore} 适配为 Spring {@link org.springframework.cache.Cache}。
 *
 * <p>{@link #get(Object, Callable)} 在缓存未命中时用存储的建议锁保护加载过程，同一个键同一时间只有一个调用方加载；
 * 等待锁超时后不再等待，直接加载。
 *
 * <p>加载锁是没有过期时间的建议锁。持有者崩溃时锁键会残留，之后该键的每次未命中都会先等待
 * {@code lockWait} 再加载，因此 {@code lockWait} 应保持在调用方能接受的延迟以内。
 */
@Slf4j
public class RedisClusterCache extends AbstractValueAdaptingCache {

    static final String LOCK_KEY_PREFIX = "lock:";

    private static final long LOCK_POLL_INTERVAL_MS = 50;

    private final String name;
    private final RedisClusterStore store;
    private final Duration lockWait;
    private final Sleeper sleeper;

    public RedisClusterCache(String name, RedisClusterStore store, boolean allowNullValues, Duration lockWait) {
        this(name, store, allowNullValues, lockWait, Sleeper.THREAD);
    }

    RedisClusterCache(
            String name, RedisClusterStore store, boolean allowNullValues, Duration lockWait, Sleeper sleeper) {
        super(allowNullValues);
        this.name = name;
        this.store = store;
        this.lockWait = lockWait;
        this.sleeper = sleeper;
    }

    @Override
    @NonNull
    public String getName() {
        return name;
    }

    @Override
    @NonNull
    public RedisClusterStore getNativeCache() {
        return store;
    }

    @Override
    @Nullable
    protected Object lookup(@NonNull Object key) {
        return store.get(fieldOf(key));
    }

    @Override
    @Nullable
    @SuppressWarnings("unchecked")
    public <T> T get(@NonNull Object key, @NonNull Callable<T> valueLoader) {
        ValueWrapper cached = get(key);
        if (cached != null) {
            return (T) cached.get();
        }

        String field = fieldOf(key);
        String lockKey = LOCK_KEY_PREFIX + field;
        String ownerId = UUID.randomUUID().toString();
        boolean locked = awaitLock(lockKey, ownerId);
        try {
            if (locked) {
                cached = get(key);
                if (cached != null) {
                    return (T) cached.get();
                }
            }
            T value = loadValue(key, valueLoader);
            put(key, value);
            return value;
        } finally {
            if (locked) {
                store.releaseLock(lockKey, ownerId);
            }
        }
    }

    @Override
    public void put(@NonNull Object key, @Nullable Object value) {
        store.set(fieldOf(key), toStoreValue(value));
    }

    @Override
    public void evict(@NonNull Object key) {
        store.delete(fieldOf(key));
    }

    @Override
    public boolean evictIfPresent(@NonNull Object key) {
        return store.delete(fieldOf(key));
    }

    @Override
    public void clear() {
        store.purge();
    }

    @Override
    public boolean invalidate() {
        return store.purge();
    }

    private boolean awaitLock(String lockKey, String ownerId) {
        long deadline = System.nanoTime() + lockWait.toNanos();
        while (true) {
            if (store.acquireLock(lockKey, ownerId)) {
                return true;
            }
            if (System.nanoTime() >= deadline) {
                log.warn("Timed out waiting for load lock, loading without it (a stale lock must be deleted manually): "
                        + "cache={}, lock={}", name, lockKey);
                return false;
            }
            try {
                sleeper.sleep(LOCK_POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    private <T> T loadValue(Object key, Callable<T> valueLoader) {
        try {
            return valueLoader.call();
        } catch (Exception e) {
            throw new ValueRetrievalException(key, valueLoader, e);
        }
    }

    private static String fieldOf(Object key) {
        return key.toString();
    }
}
