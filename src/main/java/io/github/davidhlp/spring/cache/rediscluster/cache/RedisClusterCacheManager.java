package io.github.davidhlp.spring.cache.rediscluster.cache;

import io.github.davidhlp.spring.cache.rediscluster.store.CacheDefinition;
import io.github.davidhlp.spring.cache.rediscluster.store.RedisClusterStore;
import io.github.davidhlp.spring.cache.rediscluster.store.RedisClusterStores;
import io.github.davidhlp.spring.cache.rediscluster.store.StoreMode;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.DisposableBean;
import org.springframework.cache.Cache;
import org.springframework.cache.support.AbstractCacheManager;
import org.springframework.lang.NonNull;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 每个缓存名称对应一个 {@link RedisClusterStore}（一张远端哈希表和一条集群连接）。
 *
 * <p>缓存定义为 {@code APPLICATION/<component>/<cacheName>}。关闭时只释放连接，不清空数据。
 */
@Slf4j
public class RedisClusterCacheManager extends AbstractCacheManager implements DisposableBean {

    private final RedisClusterStores stores;
    private final String storeName;
    private final String component;
    private final Collection<String> initialCacheNames;
    private final boolean allowNullValues;
    private final Duration lockWait;

    public RedisClusterCacheManager(
            RedisClusterStores stores,
            String storeName,
            String component,
            Collection<String> initialCacheNames,
            boolean allowNullValues,
            Duration lockWait) {
        this.stores = stores;
        this.storeName = storeName;
        this.component = component;
        this.initialCacheNames = List.copyOf(initialCacheNames);
        this.allowNullValues = allowNullValues;
        this.lockWait = lockWait;
    }

    @Override
    @NonNull
    protected Collection<? extends Cache> loadCaches() {
        List<Cache> caches = new ArrayList<>(initialCacheNames.size());
        for (String cacheName : initialCacheNames) {
            caches.add(createCache(cacheName));
        }
        return caches;
    }

    @Override
    protected Cache getMissingCache(@NonNull String name) {
        return createCache(name);
    }

    private RedisClusterCache createCache(String cacheName) {
        CacheDefinition definition = CacheDefinition.adhoc(StoreMode.APPLICATION, component, cacheName);
        RedisClusterStore store = stores.create(storeName, definition);
        log.debug("Created cache '{}' backed by store '{}', hash: {}",
                cacheName, storeName, definition.generateDefinitionHash());
        return new RedisClusterCache(cacheName, store, allowNullValues, lockWait);
    }

    @Override
    public void destroy() {
        for (String cacheName : getCacheNames()) {
            Cache cache = lookupCache(cacheName);
            if (cache instanceof RedisClusterCache clusterCache) {
                clusterCache.getNativeCache().close();
            }
        }
    }
}
