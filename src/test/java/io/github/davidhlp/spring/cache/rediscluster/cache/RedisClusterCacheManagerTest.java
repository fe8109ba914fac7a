package io.github.davidhlp.spring.cache.rediscluster.cache;

import static org.assertj.core.api.Assertions.*;

import io.github.davidhlp.spring.cache.rediscluster.config.StoreConfigResolver;
import io.github.davidhlp.spring.cache.rediscluster.store.CacheDefinition;
import io.github.davidhlp.spring.cache.rediscluster.store.RedisClusterStores;
import io.github.davidhlp.spring.cache.rediscluster.store.StoreMode;
import io.github.davidhlp.spring.cache.rediscluster.support.InMemoryBackendClient;
import io.github.davidhlp.spring.cache.rediscluster.support.InMemoryClusterConnector;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.cache.Cache;

import java.time.Duration;
import java.util.List;
import java.util.Map;

class RedisClusterCacheManagerTest {

    private InMemoryClusterConnector connector;
    private RedisClusterCacheManager cacheManager;

    @BeforeEach
    void setUp() {
        connector = new InMemoryClusterConnector();
        RedisClusterStores stores = new RedisClusterStores(
                Map.of(StoreConfigResolver.SERVER, "127.0.0.1:7000"), connector);
        cacheManager = new RedisClusterCacheManager(
                stores, "rediscluster", "application", List.of("users"), true, Duration.ofSeconds(1));
        cacheManager.afterPropertiesSet();
    }

    @Test
    void testInitialCaches() {
        assertThat(cacheManager.getCacheNames()).containsExactly("users");
        assertThat(connector.clients()).hasSize(1);
    }

    @Test
    void testMissingCacheCreatedOnDemand() {
        Cache orders = cacheManager.getCache("orders");

        assertThat(orders).isInstanceOf(RedisClusterCache.class);
        assertThat(cacheManager.getCacheNames()).containsExactlyInAnyOrder("users", "orders");
        assertThat(cacheManager.getCache("orders")).isSameAs(orders);

        RedisClusterCache clusterCache = (RedisClusterCache) orders;
        assertThat(clusterCache.getNativeCache().getDefinition())
                .isEqualTo(CacheDefinition.adhoc(StoreMode.APPLICATION, "application", "orders"));
        assertThat(clusterCache.getNativeCache().getBucket().prefix()).isEqualTo("rediscluster-");
    }

    @Test
    void testCachesUseSeparateBuckets() {
        Cache users = cacheManager.getCache("users");
        Cache orders = cacheManager.getCache("orders");

        users.put("1", "alice");

        assertThat(orders.get("1")).isNull();
        assertThat(users.get("1").get()).isEqualTo("alice");
    }

    @Test
    void testDestroyClosesWithoutPurging() {
        cacheManager.getCache("users").put("1", "alice");

        cacheManager.destroy();

        InMemoryBackendClient client = connector.clients().get(0);
        assertThat(client.isClosed()).isTrue();
        assertThat(client.keys()).hasSize(1);
    }
}
