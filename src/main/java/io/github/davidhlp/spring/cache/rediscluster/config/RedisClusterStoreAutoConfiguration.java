package io.github.davidhlp.spring.cache.rediscluster.config;

import io.github.davidhlp.spring.cache.rediscluster.cache.RedisClusterCacheManager;
import io.github.davidhlp.spring.cache.rediscluster.connection.BackendClientFactory;
import io.github.davidhlp.spring.cache.rediscluster.connection.ClusterConnector;
import io.github.davidhlp.spring.cache.rediscluster.connection.LettuceBackendClientFactory;
import io.github.davidhlp.spring.cache.rediscluster.store.RedisClusterStores;
import io.github.davidhlp.spring.cache.rediscluster.web.CacheStoreUnavailableAdvice;
import io.lettuce.core.cluster.RedisClusterClient;

import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisOperations;

/**
 * Redis Cluster 缓存存储自动配置
 *
 * <p>职责： 1. 绑定 {@code cache.rediscluster.*} 配置 2. 提供连接器和存储工厂 3. 配置了 server 时注册缓存管理器
 * 4. 存在 Actuator 时注册健康检查 5. Servlet 应用中注册 503 处理
 */
@Slf4j
@AutoConfiguration
@ConditionalOnClass({RedisOperations.class, RedisClusterClient.class})
@ConditionalOnProperty(prefix = "cache.rediscluster", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(RedisClusterStoreProperties.class)
public class RedisClusterStoreAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public BackendClientFactory redisClusterBackendClientFactory() {
        return new LettuceBackendClientFactory();
    }

    @Bean
    @ConditionalOnMissingBean
    public ClusterConnector redisClusterConnector(BackendClientFactory redisClusterBackendClientFactory) {
        return new ClusterConnector(redisClusterBackendClientFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public RedisClusterStores redisClusterStores(
            RedisClusterStoreProperties properties, ClusterConnector redisClusterConnector) {
        return new RedisClusterStores(properties.toConfiguration(), redisClusterConnector);
    }

    @Bean
    @ConditionalOnMissingBean(CacheManager.class)
    @ConditionalOnProperty(prefix = "cache.rediscluster", name = "server")
    public RedisClusterCacheManager redisClusterCacheManager(
            RedisClusterStores redisClusterStores, RedisClusterStoreProperties properties) {
        RedisClusterStoreProperties.CacheManagerConfiguration cacheManager = properties.getCacheManager();
        log.info("Creating RedisClusterCacheManager, store: {}, seeds: {}",
                cacheManager.getStoreName(), properties.getServer());
        return new RedisClusterCacheManager(
                redisClusterStores,
                cacheManager.getStoreName(),
                cacheManager.getComponent(),
                cacheManager.getCacheNames(),
                cacheManager.isAllowNullValues(),
                cacheManager.getLockWait());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(HealthIndicator.class)
    @ConditionalOnProperty(prefix = "cache.rediscluster", name = "server")
    static class HealthConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "redisClusterHealthIndicator")
        public RedisClusterHealthIndicator redisClusterHealthIndicator(CacheManager cacheManager) {
            return new RedisClusterHealthIndicator(cacheManager);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(name = "org.springframework.web.bind.annotation.RestControllerAdvice")
    static class WebConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public CacheStoreUnavailableAdvice cacheStoreUnavailableAdvice() {
            return new CacheStoreUnavailableAdvice();
        }
    }
}
