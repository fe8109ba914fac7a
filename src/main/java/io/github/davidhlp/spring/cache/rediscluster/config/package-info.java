/// Redis Cluster 缓存存储配置包
/// 1. [io.github.davidhlp.spring.cache.rediscluster.config.StoreConfigResolver] - 将配置映射与默认值合并为不可变的 StoreConfig
/// 2. [io.github.davidhlp.spring.cache.rediscluster.config.RedisClusterStoreProperties] - Spring Boot 外部化配置
/// 3. [io.github.davidhlp.spring.cache.rediscluster.config.RedisClusterStoreAutoConfiguration] - 自动配置入口
/// 4. [io.github.davidhlp.spring.cache.rediscluster.config.RedisClusterHealthIndicator] - Actuator 健康检查
@NonNullApi
package io.github.davidhlp.spring.cache.rediscluster.config;

import org.springframework.lang.NonNullApi;
