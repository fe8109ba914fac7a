package io.github.davidhlp.spring.cache.rediscluster.connection;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.davidhlp.spring.cache.rediscluster.config.StoreConfig;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.cluster.ClusterClientOptions;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.data.redis.connection.RedisClusterConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * 使用 Lettuce 创建 Redis Cluster 连接。
 *
 * <p>配置映射：
 * - timeout → 建立 socket 连接的超时
 * - readTimeout → 单条命令的超时
 * - failover → Lettuce ReadFrom
 * - persist → 创建时立即建立连接，并开启 TCP keep-alive
 *
 * <p>所有命令共享同一个原生连接，每个存储只持有一条集群连接。创建完成后立即 PING 一次，
 * 任何失败都会销毁连接工厂及其线程资源后再抛出。
 */
@Slf4j
@RequiredArgsConstructor
public class LettuceBackendClientFactory implements BackendClientFactory {

    @Nullable
    private final ObjectMapper objectMapper;

    public LettuceBackendClientFactory() {
        this(null);
    }

    @Override
    public BackendClient create(List<String> seeds, StoreConfig config, String keyPrefix) {
        if (seeds.isEmpty()) {
            throw new IllegalArgumentException("Seed list is empty");
        }

        LettuceConnectionFactory connectionFactory = createConnectionFactory(seeds, config);
        try {
            connectionFactory.afterPropertiesSet();
            connectionFactory.start();

            RedisTemplateBackendClient client = new RedisTemplateBackendClient(
                    connectionFactory, keyPrefix, config.getSerializer().createSerializer(objectMapper));
            String pong = client.ping();
            log.debug("Connected to cluster seeds {}, ping: {}, prefix: {}", seeds, pong, keyPrefix);
            return client;
        } catch (RuntimeException e) {
            log.debug("Connecting to cluster seeds {} failed, releasing connection factory", seeds);
            connectionFactory.destroy();
            throw e;
        }
    }

    /** 构建尚未启动的连接工厂 */
    LettuceConnectionFactory createConnectionFactory(List<String> seeds, StoreConfig config) {
        RedisClusterConfiguration clusterConfiguration = new RedisClusterConfiguration(seeds);

        ClusterClientOptions clientOptions = ClusterClientOptions.builder()
                .socketOptions(SocketOptions.builder()
                        .connectTimeout(config.getTimeout())
                        .keepAlive(config.isPersist())
                        .build())
                .build();

        LettuceClientConfiguration clientConfiguration = LettuceClientConfiguration.builder()
                .commandTimeout(config.getReadTimeout())
                .readFrom(config.getFailover().getReadFrom())
                .clientOptions(clientOptions)
                .build();

        LettuceConnectionFactory connectionFactory =
                new LettuceConnectionFactory(clusterConfiguration, clientConfiguration);
        connectionFactory.setShareNativeConnection(true);
        connectionFactory.setEagerInitialization(config.isPersist());
        return connectionFactory;
    }
}
