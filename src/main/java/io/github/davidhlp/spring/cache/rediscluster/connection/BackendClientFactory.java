package io.github.davidhlp.spring.cache.rediscluster.connection;

import io.github.davidhlp.spring.cache.rediscluster.config.StoreConfig;

import java.util.List;

/**
 * 根据一组种子节点创建已连通的 {@link BackendClient}。
 */
@FunctionalInterface
public interface BackendClientFactory {

    /**
     * @param seeds     种子节点，host:port
     * @param config    连接配置
     * @param keyPrefix 连接上附加的键前缀
     * @return 已验证可用的客户端
     * @throws RuntimeException 无法连接到集群
     */
    BackendClient create(List<String> seeds, StoreConfig config, String keyPrefix);
}
