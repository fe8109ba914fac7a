package io.github.davidhlp.spring.cache.rediscluster.connection;

import io.github.davidhlp.spring.cache.rediscluster.config.StoreConfig;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 负责为一个存储实例建立唯一的集群连接。
 *
 * <p>故障转移只发生在种子列表层面：主列表连接失败时整体切换到备用列表。
 * 单条命令遇到 CLUSTERDOWN 由执行器重试，不会在这里重连。
 */
@Slf4j
@RequiredArgsConstructor
public class ClusterConnector {

    private final BackendClientFactory clientFactory;

    /**
     * 连接主种子列表，失败时尝试备用列表。
     *
     * @param config    连接配置
     * @param storeName 存储名称，用于计算键前缀
     * @return 可用的客户端
     * @throws CacheStoreUnavailableException 两个列表都无法连接，或未配置备用列表时主列表连接失败
     */
    public BackendClient connect(StoreConfig config, String storeName) {
        String keyPrefix = config.keyPrefix(storeName);
        try {
            return clientFactory.create(config.primarySeeds(), config, keyPrefix);
        } catch (RuntimeException e) {
            if (!config.hasSecondary()) {
                log.error("{}: Redis failure, message: {}", config.subsystem(), e.getMessage());
                throw new CacheStoreUnavailableException(
                        "Cache store connection failed for store '" + storeName + "'", e);
            }
            log.warn("{}: Primary redis seed list failed, trying with fallback seed list ({})",
                    config.subsystem(), e.getMessage());
        }

        try {
            return clientFactory.create(config.secondarySeeds(), config, keyPrefix);
        } catch (RuntimeException e) {
            log.warn("{}: Redis failure, message: {}", config.subsystem(), e.getMessage());
            throw new CacheStoreUnavailableException(
                    "Cache store connection failed for store '" + storeName + "' on both seed lists", e);
        }
    }
}
