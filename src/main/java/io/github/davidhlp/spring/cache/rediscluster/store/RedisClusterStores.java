package io.github.davidhlp.spring.cache.rediscluster.store;

import io.github.davidhlp.spring.cache.rediscluster.config.StoreConfigResolver;
import io.github.davidhlp.spring.cache.rediscluster.connection.ClusterConnector;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 创建 {@link RedisClusterStore} 的工厂。
 *
 * <p>测试用的实例通过 {@link #forTesting(String, String, CacheDefinition)} 显式创建，不依赖任何全局标志。
 */
@Slf4j
@RequiredArgsConstructor
public class RedisClusterStores {

    /** 测试实例使用的存储名称，是键前缀的一部分 */
    public static final String TESTING_NAME = "test_application";

    private final Map<String, ?> configuration;
    private final ClusterConnector connector;

    /**
     * 创建存储并绑定缓存定义。
     *
     * @param name       存储名称
     * @param definition 缓存定义
     * @return 已初始化的存储
     */
    public RedisClusterStore create(String name, CacheDefinition definition) {
        RedisClusterStore store = new RedisClusterStore(name, configuration, connector);
        store.initialise(definition);
        return store;
    }

    /**
     * 创建连接测试集群的实例。
     *
     * @param testServer 测试集群的种子节点，为空时不创建
     * @param prefix     键前缀，用于隔离测试数据
     * @param definition 缓存定义
     * @return 就绪的存储；未配置测试集群或存储未就绪时为空
     */
    public Optional<RedisClusterStore> forTesting(String testServer, String prefix, CacheDefinition definition) {
        if (!RedisClusterStore.areRequirementsMet() || !StringUtils.hasText(testServer)) {
            log.debug("No test cluster configured, skipping test store");
            return Optional.empty();
        }

        Map<String, Object> testing = new HashMap<>();
        testing.put(StoreConfigResolver.SERVER, testServer);
        testing.put(StoreConfigResolver.PREFIX, prefix);

        RedisClusterStore store = new RedisClusterStore(TESTING_NAME, testing, connector);
        if (!store.isReady()) {
            return Optional.empty();
        }
        store.initialise(definition);
        return Optional.of(store);
    }
}
