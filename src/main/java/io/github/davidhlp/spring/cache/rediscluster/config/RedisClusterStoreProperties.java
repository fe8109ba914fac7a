package io.github.davidhlp.spring.cache.rediscluster.config;

import lombok.Data;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Redis Cluster 缓存存储的外部化配置。
 *
 * <p>通过 {@link #toConfiguration()} 转换成与存储构造参数一致的配置映射，再交给
 * {@link StoreConfigResolver} 与默认值合并。
 */
@Data
@ConfigurationProperties(prefix = "cache.rediscluster")
public class RedisClusterStoreProperties {

	private boolean enabled = true;

	/** 主种子节点列表，逗号分隔的 host:port */
	private String server;

	/** 备用种子节点列表 */
	private String serverSecondary;

	private FailoverMode failover = FailoverMode.NONE;

	private boolean persist = false;

	private String prefix = "";

	private PurgeMode purgeMode = PurgeMode.LAZY;

	private Duration readTimeout = Duration.ofSeconds(3);

	private Duration timeout = Duration.ofSeconds(3);

	private SerializerType serializer = SerializerType.JDK;

	private boolean session = false;

	private CacheManagerConfiguration cacheManager = new CacheManagerConfiguration();

	public Map<String, Object> toConfiguration() {
		Map<String, Object> configuration = new LinkedHashMap<>();
		configuration.put(StoreConfigResolver.FAILOVER, failover);
		configuration.put(StoreConfigResolver.PERSIST, persist);
		configuration.put(StoreConfigResolver.PREFIX, prefix);
		configuration.put(StoreConfigResolver.PURGE_MODE, purgeMode);
		configuration.put(StoreConfigResolver.READ_TIMEOUT, readTimeout);
		configuration.put(StoreConfigResolver.SERIALIZER, serializer);
		configuration.put(StoreConfigResolver.SERVER, server);
		configuration.put(StoreConfigResolver.SERVER_SECONDARY, serverSecondary);
		configuration.put(StoreConfigResolver.SESSION, session);
		configuration.put(StoreConfigResolver.TIMEOUT, timeout);
		return configuration;
	}

	@Data
	public static class CacheManagerConfiguration {
		/** 存储名称，是键前缀的一部分 */
		private String storeName = "rediscluster";
		/** 缓存定义中的组件名 */
		private String component = "application";
		/** 启动时创建的缓存，其余缓存在首次访问时创建 */
		private List<String> cacheNames = new ArrayList<>();
		private boolean allowNullValues = true;
		/**
		 * {@code Cache#get(key, loader)} 等待加载锁的最长时间。
		 *
		 * <p>加载锁没有过期时间。持有锁的进程崩溃后锁键会一直保留，此后该键的每次未命中都要等满这段时间
		 * 才会不加锁直接加载，残留的锁键需要手动删除。
		 */
		private Duration lockWait = Duration.ofSeconds(5);
	}
}
