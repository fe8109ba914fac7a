package io.github.davidhlp.spring.cache.rediscluster.config;

import io.github.davidhlp.spring.cache.rediscluster.cache.RedisClusterCache;
import io.github.davidhlp.spring.cache.rediscluster.store.RedisClusterStore;

import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 对每个缓存背后的存储执行 PING，全部返回 PONG 时为 UP。
 */
@Slf4j
public class RedisClusterHealthIndicator implements HealthIndicator {

	private final CacheManager cacheManager;

	public RedisClusterHealthIndicator(CacheManager cacheManager) {
		this.cacheManager = cacheManager;
	}

	@Override
	public Health health() {
		Map<String, Object> details = new LinkedHashMap<>();
		boolean healthy = true;
		for (String cacheName : cacheManager.getCacheNames()) {
			Cache cache = cacheManager.getCache(cacheName);
			if (!(cache instanceof RedisClusterCache clusterCache)) {
				continue;
			}
			RedisClusterStore store = clusterCache.getNativeCache();
			boolean reachable = store.isReady() && store.ping();
			details.put(cacheName, reachable ? "PONG" : "unreachable");
			healthy &= reachable;
		}

		if (healthy) {
			return Health.up().withDetails(details).build();
		}
		log.warn("Redis cluster health check failed: {}", details);
		return Health.down().withDetails(details).build();
	}
}
