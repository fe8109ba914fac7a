package io.github.davidhlp.spring.cache.rediscluster.purge;

import io.github.davidhlp.spring.cache.rediscluster.config.PurgeMode;
import io.github.davidhlp.spring.cache.rediscluster.store.BucketHandle;

/**
 * 清空整个缓存桶的策略。
 */
public interface PurgeStrategy {

    PurgeMode mode();

    /**
     * 清空缓存桶。桶不存在时视为成功。
     *
     * @param bucket 要清空的缓存桶
     * @return 清空成功返回 true
     * @throws io.github.davidhlp.spring.cache.rediscluster.command.BackendOperationException 命令重试后仍失败
     */
    boolean purge(BucketHandle bucket);
}
