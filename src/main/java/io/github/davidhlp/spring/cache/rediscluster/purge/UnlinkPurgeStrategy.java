package io.github.davidhlp.spring.cache.rediscluster.purge;

import io.github.davidhlp.spring.cache.rediscluster.command.RetryingCommandExecutor;
import io.github.davidhlp.spring.cache.rediscluster.config.PurgeMode;
import io.github.davidhlp.spring.cache.rediscluster.store.BucketHandle;

import lombok.RequiredArgsConstructor;

/** UNLINK 清空，内存由服务端在后台回收。需要 Redis 4.0 及以上。 */
@RequiredArgsConstructor
public class UnlinkPurgeStrategy implements PurgeStrategy {

    private final RetryingCommandExecutor executor;

    @Override
    public PurgeMode mode() {
        return PurgeMode.UNLINK;
    }

    @Override
    public boolean purge(BucketHandle bucket) {
        return Boolean.TRUE.equals(
                executor.execute("UNLINK", client -> client.unlink(bucket.definitionHash())));
    }
}
