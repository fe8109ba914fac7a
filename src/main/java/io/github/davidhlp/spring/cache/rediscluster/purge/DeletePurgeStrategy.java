package io.github.davidhlp.spring.cache.rediscluster.purge;

import io.github.davidhlp.spring.cache.rediscluster.command.RetryingCommandExecutor;
import io.github.davidhlp.spring.cache.rediscluster.config.PurgeMode;
import io.github.davidhlp.spring.cache.rediscluster.store.BucketHandle;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class DeletePurgeStrategy implements PurgeStrategy {

    private final RetryingCommandExecutor executor;

    @Override
    public PurgeMode mode() {
        return PurgeMode.DEL;
    }

    @Override
    public boolean purge(BucketHandle bucket) {
        executor.execute("DEL", client -> client.del(bucket.definitionHash()));
        return true;
    }
}
