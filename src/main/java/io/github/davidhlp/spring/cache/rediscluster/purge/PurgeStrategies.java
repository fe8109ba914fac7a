package io.github.davidhlp.spring.cache.rediscluster.purge;

import io.github.davidhlp.spring.cache.rediscluster.command.RetryingCommandExecutor;
import io.github.davidhlp.spring.cache.rediscluster.config.PurgeMode;

public final class PurgeStrategies {

    private PurgeStrategies() {}

    public static PurgeStrategy forMode(PurgeMode mode, RetryingCommandExecutor executor) {
        return switch (mode) {
            case LAZY -> new LazyPurgeStrategy(executor);
            case UNLINK -> new UnlinkPurgeStrategy(executor);
            case DEL -> new DeletePurgeStrategy(executor);
        };
    }
}
