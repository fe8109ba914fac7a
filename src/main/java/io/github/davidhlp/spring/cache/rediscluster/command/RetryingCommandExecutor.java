package io.github.davidhlp.spring.cache.rediscluster.command;

import io.github.davidhlp.spring.cache.rediscluster.connection.BackendClient;

import lombok.extern.slf4j.Slf4j;

import org.springframework.lang.Nullable;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;

/**
 * 所有 Redis 命令的唯一出口，负责有限次数的重试。
 *
 * <p>重试规则：
 * - {@code retries} 是第一次尝试之外允许的额外次数，只作用于本次调用
 * - 普通失败在预算内立即重试
 * - 集群重组（CLUSTERDOWN）时等待 100~200ms 后强制再试一次，无论预算是否还有剩余，这次尝试同样消耗预算
 * - 全部失败后抛出 {@link BackendOperationException}，携带最后一次异常
 */
@Slf4j
public class RetryingCommandExecutor {

    static final String CLUSTER_DOWN = "CLUSTERDOWN";

    private static final long MIN_CLUSTER_DOWN_DELAY_MS = 100;
    private static final long MAX_CLUSTER_DOWN_DELAY_MS = 200;

    private final BackendClient client;
    private final Sleeper sleeper;

    public RetryingCommandExecutor(BackendClient client) {
        this(client, Sleeper.THREAD);
    }

    public RetryingCommandExecutor(BackendClient client, Sleeper sleeper) {
        this.client = client;
        this.sleeper = sleeper;
    }

    /** 不重试，只执行一次 */
    @Nullable
    public <T> T execute(String name, Function<BackendClient, T> command) {
        return execute(name, command, 0);
    }

    /**
     * 执行命令。
     *
     * @param name    命令名称，仅用于日志
     * @param command 在客户端上执行的命令
     * @param retries 额外重试次数，负数按 0 处理
     * @return 命令结果
     * @throws BackendOperationException 所有尝试都失败
     */
    @Nullable
    public <T> T execute(String name, Function<BackendClient, T> command, int retries) {
        int budget = Math.max(retries, 0);
        RuntimeException lastException = null;

        while (budget >= 0) {
            budget--;
            try {
                return command.apply(client);
            } catch (RuntimeException e) {
                lastException = e;
                if (!isClusterDown(e)) {
                    log.debug("Command {} failed, remaining retries: {}, error: {}",
                            name, Math.max(budget, 0), e.getMessage());
                    continue;
                }
            }

            budget--;
            long delay = ThreadLocalRandom.current()
                    .nextLong(MIN_CLUSTER_DOWN_DELAY_MS, MAX_CLUSTER_DOWN_DELAY_MS + 1);
            log.warn("Command {} hit CLUSTERDOWN, retrying once in {}ms", name, delay);
            pause(name, delay, lastException);
            try {
                return command.apply(client);
            } catch (RuntimeException e) {
                lastException = e;
                log.debug("Command {} failed again after CLUSTERDOWN: {}", name, e.getMessage());
            }
        }

        throw new BackendOperationException("Redis command " + name + " failed", lastException);
    }

    private void pause(String name, long delay, RuntimeException cause) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendOperationException("Interrupted while retrying " + name, cause);
        }
    }

    static boolean isClusterDown(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            String message = current.getMessage();
            if (message != null && message.contains(CLUSTER_DOWN)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }
}
