package io.github.davidhlp.spring.cache.rediscluster.command;

import org.springframework.core.NestedRuntimeException;

/**
 * 命令在重试预算用尽后仍然失败。{@link #getCause()} 是最后一次尝试的异常。
 */
public class BackendOperationException extends NestedRuntimeException {

    public BackendOperationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
