package io.github.davidhlp.spring.cache.rediscluster.connection;

import org.springframework.core.NestedRuntimeException;

/**
 * 主、备种子节点列表都无法建立连接。
 *
 * <p>不可恢复：存储保持未就绪状态，由嵌入方（例如 {@code CacheStoreUnavailableAdvice}）
 * 负责终止当前请求并返回 503。
 */
public class CacheStoreUnavailableException extends NestedRuntimeException {

    public CacheStoreUnavailableException(String msg) {
        super(msg);
    }

    public CacheStoreUnavailableException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
