package io.github.davidhlp.spring.cache.rediscluster.purge;

import io.github.davidhlp.spring.cache.rediscluster.command.RetryingCommandExecutor;
import io.github.davidhlp.spring.cache.rediscluster.config.PurgeMode;
import io.github.davidhlp.spring.cache.rediscluster.store.BucketHandle;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/**
 * 延迟清空：把哈希表重命名为临时键，再登记到 {@value #GC_SET_KEY} 集合，由外部清理任务删除。
 *
 * <p>字段很多的哈希表直接 DEL 会阻塞服务端，重命名是 O(1) 的。临时键带有与原哈希表相同的路由标签，
 * 因此重命名发生在同一个槽位内。
 */
@Slf4j
@RequiredArgsConstructor
public class LazyPurgeStrategy implements PurgeStrategy {

    /** 待回收键的集合，成员是临时键在服务端的完整名称 */
    public static final String GC_SET_KEY = "gc:hash";

    static final String GC_KEY_PREFIX = "gc:tmp:";

    private final RetryingCommandExecutor executor;

    @Override
    public PurgeMode mode() {
        return PurgeMode.LAZY;
    }

    @Override
    public boolean purge(BucketHandle bucket) {
        String tempKey = temporaryKey(bucket);

        Boolean renamed = executor.execute(
                "RENAME", client -> client.rename(bucket.definitionHash(), tempKey), 1);
        if (!Boolean.TRUE.equals(renamed)) {
            log.debug("Lazy purge found no bucket to rename: {}", bucket.fullKey());
            return true;
        }

        String fullTempKey = bucket.prefix() + tempKey;
        executor.execute("SADD", client -> client.sAdd(GC_SET_KEY, fullTempKey));
        log.debug("Lazy purge renamed bucket {} to {}", bucket.fullKey(), fullTempKey);
        return true;
    }

    static String temporaryKey(BucketHandle bucket) {
        String gcId = UUID.randomUUID().toString().replace("-", "");
        return GC_KEY_PREFIX + gcId + ":" + bucket.routingTag();
    }
}
