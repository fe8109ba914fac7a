package io.github.davidhlp.spring.cache.rediscluster.connection;

import org.springframework.lang.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 缓存存储使用的 Redis Cluster 命令集合。
 *
 * <p>所有键名都会由实现自动加上 {@link #keyPrefix()}；哈希字段不加前缀。实现类直接抛出底层异常，
 * 重试与异常转换统一由 {@code RetryingCommandExecutor} 负责。
 *
 * @author David
 */
public interface BackendClient extends AutoCloseable {

    /** 连接上统一附加的键前缀 */
    String keyPrefix();

    @Nullable
    Object hGet(String key, String field);

    /**
     * 批量读取哈希字段。
     *
     * @return 与 {@code fields} 顺序一致的值列表，不存在的字段为 {@code null}
     */
    List<Object> hMGet(String key, Collection<String> fields);

    boolean hSet(String key, String field, Object value);

    boolean hMSet(String key, Map<String, Object> values);

    /** @return 实际删除的字段数量 */
    long hDel(String key, String... fields);

    boolean hExists(String key, String field);

    @Nullable
    Object get(String key);

    /** @return 键原本不存在并且本次写入成功时返回 true */
    boolean setNx(String key, Object value);

    /** @return 删除的键数量 */
    long del(String key);

    /** @return 服务端接受异步删除时返回 true */
    boolean unlink(String key);

    /**
     * 原子重命名。
     *
     * @return 源键存在并完成重命名时返回 true，源键不存在时返回 false
     */
    boolean rename(String source, String target);

    /**
     * 向集合添加成员。成员按原样（UTF-8 字符串）写入，不经过值序列化器。
     *
     * @return 新增的成员数量
     */
    long sAdd(String key, String member);

    String ping();

    @Override
    void close();
}
