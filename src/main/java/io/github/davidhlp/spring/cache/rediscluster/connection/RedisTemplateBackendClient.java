package io.github.davidhlp.spring.cache.rediscluster.connection;

import lombok.extern.slf4j.Slf4j;

import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 基于 {@link RedisTemplate} 的 {@link BackendClient} 实现
 *
 * <p>键使用 {@link PrefixedKeySerializer} 加前缀，哈希字段按字符串写入，值使用配置的序列化器。
 *
 * @author David
 */
@Slf4j
public class RedisTemplateBackendClient implements BackendClient {

    private static final String NO_SUCH_KEY = "no such key";

    private final RedisConnectionFactory connectionFactory;
    private final RedisTemplate<String, Object> redisTemplate;
    private final HashOperations<String, String, Object> hashOperations;
    private final PrefixedKeySerializer keySerializer;

    public RedisTemplateBackendClient(
            RedisConnectionFactory connectionFactory,
            String keyPrefix,
            RedisSerializer<Object> valueSerializer) {
        this.connectionFactory = connectionFactory;
        this.keySerializer = new PrefixedKeySerializer(keyPrefix);

        RedisTemplate<String, Object> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(keySerializer);
        template.setHashKeySerializer(StringRedisSerializer.UTF_8);
        template.setValueSerializer(valueSerializer);
        template.setHashValueSerializer(valueSerializer);
        template.afterPropertiesSet();

        this.redisTemplate = template;
        this.hashOperations = template.opsForHash();
    }

    @Override
    public String keyPrefix() {
        return keySerializer.getPrefix();
    }

    @Override
    public Object hGet(String key, String field) {
        Object value = hashOperations.get(key, field);
        log.debug("HGET {}[{}], found: {}", key, field, value != null);
        return value;
    }

    @Override
    public List<Object> hMGet(String key, Collection<String> fields) {
        List<Object> values = hashOperations.multiGet(key, fields);
        log.debug("HMGET {}, fields: {}", key, fields.size());
        return values != null ? values : Collections.nCopies(fields.size(), null);
    }

    @Override
    public boolean hSet(String key, String field, Object value) {
        hashOperations.put(key, field, value);
        log.debug("HSET {}[{}]", key, field);
        return true;
    }

    @Override
    public boolean hMSet(String key, Map<String, Object> values) {
        hashOperations.putAll(key, values);
        log.debug("HMSET {}, fields: {}", key, values.size());
        return true;
    }

    @Override
    public long hDel(String key, String... fields) {
        Long removed = hashOperations.delete(key, (Object[]) fields);
        log.debug("HDEL {}, fields: {}, removed: {}", key, fields.length, removed);
        return removed != null ? removed : 0L;
    }

    @Override
    public boolean hExists(String key, String field) {
        return Boolean.TRUE.equals(hashOperations.hasKey(key, field));
    }

    @Override
    public Object get(String key) {
        return redisTemplate.opsForValue().get(key);
    }

    @Override
    public boolean setNx(String key, Object value) {
        Boolean created = redisTemplate.opsForValue().setIfAbsent(key, value);
        log.debug("SETNX {}, created: {}", key, created);
        return Boolean.TRUE.equals(created);
    }

    @Override
    public long del(String key) {
        return Boolean.TRUE.equals(redisTemplate.delete(key)) ? 1L : 0L;
    }

    @Override
    public boolean unlink(String key) {
        Boolean unlinked = redisTemplate.unlink(key);
        return unlinked != null;
    }

    @Override
    public boolean rename(String source, String target) {
        try {
            redisTemplate.rename(source, target);
            log.debug("RENAME {} -> {}", source, target);
            return true;
        } catch (DataAccessException e) {
            if (isNoSuchKey(e)) {
                log.debug("RENAME skipped, source does not exist: {}", source);
                return false;
            }
            throw e;
        }
    }

    /** 服务端对不存在的源键返回 {@code ERR no such key} */
    static boolean isNoSuchKey(DataAccessException e) {
        String message = NestedExceptionUtils.getMostSpecificCause(e).getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains(NO_SUCH_KEY);
    }

    @Override
    public long sAdd(String key, String member) {
        byte[] rawKey = keySerializer.serialize(key);
        byte[] rawMember = member.getBytes(StandardCharsets.UTF_8);
        Long added = redisTemplate.execute(
                (RedisCallback<Long>) connection -> connection.setCommands().sAdd(rawKey, rawMember));
        return added != null ? added : 0L;
    }

    @Override
    public String ping() {
        return redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
    }

    @Override
    public void close() {
        if (connectionFactory instanceof LettuceConnectionFactory lettuce) {
            lettuce.destroy();
            log.debug("Closed cluster connection, prefix: {}", keyPrefix());
        }
    }
}
