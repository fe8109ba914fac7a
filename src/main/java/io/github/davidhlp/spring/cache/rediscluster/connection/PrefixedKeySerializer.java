package io.github.davidhlp.spring.cache.rediscluster.connection;

import lombok.Getter;

import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.lang.Nullable;

import java.nio.charset.StandardCharsets;

/**
 * 写入时给键加上固定前缀、读取时去掉前缀的键序列化器。
 */
@Getter
public class PrefixedKeySerializer implements RedisSerializer<String> {

    private final String prefix;

    public PrefixedKeySerializer(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public byte[] serialize(@Nullable String key) {
        if (key == null) {
            return null;
        }
        return prefixed(key).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String deserialize(@Nullable byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        String key = new String(bytes, StandardCharsets.UTF_8);
        return key.startsWith(prefix) ? key.substring(prefix.length()) : key;
    }

    /** 键在服务端的完整名称 */
    public String prefixed(String key) {
        return prefix + key;
    }
}
