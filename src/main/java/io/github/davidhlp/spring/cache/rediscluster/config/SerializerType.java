package io.github.davidhlp.spring.cache.rediscluster.config;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.GenericToStringSerializer;
import org.springframework.data.redis.serializer.JdkSerializationRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.lang.Nullable;

import java.util.Locale;

/**
 * 缓存值的编码方式。
 *
 * <p>默认使用 JDK 二进制序列化；读取时总是得到新的对象副本，不会共享可变引用。
 */
public enum SerializerType {

    /** 不做序列化，按字符串读写 */
    NONE {
        @Override
        public RedisSerializer<Object> createSerializer(@Nullable ObjectMapper objectMapper) {
            return new GenericToStringSerializer<>(Object.class);
        }
    },

    /** JDK 二进制序列化 */
    JDK {
        @Override
        public RedisSerializer<Object> createSerializer(@Nullable ObjectMapper objectMapper) {
            return new JdkSerializationRedisSerializer();
        }
    },

    /** Jackson JSON。未指定 ObjectMapper 时使用带类型信息的默认配置 */
    JSON {
        @Override
        public RedisSerializer<Object> createSerializer(@Nullable ObjectMapper objectMapper) {
            return objectMapper != null
                    ? new GenericJackson2JsonRedisSerializer(objectMapper)
                    : new GenericJackson2JsonRedisSerializer();
        }
    };

    public abstract RedisSerializer<Object> createSerializer(@Nullable ObjectMapper objectMapper);

    public static SerializerType fromValue(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (SerializerType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown serializer: " + value);
    }
}
