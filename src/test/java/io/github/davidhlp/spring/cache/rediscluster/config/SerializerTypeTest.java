package io.github.davidhlp.spring.cache.rediscluster.config;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.JdkSerializationRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializer;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/** 值序列化方式测试 */
class SerializerTypeTest {

    @Test
    void testFromValue() {
        assertThat(SerializerType.fromValue("jdk")).isEqualTo(SerializerType.JDK);
        assertThat(SerializerType.fromValue(" Json ")).isEqualTo(SerializerType.JSON);
        assertThatThrownBy(() -> SerializerType.fromValue("igbinary"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testSerializers() {
        assertThat(SerializerType.JDK.createSerializer(null)).isInstanceOf(JdkSerializationRedisSerializer.class);
        assertThat(SerializerType.JSON.createSerializer(null)).isInstanceOf(GenericJackson2JsonRedisSerializer.class);

        RedisSerializer<Object> none = SerializerType.NONE.createSerializer(null);
        assertThat(none.serialize("plain")).isEqualTo("plain".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testJdkSerializerReturnsCopies() {
        RedisSerializer<Object> serializer = SerializerType.JDK.createSerializer(null);
        List<String> source = new ArrayList<>(List.of("a"));

        Object copy = serializer.deserialize(serializer.serialize(source));
        source.add("b");

        assertThat(copy).isEqualTo(List.of("a"));
    }
}
