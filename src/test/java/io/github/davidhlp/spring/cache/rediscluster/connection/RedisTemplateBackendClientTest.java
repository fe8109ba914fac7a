package io.github.davidhlp.spring.cache.rediscluster.connection;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import io.github.davidhlp.spring.cache.rediscluster.config.SerializerType;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisSystemException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisSetCommands;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/** 使用 Mockito 模拟连接，验证发往服务端的原始参数 */
class RedisTemplateBackendClientTest {

    private RedisConnectionFactory connectionFactory;
    private RedisConnection connection;
    private RedisTemplateBackendClient client;

    @BeforeEach
    void setUp() {
        connectionFactory = mock(RedisConnectionFactory.class);
        connection = mock(RedisConnection.class);
        when(connectionFactory.getConnection()).thenReturn(connection);
        client = new RedisTemplateBackendClient(
                connectionFactory, "site1-muc-", SerializerType.JDK.createSerializer(null));
    }

    @Test
    void testPing() {
        when(connection.ping()).thenReturn("PONG");

        assertThat(client.ping()).isEqualTo("PONG");
        verify(connection).close();
    }

    @Test
    void testSetMemberWrittenRaw() {
        RedisSetCommands setCommands = mock(RedisSetCommands.class);
        when(connection.setCommands()).thenReturn(setCommands);
        when(setCommands.sAdd(any(byte[].class), any(byte[].class))).thenReturn(1L);

        long added = client.sAdd("gc:hash", "site1-muc-gc:tmp:42:{site1-muc-abc}");

        assertThat(added).isEqualTo(1L);
        // 集合键带前缀，成员不经过值序列化器
        verify(setCommands).sAdd(
                "site1-muc-gc:hash".getBytes(StandardCharsets.UTF_8),
                "site1-muc-gc:tmp:42:{site1-muc-abc}".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testKeyPrefixAndCloseWithoutLettuce() {
        assertThat(client.keyPrefix()).isEqualTo("site1-muc-");

        client.close();

        verifyNoInteractions(connection);
    }

    @Test
    void testNoSuchKeyDetectionIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        // 匹配不区分大小写，也不受默认语言环境影响
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(RedisTemplateBackendClient.isNoSuchKey(new RedisSystemException(
                    "Error in execution", new IllegalStateException("ERR NO SUCH KEY")))).isTrue();
            assertThat(RedisTemplateBackendClient.isNoSuchKey(new RedisSystemException(
                    "Error in execution", new IllegalStateException("ERR no such key")))).isTrue();
            assertThat(RedisTemplateBackendClient.isNoSuchKey(new RedisSystemException(
                    "Error in execution", new IllegalStateException("CROSSSLOT Keys in request don't hash to the same slot"))))
                    .isFalse();
        } finally {
            Locale.setDefault(previous);
        }
    }
}
