package io.github.davidhlp.spring.cache.rediscluster.config;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;

/**
 * 将调用方提供的配置项覆盖到默认配置上，生成完整的 {@link StoreConfig}。
 *
 * <p>只有非空值才会覆盖默认值：{@code null}、空白字符串、{@code false}、数值 0 以及空集合都视为未配置。
 * 除类型转换外不做校验，错误的地址等问题会在连接或执行命令时暴露。
 */
public final class StoreConfigResolver {

    public static final String SERVER = "server";
    public static final String SERVER_SECONDARY = "serversecondary";
    public static final String FAILOVER = "failover";
    public static final String PERSIST = "persist";
    public static final String PREFIX = "prefix";
    public static final String PURGE_MODE = "purgemode";
    public static final String READ_TIMEOUT = "readtimeout";
    public static final String SERIALIZER = "serializer";
    public static final String SESSION = "session";
    public static final String TIMEOUT = "timeout";

    private static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(3000);

    private StoreConfigResolver() {}

    public static StoreConfig defaults() {
        return StoreConfig.builder()
                .failover(FailoverMode.NONE)
                .persist(false)
                .prefix("")
                .purgeMode(PurgeMode.LAZY)
                .readTimeout(DEFAULT_TIMEOUT)
                .timeout(DEFAULT_TIMEOUT)
                .serializer(SerializerType.JDK)
                .session(false)
                .build();
    }

    public static StoreConfig resolve(Map<String, ?> options) {
        StoreConfig.StoreConfigBuilder builder = defaults().toBuilder();

        Object value;
        if (!isEmpty(value = options.get(SERVER))) {
            builder.server(value.toString());
        }
        if (!isEmpty(value = options.get(SERVER_SECONDARY))) {
            builder.serverSecondary(value.toString());
        }
        if (!isEmpty(value = options.get(FAILOVER))) {
            builder.failover(value instanceof FailoverMode mode ? mode : FailoverMode.fromValue(value.toString()));
        }
        if (!isEmpty(value = options.get(PERSIST))) {
            builder.persist(toBoolean(value));
        }
        if (!isEmpty(value = options.get(PREFIX))) {
            builder.prefix(value.toString());
        }
        if (!isEmpty(value = options.get(PURGE_MODE))) {
            builder.purgeMode(value instanceof PurgeMode mode ? mode : PurgeMode.fromValue(value.toString()));
        }
        if (!isEmpty(value = options.get(READ_TIMEOUT))) {
            builder.readTimeout(toDuration(value));
        }
        if (!isEmpty(value = options.get(SERIALIZER))) {
            builder.serializer(value instanceof SerializerType type ? type : SerializerType.fromValue(value.toString()));
        }
        if (!isEmpty(value = options.get(SESSION))) {
            builder.session(toBoolean(value));
        }
        if (!isEmpty(value = options.get(TIMEOUT))) {
            builder.timeout(toDuration(value));
        }
        return builder.build();
    }

    static boolean isEmpty(@Nullable Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            return trimmed.isEmpty() || "0".equals(trimmed) || "false".equalsIgnoreCase(trimmed);
        }
        if (value instanceof Boolean flag) {
            return !flag;
        }
        if (value instanceof Number number) {
            return number.doubleValue() == 0d;
        }
        if (value instanceof Duration duration) {
            return duration.isZero();
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return false;
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        String text = value.toString().trim();
        return "1".equals(text) || "true".equalsIgnoreCase(text) || "yes".equalsIgnoreCase(text);
    }

    /** 数值按秒处理（允许小数），字符串可以是秒数或 ISO-8601 时长 */
    private static Duration toDuration(Object value) {
        if (value instanceof Duration duration) {
            return duration;
        }
        if (value instanceof Number number) {
            return Duration.ofMillis(Math.round(number.doubleValue() * 1000));
        }
        String text = value.toString().trim();
        if (text.startsWith("P") || text.startsWith("p")) {
            return Duration.parse(text);
        }
        try {
            return Duration.ofMillis(Math.round(Double.parseDouble(text) * 1000));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid timeout value: " + value, e);
        }
    }
}
