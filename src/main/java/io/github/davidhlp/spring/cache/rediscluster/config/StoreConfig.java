package io.github.davidhlp.spring.cache.rediscluster.config;

import lombok.Builder;
import lombok.Value;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * 缓存存储的连接配置（不可变）。
 *
 * <p>由 {@link StoreConfigResolver} 在构造时一次性生成，之后不再修改。
 */
@Value
@Builder(toBuilder = true)
public class StoreConfig {

    /** 主种子节点列表，逗号分隔的 host:port */
    @Nullable String server;

    /** 备用种子节点列表，主列表连接失败时使用 */
    @Nullable String serverSecondary;

    FailoverMode failover;

    boolean persist;

    String prefix;

    PurgeMode purgeMode;

    Duration readTimeout;

    Duration timeout;

    SerializerType serializer;

    boolean session;

    public List<String> primarySeeds() {
        return splitSeeds(server);
    }

    public List<String> secondarySeeds() {
        return splitSeeds(serverSecondary);
    }

    public boolean hasSecondary() {
        return StringUtils.hasText(serverSecondary);
    }

    /**
     * 连接上统一附加的键前缀。会话模式下只使用配置前缀，否则再加上存储名称。
     *
     * @param storeName 存储名称
     * @return 键前缀
     */
    public String keyPrefix(String storeName) {
        return session ? prefix : prefix + storeName + "-";
    }

    /** 日志中使用的子系统标识 */
    public String subsystem() {
        return session ? "SESSION" : "MUC";
    }

    private static List<String> splitSeeds(@Nullable String seeds) {
        if (!StringUtils.hasText(seeds)) {
            return List.of();
        }
        return Arrays.stream(seeds.split(","))
                .map(String::trim)
                .filter(StringUtils::hasText)
                .toList();
    }
}
