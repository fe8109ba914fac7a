package io.github.davidhlp.spring.cache.rediscluster.config;

import io.lettuce.core.ReadFrom;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/**
 * 读请求在主从节点间的分配策略。
 *
 * <p>每个模式对应一个 Lettuce {@link ReadFrom} 设置。
 */
@Getter
@RequiredArgsConstructor
public enum FailoverMode {

    /** 只从主节点读取 */
    NONE(ReadFrom.UPSTREAM),

    /** 主节点不可用时才读取从节点 */
    ERROR(ReadFrom.UPSTREAM_PREFERRED),

    /** 主从节点之间随机分配 */
    DISTRIBUTE(ReadFrom.ANY),

    /** 只在从节点之间分配 */
    DISTRIBUTE_REPLICAS(ReadFrom.ANY_REPLICA);

    private final ReadFrom readFrom;

    /**
     * 按配置值解析模式，忽略大小写。
     *
     * @param value 配置值，例如 {@code distribute}
     * @return 对应的模式
     * @throws IllegalArgumentException 无法识别的配置值
     */
    public static FailoverMode fromValue(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (FailoverMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown failover mode: " + value);
    }
}
