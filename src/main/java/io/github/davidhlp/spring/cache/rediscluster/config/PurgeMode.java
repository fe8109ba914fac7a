package io.github.davidhlp.spring.cache.rediscluster.config;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/** 清空整个缓存桶的方式。 */
@Getter
@RequiredArgsConstructor
public enum PurgeMode {

    /** 重命名为临时键并登记到待回收集合，由外部清理任务删除 */
    LAZY("lazy"),

    /** UNLINK，服务端异步回收（Redis 4.0+） */
    UNLINK("unlink"),

    /** 同步 DEL */
    DEL("del");

    private final String value;

    public static PurgeMode fromValue(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PurgeMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown purge mode: " + value);
    }
}
