package io.github.davidhlp.spring.cache.rediscluster.store;

import org.springframework.util.Assert;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * 宿主框架提供的缓存定义标识。
 *
 * @param mode      作用范围
 * @param component 所属组件
 * @param area      组件内的缓存区域
 */
public record CacheDefinition(StoreMode mode, String component, String area) {

    public CacheDefinition {
        Assert.notNull(mode, "mode must not be null");
        Assert.hasText(component, "component must not be empty");
        Assert.hasText(area, "area must not be empty");
    }

    public static CacheDefinition adhoc(StoreMode mode, String component, String area) {
        return new CacheDefinition(mode, component, area);
    }

    public String id() {
        return component + "/" + area;
    }

    /**
     * 定义的哈希值，作为远端哈希表的键。同一个定义在进程重启后得到相同的值。
     *
     * @return 32 位十六进制 MD5
     */
    public String generateDefinitionHash() {
        String identity = mode.name().toLowerCase() + " " + component + " " + area;
        return DigestUtils.md5DigestAsHex(identity.getBytes(StandardCharsets.UTF_8));
    }
}
