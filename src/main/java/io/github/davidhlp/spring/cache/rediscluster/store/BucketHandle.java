package io.github.davidhlp.spring.cache.rediscluster.store;

import org.springframework.util.Assert;

/**
 * 一个缓存定义对应的远端哈希表。
 *
 * @param prefix         连接上附加的键前缀
 * @param definitionHash 哈希表的键（不含前缀）
 */
public record BucketHandle(String prefix, String definitionHash) {

    /** 哈希表在服务端的完整键名 */
    public String fullKey() {
        return prefix + definitionHash;
    }

    /**
     * 路由标签，形如 {@code {...}}。任何包含该标签的键都与本哈希表落在同一个集群槽位。
     *
     * <p>完整键名本身带有标签时沿用其中的内容，否则以完整键名作为标签内容。
     * 没有有效标签的键名不能包含 '}'，否则包装后的标签与原键名落在不同槽位。
     *
     * @throws IllegalStateException 键名含有 '}' 但没有有效标签
     */
    public String routingTag() {
        String fullKey = fullKey();
        int open = fullKey.indexOf('{');
        if (open >= 0) {
            int close = fullKey.indexOf('}', open + 1);
            if (close > open + 1) {
                return fullKey.substring(open, close + 1);
            }
        }
        Assert.state(fullKey.indexOf('}') < 0,
                () -> "Key '" + fullKey + "' has no usable hash tag and cannot be wrapped in one");
        return "{" + fullKey + "}";
    }
}
