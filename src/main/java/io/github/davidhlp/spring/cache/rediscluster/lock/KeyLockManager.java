package io.github.davidhlp.spring.cache.rediscluster.lock;

import io.github.davidhlp.spring.cache.rediscluster.command.RetryingCommandExecutor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.lang.Nullable;

/**
 * 基于普通键的建议锁：键存在表示已被持有，键值是持有者标识。
 *
 * <p>不可重入，不设置过期时间，锁键一直保留到显式释放。锁键是顶层键，与缓存桶的哈希表无关。
 *
 * @author David
 */
@Slf4j
@RequiredArgsConstructor
public class KeyLockManager {

    private final RetryingCommandExecutor executor;

    /**
     * 尝试获取锁。
     *
     * @param name    锁名称
     * @param ownerId 持有者标识
     * @return 本次调用创建了锁键时返回 true
     */
    public boolean acquire(String name, String ownerId) {
        boolean acquired = Boolean.TRUE.equals(
                executor.execute("SETNX", client -> client.setNx(name, ownerId)));
        log.debug("Acquire lock: name={}, owner={}, acquired={}", name, ownerId, acquired);
        return acquired;
    }

    /**
     * 检查锁状态。
     *
     * @return 持有者一致返回 {@code TRUE}，锁不存在返回 {@code null}，被其他持有者占用返回 {@code FALSE}
     */
    @Nullable
    public Boolean check(String name, String ownerId) {
        Object current = executor.execute("GET", client -> client.get(name));
        if (current == null) {
            return null;
        }
        return ownerId.equals(current);
    }

    /**
     * 释放锁。只有当前持有者才能删除锁键。
     *
     * @return 锁被删除时返回 true
     */
    public boolean release(String name, String ownerId) {
        if (!Boolean.TRUE.equals(check(name, ownerId))) {
            log.debug("Lock not held by owner, skip release: name={}, owner={}", name, ownerId);
            return false;
        }
        executor.execute("DEL", client -> client.del(name));
        log.debug("Released lock: name={}, owner={}", name, ownerId);
        return true;
    }
}
