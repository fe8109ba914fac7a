package io.github.davidhlp.spring.cache.rediscluster.support;

import io.github.davidhlp.spring.cache.rediscluster.connection.BackendClient;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 内存版 {@link BackendClient}，按 Redis 语义模拟哈希、字符串和集合。
 *
 * <p>{@link #failNext(RuntimeException...)} 可以让接下来的若干条命令依次抛出指定异常，
 * {@link #failOn(String, RuntimeException)} 只让指定命令的下一次执行失败。
 */
public class InMemoryBackendClient implements BackendClient {

    private final String keyPrefix;
    private final Map<String, Map<String, Object>> hashes = new HashMap<>();
    private final Map<String, Object> strings = new HashMap<>();
    private final Map<String, Set<String>> sets = new HashMap<>();
    private final Deque<RuntimeException> failures = new ArrayDeque<>();
    private final Map<String, Deque<RuntimeException>> commandFailures = new HashMap<>();
    private final List<String> commands = new ArrayList<>();
    private boolean closed = false;

    public InMemoryBackendClient(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public InMemoryBackendClient failNext(RuntimeException... errors) {
        failures.addAll(List.of(errors));
        return this;
    }

    public InMemoryBackendClient failOn(String command, RuntimeException error) {
        commandFailures.computeIfAbsent(command, c -> new ArrayDeque<>()).add(error);
        return this;
    }

    public List<String> commands() {
        return commands;
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean exists(String key) {
        return hashes.containsKey(key) || strings.containsKey(key) || sets.containsKey(key);
    }

    public Map<String, Object> hash(String key) {
        return hashes.getOrDefault(key, Map.of());
    }

    public Set<String> members(String key) {
        return sets.getOrDefault(key, Set.of());
    }

    public Set<String> keys() {
        Set<String> keys = new LinkedHashSet<>();
        keys.addAll(hashes.keySet());
        keys.addAll(strings.keySet());
        keys.addAll(sets.keySet());
        return keys;
    }

    private void record(String command) {
        commands.add(command);
        Deque<RuntimeException> pending = commandFailures.get(command);
        RuntimeException failure = pending != null ? pending.poll() : null;
        if (failure == null) {
            failure = failures.poll();
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public String keyPrefix() {
        return keyPrefix;
    }

    @Override
    public Object hGet(String key, String field) {
        record("HGET");
        return hash(key).get(field);
    }

    @Override
    public List<Object> hMGet(String key, Collection<String> fields) {
        record("HMGET");
        Map<String, Object> hash = hash(key);
        List<Object> values = new ArrayList<>(fields.size());
        for (String field : fields) {
            values.add(hash.get(field));
        }
        return values;
    }

    @Override
    public boolean hSet(String key, String field, Object value) {
        record("HSET");
        hashes.computeIfAbsent(key, k -> new LinkedHashMap<>()).put(field, value);
        return true;
    }

    @Override
    public boolean hMSet(String key, Map<String, Object> values) {
        record("HMSET");
        hashes.computeIfAbsent(key, k -> new LinkedHashMap<>()).putAll(values);
        return true;
    }

    @Override
    public long hDel(String key, String... fields) {
        record("HDEL");
        Map<String, Object> hash = hashes.get(key);
        if (hash == null) {
            return 0;
        }
        long removed = 0;
        for (String field : fields) {
            if (hash.remove(field) != null) {
                removed++;
            }
        }
        if (hash.isEmpty()) {
            hashes.remove(key);
        }
        return removed;
    }

    @Override
    public boolean hExists(String key, String field) {
        record("HEXISTS");
        return hash(key).containsKey(field);
    }

    @Override
    public Object get(String key) {
        record("GET");
        return strings.get(key);
    }

    @Override
    public boolean setNx(String key, Object value) {
        record("SETNX");
        return strings.putIfAbsent(key, value) == null;
    }

    @Override
    public long del(String key) {
        record("DEL");
        return remove(key) ? 1 : 0;
    }

    @Override
    public boolean unlink(String key) {
        record("UNLINK");
        remove(key);
        return true;
    }

    @Override
    public boolean rename(String source, String target) {
        record("RENAME");
        Map<String, Object> hash = hashes.remove(source);
        if (hash == null) {
            return false;
        }
        hashes.put(target, hash);
        return true;
    }

    @Override
    public long sAdd(String key, String member) {
        record("SADD");
        return sets.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(member) ? 1 : 0;
    }

    @Override
    public String ping() {
        record("PING");
        return "PONG";
    }

    @Override
    public void close() {
        closed = true;
    }

    private boolean remove(String key) {
        boolean removed = hashes.remove(key) != null;
        removed |= strings.remove(key) != null;
        removed |= sets.remove(key) != null;
        return removed;
    }
}
