package io.github.davidhlp.spring.cache.rediscluster.support;

import io.github.davidhlp.spring.cache.rediscluster.connection.ClusterConnector;

import java.util.ArrayList;
import java.util.List;

/**
 * 每次连接都返回新的 {@link InMemoryBackendClient}，并记录下来供断言使用。
 */
public class InMemoryClusterConnector extends ClusterConnector {

    private final List<InMemoryBackendClient> clients;

    public InMemoryClusterConnector() {
        this(new ArrayList<>());
    }

    private InMemoryClusterConnector(List<InMemoryBackendClient> clients) {
        super((seeds, config, keyPrefix) -> {
            InMemoryBackendClient client = new InMemoryBackendClient(keyPrefix);
            clients.add(client);
            return client;
        });
        this.clients = clients;
    }

    public List<InMemoryBackendClient> clients() {
        return clients;
    }

    public InMemoryBackendClient lastClient() {
        return clients.get(clients.size() - 1);
    }
}
