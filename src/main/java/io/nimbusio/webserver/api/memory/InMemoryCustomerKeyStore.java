package io.nimbusio.webserver.api.memory;

import io.nimbusio.webserver.api.auth.CustomerKey;
import io.nimbusio.webserver.api.auth.CustomerKeyStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCustomerKeyStore implements CustomerKeyStore {

    private final Map<String, CustomerKey> keys = new ConcurrentHashMap<>();

    public void addKey(CustomerKey key) {
        keys.put(key.getKeyId(), key);
    }

    @Override
    public Optional<CustomerKey> getKey(String keyId) {
        return Optional.ofNullable(keys.get(keyId));
    }
}
