package io.nimbusio.webserver.api.auth;

import java.util.Optional;

/**
 * Looks up customer signing keys. Implementations may block.
 */
public interface CustomerKeyStore {

    Optional<CustomerKey> getKey(String keyId);
}
