package io.nimbusio.webserver.api.auth;

import io.nimbusio.webserver.api.model.Collection;

/**
 * Verifies the credentials of a request that the access control policy requires to be authenticated.
 */
public interface PasswordAuthenticator {

    /**
     * @return true if the request carries valid credentials of the collection owner
     * @throws io.nimbusio.webserver.api.model.exceptions.DependencyUnavailableException if the credentials could not
     *         be checked
     */
    boolean authenticate(Collection collection, Credentials credentials, AccessRequest request);
}
