package com.farearound.search.auth;

/**
 * Performs one credential exchange against the upstream authorization endpoint.
 */
public interface TokenExchanger {

    /**
     * @return a freshly issued token
     * @throws com.farearound.search.exception.AuthenticationException if the exchange fails
     */
    AccessToken exchange();
}
