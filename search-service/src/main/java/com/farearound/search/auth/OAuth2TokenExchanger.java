package com.farearound.search.auth;

import com.farearound.search.constants.UpstreamConstants;
import com.farearound.search.dto.TokenResponse;
import com.farearound.search.exception.AuthenticationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * OAuth2 client-credentials exchange over HTTP.
 * Posts the form-encoded credentials and converts the response into an {@link AccessToken}.
 */
@Slf4j
public class OAuth2TokenExchanger implements TokenExchanger {

    private final RestTemplate restTemplate;
    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final Clock clock;

    public OAuth2TokenExchanger(RestTemplate restTemplate, String baseUrl,
                                String clientId, String clientSecret, Clock clock) {
        this.restTemplate = restTemplate;
        this.tokenUrl = stripTrailingSlash(baseUrl) + UpstreamConstants.TOKEN_PATH;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.clock = clock;
        if (!StringUtils.hasText(clientId) || !StringUtils.hasText(clientSecret)) {
            log.warn("Upstream client id/secret missing; token exchanges will fail until set");
        }
    }

    @Override
    public AccessToken exchange() {
        if (!StringUtils.hasText(clientId) || !StringUtils.hasText(clientSecret)) {
            throw new AuthenticationException("Upstream client credentials are not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", UpstreamConstants.GRANT_TYPE_CLIENT_CREDENTIALS);
        form.add("client_id", clientId);
        form.add("client_secret", clientSecret);

        Instant requestedAt = clock.instant();
        ResponseEntity<TokenResponse> response;
        try {
            response = restTemplate.postForEntity(tokenUrl, new HttpEntity<>(form, headers), TokenResponse.class);
        } catch (RestClientResponseException e) {
            log.error("Token exchange rejected: status={}", e.getStatusCode().value());
            throw new AuthenticationException(
                    "Token exchange rejected with status " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            log.error("Token endpoint unreachable: {}", e.getMessage());
            throw new AuthenticationException("Token endpoint unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            log.error("Token exchange failed: {}", e.getMessage());
            throw new AuthenticationException("Token exchange failed: " + e.getMessage(), e);
        }

        TokenResponse body = response.getBody();
        if (body == null || !StringUtils.hasText(body.getAccessToken())) {
            throw new AuthenticationException("Token response did not contain an access_token");
        }

        long expiresIn = body.getExpiresIn() != null
                ? body.getExpiresIn()
                : UpstreamConstants.DEFAULT_TOKEN_EXPIRES_IN_SECONDS;
        log.debug("Obtained upstream token: expiresIn={}s", expiresIn);

        return AccessToken.builder()
                .value(body.getAccessToken())
                .tokenType(body.getTokenType())
                .expiresAt(requestedAt.plusSeconds(expiresIn))
                .build();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
