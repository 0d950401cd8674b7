package com.gentoro.gateway.token;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of a successful OAuth2 client-credentials exchange. */
public record TokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("expires_in") long expiresIn) {}
