package com.dbdrive.server.model.drive;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.ToString;

@Data
public class TokenResponse {

    @ToString.Exclude
    @JsonProperty("access_token")
    private String accessToken;

    // only on the authorization code grant, or when the server rotates it
    @ToString.Exclude
    @JsonProperty("refresh_token")
    private String refreshToken;

    // seconds
    @JsonProperty("expires_in")
    private Long expiresIn;

    @JsonProperty("token_type")
    private String tokenType;

    @JsonProperty("scope")
    private String scope;
}
