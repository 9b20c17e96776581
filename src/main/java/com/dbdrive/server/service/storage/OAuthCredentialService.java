package com.dbdrive.server.service.storage;

import com.dbdrive.server.exception.BusinessException;
import com.dbdrive.server.exception.DbDriveException;
import com.dbdrive.server.exception.ValidationException;
import com.dbdrive.server.model.api.drive.DriveTokenInfo;
import com.dbdrive.server.model.drive.TokenResponse;
import com.dbdrive.server.model.entity.TokenConfigEntity;
import com.dbdrive.server.service.store.ConfigStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.nio.charset.StandardCharsets;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * OAuth client for the drive api.
 * <p>
 * The token pair lives in the {@link ConfigStore}. An authorization code exchange seeds it,
 * and every refresh writes the new access token back. Until a pair is stored, the refresh token
 * from the configuration is used. The access token is also cached in memory and refreshed
 * once it is about to expire.
 */
@Slf4j
@Service
public class OAuthCredentialService implements CredentialService {

    private static final Duration REFRESH_AHEAD = Duration.ofMinutes(5);

    private static final long DEFAULT_EXPIRES_IN_SEC = 3600L;

    private static final String DRIVE_FILE_SCOPE = "https://www.googleapis.com/auth/drive.file";

    private final RestClient restClient;

    private final ConfigStore configStore;

    private final String tokenUrl;

    private final String authUrl;

    private final String redirectUri;

    private final String clientId;

    private final String clientSecret;

    private final String configuredRefreshToken;

    private final ReentrantLock lock = new ReentrantLock();

    private String accessToken;

    private Instant expiresAt = Instant.EPOCH;

    @Autowired
    public OAuthCredentialService(
            @Qualifier("driveRestClient") RestClient driveRestClient,
            ConfigStore configStore,
            @Value("${dbdrive.server.drive.tokenUrl:https://oauth2.googleapis.com/token}") String tokenUrl,
            @Value("${dbdrive.server.drive.authUrl:https://accounts.google.com/o/oauth2/auth}") String authUrl,
            @Value("${dbdrive.server.drive.redirectUri:}") String redirectUri,
            @Value("${dbdrive.server.drive.clientId:}") String clientId,
            @Value("${dbdrive.server.drive.clientSecret:}") String clientSecret,
            @Value("${dbdrive.server.drive.refreshToken:}") String refreshToken) {
        this.restClient = driveRestClient;
        this.configStore = configStore;
        this.tokenUrl = tokenUrl;
        this.authUrl = authUrl;
        this.redirectUri = redirectUri;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.configuredRefreshToken = refreshToken;
    }

    @Override
    public String validCredential() throws BusinessException {
        this.lock.lock();
        try {
            if (this.isFresh(this.accessToken, this.expiresAt)) {
                return this.accessToken;
            }
            TokenConfigEntity stored = this.configStore.getToken();
            if (ObjectUtils.isNotEmpty(stored)
                    && ObjectUtils.isNotEmpty(stored.getExpiry())
                    && this.isFresh(stored.getAccessToken(), stored.getExpiry().toInstant())) {
                this.accessToken = stored.getAccessToken();
                this.expiresAt = stored.getExpiry().toInstant();
                return this.accessToken;
            }
            String refreshToken = ObjectUtils.isNotEmpty(stored) && StringUtils.isNotBlank(stored.getRefreshToken()) ?
                    stored.getRefreshToken() :
                    this.configuredRefreshToken;
            TokenResponse tokenResponse = this.refresh(refreshToken);
            this.storeToken(stored, tokenResponse, refreshToken);
            log.info("access token refreshed. expires at {}", this.expiresAt);
            return this.accessToken;
        } finally {
            this.lock.unlock();
        }
    }

    public String authorizationUrl() throws BusinessException {
        if (StringUtils.isAnyBlank(this.clientId, this.redirectUri)) {
            throw new BusinessException("authorizationUrl failed. clientId or redirectUri is not configured");
        }
        return UriComponentsBuilder.fromHttpUrl(this.authUrl)
                .queryParam("client_id", this.clientId)
                .queryParam("redirect_uri", this.redirectUri)
                .queryParam("response_type", "code")
                .queryParam("scope", DRIVE_FILE_SCOPE)
                .queryParam("access_type", "offline")
                .queryParam("prompt", "consent")
                .queryParam("state", "dbdrive")
                .encode()
                .build()
                .toUriString();
    }

    // authorization code grant, the resulting pair replaces the stored one
    public DriveTokenInfo exchangeAuthorizationCode(String authorizationCode)
            throws ValidationException, BusinessException {
        if (StringUtils.isBlank(authorizationCode)) {
            throw new ValidationException("exchangeAuthorizationCode failed. authorizationCode is blank");
        }
        if (StringUtils.isAnyBlank(this.clientId, this.clientSecret, this.redirectUri)) {
            throw new BusinessException("exchangeAuthorizationCode failed. " +
                    "clientId, clientSecret or redirectUri is not configured");
        }
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "authorization_code");
        form.add("code", authorizationCode.trim());
        form.add("client_id", this.clientId);
        form.add("client_secret", this.clientSecret);
        form.add("redirect_uri", this.redirectUri);
        this.lock.lock();
        try {
            TokenResponse tokenResponse = this.requestToken(form, "exchangeAuthorizationCode");
            TokenConfigEntity stored = this.configStore.getToken();
            String previousRefreshToken = ObjectUtils.isEmpty(stored) ? null : stored.getRefreshToken();
            if (StringUtils.isAllBlank(tokenResponse.getRefreshToken(), previousRefreshToken)) {
                throw new BusinessException("exchangeAuthorizationCode failed. response has no refresh_token. " +
                        "revoke the app access and authorize again");
            }
            this.storeToken(stored, tokenResponse, previousRefreshToken);
            log.info("authorization code exchanged. access token expires at {}", this.expiresAt);
        } finally {
            this.lock.unlock();
        }
        return this.tokenInfo();
    }

    public DriveTokenInfo tokenInfo() throws BusinessException {
        DriveTokenInfo driveTokenInfo = new DriveTokenInfo();
        TokenConfigEntity stored = this.configStore.getToken();
        if (ObjectUtils.isEmpty(stored)) {
            driveTokenInfo.setHasToken(StringUtils.isNotBlank(this.configuredRefreshToken));
            return driveTokenInfo;
        }
        driveTokenInfo.setHasToken(StringUtils.isNotBlank(stored.getRefreshToken()));
        if (ObjectUtils.isNotEmpty(stored.getExpiry())) {
            driveTokenInfo.setExpiry(stored.getExpiry().toLocalDateTime());
            driveTokenInfo.setValid(StringUtils.isNotBlank(stored.getAccessToken())
                    && stored.getExpiry().toInstant().isAfter(Instant.now()));
        }
        return driveTokenInfo;
    }

    private boolean isFresh(String token, Instant expiry) {
        return StringUtils.isNotBlank(token) && Instant.now().plus(REFRESH_AHEAD).isBefore(expiry);
    }

    // caller holds the lock
    private void storeToken(TokenConfigEntity stored, TokenResponse tokenResponse, String fallbackRefreshToken) {
        long expiresIn = ObjectUtils.defaultIfNull(tokenResponse.getExpiresIn(), DEFAULT_EXPIRES_IN_SEC);
        this.accessToken = tokenResponse.getAccessToken();
        this.expiresAt = Instant.now().plusSeconds(expiresIn);
        TokenConfigEntity tokenConfigEntity = ObjectUtils.isEmpty(stored) ? new TokenConfigEntity() : stored;
        tokenConfigEntity.setClientId(this.clientId);
        tokenConfigEntity.setAccessToken(this.accessToken);
        tokenConfigEntity.setRefreshToken(StringUtils.isNotBlank(tokenResponse.getRefreshToken()) ?
                tokenResponse.getRefreshToken() :
                fallbackRefreshToken);
        tokenConfigEntity.setTokenType(StringUtils.defaultIfBlank(tokenResponse.getTokenType(), "Bearer"));
        tokenConfigEntity.setExpiry(Timestamp.from(this.expiresAt));
        try {
            this.configStore.saveToken(tokenConfigEntity);
        } catch (DbDriveException e) {
            // the in memory token still serves this process
            log.error("storeToken failed. can't save token. expiry is {}", this.expiresAt, e);
        }
    }

    private TokenResponse refresh(String refreshToken) throws BusinessException {
        if (StringUtils.isAnyBlank(this.clientId, this.clientSecret, refreshToken)) {
            throw new BusinessException("refresh token failed. clientId, clientSecret or refreshToken is not configured");
        }
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("client_id", this.clientId);
        form.add("client_secret", this.clientSecret);
        form.add("refresh_token", refreshToken);
        return this.requestToken(form, "refresh token");
    }

    private TokenResponse requestToken(MultiValueMap<String, String> form, String operation)
            throws BusinessException {
        TokenResponse tokenResponse;
        try {
            tokenResponse = this.restClient.post()
                    .uri(this.tokenUrl)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .exchange((request, response) -> {
                        HttpStatusCode statusCode = response.getStatusCode();
                        if (!statusCode.is2xxSuccessful()) {
                            throw new BusinessException("%s failed. http code is %d, body is %s"
                                    .formatted(
                                            operation,
                                            statusCode.value(),
                                            new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8)));
                        }
                        return response.bodyTo(TokenResponse.class);
                    });
        } catch (BusinessException e) {
            throw e;
        } catch (Exception e) {
            throw new BusinessException("%s failed.".formatted(operation), e);
        }
        if (ObjectUtils.isEmpty(tokenResponse) || StringUtils.isBlank(tokenResponse.getAccessToken())) {
            throw new BusinessException("%s failed. response has no access_token".formatted(operation));
        }
        return tokenResponse;
    }
}
