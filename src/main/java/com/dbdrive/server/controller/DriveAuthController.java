package com.dbdrive.server.controller;

import com.dbdrive.server.model.api.drive.DriveTokenInfo;
import com.dbdrive.server.model.api.global.DbDriveHttpResponse;
import com.dbdrive.server.service.storage.OAuthCredentialService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/drive-auth")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class DriveAuthController {

    private final OAuthCredentialService oAuthCredentialService;

    @Autowired
    public DriveAuthController(OAuthCredentialService oAuthCredentialService) {
        this.oAuthCredentialService = oAuthCredentialService;
    }

    // open it in a browser, consent, then post the returned code to exchange-token
    @GetMapping("/get-auth-url")
    public DbDriveHttpResponse<String> getAuthUrl() {
        return DbDriveHttpResponse.success(this.oAuthCredentialService.authorizationUrl());
    }

    @PostMapping("/exchange-token")
    public DbDriveHttpResponse<DriveTokenInfo> exchangeToken(@RequestParam("code") String code) {
        return DbDriveHttpResponse.success(this.oAuthCredentialService.exchangeAuthorizationCode(code));
    }

    @GetMapping("/get-token-info")
    public DbDriveHttpResponse<DriveTokenInfo> getTokenInfo() {
        return DbDriveHttpResponse.success(this.oAuthCredentialService.tokenInfo());
    }

    // refreshes when needed, fails when the stored grant is revoked
    @PostMapping("/validate-token")
    public DbDriveHttpResponse<DriveTokenInfo> validateToken() {
        this.oAuthCredentialService.validCredential();
        return DbDriveHttpResponse.success(this.oAuthCredentialService.tokenInfo());
    }
}
