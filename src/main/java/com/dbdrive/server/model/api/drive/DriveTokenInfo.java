package com.dbdrive.server.model.api.drive;

import lombok.Data;

import java.time.LocalDateTime;

@Data
public class DriveTokenInfo {

    // a refresh token is stored or configured
    private boolean hasToken;

    // null when no access token was issued yet
    private LocalDateTime expiry;

    // the stored access token is not expired
    private boolean valid;
}
