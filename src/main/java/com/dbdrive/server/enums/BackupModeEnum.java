package com.dbdrive.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

@AllArgsConstructor
@Getter
public enum BackupModeEnum {

    // schema and data
    FULL("full"),

    SCHEMA_ONLY("schema"),
    ;

    private final String mode;

    // null for unsupported mode, accepts "schemaOnly" as an alias of "schema"
    public static BackupModeEnum fromMode(String mode) {
        if (StringUtils.isBlank(mode)) {
            return null;
        }
        if (StringUtils.equalsIgnoreCase(mode, "schemaOnly")) {
            return SCHEMA_ONLY;
        }
        for (BackupModeEnum value : values()) {
            if (value.mode.equalsIgnoreCase(mode)) {
                return value;
            }
        }
        return null;
    }
}
