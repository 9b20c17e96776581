package com.dbdrive.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum RunStatusEnum {

    RUNNING("RUNNING"),

    SUCCESS("SUCCESS"),

    FAILED("FAILED"),

    UNKNOWN("UNKNOWN")
    ;

    private final String name;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }

    public static RunStatusEnum fromName(String name) {
        for (RunStatusEnum value : values()) {
            if (value.name.equals(name)) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
