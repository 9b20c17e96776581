package com.dbdrive.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

@AllArgsConstructor
@Getter
public enum ChannelKindEnum {

    CHATWORK("chatwork"),

    DISCORD("discord"),

    SLACK("slack"),
    ;

    private final String kind;

    public static ChannelKindEnum fromKind(String kind) {
        if (StringUtils.isBlank(kind)) {
            return null;
        }
        for (ChannelKindEnum value : values()) {
            if (value.kind.equalsIgnoreCase(kind.trim())) {
                return value;
            }
        }
        return null;
    }
}
