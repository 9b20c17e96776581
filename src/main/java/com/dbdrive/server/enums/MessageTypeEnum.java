package com.dbdrive.server.enums;

public enum MessageTypeEnum {

    SUCCESS,

    ERROR,

    INFO,

    WARNING,
    ;
}
