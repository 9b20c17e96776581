package com.dbdrive.server.configuration;

import com.baomidou.mybatisplus.core.handlers.MetaObjectHandler;
import org.apache.ibatis.reflection.MetaObject;

import java.time.LocalDateTime;

public class MyMetaObjectHandler implements MetaObjectHandler {

    private static final String SYSTEM_USER = "System";

    @Override
    public void insertFill(MetaObject metaObject) {
        // base entity autofill
        LocalDateTime now = LocalDateTime.now();
        this.strictInsertFill(metaObject, "createdUser", String.class, SYSTEM_USER);
        this.strictInsertFill(metaObject, "createdTime", LocalDateTime.class, now);
        this.strictInsertFill(metaObject, "lastUpdatedUser", String.class, SYSTEM_USER);
        this.strictInsertFill(metaObject, "lastUpdatedTime", LocalDateTime.class, now);

        // job and channel config autofill
        this.strictInsertFill(metaObject, "enabled", Boolean.class, Boolean.TRUE);
        this.strictInsertFill(metaObject, "notifyOnSuccess", Boolean.class, Boolean.TRUE);
        this.strictInsertFill(metaObject, "notifyOnError", Boolean.class, Boolean.TRUE);
    }

    @Override
    public void updateFill(MetaObject metaObject) {
        // strict fill skips non null fields, the entity still carries the last value
        this.setFieldValByName("lastUpdatedUser", SYSTEM_USER, metaObject);
        this.setFieldValByName("lastUpdatedTime", LocalDateTime.now(), metaObject);
    }
}
