package com.dbdrive.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DbDriveServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DbDriveServerApplication.class, args);
    }
}
