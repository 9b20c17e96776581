package com.dbdrive.server.configuration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
public class RestClientConfig {

    @Bean
    public RestClient notificationRestClient(
            @Value("${dbdrive.server.notification.connectTimeoutSec:5}") long connectTimeoutSec,
            @Value("${dbdrive.server.notification.readTimeoutSec:10}") long readTimeoutSec) {
        return RestClient.builder()
                .requestFactory(requestFactory(connectTimeoutSec, readTimeoutSec))
                .build();
    }

    // read timeout covers a whole upload
    @Bean
    public RestClient driveRestClient(
            @Value("${dbdrive.server.drive.connectTimeoutSec:10}") long connectTimeoutSec,
            @Value("${dbdrive.server.drive.readTimeoutSec:600}") long readTimeoutSec) {
        return RestClient.builder()
                .requestFactory(requestFactory(connectTimeoutSec, readTimeoutSec))
                .build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(long connectTimeoutSec, long readTimeoutSec) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(connectTimeoutSec));
        requestFactory.setReadTimeout(Duration.ofSeconds(readTimeoutSec));
        return requestFactory;
    }
}
