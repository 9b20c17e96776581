package com.dbdrive.server.service.notification.channel;

import com.dbdrive.server.exception.DeliveryException;
import com.dbdrive.server.exception.ValidationException;
import com.dbdrive.server.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Shared plumbing for adapters that deliver over plain http.
 */
@Slf4j
public abstract class AbstractHttpChannelAdapter implements ChannelAdapter {

    protected static final String USER_AGENT = "DbDrive-Server/1.0";

    protected static final String FOOTER = "Database Backup Service";

    private final RestClient restClient;

    protected AbstractHttpChannelAdapter(RestClient restClient) {
        this.restClient = restClient;
    }

    protected int postJson(String url, Object payload) throws DeliveryException {
        try {
            return this.restClient.post()
                    .uri(URI.create(url))
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(HttpHeaders.USER_AGENT, USER_AGENT)
                    .body(payload)
                    .exchange((request, response) -> response.getStatusCode().value());
        } catch (RestClientException | IllegalArgumentException e) {
            throw new DeliveryException("%s postJson failed. request failed".formatted(this.kind().getKind()), e);
        }
    }

    protected int postForm(
            String url,
            MultiValueMap<String, String> form,
            Consumer<HttpHeaders> headers) throws DeliveryException {
        try {
            return this.restClient.post()
                    .uri(URI.create(url))
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .headers(headers)
                    .body(form)
                    .exchange((request, response) -> response.getStatusCode().value());
        } catch (RestClientException | IllegalArgumentException e) {
            throw new DeliveryException("%s postForm failed. request failed".formatted(this.kind().getKind()), e);
        }
    }

    protected <T> T readSettings(Map<String, Object> settings, Class<T> clazz) throws ValidationException {
        this.validateConfig(settings);
        return JsonUtil.deserializeObjectToPojo(settings, clazz);
    }

    protected static String requireText(Map<String, Object> settings, String key, String kind)
            throws ValidationException {
        if (MapUtils.isEmpty(settings)) {
            throw new ValidationException("%s validateConfig failed. settings is empty".formatted(kind));
        }
        Object value = settings.get(key);
        if (ObjectUtils.isEmpty(value) || StringUtils.isBlank(value.toString())) {
            throw new ValidationException("%s validateConfig failed. %s is required".formatted(kind, key));
        }
        return value.toString().trim();
    }

    protected static void requireHttpUrl(Map<String, Object> settings, String key, String kind)
            throws ValidationException {
        String url = requireText(settings, key, kind);
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("%s validateConfig failed. %s is not a valid url".formatted(kind, key), e);
        }
        if (!StringUtils.equalsAnyIgnoreCase(uri.getScheme(), "http", "https")
                || StringUtils.isBlank(uri.getHost())) {
            throw new ValidationException("%s validateConfig failed. %s should be an http(s) url"
                    .formatted(kind, key));
        }
    }
}
