package com.github.salilvnair.convstage.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.convstage.config.ConvStageConfig;
import com.github.salilvnair.convstage.engine.exception.ConvStageErrorCode;
import com.github.salilvnair.convstage.engine.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads device identifiers from a remote registry endpoint. Accepted payloads:
 * <pre>
 * ["dev1", "dev2"]
 * [{"device_id": "dev1"}, {"id_device": "dev2"}]
 * {"devices": [...]}
 * </pre>
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "convstage.device-registry", name = "mode", havingValue = "http")
public class HttpDeviceRegistry implements DeviceRegistry {

    static final String LEGACY_DEVICE_ID_FIELD = "id_device";

    private final ConvStageConfig.DeviceRegistrySettings.Http settings;
    private final ObjectMapper mapper;

    public HttpDeviceRegistry(ConvStageConfig config, ObjectMapper mapper) {
        this.settings = config.getDeviceRegistry().getHttp();
        this.mapper = mapper;
        if (settings.getUrl() == null || settings.getUrl().isBlank()) {
            throw new IllegalStateException("convstage.device-registry.http.url is required when mode=http");
        }
    }

    @Override
    public Set<String> listDeviceIds() {
        HttpResponse<String> response = fetch();
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.warn("ConvStage device registry: {} returned status {}", settings.getUrl(), status);
            throw unavailable("Device registry returned status " + status, null);
        }
        return parse(response.body());
    }

    private HttpResponse<String> fetch() {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(settings.getConnectTimeoutMs(), 100)))
                .build();

        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(settings.getUrl()))
                .timeout(Duration.ofMillis(Math.max(settings.getReadTimeoutMs(), 100)))
                .header(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .GET();
        if (settings.getHeaders() != null) {
            settings.getHeaders().forEach(request::header);
        }

        try {
            return client.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException io) {
            log.warn("ConvStage device registry: call to {} failed: {}", settings.getUrl(), io.getMessage());
            throw unavailable("Device registry call failed", io);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw unavailable("Device registry call interrupted", interrupted);
        }
    }

    Set<String> parse(String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body == null ? "" : body);
        } catch (IOException e) {
            throw unavailable("Device registry returned an unreadable body", e);
        }
        JsonNode devices = root != null && root.isObject() ? root.get(settings.getDevicesField()) : root;
        if (devices == null || !devices.isArray()) {
            throw unavailable("Device registry payload has no device array", null);
        }

        Set<String> ids = new TreeSet<>();
        for (JsonNode device : devices) {
            String deviceId = deviceIdOf(device);
            if (deviceId != null && !deviceId.isBlank()) {
                ids.add(deviceId.trim());
            }
        }
        return Collections.unmodifiableSet(ids);
    }

    private String deviceIdOf(JsonNode device) {
        if (device.isTextual()) {
            return device.asText();
        }
        if (!device.isObject()) {
            return null;
        }
        JsonNode id = device.get(settings.getDeviceIdField());
        if (id == null || id.isNull()) {
            id = device.get(LEGACY_DEVICE_ID_FIELD);
        }
        return id == null || id.isNull() ? null : id.asText();
    }

    private StoreUnavailableException unavailable(String message, Throwable cause) {
        return new StoreUnavailableException(ConvStageErrorCode.DEVICE_REGISTRY_UNAVAILABLE, message, cause);
    }
}
