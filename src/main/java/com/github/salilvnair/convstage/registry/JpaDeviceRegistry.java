package com.github.salilvnair.convstage.registry;

import com.github.salilvnair.convstage.config.ConvStageConfig;
import com.github.salilvnair.convstage.engine.exception.ConvStageErrorCode;
import com.github.salilvnair.convstage.engine.exception.StoreUnavailableException;
import com.github.salilvnair.convstage.repo.DeviceSettingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "convstage.device-registry", name = "mode", havingValue = "db", matchIfMissing = true)
public class JpaDeviceRegistry implements DeviceRegistry {

    private final DeviceSettingRepository deviceSettingRepository;
    private final TransactionTemplate readTemplate;

    public JpaDeviceRegistry(DeviceSettingRepository deviceSettingRepository,
                             PlatformTransactionManager transactionManager,
                             ConvStageConfig config) {
        this.deviceSettingRepository = deviceSettingRepository;
        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
        this.readTemplate.setTimeout(config.getStore().getTimeoutSeconds());
    }

    @Override
    public Set<String> listDeviceIds() {
        return read("list devices", () -> {
            Set<String> ids = new TreeSet<>();
            for (String deviceId : deviceSettingRepository.findAllDeviceIds()) {
                if (deviceId != null && !deviceId.isBlank()) {
                    ids.add(deviceId.trim());
                }
            }
            return Collections.unmodifiableSet(ids);
        });
    }

    @Override
    public boolean exists(String deviceId) {
        if (deviceId == null || deviceId.isBlank()) {
            return false;
        }
        return read("check device", () -> deviceSettingRepository.existsByTrimmedDeviceId(deviceId.trim()));
    }

    private <T> T read(String operation, Supplier<T> query) {
        try {
            return readTemplate.execute(status -> query.get());
        } catch (DataAccessException | TransactionException e) {
            log.warn("ConvStage device registry: {} failed: {}", operation, e.getMessage());
            throw new StoreUnavailableException(ConvStageErrorCode.DEVICE_REGISTRY_UNAVAILABLE,
                    "Device registry unavailable during " + operation, e);
        }
    }
}
