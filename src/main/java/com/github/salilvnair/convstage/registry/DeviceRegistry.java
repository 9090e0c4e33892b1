package com.github.salilvnair.convstage.registry;

import java.util.Set;

/**
 * Source of the device identifiers a stage rule may be attached to.
 * Implementations throw {@link com.github.salilvnair.convstage.engine.exception.StoreUnavailableException}
 * when the registry cannot be read; an empty set always means "no devices".
 */
public interface DeviceRegistry {

    Set<String> listDeviceIds();

    default boolean exists(String deviceId) {
        return deviceId != null && listDeviceIds().contains(deviceId.trim());
    }
}
