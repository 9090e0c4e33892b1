package com.github.salilvnair.convstage.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

/**
 * Read-only view of the platform's device registry table.
 */
@Getter
@Setter
@Entity
@Immutable
@Table(name = "device_setting")
public class CsDeviceSetting {

    @Id
    @Column(name = "id")
    private String id;

    @Column(name = "device_id", unique = true)
    private String deviceId;

    @Column(name = "device_name")
    private String deviceName;

    @Column(name = "provider")
    private String provider;

    @Column(name = "status")
    private String status;
}
