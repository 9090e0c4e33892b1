package com.github.salilvnair.convstage.repo;

import com.github.salilvnair.convstage.entity.CsDeviceSetting;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface DeviceSettingRepository extends JpaRepository<CsDeviceSetting, String> {

    @Query("""
            select distinct d.deviceId
            from CsDeviceSetting d
            where d.deviceId is not null
            """)
    List<String> findAllDeviceIds();

    @Query("""
            select case when count(d) > 0 then true else false end
            from CsDeviceSetting d
            where trim(d.deviceId) = :deviceId
            """)
    boolean existsByTrimmedDeviceId(@Param("deviceId") String deviceId);
}
