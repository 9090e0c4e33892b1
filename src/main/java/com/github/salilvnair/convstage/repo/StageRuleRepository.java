package com.github.salilvnair.convstage.repo;

import com.github.salilvnair.convstage.entity.CsStageRule;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface StageRuleRepository extends JpaRepository<CsStageRule, Long> {
    List<CsStageRule> findAllByOrderByCreatedAtDescIdDesc();
    List<CsStageRule> findByDeviceIdOrderByCreatedAtDescIdDesc(String deviceId);
    Optional<CsStageRule> findFirstByDeviceIdAndStageOrderByCreatedAtDescIdDesc(String deviceId, String stage);
    boolean existsByDeviceIdAndStage(String deviceId, String stage);
}
