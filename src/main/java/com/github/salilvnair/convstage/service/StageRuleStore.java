package com.github.salilvnair.convstage.service;

import com.github.salilvnair.convstage.entity.CsStageRule;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable collection of stage rules. Rules are immutable once created: a correction is a
 * delete followed by a create.
 */
public interface StageRuleStore {

    /**
     * All rules, newest first.
     */
    List<CsStageRule> listRules();

    /**
     * Rules of one device, newest first.
     */
    List<CsStageRule> listRules(String deviceId);

    CsStageRule getRule(Long id);

    /**
     * The rule governing a (device, stage) pair, if one is configured.
     */
    Optional<CsStageRule> findRule(String deviceId, String stage);

    Set<String> listDevices();

    /**
     * Creates a rule. Not idempotent: a retry after a timeout may fail with
     * DUPLICATE_STAGE_RULE when the first attempt was committed.
     */
    CsStageRule createRule(String deviceId, String stage, String inputType, String sourceColumn, String literalValue);

    void deleteRule(Long id);
}
