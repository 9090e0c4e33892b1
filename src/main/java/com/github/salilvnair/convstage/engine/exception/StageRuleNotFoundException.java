package com.github.salilvnair.convstage.engine.exception;

import lombok.Getter;

@Getter
public class StageRuleNotFoundException extends ConvStageException {

    private final Long ruleId;

    public StageRuleNotFoundException(Long ruleId) {
        super(ConvStageErrorCode.STAGE_RULE_NOT_FOUND, "Stage rule not found for id=" + ruleId);
        this.ruleId = ruleId;
    }
}
