package com.github.salilvnair.convstage.api.dto;

import lombok.Data;

@Data
public class CreateStageRuleRequest {

    private String deviceId;
    private String stage;
    private String inputType;
    private String sourceColumn;
    private String literalValue;
}
