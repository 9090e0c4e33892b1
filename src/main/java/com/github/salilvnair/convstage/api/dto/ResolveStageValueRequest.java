package com.github.salilvnair.convstage.api.dto;

import lombok.Data;

import java.util.Map;

@Data
public class ResolveStageValueRequest {

    private String deviceId;
    private String stage;
    private Map<String, String> record;
}
