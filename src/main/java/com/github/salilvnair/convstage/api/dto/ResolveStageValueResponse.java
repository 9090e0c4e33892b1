package com.github.salilvnair.convstage.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolveStageValueResponse {

    private String deviceId;
    private String stage;
    /**
     * False when no rule is configured for the device and stage.
     */
    private boolean resolved;
    private String value;
}
