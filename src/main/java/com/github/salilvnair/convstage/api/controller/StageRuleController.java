package com.github.salilvnair.convstage.api.controller;

import com.github.salilvnair.convstage.api.dto.CreateStageRuleRequest;
import com.github.salilvnair.convstage.api.dto.ResolveStageValueRequest;
import com.github.salilvnair.convstage.api.dto.ResolveStageValueResponse;
import com.github.salilvnair.convstage.entity.CsStageRule;
import com.github.salilvnair.convstage.service.StageRuleStore;
import com.github.salilvnair.convstage.service.StageValueResolutionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;
import java.util.Set;

@RestController
@RequestMapping("/api/v1/stage-rules")
@RequiredArgsConstructor
public class StageRuleController {

    private final StageRuleStore ruleStore;
    private final StageValueResolutionService resolutionService;

    @GetMapping
    public List<CsStageRule> list(@RequestParam(name = "deviceId", required = false) String deviceId) {
        return deviceId == null ? ruleStore.listRules() : ruleStore.listRules(deviceId);
    }

    @GetMapping("/{id}")
    public CsStageRule get(@PathVariable("id") Long id) {
        return ruleStore.getRule(id);
    }

    @PostMapping
    public ResponseEntity<CsStageRule> create(@RequestBody CreateStageRuleRequest request) {
        CsStageRule rule = ruleStore.createRule(
                request.getDeviceId(),
                request.getStage(),
                request.getInputType(),
                request.getSourceColumn(),
                request.getLiteralValue()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(rule);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") Long id) {
        ruleStore.deleteRule(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/devices")
    public Set<String> devices() {
        return ruleStore.listDevices();
    }

    @PostMapping("/resolve")
    public ResolveStageValueResponse resolve(@RequestBody ResolveStageValueRequest request) {
        Optional<String> value = resolutionService.resolveForStage(
                request.getDeviceId(),
                request.getStage(),
                request.getRecord()
        );
        return new ResolveStageValueResponse(
                request.getDeviceId(),
                request.getStage(),
                value.isPresent(),
                value.orElse(null)
        );
    }
}
