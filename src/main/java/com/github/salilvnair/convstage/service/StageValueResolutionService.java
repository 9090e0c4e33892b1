package com.github.salilvnair.convstage.service;

import com.github.salilvnair.convstage.engine.rule.factory.StageValueResolverFactory;
import com.github.salilvnair.convstage.engine.rule.model.StageValueSource;
import com.github.salilvnair.convstage.entity.CsStageRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
@Service
public class StageValueResolutionService {

    private final StageValueResolverFactory resolverFactory;
    private final StageRuleStore ruleStore;

    /**
     * Computes the value a rule yields for a prospect record. No I/O.
     */
    public String resolve(CsStageRule rule, Map<String, String> prospectRecord) {
        StageValueSource source = StageValueSource.from(rule);
        String value = resolverFactory.get(source.type()).resolve(source, prospectRecord == null ? Map.of() : prospectRecord);
        log.debug("ConvStage: resolved rule id={} device={} stage={} type={}",
                rule.getId(), rule.getDeviceId(), rule.getStage(), source.type());
        return value;
    }

    /**
     * Looks up the rule for a (device, stage) pair and resolves it. Empty when the pair has no rule,
     * in which case the caller only moves the conversation to the stage.
     */
    public Optional<String> resolveForStage(String deviceId, String stage, Map<String, String> prospectRecord) {
        Optional<CsStageRule> rule = ruleStore.findRule(deviceId, stage);
        if (rule.isEmpty()) {
            log.debug("ConvStage: no stage rule for device={} stage={}", deviceId, stage);
            return Optional.empty();
        }
        return Optional.of(resolve(rule.get(), prospectRecord));
    }
}
