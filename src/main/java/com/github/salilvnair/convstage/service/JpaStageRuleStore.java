package com.github.salilvnair.convstage.service;

import com.github.salilvnair.convstage.config.ConvStageConfig;
import com.github.salilvnair.convstage.engine.exception.ConvStageErrorCode;
import com.github.salilvnair.convstage.engine.exception.StageRuleNotFoundException;
import com.github.salilvnair.convstage.engine.exception.StageRuleValidationException;
import com.github.salilvnair.convstage.engine.exception.StoreUnavailableException;
import com.github.salilvnair.convstage.engine.type.StageInputType;
import com.github.salilvnair.convstage.entity.CsStageRule;
import com.github.salilvnair.convstage.registry.DeviceRegistry;
import com.github.salilvnair.convstage.repo.StageRuleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

@Slf4j
@Service
public class JpaStageRuleStore implements StageRuleStore {

    private final StageRuleRepository ruleRepository;
    private final DeviceRegistry deviceRegistry;
    private final ConvStageConfig config;
    private final TransactionTemplate readTemplate;
    private final TransactionTemplate writeTemplate;

    public JpaStageRuleStore(StageRuleRepository ruleRepository,
                             DeviceRegistry deviceRegistry,
                             PlatformTransactionManager transactionManager,
                             ConvStageConfig config) {
        this.ruleRepository = ruleRepository;
        this.deviceRegistry = deviceRegistry;
        this.config = config;
        int timeout = config.getStore().getTimeoutSeconds();
        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
        this.readTemplate.setTimeout(timeout);
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setTimeout(timeout);
    }

    @Override
    public List<CsStageRule> listRules() {
        return inTransaction(readTemplate, "list rules", ruleRepository::findAllByOrderByCreatedAtDescIdDesc);
    }

    @Override
    public List<CsStageRule> listRules(String deviceId) {
        if (deviceId == null || deviceId.isBlank()) {
            return listRules();
        }
        return inTransaction(readTemplate, "list rules by device",
                () -> ruleRepository.findByDeviceIdOrderByCreatedAtDescIdDesc(deviceId.trim()));
    }

    @Override
    public CsStageRule getRule(Long id) {
        if (id == null) {
            throw new StageRuleNotFoundException(null);
        }
        return inTransaction(readTemplate, "get rule",
                () -> ruleRepository.findById(id).orElseThrow(() -> new StageRuleNotFoundException(id)));
    }

    @Override
    public Optional<CsStageRule> findRule(String deviceId, String stage) {
        if (deviceId == null || deviceId.isBlank() || stage == null || stage.isBlank()) {
            return Optional.empty();
        }
        return inTransaction(readTemplate, "find rule",
                () -> ruleRepository.findFirstByDeviceIdAndStageOrderByCreatedAtDescIdDesc(deviceId.trim(), stage.trim()));
    }

    @Override
    public Set<String> listDevices() {
        return deviceRegistry.listDeviceIds();
    }

    @Override
    public CsStageRule createRule(String deviceId,
                                  String stage,
                                  String inputType,
                                  String sourceColumn,
                                  String literalValue) {
        CsStageRule rule = validate(deviceId, stage, inputType, sourceColumn, literalValue);

        if (config.getRules().isRequireKnownDevice() && !deviceRegistry.exists(rule.getDeviceId())) {
            throw new StageRuleValidationException(ConvStageErrorCode.UNKNOWN_DEVICE,
                    "Device '" + rule.getDeviceId() + "' is not listed by the device registry");
        }

        try {
            CsStageRule saved = inTransaction(writeTemplate, "create rule", () -> {
                if (ruleRepository.existsByDeviceIdAndStage(rule.getDeviceId(), rule.getStage())) {
                    throw duplicate(rule, null);
                }
                return ruleRepository.saveAndFlush(rule);
            });
            log.info("ConvStage: created stage rule id={} device={} stage={} type={}",
                    saved.getId(), saved.getDeviceId(), saved.getStage(), saved.getInputType());
            return saved;
        } catch (StoreUnavailableException e) {
            // a concurrent insert of the same pair trips the unique key; anything else is a store failure
            if (e.getCause() instanceof DataIntegrityViolationException integrity
                    && inTransaction(readTemplate, "recheck rule",
                            () -> ruleRepository.existsByDeviceIdAndStage(rule.getDeviceId(), rule.getStage()))) {
                throw duplicate(rule, integrity);
            }
            throw e;
        }
    }

    @Override
    public void deleteRule(Long id) {
        if (id == null) {
            throw new StageRuleNotFoundException(null);
        }
        inTransaction(writeTemplate, "delete rule", () -> {
            CsStageRule rule = ruleRepository.findById(id).orElseThrow(() -> new StageRuleNotFoundException(id));
            ruleRepository.delete(rule);
            return rule;
        });
        log.info("ConvStage: deleted stage rule id={}", id);
    }

    private CsStageRule validate(String deviceId,
                                 String stage,
                                 String inputType,
                                 String sourceColumn,
                                 String literalValue) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new StageRuleValidationException("device_id is required");
        }
        if (stage == null || stage.isBlank()) {
            throw new StageRuleValidationException("stage is required");
        }
        requireMaxLength("device_id", deviceId.trim(), CsStageRule.MAX_KEY_LENGTH);
        requireMaxLength("stage", stage.trim(), CsStageRule.MAX_KEY_LENGTH);
        StageInputType type = StageInputType.from(inputType)
                .orElseThrow(() -> new StageRuleValidationException(
                        "input_type must be one of [column, hardcoded] but was '" + inputType + "'"));

        CsStageRule rule = new CsStageRule();
        rule.setDeviceId(deviceId.trim());
        rule.setStage(stage.trim());
        rule.setInputType(type.code());
        if (type == StageInputType.COLUMN) {
            if (sourceColumn == null || sourceColumn.isBlank()) {
                throw new StageRuleValidationException("source_column is required when input_type is column");
            }
            requireMaxLength("source_column", sourceColumn.trim(), CsStageRule.MAX_KEY_LENGTH);
            rule.setSourceColumn(sourceColumn.trim());
        } else {
            String literal = literalValue == null ? "" : literalValue;
            requireMaxLength("literal_value", literal, CsStageRule.MAX_LITERAL_LENGTH);
            rule.setLiteralValue(literal);
        }
        return rule;
    }

    private void requireMaxLength(String field, String value, int max) {
        if (value.length() > max) {
            throw new StageRuleValidationException(field + " must be at most " + max + " characters but was " + value.length());
        }
    }

    private StageRuleValidationException duplicate(CsStageRule rule, Throwable cause) {
        StageRuleValidationException ex = new StageRuleValidationException(ConvStageErrorCode.DUPLICATE_STAGE_RULE,
                "A stage rule already exists for device '" + rule.getDeviceId() + "' and stage '" + rule.getStage() + "'",
                cause);
        ex.withMetaData(Map.of("deviceId", rule.getDeviceId(), "stage", rule.getStage()));
        return ex;
    }

    private <T> T inTransaction(TransactionTemplate template, String operation, Supplier<T> work) {
        try {
            return template.execute(status -> work.get());
        } catch (DataAccessException | TransactionException e) {
            log.warn("ConvStage: stage rule store failed to {}: {}", operation, e.getMessage());
            throw new StoreUnavailableException("Stage rule store unavailable during " + operation, e);
        }
    }
}
