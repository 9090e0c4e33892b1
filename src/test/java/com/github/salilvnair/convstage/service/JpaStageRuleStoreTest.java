package com.github.salilvnair.convstage.service;

import com.github.salilvnair.convstage.config.ConvStageConfig;
import com.github.salilvnair.convstage.engine.exception.StageRuleNotFoundException;
import com.github.salilvnair.convstage.engine.exception.StageRuleValidationException;
import com.github.salilvnair.convstage.engine.exception.StoreUnavailableException;
import com.github.salilvnair.convstage.entity.CsStageRule;
import com.github.salilvnair.convstage.registry.DeviceRegistry;
import com.github.salilvnair.convstage.repo.StageRuleRepository;
import com.github.salilvnair.convstage.support.StageRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.Optional;

import static com.github.salilvnair.convstage.support.TestConstants.COLUMN;
import static com.github.salilvnair.convstage.support.TestConstants.DEVICE_1;
import static com.github.salilvnair.convstage.support.TestConstants.HARDCODED;
import static com.github.salilvnair.convstage.support.TestConstants.HELLO;
import static com.github.salilvnair.convstage.support.TestConstants.NAME_KEY;
import static com.github.salilvnair.convstage.support.TestConstants.STAGE_ASK_NAME;
import static com.github.salilvnair.convstage.support.TestConstants.STAGE_GREETING;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JpaStageRuleStoreTest {

    @Mock
    private StageRuleRepository ruleRepository;

    @Mock
    private DeviceRegistry deviceRegistry;

    @Mock
    private PlatformTransactionManager transactionManager;

    private ConvStageConfig config;
    private JpaStageRuleStore store;

    @BeforeEach
    void setUp() {
        config = new ConvStageConfig();
        store = new JpaStageRuleStore(ruleRepository, deviceRegistry, transactionManager, config);
    }

    @Test
    void createRejectsBlankDeviceAndStage() {
        StageRuleValidationException noDevice = assertThrows(StageRuleValidationException.class,
                () -> store.createRule(" ", STAGE_ASK_NAME, COLUMN, NAME_KEY, null));
        StageRuleValidationException noStage = assertThrows(StageRuleValidationException.class,
                () -> store.createRule(DEVICE_1, null, COLUMN, NAME_KEY, null));

        assertEquals("VALIDATION_FAILED", noDevice.getErrorCode());
        assertEquals("VALIDATION_FAILED", noStage.getErrorCode());
        verifyNoInteractions(ruleRepository, deviceRegistry);
    }

    @Test
    void createRejectsUnknownInputType() {
        assertThrows(StageRuleValidationException.class,
                () -> store.createRule(DEVICE_1, STAGE_ASK_NAME, "Input", NAME_KEY, null));
        verifyNoInteractions(ruleRepository);
    }

    @Test
    void createRejectsColumnRuleWithoutSourceColumn() {
        assertThrows(StageRuleValidationException.class,
                () -> store.createRule(DEVICE_1, STAGE_ASK_NAME, COLUMN, "  ", null));
        verifyNoInteractions(ruleRepository);
    }

    @Test
    void createRejectsDeviceMissingFromRegistry() {
        when(deviceRegistry.exists(DEVICE_1)).thenReturn(false);

        StageRuleValidationException ex = assertThrows(StageRuleValidationException.class,
                () -> store.createRule(DEVICE_1, STAGE_ASK_NAME, COLUMN, NAME_KEY, null));

        assertEquals("UNKNOWN_DEVICE", ex.getErrorCode());
        verifyNoInteractions(ruleRepository);
    }

    @Test
    void createSkipsRegistryCheckWhenDisabled() {
        config.getRules().setRequireKnownDevice(false);
        when(ruleRepository.existsByDeviceIdAndStage(DEVICE_1, STAGE_ASK_NAME)).thenReturn(false);
        when(ruleRepository.saveAndFlush(any(CsStageRule.class))).thenAnswer(invocation -> invocation.getArgument(0));

        store.createRule(DEVICE_1, STAGE_ASK_NAME, COLUMN, NAME_KEY, null);

        verifyNoInteractions(deviceRegistry);
    }

    @Test
    void createNormalizesAndClearsFieldOfOtherType() {
        when(deviceRegistry.exists(DEVICE_1)).thenReturn(true);
        when(ruleRepository.existsByDeviceIdAndStage(DEVICE_1, STAGE_GREETING)).thenReturn(false);
        when(ruleRepository.saveAndFlush(any(CsStageRule.class))).thenAnswer(invocation -> invocation.getArgument(0));

        store.createRule(" dev1 ", " greeting ", "HARDCODED", "ignored", HELLO);

        ArgumentCaptor<CsStageRule> saved = ArgumentCaptor.forClass(CsStageRule.class);
        verify(ruleRepository).saveAndFlush(saved.capture());
        assertEquals(DEVICE_1, saved.getValue().getDeviceId());
        assertEquals(STAGE_GREETING, saved.getValue().getStage());
        assertEquals(HARDCODED, saved.getValue().getInputType());
        assertEquals(HELLO, saved.getValue().getLiteralValue());
        assertNull(saved.getValue().getSourceColumn());
    }

    @Test
    void createStoresEmptyLiteralForHardcodedRuleWithoutValue() {
        when(deviceRegistry.exists(DEVICE_1)).thenReturn(true);
        when(ruleRepository.existsByDeviceIdAndStage(DEVICE_1, STAGE_GREETING)).thenReturn(false);
        when(ruleRepository.saveAndFlush(any(CsStageRule.class))).thenAnswer(invocation -> invocation.getArgument(0));

        CsStageRule rule = store.createRule(DEVICE_1, STAGE_GREETING, HARDCODED, null, null);

        assertEquals("", rule.getLiteralValue());
    }

    @Test
    void createRejectsDuplicateDeviceStage() {
        when(deviceRegistry.exists(DEVICE_1)).thenReturn(true);
        when(ruleRepository.existsByDeviceIdAndStage(DEVICE_1, STAGE_ASK_NAME)).thenReturn(true);

        StageRuleValidationException ex = assertThrows(StageRuleValidationException.class,
                () -> store.createRule(DEVICE_1, STAGE_ASK_NAME, COLUMN, NAME_KEY, null));

        assertEquals("DUPLICATE_STAGE_RULE", ex.getErrorCode());
        verify(ruleRepository, never()).saveAndFlush(any());
    }

    @Test
    void createReportsConstraintViolationAsDuplicate() {
        when(deviceRegistry.exists(DEVICE_1)).thenReturn(true);
        when(ruleRepository.existsByDeviceIdAndStage(DEVICE_1, STAGE_ASK_NAME)).thenReturn(false, true);
        when(ruleRepository.saveAndFlush(any(CsStageRule.class)))
                .thenThrow(new DataIntegrityViolationException("uk_cs_stage_rule_device_stage"));

        StageRuleValidationException ex = assertThrows(StageRuleValidationException.class,
                () -> store.createRule(DEVICE_1, STAGE_ASK_NAME, COLUMN, NAME_KEY, null));

        assertEquals("DUPLICATE_STAGE_RULE", ex.getErrorCode());
    }

    @Test
    void createReportsOtherConstraintViolationAsStoreUnavailable() {
        when(deviceRegistry.exists(DEVICE_1)).thenReturn(true);
        when(ruleRepository.existsByDeviceIdAndStage(DEVICE_1, STAGE_GREETING)).thenReturn(false);
        when(ruleRepository.saveAndFlush(any(CsStageRule.class)))
                .thenThrow(new DataIntegrityViolationException("value too long for column"));

        StoreUnavailableException ex = assertThrows(StoreUnavailableException.class,
                () -> store.createRule(DEVICE_1, STAGE_GREETING, HARDCODED, null, HELLO));

        assertEquals("STORE_UNAVAILABLE", ex.getErrorCode());
    }

    @Test
    void createRejectsValuesLongerThanTheirColumns() {
        StageRuleValidationException longStage = assertThrows(StageRuleValidationException.class,
                () -> store.createRule(DEVICE_1, "s".repeat(CsStageRule.MAX_KEY_LENGTH + 1), HARDCODED, null, HELLO));
        StageRuleValidationException longColumn = assertThrows(StageRuleValidationException.class,
                () -> store.createRule(DEVICE_1, STAGE_ASK_NAME, COLUMN, "c".repeat(CsStageRule.MAX_KEY_LENGTH + 1), null));
        StageRuleValidationException longLiteral = assertThrows(StageRuleValidationException.class,
                () -> store.createRule(DEVICE_1, STAGE_GREETING, HARDCODED, null, "x".repeat(CsStageRule.MAX_LITERAL_LENGTH + 1)));

        assertEquals("VALIDATION_FAILED", longStage.getErrorCode());
        assertEquals("VALIDATION_FAILED", longColumn.getErrorCode());
        assertEquals("VALIDATION_FAILED", longLiteral.getErrorCode());
        verifyNoInteractions(ruleRepository, deviceRegistry);
    }

    @Test
    void listFailureSurfacesAsStoreUnavailable() {
        when(ruleRepository.findAllByOrderByCreatedAtDescIdDesc()).thenThrow(new QueryTimeoutException("timeout"));

        StoreUnavailableException ex = assertThrows(StoreUnavailableException.class, () -> store.listRules());

        assertTrue(ex.isRecoverable());
        assertEquals("STORE_UNAVAILABLE", ex.getErrorCode());
    }

    @Test
    void deleteMissingRuleFailsEveryTime() {
        when(ruleRepository.findById(42L)).thenReturn(Optional.empty());

        assertThrows(StageRuleNotFoundException.class, () -> store.deleteRule(42L));
        StageRuleNotFoundException second = assertThrows(StageRuleNotFoundException.class, () -> store.deleteRule(42L));

        assertEquals(42L, second.getRuleId());
        verify(ruleRepository, never()).delete(any());
    }

    @Test
    void deleteRemovesExistingRule() {
        CsStageRule rule = StageRules.column(9L, DEVICE_1, STAGE_ASK_NAME, NAME_KEY);
        when(ruleRepository.findById(9L)).thenReturn(Optional.of(rule));

        store.deleteRule(9L);

        verify(ruleRepository).delete(rule);
    }

    @Test
    void findRuleWithBlankKeysDoesNotQuery() {
        assertTrue(store.findRule(DEVICE_1, " ").isEmpty());
        assertTrue(store.findRule(null, STAGE_ASK_NAME).isEmpty());
        verifyNoInteractions(ruleRepository);
    }

    @Test
    void listDevicesPropagatesRegistryFailure() {
        when(deviceRegistry.listDeviceIds())
                .thenThrow(new StoreUnavailableException("registry down", new IllegalStateException("down")));

        assertThrows(StoreUnavailableException.class, () -> store.listDevices());
    }
}
