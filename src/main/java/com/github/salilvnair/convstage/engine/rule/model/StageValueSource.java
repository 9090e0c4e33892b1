package com.github.salilvnair.convstage.engine.rule.model;

import com.github.salilvnair.convstage.engine.exception.UnsupportedRuleTypeException;
import com.github.salilvnair.convstage.engine.type.StageInputType;
import com.github.salilvnair.convstage.entity.CsStageRule;

/**
 * Where the value for a stage comes from. The raw input_type of a stored rule is
 * converted here and nowhere else; anything past this point only sees one of the
 * two variants.
 */
public sealed interface StageValueSource permits StageValueSource.Column, StageValueSource.Hardcoded {

    StageInputType type();

    static StageValueSource from(CsStageRule rule) {
        StageInputType type = StageInputType.from(rule.getInputType())
                .orElseThrow(() -> new UnsupportedRuleTypeException(rule.getInputType()));
        return switch (type) {
            case COLUMN -> new Column(rule.getSourceColumn() == null ? "" : rule.getSourceColumn().trim());
            case HARDCODED -> new Hardcoded(rule.getLiteralValue() == null ? "" : rule.getLiteralValue());
        };
    }

    record Column(String column) implements StageValueSource {
        @Override
        public StageInputType type() {
            return StageInputType.COLUMN;
        }
    }

    record Hardcoded(String literal) implements StageValueSource {
        @Override
        public StageInputType type() {
            return StageInputType.HARDCODED;
        }
    }
}
