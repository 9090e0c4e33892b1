package com.github.salilvnair.convstage.engine.rule.core;

import com.github.salilvnair.convstage.engine.rule.model.StageValueSource;
import com.github.salilvnair.convstage.engine.type.StageInputType;

import java.util.Map;

public interface StageValueResolver {

    StageInputType type();

    String resolve(StageValueSource source, Map<String, String> prospectRecord);
}
