package com.github.salilvnair.convstage.engine.rule.provider;

import com.github.salilvnair.convstage.engine.rule.core.StageValueResolver;
import com.github.salilvnair.convstage.engine.rule.model.StageValueSource;
import com.github.salilvnair.convstage.engine.type.StageInputType;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class HardcodedStageValueResolver implements StageValueResolver {

    @Override
    public StageInputType type() {
        return StageInputType.HARDCODED;
    }

    @Override
    public String resolve(StageValueSource source, Map<String, String> prospectRecord) {
        if (!(source instanceof StageValueSource.Hardcoded hardcoded)) {
            throw new IllegalArgumentException("HARDCODED resolver cannot handle " + source.type());
        }
        return hardcoded.literal();
    }
}
