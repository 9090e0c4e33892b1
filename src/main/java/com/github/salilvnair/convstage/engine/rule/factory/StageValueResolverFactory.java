package com.github.salilvnair.convstage.engine.rule.factory;

import com.github.salilvnair.convstage.engine.exception.UnsupportedRuleTypeException;
import com.github.salilvnair.convstage.engine.rule.core.StageValueResolver;
import com.github.salilvnair.convstage.engine.type.StageInputType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class StageValueResolverFactory {

    private final Map<StageInputType, StageValueResolver> resolvers = new EnumMap<>(StageInputType.class);

    public StageValueResolverFactory(List<StageValueResolver> resolvers) {
        for (StageValueResolver resolver : resolvers) {
            StageValueResolver previous = this.resolvers.put(resolver.type(), resolver);
            if (previous != null) {
                throw new IllegalStateException("Duplicate StageValueResolver for type " + resolver.type()
                        + ": " + previous.getClass().getSimpleName() + ", " + resolver.getClass().getSimpleName());
            }
        }
    }

    public StageValueResolver get(StageInputType type) {
        StageValueResolver resolver = type == null ? null : resolvers.get(type);
        if (resolver == null) {
            throw new UnsupportedRuleTypeException(type == null ? null : type.code());
        }
        return resolver;
    }
}
