package com.github.salilvnair.convstage.engine.rule.provider;

import com.github.salilvnair.convstage.engine.exception.UnresolvedFieldException;
import com.github.salilvnair.convstage.engine.rule.core.StageValueResolver;
import com.github.salilvnair.convstage.engine.rule.helper.ColumnNameNormalizer;
import com.github.salilvnair.convstage.engine.rule.model.StageValueSource;
import com.github.salilvnair.convstage.engine.type.StageInputType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

@RequiredArgsConstructor
@Component
public class ColumnStageValueResolver implements StageValueResolver {

    private final ColumnNameNormalizer normalizer;

    @Override
    public StageInputType type() {
        return StageInputType.COLUMN;
    }

    @Override
    public String resolve(StageValueSource source, Map<String, String> prospectRecord) {
        if (!(source instanceof StageValueSource.Column columnSource)) {
            throw new IllegalArgumentException("COLUMN resolver cannot handle " + source.type());
        }
        String column = columnSource.column();
        if (prospectRecord == null || column.isBlank()) {
            throw new UnresolvedFieldException(column);
        }
        if (prospectRecord.containsKey(column)) {
            return valueOf(prospectRecord.get(column));
        }
        String normalized = normalizer.normalize(column);
        if (!normalized.equals(column) && prospectRecord.containsKey(normalized)) {
            return valueOf(prospectRecord.get(normalized));
        }
        throw new UnresolvedFieldException(column);
    }

    private String valueOf(String value) {
        return value == null ? "" : value;
    }
}
