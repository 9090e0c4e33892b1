package com.github.salilvnair.convstage.engine.rule.helper;

import com.github.salilvnair.convstage.config.ConvStageConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Maps an operator-facing column label to the field name used in prospect records:
 * a configured alias first, otherwise lower case with spaces turned into underscores.
 */
@RequiredArgsConstructor
@Component
public class ColumnNameNormalizer {

    private final ConvStageConfig config;

    public String normalize(String column) {
        if (column == null) {
            return "";
        }
        String trimmed = column.trim();
        Map<String, String> aliases = config.getColumns().getAliases();
        if (aliases != null && aliases.containsKey(trimmed)) {
            return aliases.get(trimmed);
        }
        return trimmed.toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
