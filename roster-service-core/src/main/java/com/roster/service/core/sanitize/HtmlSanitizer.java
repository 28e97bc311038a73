package com.roster.service.core.sanitize;

import com.roster.player.model.PlayerRecord;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Neutralizes angle brackets in string values so exported data cannot inject markup into a dashboard. Only top-level
 * string values are rewritten; numbers, booleans, nulls and nested structures pass through as they are.
 */
@Component
public class HtmlSanitizer {

    /** Returns a copy of {@code record} with every string field escaped. The input is left untouched. */
    public PlayerRecord clean(PlayerRecord record) {
        return new PlayerRecord(cleanFields(record.fields()), record.lastUpdated(), record.origin());
    }

    public Map<String, Object> cleanFields(Map<String, ?> fields) {
        Map<String, Object> cleaned = new LinkedHashMap<>(fields.size() * 2);
        fields.forEach((key, value) -> cleaned.put(key, value instanceof String s ? escape(s) : value));
        return cleaned;
    }

    public static String escape(String value) {
        if (value.indexOf('<') < 0 && value.indexOf('>') < 0) {
            return value;
        }
        return value.replace("<", "&lt;").replace(">", "&gt;");
    }
}
