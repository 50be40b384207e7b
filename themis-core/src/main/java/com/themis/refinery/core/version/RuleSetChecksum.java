package com.themis.refinery.core.version;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.themis.refinery.api.model.Rule;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SHA-256 over the canonical JSON form of a rule set.
 *
 * <p>Only fields that change behavior take part (id, type, pattern,
 * replacement, priority, enabled), ordered by rule id, so usage counters and
 * timestamps do not change the checksum.
 */
public final class RuleSetChecksum {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private RuleSetChecksum() {
    }

    public static String of(List<Rule> rules) {
        List<Map<String, Object>> canonical = rules.stream()
                .sorted(Comparator.comparing(Rule::ruleId))
                .map(RuleSetChecksum::canonicalForm)
                .toList();
        try {
            byte[] json = CANONICAL.writeValueAsString(canonical).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Rule set could not be serialized for checksum", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static Map<String, Object> canonicalForm(Rule rule) {
        Map<String, Object> form = new LinkedHashMap<>();
        form.put("rule_id", rule.ruleId());
        form.put("type", rule.type().code());
        form.put("pattern", rule.pattern());
        form.put("replacement", rule.replacement());
        form.put("priority", rule.priority());
        form.put("enabled", rule.enabled());
        return form;
    }
}
