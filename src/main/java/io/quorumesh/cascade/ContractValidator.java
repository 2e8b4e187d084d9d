package io.quorumesh.cascade;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a task's self-test IO against its declared contract: required input keys, produced output keys and
 * the validation rules {@code non_empty:<field>} and {@code equals:<field>:<value>}, evaluated against the
 * output. A blank value counts as missing.
 */
public final class ContractValidator {
    public static final String MISSING_INPUT = "missing_input";
    public static final String MISSING_OUTPUT = "missing_output";
    public static final String INVALID_RULES = "invalid_rules";

    private ContractValidator() {
    }

    public static ValidationResult validate(
            List<String> requiredInput,
            List<String> producedOutput,
            List<String> rules,
            JsonNode input,
            JsonNode output
    ) {
        List<String> missingInput = missingKeys(requiredInput, input);
        List<String> missingOutput = missingKeys(producedOutput, output);
        List<String> failedRules = new ArrayList<>();
        for (String rule : rules == null ? List.<String>of() : rules) {
            if (rule == null || rule.isBlank()) {
                continue;
            }
            if (!ruleHolds(rule.trim(), output)) {
                failedRules.add(rule.trim());
            }
        }
        return new ValidationResult(missingInput, missingOutput, failedRules);
    }

    private static List<String> missingKeys(List<String> keys, JsonNode node) {
        List<String> missing = new ArrayList<>();
        for (String key : keys == null ? List.<String>of() : keys) {
            if (key == null || key.isBlank()) {
                continue;
            }
            if (text(node, key.trim()).isEmpty()) {
                missing.add(key.trim());
            }
        }
        return missing;
    }

    private static boolean ruleHolds(String rule, JsonNode output) {
        if (rule.startsWith("non_empty:")) {
            return !text(output, rule.substring("non_empty:".length()).trim()).isEmpty();
        }
        if (rule.startsWith("equals:")) {
            String rest = rule.substring("equals:".length());
            int sep = rest.indexOf(':');
            if (sep < 0) {
                return false;
            }
            String field = rest.substring(0, sep).trim();
            String expected = rest.substring(sep + 1).trim();
            return text(output, field).equals(expected);
        }
        // Unknown rule kinds fail closed.
        return false;
    }

    /**
     * Trimmed text of a scalar field; containers and missing or null fields read as empty.
     */
    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return "";
        }
        return value.asText("").trim();
    }

    public record ValidationResult(List<String> missingInput, List<String> missingOutput, List<String> failedRules) {
        public boolean valid() {
            return missingInput.isEmpty() && missingOutput.isEmpty() && failedRules.isEmpty();
        }

        /**
         * First failing category, or an empty string when valid.
         */
        public String failureReason() {
            if (!missingInput.isEmpty()) {
                return MISSING_INPUT;
            }
            if (!missingOutput.isEmpty()) {
                return MISSING_OUTPUT;
            }
            if (!failedRules.isEmpty()) {
                return INVALID_RULES;
            }
            return "";
        }

        public String remediation() {
            List<String> parts = new ArrayList<>();
            if (!missingInput.isEmpty()) {
                parts.add(MISSING_INPUT + "=" + String.join(",", missingInput));
            }
            if (!missingOutput.isEmpty()) {
                parts.add(MISSING_OUTPUT + "=" + String.join(",", missingOutput));
            }
            if (!failedRules.isEmpty()) {
                parts.add(INVALID_RULES + "=" + String.join(",", failedRules));
            }
            return String.join("; ", parts);
        }
    }
}
