package io.quorumesh.model;

import java.util.List;

public record CascadeTask(
        String taskId,
        String traceId,
        int sequence,
        String title,
        CascadeStatus status,
        List<String> requiredInput,
        List<String> producedOutput,
        List<String> validationRules,
        int retryCount,
        int maxRetries,
        String inputJson,
        String outputJson,
        String lastError,
        long createdAtMs,
        long updatedAtMs,
        Long committedAtMs,
        Long archivedAtMs
) {
    public CascadeTask {
        requiredInput = requiredInput == null ? List.of() : List.copyOf(requiredInput);
        producedOutput = producedOutput == null ? List.of() : List.copyOf(producedOutput);
        validationRules = validationRules == null ? List.of() : List.copyOf(validationRules);
    }

    public boolean retryBudgetExhausted() {
        return maxRetries > 0 && retryCount >= maxRetries;
    }
}
