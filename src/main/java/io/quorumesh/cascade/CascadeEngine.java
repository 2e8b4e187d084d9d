package io.quorumesh.cascade;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.quorumesh.error.NotFoundException;
import io.quorumesh.error.StateConflictException;
import io.quorumesh.error.ValidationException;
import io.quorumesh.model.CascadeStatus;
import io.quorumesh.model.CascadeTask;
import io.quorumesh.model.CascadeTransition;
import io.quorumesh.observability.AuditLogger;
import io.quorumesh.runtime.GovernanceSettings;
import io.quorumesh.storage.CascadeStore;
import io.quorumesh.util.Jsons;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Stage-gated task protocol. Task N+1 of a trace may only start once task N is committed, every transition is
 * a compare-and-set on the stored status, and transitions are deduplicated by idempotency key.
 */
public final class CascadeEngine {
    public static final String GATE_OK = "ok";
    public static final String GATE_TASK_NOT_PENDING = "task_not_pending";
    public static final String GATE_RETRY_BUDGET_EXHAUSTED = "retry_budget_exhausted";
    public static final String GATE_PREDECESSOR_NOT_FOUND = "predecessor_not_found";
    public static final String GATE_PREDECESSOR_NOT_COMMITTED = "predecessor_not_committed";

    private final CascadeStore store;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final Supplier<GovernanceSettings> settings;

    public CascadeEngine(CascadeStore store, AuditLogger auditLogger, Clock clock, Supplier<GovernanceSettings> settings) {
        this.store = store;
        this.auditLogger = auditLogger;
        this.clock = clock;
        this.settings = settings;
    }

    public CascadeTask createTask(CreateTaskRequest req) {
        if (isBlank(req.traceId())) {
            throw new ValidationException("traceId is required");
        }
        if (isBlank(req.taskId())) {
            throw new ValidationException("taskId is required");
        }
        if (req.sequence() <= 0) {
            throw new ValidationException("sequence must be > 0");
        }
        int maxRetries = req.maxRetries() == null ? settings.get().cascadeMaxRetries() : req.maxRetries();
        if (maxRetries < 0) {
            throw new ValidationException("maxRetries must be >= 0");
        }
        long nowMs = clock.millis();
        CascadeTask task = new CascadeTask(
                req.taskId().trim(),
                req.traceId().trim(),
                req.sequence(),
                req.title() == null ? "" : req.title().trim(),
                CascadeStatus.PENDING,
                req.requiredInput(),
                req.producedOutput(),
                req.validationRules(),
                0,
                maxRetries,
                "{}",
                "{}",
                "",
                nowMs,
                nowMs,
                null,
                null
        );
        store.createCascadeTask(task);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "cascade.create",
                "system",
                "cascade/" + task.traceId() + "/" + task.taskId(),
                "ok",
                task.traceId(),
                Map.of("sequence", task.sequence(), "max_retries", task.maxRetries())
        ));
        return task;
    }

    public CascadeTask getTask(String traceId, String taskId) {
        return store.getCascadeTask(traceId, taskId)
                .orElseThrow(() -> new NotFoundException("cascade task", traceId + "/" + taskId));
    }

    public List<CascadeTask> listTasks(String traceId) {
        if (isBlank(traceId)) {
            throw new ValidationException("traceId is required");
        }
        return store.listCascadeTasks(traceId.trim());
    }

    public List<CascadeTransition> listTransitions(String traceId, String taskId, int limit) {
        if (isBlank(traceId)) {
            throw new ValidationException("traceId is required");
        }
        return store.listCascadeTransitions(traceId.trim(), taskId, limit);
    }

    public StartGate canStart(String traceId, String taskId) {
        CascadeTask task = getTask(traceId, taskId);
        if (task.status() != CascadeStatus.PENDING) {
            return StartGate.closed(GATE_TASK_NOT_PENDING);
        }
        if (task.retryBudgetExhausted()) {
            return StartGate.closed(GATE_RETRY_BUDGET_EXHAUSTED);
        }
        if (task.sequence() <= 1) {
            return StartGate.open();
        }
        Optional<CascadeTask> predecessor = store.findBySequence(task.traceId(), task.sequence() - 1);
        if (predecessor.isEmpty()) {
            return StartGate.closed(GATE_PREDECESSOR_NOT_FOUND);
        }
        if (!predecessor.get().status().isCommittedOrReleased()) {
            return StartGate.closed(GATE_PREDECESSOR_NOT_COMMITTED);
        }
        return StartGate.open();
    }

    /**
     * Moves a task from {@code from} to {@code to}.
     *
     * @throws ValidationException    if the transition is not in the table or the key is blank
     * @throws StateConflictException if the stored status differs from {@code from}, or the stage gate is closed
     * @throws NotFoundException      if the task does not exist
     */
    public CascadeStore.AdvanceResult advanceTask(AdvanceRequest req) {
        return advance(req, null, null);
    }

    private CascadeStore.AdvanceResult advance(AdvanceRequest req, String inputJson, String outputJson) {
        if (req.from() == null || req.to() == null) {
            throw new ValidationException("from and to are required");
        }
        if (!req.from().canTransitionTo(req.to())) {
            throw new ValidationException("invalid transition " + req.from().wire() + " -> " + req.to().wire());
        }
        if (isBlank(req.idempotencyKey())) {
            throw new ValidationException("idempotencyKey is required");
        }
        if (isBlank(req.traceId()) || isBlank(req.taskId())) {
            throw new ValidationException("traceId and taskId are required");
        }
        String traceId = req.traceId().trim();
        String taskId = req.taskId().trim();
        Optional<CascadeTransition> replay = store.findTransition(traceId, taskId, req.idempotencyKey());
        if (replay.isPresent()) {
            return new CascadeStore.AdvanceResult(replay.get(), getTask(traceId, taskId), true);
        }
        if (req.from() == CascadeStatus.PENDING && req.to() == CascadeStatus.RUNNING) {
            StartGate gate = canStart(traceId, taskId);
            if (!gate.allowed()) {
                CascadeTask task = getTask(traceId, taskId);
                throw new StateConflictException(
                        "cascade task " + taskId + " cannot start: " + gate.reason(),
                        CascadeStatus.PENDING.wire(),
                        task.status().wire()
                );
            }
        }
        CascadeStore.AdvanceResult result = store.advanceCascadeTask(new CascadeStore.Advance(
                traceId,
                taskId,
                req.from(),
                req.to(),
                req.actor(),
                req.reason(),
                req.payload(),
                req.idempotencyKey(),
                inputJson,
                outputJson,
                clock.millis()
        ));
        if (!result.deduplicated()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("from", req.from().wire());
            details.put("to", req.to().wire());
            details.put("reason", req.reason() == null ? "" : req.reason());
            details.put("retry_count", result.task().retryCount());
            details.put("idempotency_key", req.idempotencyKey());
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "cascade.advance",
                    req.actor() == null || req.actor().isBlank() ? "system" : req.actor(),
                    "cascade/" + traceId + "/" + taskId,
                    req.to().wire(),
                    traceId,
                    details
            ));
        }
        return result;
    }

    /**
     * Validates the task's IO against the contract and routes the task out of self_test: to validated, back to
     * pending while retry budget remains, otherwise to failed. The IO is stored with that transition.
     * Without an idempotency key, one is derived from the task and its self_test attempt number.
     */
    public SelfTestResult submitSelfTest(SelfTestRequest req) {
        CascadeTask task = getTask(req.traceId(), req.taskId());
        String key = isBlank(req.idempotencyKey())
                ? defaultSelfTestKey(task)
                : req.idempotencyKey().trim();
        JsonNode input = parseObject(req.inputJson(), "input");
        JsonNode output = parseObject(req.outputJson(), "output");
        ContractValidator.ValidationResult validation = ContractValidator.validate(
                task.requiredInput(), task.producedOutput(), task.validationRules(), input, output);
        Optional<CascadeTransition> replay = store.findTransition(task.traceId(), task.taskId(), key);
        if (replay.isPresent()) {
            return new SelfTestResult(task, validation, replay.get(), true);
        }
        if (task.status() != CascadeStatus.SELF_TEST) {
            throw new StateConflictException(
                    "cascade task " + task.taskId() + " is " + task.status().wire() + ", expected self_test",
                    CascadeStatus.SELF_TEST.wire(),
                    task.status().wire()
            );
        }
        CascadeStatus next = nextStatusAfterValidation(task, validation);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("missing_input", validation.missingInput());
        payload.put("missing_output", validation.missingOutput());
        payload.put("invalid_rules", validation.failedRules());
        payload.put("remediation", validation.remediation());
        CascadeStore.AdvanceResult advanced = advance(new AdvanceRequest(
                task.traceId(),
                task.taskId(),
                CascadeStatus.SELF_TEST,
                next,
                req.actor(),
                validation.valid() ? "validated" : validation.failureReason(),
                Jsons.toCompactJson(payload),
                key
        ), input.toString(), output.toString());
        return new SelfTestResult(advanced.task(), validation, advanced.transition(), advanced.deduplicated());
    }

    // Attempt n is the n-th entry into self_test; it stays stable across a retried submission.
    private String defaultSelfTestKey(CascadeTask task) {
        int attempt = store.countTransitionsInto(task.traceId(), task.taskId(), CascadeStatus.SELF_TEST);
        return "selftest:" + task.traceId() + ":" + task.taskId() + ":" + attempt;
    }

    static CascadeStatus nextStatusAfterValidation(CascadeTask task, ContractValidator.ValidationResult validation) {
        if (validation.valid()) {
            return CascadeStatus.VALIDATED;
        }
        if (task.maxRetries() > 0 && task.retryCount() + 1 >= task.maxRetries()) {
            return CascadeStatus.FAILED;
        }
        return CascadeStatus.PENDING;
    }

    private static JsonNode parseObject(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            return Jsons.compactMapper().createObjectNode();
        }
        try {
            JsonNode node = Jsons.compactMapper().readTree(raw);
            if (node == null || !node.isObject()) {
                throw new ValidationException(field + " must be a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ValidationException(field + " is not valid JSON", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record CreateTaskRequest(
            String traceId,
            String taskId,
            int sequence,
            String title,
            List<String> requiredInput,
            List<String> producedOutput,
            List<String> validationRules,
            Integer maxRetries
    ) {}

    public record AdvanceRequest(
            String traceId,
            String taskId,
            CascadeStatus from,
            CascadeStatus to,
            String actor,
            String reason,
            String payload,
            String idempotencyKey
    ) {}

    public record SelfTestRequest(
            String traceId,
            String taskId,
            String inputJson,
            String outputJson,
            String actor,
            String idempotencyKey
    ) {}

    public record SelfTestResult(
            CascadeTask task,
            ContractValidator.ValidationResult validation,
            CascadeTransition transition,
            boolean deduplicated
    ) {}

    public record StartGate(boolean allowed, String reason) {
        public static StartGate open() {
            return new StartGate(true, GATE_OK);
        }

        public static StartGate closed(String reason) {
            return new StartGate(false, reason);
        }
    }
}
