package io.quorumesh.cli;

import io.quorumesh.cascade.CascadeEngine;
import io.quorumesh.config.QuorumMeshConfig;
import io.quorumesh.error.QuorumMeshException;
import io.quorumesh.governance.GovernanceService;
import io.quorumesh.governance.KnowledgeEnvelopeHandler;
import io.quorumesh.model.CascadeStatus;
import io.quorumesh.model.GroupMember;
import io.quorumesh.model.ProposalStatus;
import io.quorumesh.runtime.GovernanceSettings;
import io.quorumesh.runtime.QuorumMeshRuntime;
import io.quorumesh.storage.Database;
import io.quorumesh.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "quorumesh",
        mixinStandardHelpOptions = true,
        description = "Knowledge governance and cascading task CLI",
        subcommands = {
                QuorumMeshCommand.InitCommand.class,
                QuorumMeshCommand.StatusCommand.class,
                QuorumMeshCommand.ProposeCommand.class,
                QuorumMeshCommand.VoteCommand.class,
                QuorumMeshCommand.EvaluateCommand.class,
                QuorumMeshCommand.DecisionsCommand.class,
                QuorumMeshCommand.FactsCommand.class,
                QuorumMeshCommand.ConsumeCommand.class,
                QuorumMeshCommand.MembersCommand.class,
                QuorumMeshCommand.MemberJoinCommand.class,
                QuorumMeshCommand.CascadeCreateCommand.class,
                QuorumMeshCommand.CascadeAdvanceCommand.class,
                QuorumMeshCommand.CascadeSelfTestCommand.class,
                QuorumMeshCommand.CascadeGateCommand.class,
                QuorumMeshCommand.CascadeTasksCommand.class,
                QuorumMeshCommand.CascadeTransitionsCommand.class,
                QuorumMeshCommand.AuditTailCommand.class,
                QuorumMeshCommand.AuditVerifyCommand.class,
                QuorumMeshCommand.SchemaMigrationsCommand.class
        }
)
public final class QuorumMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Namespace (tenant scope)", defaultValue = "default")
    String namespace;

    @Option(names = {"--claw-id"}, description = "Override this node's claw id")
    String clawId;

    @Option(names = {"--instance-id"}, description = "Override this node's instance id")
    String instanceId;

    @Option(names = {"--group"}, description = "Override the default knowledge group")
    String group;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | status | propose | vote | evaluate | decisions | facts | consume | members | member-join | cascade-create | cascade-advance | cascade-self-test | cascade-gate | cascade-tasks | cascade-transitions | audit-tail | audit-verify | schema-migrations");
    }

    /**
     * Command line with domain errors mapped to a JSON error line and exit code 1.
     */
    public static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new QuorumMeshCommand());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof QuorumMeshException || ex instanceof IllegalArgumentException) {
                Map<String, Object> error = new LinkedHashMap<>();
                error.put("error", ex.getMessage());
                error.put("code", ex instanceof QuorumMeshException ? ((QuorumMeshException) ex).code() : "invalid_argument");
                System.out.println(Jsons.toCompactJson(error));
                return 1;
            }
            throw ex;
        });
        return cmd;
    }

    QuorumMeshConfig config() {
        return QuorumMeshConfig.fromRoot(root, namespace);
    }

    QuorumMeshRuntime runtime() {
        QuorumMeshRuntime runtime = new QuorumMeshRuntime(config());
        runtime.init();
        GovernanceSettings current = runtime.settings();
        runtime.overrideSettings(current.withIdentity(group, clawId, instanceId));
        return runtime;
    }

    private static void print(Object value) {
        System.out.println(Jsons.toJson(value));
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        QuorumMeshCommand parent;

        @Override
        public Integer call() {
            QuorumMeshRuntime runtime = parent.runtime();
            System.out.println("Initialized QuorumMesh at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "status", description = "Show settings, proposal/fact counters and pool size")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        QuorumMeshCommand parent;

        @Override
        public Integer call() {
            print(parent.runtime().status());
            return 0;
        }
    }

    @Command(name = "propose", description = "Create a proposal and publish it to the group")
    static final class ProposeCommand implements Callable<Integer> {
        @ParentCommand
        QuorumMeshCommand parent;

        @Option(names = {"--statement"}, required = true, description = "Statement to vote on")
        String statement;

        @Option(names = {"--title"}, description = "Short title; becomes the fact subject on approval")
        String title;

        @Option(names = {"--id"}, description = "Proposal id (generated when omitted); repeating an unchanged proposal republishes it")
        String proposalId;

        @Option(names = {"--tag"}, description = "Tag (repeatable)")
        List<String> tags;

        @Option(names = {"--trace-id"}, description = "Trace id")
        String traceId;

        @Override
        public Integer call() {
            QuorumMeshRuntime runtime = parent.runtime();
            print(runtime.governance().propose(new GovernanceService.ProposeRequest(
                    proposalId, null, title, statement, tags, traceId)));
            return 0;
        }
    }

    @Command(name = "vote", description = "Cast this node's vote and re-evaluate the proposal")
    static final class VoteCommand implements Callable<Integer> {
        @ParentCommand
        QuorumMeshCommand parent;

        @Parameters(index = "0", description = "Proposal id")
        String proposalId;

        @Option(names = {"--vote"}, required = true, description = "yes|no")
        String vote;

        @Option(names = {"--reason"}, description = "Reason")
        String reason;

        @Option(names = {"--pool-size"}, defaultValue = "0", description = "Pool size override; 0 uses the roster")
        int poolSize;

        @Option(names = {"--trace-id"}, description = "Trace id")
        String traceId;

        @Override
        public Integer call() {
            QuorumMeshRuntime runtime = parent.runtime();
            print(runtime.governance().vote(new GovernanceService.VoteRequest(
                    proposalId, vote, reason, poolSize, traceId)));
            return 0;
        }
    }

    @Command(name = "evaluate", description = "Re-run quorum evaluation (applies timeout expiry)")
    static final class EvaluateCommand implements Callable<Integer> {
        @ParentCommand
        QuorumMeshCommand parent;

        @Parameters(index = "0", description = "Proposal id")
        String proposalId;

        @Option(names = {"--pool-size"}, defaultValue = "0", description = "Pool size override; 0 uses the roster")
        int poolSize;

        @Override
        public Integer call() {
            print(parent.runtime().governance().evaluate(proposalId, poolSize, null));
            return 0;
        }
    }

    @Command(name = "decisions", description = "List proposals and their decisions")
    static final class DecisionsCommand implements Callable<Integer> {
        @ParentCommand
        QuorumMeshCommand parent;

        @Option(names = {"--status"}, description = "pending|approved|rejected|expired")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Option(names = {"--offset"}, defaultValue = "0", description = "Pagination offset")
        int offset;

        @Override
        public Integer call() {
            ProposalStatus filter = status == null || status.isBlank() ? null : ProposalStatus.fromString(status);
            print(parent.runtime().governance().listDecisions(filter, limit, offset));
            return 0;
        }
    }

    @Command(name = "facts", description = "List latest facts, or the history of one fact key")
    static final class FactsCommand implements Callable<Integer> {
        @ParentCommand
        QuorumMeshCommand parent;

        @Option(names = {"--subject"}, description = "With --predicate: show the audit history of this key")
        String subject;

        @Option(names = {"--predicate"}, description = "With --subject: show the audit history of this key")
        String predicate;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Option(names = {"--offset"}, defaultValue = "0", description = "Pagination offset")
        int offset;

        @Override
        public Integer call() {
            QuorumMeshRuntime runtime = parent.runtime();
            String group = runtime.settings().group();
            if (subject != null && predicate != null) {
                print(runtime.knowledgeStore().listFactHistory(group, subject, predicate, limit));
                return 0;
            }
            print(runtime.governance().listFacts(group, limit, offset));
            return 0;
        }
    }

    @Command(name = "consume", description = "Apply pending envelopes from the group's knowledge topics")
    static final class ConsumeCommand implements Callable<Integer> {
        @ParentCommand
        QuorumMeshCommand parent;

        @Option(names = {"--consumer"}, description = "Consumer id whose committed records are tracked (defaults to claw id)")
        String consumer;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max records per topic")
        int limit;

        @Override
        public Integer call() {
            QuorumMeshRuntime runtime = parent.runtime();
            String consumerId = consumer == null || consumer.isBlank() ? runtime.settings().clawId() : consumer;
            KnowledgeEnvelopeHandler.ConsumeSummary summary = runtime.envelopeHandler().consume(
                    runtime.fileBus(), runtime.settings().group(), consumerId, limit);
            print(summary);
            return 0;
        }
    }

    @Command(name = "members", description = "List the group roster")
    static final class MembersCommand implements Callable<Integer> {
        @ParentCommand
        QuorumMeshCommand parent;

        @Option(names = {"--active-only"}, description = "Only active members")
        boolean activeOnly;

        @Override
        public Integer call() {
            QuorumMeshRuntime runtime = parent.runtime();
            print(runtime.listMembers(runtime.settings().group(), activeOnly));
            return 0;
        }
    }

    @Command(name = "member-join", description = "Record a group member; --announce also publishes this node's presence")
    static final class MemberJoinCommand implements Callable<Integer> {
        @ParentCommand
        QuorumMeshCommand parent;

        @Option(names = {"--member-id"}, description = "Member id (defaults to claw id)")
        String memberId;

        @Option(names = {"--member-instance-id"}, description = "Member instance id")
        String memberInstanceId;

        @Option(names = {"--status"}, defaultValue = "active", description = "active|inactive")
        String status;

        @Option(names = {"--capability"}, description = "Capability (repeatable)")
        List<String> capabilities;

        @Option(names = {"--announce"}, description = "Publish presence/capabilities envelopes for this node")
        boolean announce;

        @Override
        public Integer call() {
            QuorumMeshRuntime runtime = parent.runtime();
            GovernanceSettings s = runtime.settings();
            String id = memberId == null || memberId.isBlank() ? s.clawId() : memberId.trim();
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("member id is required; pass --member-id or --claw-id");
            }
            if (s.group() == null || s.group().isBlank()) {
                throw new IllegalArgumentException("group is required; pass --group");
            }
            GroupMember member = new GroupMember(
                    s.group(),
                    id,
                    memberInstanceId == null ? s.instanceId() : memberInstanceId,
                    status,
                    capabilities,
                    runtime.clock().millis()
            );
            runtime.joinMember(member);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("member", member);
            if (announce) {
                out.put("publishedTopics", runtime.governance().announce(s.group(), status, capabilities));
            }
            print(out);
            return 0;
        }
    }

    @Command(name = "cascade-create", description = "Create a cascade task in a trace")
    static final class CascadeCreateCommand implements Callable<Integer> {
        @ParentCommand
        QuorumMeshCommand parent;

        @Option(names = {"--trace-id"}, required = true, description = "Trace id")
        String traceId;

        @Option(names = {"--task-id"}, required = true, description = "Task id")
        String taskId;

        @Option(names = {"--sequence"}, required = true, description = "1-based position in the trace")
        int sequence;

        @Option(names = {"--title"}, description = "Title")
        String title;

        @Option(names = {"--required-input"}, split = ",", description = "Required input keys")
        List<String> requiredInput;

        @Option(names = {"--produced-output"}, split = ",", description = "Produced output keys")
        List<String> producedOutput;

        @Option(names = {"--rule"}, description = "Validation rule: non_empty:<field> | equals:<field>:<value> (repeatable)")
        List<String> rules;

        @Option(names = {"--max-retries"}, description = "Retry budget (defaults to settings)")
        Integer maxRetries;

        @Override
        public Integer call() {
            QuorumMeshRuntime runtime = parent.runtime();
            print(runtime.cascade().createTask(new CascadeEngine.CreateTaskRequest(
                    traceId, taskId, sequence, title, requiredInput, producedOutput, rules, maxRetries)));
            return 0;
        }
    }

    @Command(name = "cascade-advance", description = "Compare-and-set a cascade task transition")
    static final class CascadeAdvanceCommand implements Callable<Integer> {
        @ParentCommand
        QuorumMeshCommand parent;

        @Option(names = {"--trace-id"}, required = true, description = "Trace id")
        String traceId;

        @Option(names = {"--task-id"}, required = true, description = "Task id")
        String taskId;

        @Option(names = {"--from"}, required = true, description = "Expected current status")
        String from;

        @Option(names = {"--to"}, required = true, description = "Target status")
        String to;

        @Option(names = {"--actor"}, description = "Actor")
        String actor;

        @Option(names = {"--reason"}, description = "Reason")
        String reason;

        @Option(names = {"--payload"}, description = "Transition payload JSON")
        String payload;

        @Option(names = {"--idempotency-key"}, required = true, description = "Idempotency key")
        String idempotencyKey;

        @Override
        public Integer call() {
            QuorumMeshRuntime runtime = parent.runtime();
            print(runtime.cascade().advanceTask(new CascadeEngine.AdvanceRequest(
                    traceId,
                    taskId,
                    CascadeStatus.fromString(from),
                    CascadeStatus.fromString(to),
                    actor == null ? runtime.settings().clawId() : actor,
                    reason,
                    payload,
                    idempotencyKey
            )));
            return 0;
        }
    }

    @Command(name = "cascade-self-test", description = "Submit self-test IO and route the task by validation result")
    static final class CascadeSelfTestCommand implements Callable<Integer> {
        @ParentCommand
        QuorumMeshCommand parent;

        @Option(names = {"--trace-id"}, required = true, description = "Trace id")
        String traceId;

        @Option(names = {"--task-id"}, required = true, description = "Task id")
        String taskId;

        @Option(names = {"--input"}, description = "Input JSON object")
        String input;

        @Option(names = {"--output"}, description = "Output JSON object")
        String output;

        @Option(names = {"--actor"}, description = "Actor")
        String actor;

        @Option(names = {"--idempotency-key"}, description = "Idempotency key")
        String idempotencyKey;

        @Override
        public Integer call() {
            QuorumMeshRuntime runtime = parent.runtime();
            CascadeEngine.SelfTestResult result = runtime.cascade().submitSelfTest(new CascadeEngine.SelfTestRequest(
                    traceId, taskId, input, output, actor == null ? runtime.settings().clawId() : actor, idempotencyKey));
            print(result);
            return result.validation().valid() ? 0 : 1;
        }
    }

    @Command(name = "cascade-gate", description = "Check whether a task may start")
    static final class CascadeGateCommand implements Callable<Integer> {
        @ParentCommand
        QuorumMeshCommand parent;

        @Option(names = {"--trace-id"}, required = true, description = "Trace id")
        String traceId;

        @Option(names = {"--task-id"}, required = true, description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            CascadeEngine.StartGate gate = parent.runtime().cascade().canStart(traceId, taskId);
            print(gate);
            return gate.allowed() ? 0 : 1;
        }
    }

    @Command(name = "cascade-tasks", description = "List the tasks of a trace in sequence order")
    static final class CascadeTasksCommand implements Callable<Integer> {
        @ParentCommand
        QuorumMeshCommand parent;

        @Option(names = {"--trace-id"}, required = true, description = "Trace id")
        String traceId;

        @Override
        public Integer call() {
            print(parent.runtime().cascade().listTasks(traceId));
            return 0;
        }
    }

    @Command(name = "cascade-transitions", description = "List applied transitions of a trace or task")
    static final class CascadeTransitionsCommand implements Callable<Integer> {
        @ParentCommand
        QuorumMeshCommand parent;

        @Option(names = {"--trace-id"}, required = true, description = "Trace id")
        String traceId;

        @Option(names = {"--task-id"}, description = "Task id")
        String taskId;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            print(parent.runtime().cascade().listTransitions(traceId, taskId, limit));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Print latest audit rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        QuorumMeshCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest lines")
        int lines;

        @Override
        public Integer call() {
            QuorumMeshRuntime runtime = parent.runtime();
            runtime.auditLogger().readRecent(lines).forEach(row -> System.out.println(row.toString()));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        QuorumMeshCommand parent;

        @Override
        public Integer call() {
            var out = parent.runtime().auditLogger().verifyChain();
            print(out);
            return out.valid() ? 0 : 1;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        QuorumMeshCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            Database database = new Database(parent.config());
            database.init();
            print(database.listSchemaMigrations(limit));
            return 0;
        }
    }
}
