package io.quorumesh.runtime;

import io.quorumesh.bus.EnvelopeTransport;
import io.quorumesh.bus.FileBus;
import io.quorumesh.cascade.CascadeEngine;
import io.quorumesh.config.QuorumMeshConfig;
import io.quorumesh.governance.GovernanceService;
import io.quorumesh.governance.KnowledgeEnvelopeHandler;
import io.quorumesh.model.GroupMember;
import io.quorumesh.observability.AuditLogger;
import io.quorumesh.storage.CascadeStore;
import io.quorumesh.storage.Database;
import io.quorumesh.storage.KnowledgeStore;
import io.quorumesh.storage.RosterStore;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Application context of one node. Builds and owns storage, transport, audit log, clock and settings, and
 * hands them to the services explicitly.
 */
public final class QuorumMeshRuntime {
    private final QuorumMeshConfig config;
    private final Clock clock;
    private final Database database;
    private final KnowledgeStore knowledgeStore;
    private final CascadeStore cascadeStore;
    private final RosterStore rosterStore;
    private final FileBus fileBus;
    private final EnvelopeTransport transport;
    private final AuditLogger auditLogger;
    private final GovernanceService governanceService;
    private final KnowledgeEnvelopeHandler envelopeHandler;
    private final CascadeEngine cascadeEngine;
    private volatile GovernanceSettings settings;

    public QuorumMeshRuntime(QuorumMeshConfig config) {
        this(config, null, Clock.systemUTC());
    }

    /**
     * @param transport publish side of the bus; {@code null} publishes to this node's {@link FileBus}
     */
    public QuorumMeshRuntime(QuorumMeshConfig config, EnvelopeTransport transport, Clock clock) {
        this.config = config;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.database = new Database(config);
        this.knowledgeStore = new KnowledgeStore(database);
        this.cascadeStore = new CascadeStore(database);
        this.rosterStore = new RosterStore(database);
        this.fileBus = new FileBus(config);
        this.transport = transport == null ? fileBus : transport;
        this.auditLogger = new AuditLogger(config.auditFile(), config.namespace(), this.clock);
        this.settings = GovernanceSettings.defaults();
        this.governanceService = new GovernanceService(
                knowledgeStore, rosterStore, this.transport, auditLogger, this.clock, this::settings);
        this.envelopeHandler = new KnowledgeEnvelopeHandler(
                governanceService, knowledgeStore, rosterStore, auditLogger, this.clock, this::settings);
        this.cascadeEngine = new CascadeEngine(cascadeStore, auditLogger, this.clock, this::settings);
    }

    public void init() {
        database.init();
        reloadSettings();
    }

    public GovernanceSettings.LoadOutcome reloadSettings() {
        GovernanceSettings.LoadOutcome outcome = GovernanceSettings.load(config.settingsFile());
        settings = outcome.settings();
        auditLogger.log(AuditLogger.AuditEvent.of(
                "settings.load",
                "system",
                "runtime/settings",
                outcome.configExists() ? "ok" : "ok_default",
                null,
                Map.of("config", outcome.sourcePath(), "source", outcome.configExists() ? "file" : "defaults")
        ));
        return outcome;
    }

    public GovernanceSettings settings() {
        return settings;
    }

    /**
     * Replaces the active settings for this process only; the settings file is left untouched.
     */
    public void overrideSettings(GovernanceSettings next) {
        next.voting().validate();
        this.settings = next;
    }

    public void joinMember(GroupMember member) {
        rosterStore.upsertGroupMember(member);
    }

    public List<GroupMember> listMembers(String group, boolean activeOnly) {
        return rosterStore.listGroupMembers(group, activeOnly);
    }

    public Map<String, Object> status() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("namespace", config.namespace());
        out.put("root", config.rootDir().toString());
        out.putAll(governanceService.status());
        out.put("auditHead", auditLogger.currentHash());
        return out;
    }

    public QuorumMeshConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public KnowledgeStore knowledgeStore() {
        return knowledgeStore;
    }

    public CascadeStore cascadeStore() {
        return cascadeStore;
    }

    public RosterStore rosterStore() {
        return rosterStore;
    }

    public FileBus fileBus() {
        return fileBus;
    }

    public EnvelopeTransport transport() {
        return transport;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public GovernanceService governance() {
        return governanceService;
    }

    public KnowledgeEnvelopeHandler envelopeHandler() {
        return envelopeHandler;
    }

    public CascadeEngine cascade() {
        return cascadeEngine;
    }
}
