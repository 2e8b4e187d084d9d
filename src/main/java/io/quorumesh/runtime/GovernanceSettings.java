package io.quorumesh.runtime;

import io.quorumesh.error.ValidationException;
import io.quorumesh.model.VotingPolicy;
import io.quorumesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Resolved node settings. Read from {@code quorumesh-settings.json}; every field missing from the file keeps
 * its default.
 */
public record GovernanceSettings(
        boolean knowledgeEnabled,
        boolean governanceEnabled,
        String group,
        String clawId,
        String instanceId,
        VotingPolicy voting,
        int cascadeMaxRetries
) {
    public static final int DEFAULT_CASCADE_MAX_RETRIES = 3;

    public static GovernanceSettings defaults() {
        return new GovernanceSettings(true, true, "", "", "", VotingPolicy.defaults(), DEFAULT_CASCADE_MAX_RETRIES);
    }

    public boolean governanceActive() {
        return knowledgeEnabled && governanceEnabled;
    }

    public GovernanceSettings withIdentity(String group, String clawId, String instanceId) {
        return new GovernanceSettings(
                knowledgeEnabled,
                governanceEnabled,
                blankOr(group, this.group),
                blankOr(clawId, this.clawId),
                blankOr(instanceId, this.instanceId),
                voting,
                cascadeMaxRetries
        );
    }

    public GovernanceSettings withEnabled(boolean knowledgeEnabled, boolean governanceEnabled) {
        return new GovernanceSettings(knowledgeEnabled, governanceEnabled, group, clawId, instanceId, voting, cascadeMaxRetries);
    }

    public GovernanceSettings withVoting(VotingPolicy voting) {
        voting.validate();
        return new GovernanceSettings(knowledgeEnabled, governanceEnabled, group, clawId, instanceId, voting, cascadeMaxRetries);
    }

    public static LoadOutcome load(Path settingsFile) {
        GovernanceSettings defaults = defaults();
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return new LoadOutcome(defaults, false, settingsFile == null ? "" : settingsFile.toString());
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return new LoadOutcome(fromFile(file, defaults), true, settingsFile.toString());
        } catch (IOException e) {
            throw new ValidationException("Failed to load settings: " + settingsFile, e);
        }
    }

    static GovernanceSettings fromFile(SettingsFile file, GovernanceSettings defaults) {
        if (file == null) {
            return defaults;
        }
        VotingPolicy base = defaults.voting();
        VotingFile v = file.voting();
        VotingPolicy voting = v == null ? base : new VotingPolicy(
                v.enabled() == null ? base.enabled() : v.enabled(),
                v.minPoolSize() == null ? base.minPoolSize() : v.minPoolSize(),
                v.quorumYes() == null ? base.quorumYes() : v.quorumYes(),
                v.quorumNo() == null ? base.quorumNo() : v.quorumNo(),
                v.timeoutSec() == null ? base.timeout() : Duration.ofSeconds(v.timeoutSec()),
                v.allowSelfVote() == null ? base.allowSelfVote() : v.allowSelfVote()
        );
        voting.validate();
        int maxRetries = file.cascadeMaxRetries() == null ? defaults.cascadeMaxRetries() : file.cascadeMaxRetries();
        if (maxRetries < 0) {
            throw new ValidationException("cascadeMaxRetries must be >= 0");
        }
        return new GovernanceSettings(
                file.knowledgeEnabled() == null ? defaults.knowledgeEnabled() : file.knowledgeEnabled(),
                file.governanceEnabled() == null ? defaults.governanceEnabled() : file.governanceEnabled(),
                blankOr(file.group(), defaults.group()),
                blankOr(file.clawId(), defaults.clawId()),
                blankOr(file.instanceId(), defaults.instanceId()),
                voting,
                maxRetries
        );
    }

    private static String blankOr(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    public record LoadOutcome(GovernanceSettings settings, boolean configExists, String sourcePath) {
    }

    record SettingsFile(
            Boolean knowledgeEnabled,
            Boolean governanceEnabled,
            String group,
            String clawId,
            String instanceId,
            VotingFile voting,
            Integer cascadeMaxRetries
    ) {
    }

    record VotingFile(
            Boolean enabled,
            Integer minPoolSize,
            Integer quorumYes,
            Integer quorumNo,
            Long timeoutSec,
            Boolean allowSelfVote
    ) {
    }
}
