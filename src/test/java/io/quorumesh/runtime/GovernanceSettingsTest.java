package io.quorumesh.runtime;

import io.quorumesh.error.ValidationException;
import io.quorumesh.model.VotingPolicy;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.stream.Stream;

final class GovernanceSettingsTest {

    @Test
    void missingFileFallsBackToDefaults() throws Exception {
        Path root = Files.createTempDirectory("quorumesh-test-settings-default-");
        try {
            GovernanceSettings.LoadOutcome outcome = GovernanceSettings.load(root.resolve("quorumesh-settings.json"));
            Assertions.assertFalse(outcome.configExists());
            GovernanceSettings settings = outcome.settings();
            Assertions.assertTrue(settings.governanceActive());
            Assertions.assertEquals(VotingPolicy.defaults(), settings.voting());
            Assertions.assertEquals(Duration.ofHours(1), settings.voting().timeout());
            Assertions.assertEquals(GovernanceSettings.DEFAULT_CASCADE_MAX_RETRIES, settings.cascadeMaxRetries());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileOverridesOnlyTheFieldsItNames() throws Exception {
        Path root = Files.createTempDirectory("quorumesh-test-settings-file-");
        try {
            Path file = root.resolve("quorumesh-settings.json");
            Files.writeString(file, """
                    {
                      "governanceEnabled": false,
                      "group": "ops",
                      "clawId": "claw-a",
                      "voting": { "quorumYes": 3, "timeoutSec": 120, "allowSelfVote": true },
                      "cascadeMaxRetries": 5
                    }
                    """, StandardCharsets.UTF_8);
            GovernanceSettings.LoadOutcome outcome = GovernanceSettings.load(file);
            GovernanceSettings settings = outcome.settings();

            Assertions.assertTrue(outcome.configExists());
            Assertions.assertTrue(settings.knowledgeEnabled());
            Assertions.assertFalse(settings.governanceActive());
            Assertions.assertEquals("ops", settings.group());
            Assertions.assertEquals("claw-a", settings.clawId());
            Assertions.assertEquals("", settings.instanceId());
            Assertions.assertEquals(3, settings.voting().quorumYes());
            Assertions.assertEquals(VotingPolicy.DEFAULT_QUORUM_NO, settings.voting().quorumNo());
            Assertions.assertEquals(Duration.ofSeconds(120), settings.voting().timeout());
            Assertions.assertTrue(settings.voting().allowSelfVote());
            Assertions.assertEquals(5, settings.cascadeMaxRetries());

            GovernanceSettings overridden = settings.withIdentity("eng", " ", "inst-9");
            Assertions.assertEquals("eng", overridden.group());
            Assertions.assertEquals("claw-a", overridden.clawId());
            Assertions.assertEquals("inst-9", overridden.instanceId());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidValuesAreRejected() throws Exception {
        Path root = Files.createTempDirectory("quorumesh-test-settings-invalid-");
        try {
            Path file = root.resolve("quorumesh-settings.json");
            Files.writeString(file, "{\"voting\":{\"quorumYes\":0}}", StandardCharsets.UTF_8);
            Assertions.assertThrows(ValidationException.class, () -> GovernanceSettings.load(file));

            Files.writeString(file, "{\"cascadeMaxRetries\":-1}", StandardCharsets.UTF_8);
            Assertions.assertThrows(ValidationException.class, () -> GovernanceSettings.load(file));

            Files.writeString(file, "{\"quorum\":2}", StandardCharsets.UTF_8);
            Assertions.assertThrows(ValidationException.class, () -> GovernanceSettings.load(file));

            Files.writeString(file, "{not json", StandardCharsets.UTF_8);
            Assertions.assertThrows(ValidationException.class, () -> GovernanceSettings.load(file));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
