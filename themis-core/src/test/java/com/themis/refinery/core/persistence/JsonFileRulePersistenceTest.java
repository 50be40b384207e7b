package com.themis.refinery.core.persistence;

import com.themis.refinery.api.exception.PersistenceException;
import com.themis.refinery.api.model.Rule;
import com.themis.refinery.api.model.RuleSetVersion;
import com.themis.refinery.api.model.RuleType;
import com.themis.refinery.core.engine.DefaultRules;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileRulePersistenceTest {

    @TempDir
    Path directory;

    @Test
    void emptyDirectoryHasNoLatestVersion() throws PersistenceException {
        assertThat(new JsonFileRulePersistence(directory).loadLatestVersion()).isEmpty();
    }

    @Test
    void savedSnapshotRoundTripsWithAllFields() throws PersistenceException {
        JsonFileRulePersistence persistence = new JsonFileRulePersistence(directory);
        RuleSetVersion snapshot = new RuleSetVersion("v1.4.2", DefaultRules.bootstrap(),
                Instant.parse("2025-03-01T10:15:30Z"), true, Map.of("nrr", 0.95), "v1.4.1", "holdout ok");

        persistence.saveVersion(snapshot);

        assertThat(persistence.loadLatestVersion()).contains(snapshot);
        assertThat(persistence.loadVersion("v1.4.2")).contains(snapshot);
    }

    @Test
    void laterSaveSupersedesLatestButKeepsHistory() throws PersistenceException {
        JsonFileRulePersistence persistence = new JsonFileRulePersistence(directory);
        persistence.saveVersion(new RuleSetVersion("v1.0.0", DefaultRules.bootstrap(), null, true, null, null, null));
        RuleSetVersion next = new RuleSetVersion("v1.0.1",
                List.of(Rule.of("only", RuleType.POST_NORMALIZE, " +", " ", 1, "")), null, true, null, "v1.0.0", null);
        persistence.saveVersion(next);

        assertThat(persistence.loadLatestVersion()).get()
                .extracting(RuleSetVersion::version).isEqualTo("v1.0.1");
        assertThat(persistence.loadVersion("v1.0.0")).isPresent();
        assertThat(directory.resolve("rules-latest.json.tmp")).doesNotExist();
    }

    @Test
    void corruptFileBecomesPersistenceException() throws IOException {
        Files.writeString(directory.resolve("rules-latest.json"), "{ not json");

        assertThatThrownBy(() -> new JsonFileRulePersistence(directory).loadLatestVersion())
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("rules-latest.json");
    }

    @Test
    void rejectsPathLikeVersionLabels() {
        JsonFileRulePersistence persistence = new JsonFileRulePersistence(directory);

        assertThatThrownBy(() -> persistence.loadVersion("../escape"))
                .isInstanceOf(PersistenceException.class);
    }
}
