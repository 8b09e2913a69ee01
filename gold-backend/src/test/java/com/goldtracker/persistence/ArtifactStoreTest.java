package com.goldtracker.persistence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Artifact Store Tests")
class ArtifactStoreTest {

    record Sample(String name, Instant at, List<Double> values) {}

    @TempDir
    Path dataDir;

    private ArtifactStore store;

    @BeforeEach
    void setUp() {
        store = new ArtifactStore(dataDir.resolve("nested"));
    }

    @Test
    @DisplayName("JSON written is read back, creating the directory")
    void jsonRoundTrip() throws Exception {
        var sample = new Sample("latest", Instant.parse("2024-05-02T03:00:00Z"), List.of(1.5, 2.5));

        store.writeJson("sample.json", sample);

        assertThat(store.exists("sample.json")).isTrue();
        assertThat(store.readJson("sample.json", Sample.class)).isEqualTo(sample);
        assertThat(Files.readString(store.resolve("sample.json"))).contains("2024-05-02T03:00:00Z");
    }

    @Test
    @DisplayName("Overwrite replaces the file and leaves no temp files")
    void overwrite() throws Exception {
        store.writeText("history.csv", "first");
        store.writeText("history.csv", "second");

        assertThat(Files.readString(store.resolve("history.csv"))).isEqualTo("second");
        try (var files = Files.list(store.dataDir())) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("history.csv");
        }
    }

    @Test
    @DisplayName("Missing artifacts")
    void missing() throws Exception {
        assertThat(store.readJsonIfPresent("absent.json", Sample.class)).isEmpty();
        assertThatThrownBy(() -> store.readJson("absent.json", Sample.class))
            .isInstanceOf(NoSuchFileException.class);
    }
}
