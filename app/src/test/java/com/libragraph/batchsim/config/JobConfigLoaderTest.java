package com.libragraph.batchsim.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.batchsim.core.config.ConfigValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class JobConfigLoaderTest {

    @TempDir
    Path dir;

    private JobConfigLoader loader;

    @BeforeEach
    void setUp() {
        loader = new JobConfigLoader();
        loader.json = new ObjectMapper();
    }

    @Test
    void shouldLoadYamlAndDeriveRoot() throws Exception {
        Path file = dir.resolve("demo9.yaml");
        Files.writeString(file, "image:\n  type: Tiled\n  nx_tiles: 3\noutput:\n  nfiles: 2\n");

        Map<String, Object> config = loader.load(file);

        assertThat(config).containsEntry("root", "demo9");
        assertThat(config.get("image")).isEqualTo(Map.of("type", "Tiled", "nx_tiles", 3));
    }

    @Test
    void shouldLoadJsonAndKeepExplicitRoot() throws Exception {
        Path file = dir.resolve("job.json");
        Files.writeString(file, "{\"root\": \"custom\", \"output\": {\"nproc\": -1}}");

        Map<String, Object> config = loader.load(file);

        assertThat(config).containsEntry("root", "custom");
        assertThat(config.get("output")).isEqualTo(Map.of("nproc", -1));
    }

    @Test
    void shouldRejectNullDocument() throws Exception {
        Path file = dir.resolve("empty.yaml");
        Files.writeString(file, "~\n");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(ConfigValidationException.class)
                .hasMessageContaining("is empty");
    }

    @Test
    void shouldWrapUnreadableFile() {
        assertThatThrownBy(() -> loader.load(dir.resolve("missing.json")))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("missing.json");
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldApplyTypedOverrides() {
        Map<String, Object> config = new HashMap<>();
        config.put("output", new HashMap<>(Map.of("nfiles", 1)));

        loader.applyOverrides(config, List.of("output.nfiles=4", "output.dir=out/run1", "gal.flux.first=2.5",
                "image.type=Scattered"));

        Map<String, Object> output = (Map<String, Object>) config.get("output");
        assertThat(output).containsEntry("nfiles", 4).containsEntry("dir", "out/run1");
        assertThat((Map<String, Object>) ((Map<String, Object>) config.get("gal")).get("flux"))
                .containsEntry("first", 2.5);
        assertThat((Map<String, Object>) config.get("image")).containsEntry("type", "Scattered");
    }

    @Test
    void shouldRejectMalformedOverrides() {
        Map<String, Object> config = new HashMap<>(Map.of("root", "x"));

        assertThatThrownBy(() -> loader.applyOverrides(config, List.of("nfiles")))
                .isInstanceOf(ConfigValidationException.class)
                .hasMessageContaining("expected key=value");
        assertThatThrownBy(() -> loader.applyOverrides(config, List.of("root.sub=1")))
                .isInstanceOf(ConfigValidationException.class)
                .hasMessageContaining("root is not a field");
    }
}
