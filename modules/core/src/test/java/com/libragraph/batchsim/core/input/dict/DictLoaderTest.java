package com.libragraph.batchsim.core.input.dict;

import com.libragraph.batchsim.core.config.InvalidParameterException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DictLoaderTest {

    private final DictLoader loader = new DictLoader();

    @TempDir
    Path dir;

    @Test
    void shouldReadJsonWithNestedKeys() throws Exception {
        Files.writeString(dir.resolve("d.json"), "{\"noise\": {\"sigma\": 2.5}, \"root\": \"run\"}");

        InputDict dict = loader.construct(Map.of("file_name", "d.json", "dir", dir.toString()), false);

        assertThat(dict.get("noise.sigma")).isEqualTo(2.5);
        assertThat(dict.get("root")).isEqualTo("run");
        assertThat(dict.get("noise.mean")).isNull();
        assertThat(dict.topLevelKeys()).containsExactly("noise", "root");
    }

    @Test
    void shouldReadYamlWithCustomSplit() throws Exception {
        Files.writeString(dir.resolve("d.yaml"), "psf:\n  fwhm: 0.7\nn: 3\n");

        InputDict dict = loader.construct(
                Map.of("file_name", "d.yaml", "dir", dir.toString(), "key_split", "/"), false);

        assertThat(dict.get("psf/fwhm")).isEqualTo(0.7);
        assertThat(dict.containsKey("n")).isTrue();
    }

    @Test
    void shouldRejectUnknownFileType() throws Exception {
        Files.writeString(dir.resolve("d.ini"), "a=1");

        assertThatThrownBy(() -> loader.construct(Map.of("file_name", "d.ini", "dir", dir.toString()), false))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("ini");
    }
}
