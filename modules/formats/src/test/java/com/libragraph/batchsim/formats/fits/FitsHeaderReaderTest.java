package com.libragraph.batchsim.formats.fits;

import com.libragraph.batchsim.util.image.PixelImage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class FitsHeaderReaderTest {

    @TempDir
    Path dir;

    @Test
    void shouldParseCardValues() {
        assertThat(FitsHeaderReader.parseValue("                   T")).isEqualTo(true);
        assertThat(FitsHeaderReader.parseValue("                  42 / answer")).isEqualTo(42L);
        assertThat(FitsHeaderReader.parseValue("              1.5D2")).isEqualTo(150.0);
        assertThat(FitsHeaderReader.parseValue("'O''Hara  '")).isEqualTo("O'Hara");
    }

    @Test
    void shouldFailForMissingHdu() {
        Path path = dir.resolve("one.fits");
        new FitsImageWriter().writeSingle(PixelImage.blank(2, 2), path);

        assertThatThrownBy(() -> FitsHeaderReader.read(path, 3))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("HDU 3");
    }

    @Test
    void shouldRejectNegativeHdu() {
        assertThatThrownBy(() -> FitsHeaderReader.read(dir.resolve("x.fits"), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
