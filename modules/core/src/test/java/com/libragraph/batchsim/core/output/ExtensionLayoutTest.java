package com.libragraph.batchsim.core.output;

import com.libragraph.batchsim.core.render.LayerKind;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ExtensionLayoutTest {

    @Test
    void shouldAcceptContiguousExtensions() {
        var layout = ExtensionLayout.of(Map.of(2, LayerKind.WEIGHT, 1, LayerKind.PSF));

        assertThat(layout.size()).isEqualTo(3);
        assertThat(layout.order()).containsExactly(LayerKind.MAIN, LayerKind.PSF, LayerKind.WEIGHT);
    }

    @Test
    void shouldRejectGap() {
        assertThatThrownBy(() -> ExtensionLayout.of(Map.of(1, LayerKind.PSF, 3, LayerKind.WEIGHT)))
                .isInstanceOf(InvalidExtensionLayoutException.class)
                .hasMessage("Image for hdu 2 not found. Cannot skip hdus.");
    }

    @Test
    void shouldRejectPrimaryAndDuplicates() {
        assertThatThrownBy(() -> new ExtensionLayout().assign(0, LayerKind.PSF))
                .isInstanceOf(InvalidExtensionLayoutException.class)
                .hasMessage("psf hdu = 0 is invalid or a duplicate.");

        var layout = new ExtensionLayout().assign(1, LayerKind.PSF);
        assertThatThrownBy(() -> layout.assign(1, LayerKind.BADPIX))
                .isInstanceOf(InvalidExtensionLayoutException.class)
                .hasMessageContaining("duplicate");
    }

    @Test
    void shouldHoldOnlyMainByDefault() {
        var layout = new ExtensionLayout();
        layout.validate();

        assertThat(layout.order()).containsExactly(LayerKind.MAIN);
    }
}
