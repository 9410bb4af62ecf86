package com.libragraph.batchsim.core.input;

import com.libragraph.batchsim.core.config.ParamSpec;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class InputRegistryTest {

    @Test
    void shouldKeepFirstRegistrationOrder() {
        InputRegistry registry = new InputRegistry();
        CountingLoader a = new CountingLoader("a");
        CountingLoader b = new CountingLoader("b");
        CountingLoader a2 = new CountingLoader("a");

        registry.register(a);
        registry.register(b);
        registry.register(a2);

        assertThat(registry.typeNames()).containsExactly("a", "b");
        assertThat(registry.resolve("a")).isSameAs(a2);
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void shouldThrowForUnknownType() {
        InputRegistry registry = InputRegistry.withBuiltins();

        assertThat(registry.typeNames()).containsExactly("catalog", "dict", "fits_header");
        assertThat(registry.lookup("nope")).isEmpty();
        assertThatThrownBy(() -> registry.resolve("nope"))
                .isInstanceOf(UnknownInputTypeException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void shouldRejectLoaderWithoutInterface() {
        InputLoader<String> bad = new InputLoader<>() {
            @Override
            public String typeName() {
                return "bad";
            }

            @Override
            public Class<String> objectType() {
                return String.class;
            }

            @Override
            public Set<String> valueTypes() {
                return Set.of();
            }

            @Override
            public ParamSpec paramSpec() {
                return ParamSpec.empty();
            }

            @Override
            public String construct(Map<String, Object> kwargs, boolean nobjectsOnly) {
                return "";
            }
        };

        assertThatThrownBy(() -> new InputRegistry().register(bad))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("interface");
    }
}
