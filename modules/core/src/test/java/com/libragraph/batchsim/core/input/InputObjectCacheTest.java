package com.libragraph.batchsim.core.input;

import com.libragraph.batchsim.core.TestJobs;
import com.libragraph.batchsim.core.config.ConfigValidationException;
import com.libragraph.batchsim.core.config.InvalidParameterException;
import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.config.ParsedValue;
import com.libragraph.batchsim.core.value.DefaultValueEvaluator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class InputObjectCacheTest {

    private InputRegistry registry;
    private CountingLoader alpha;
    private CountingLoader beta;
    private DefaultValueEvaluator evaluator;

    @BeforeEach
    void setUp() {
        registry = new InputRegistry();
        alpha = new CountingLoader("alpha", Set.of("AlphaValue"), true, false);
        beta = new CountingLoader("beta", Set.of("BetaValue"), false, true);
        registry.register(alpha);
        registry.register(beta);
        evaluator = new DefaultValueEvaluator();
        evaluator.register("AlphaValue", (c, ctx, t) -> ParsedValue.unsafe(ctx.objNum()));
        evaluator.register("BetaValue", (c, ctx, t) -> ParsedValue.unsafe(ctx.objNum()));
    }

    private JobContext context(String json) {
        JobContext ctx = new JobContext(TestJobs.config(json), new InputObjectCache(registry), evaluator);
        ctx.startFile(0);
        return ctx;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> node(Map<String, Object> parent, String key) {
        return (Map<String, Object>) parent.get(key);
    }

    @Test
    void shouldBuildOnceForSafeInputs() {
        JobContext ctx = context("{'input': {'alpha': {'label': 'a'}}}");

        Object first = ctx.inputs().ensureBuilt("alpha", 0, ctx);
        Object second = ctx.inputs().ensureBuilt("alpha", 0, ctx);
        ctx.startFile(1);
        ctx.inputs().processInputs(ctx, ProcessScope.ALL);

        assertThat(second).isSameAs(first);
        assertThat(alpha.constructions).hasValue(1);
        assertThat(ctx.inputs().findSlot("alpha", 0).orElseThrow().state()).isEqualTo(SlotState.BUILT_SAFE);
    }

    @Test
    void shouldRebuildUnsafeInputsOncePerFile() {
        JobContext ctx = context("{'input': {'alpha': {'label': {'type': 'NumberedFile', 'root': 'cat'}}}}");

        CountingLoader.Counted f0 = (CountingLoader.Counted) ctx.inputs().ensureBuilt("alpha", 0, ctx);
        ctx.inputs().ensureBuilt("alpha", 0, ctx);
        ctx.startFile(1);
        CountingLoader.Counted f1 = (CountingLoader.Counted) ctx.inputs().ensureBuilt("alpha", 0, ctx);

        assertThat(f0.label()).isEqualTo("cat0");
        assertThat(f1.label()).isEqualTo("cat1");
        assertThat(alpha.constructions).hasValue(2);
        assertThat(ctx.inputs().findSlot("alpha", 0).orElseThrow().state()).isEqualTo(SlotState.BUILT_UNSAFE);
    }

    @Test
    void shouldDropOnlyValuesOfRebuiltType() {
        JobContext ctx = context("{'input': {'alpha': {'label': 'a'}, 'beta': {'label': 'b'}}, "
                + "'gal': {'a': {'type': 'AlphaValue'}, 'b': {'type': 'BetaValue'}}}");
        Map<String, Object> gal = ctx.branch("gal");
        ctx.inputs().processInputs(ctx, ProcessScope.ALL);
        ctx.startObject(3);
        ctx.parseValue(gal, "a", Integer.class);
        ctx.parseValue(gal, "b", Integer.class);

        ctx.inputs().invalidate("alpha", 0);
        ctx.inputs().ensureBuilt("alpha", 0, ctx);

        assertThat(ctx.currentValues().contains(node(gal, "a"))).isFalse();
        assertThat(ctx.currentValues().contains(node(gal, "b"))).isTrue();
        assertThat(alpha.constructions).hasValue(2);
        assertThat(beta.constructions).hasValue(1);
    }

    @Test
    void shouldRespectScopes() {
        JobContext ctx = context("{'input': {'alpha': {'label': 'a'}, 'beta': {'label': 'b'}}}");

        ctx.inputs().processInputs(ctx, ProcessScope.FILE_SCOPE_ONLY);
        assertThat(alpha.constructions).hasValue(0);
        assertThat(beta.constructions).hasValue(1);

        ctx.inputs().processInputs(ctx, ProcessScope.COUNT_CAPABLE_ONLY);
        assertThat(alpha.constructions).hasValue(1);
    }

    @Test
    void shouldLeaveUnsafeSlotsUnbuiltInSafeOnlyPass() {
        JobContext ctx = context("{'input': {'alpha': [{'label': 'a'}, {'label': {'type': 'NumberedFile', 'root': 'x'}}]}}");

        ctx.inputs().processInputs(ctx, ProcessScope.SAFE_ONLY);

        assertThat(ctx.inputs().findSlot("alpha", 0).orElseThrow().state()).isEqualTo(SlotState.BUILT_SAFE);
        assertThat(ctx.inputs().findSlot("alpha", 1).orElseThrow().state()).isEqualTo(SlotState.UNBUILT);
        assertThat(ctx.inputs().buildOrUnsafe("alpha", 1, ctx)).isInstanceOf(BuildOutcome.Unsafe.class);
        assertThat(alpha.constructions).hasValue(1);
    }

    @Test
    void shouldWrapConstructionFailures() {
        JobContext ctx = context("{'input': {'alpha': {'label': 'broken', 'fail': true}}}");

        assertThatThrownBy(() -> ctx.inputs().ensureBuilt("alpha", 0, ctx))
                .isInstanceOf(InputConstructionException.class)
                .hasMessageContaining("alpha")
                .hasRootCauseMessage("cannot read broken");
    }

    @Test
    void shouldLeaveFailedSafeBuildUnbuilt() {
        JobContext ctx = context("{'input': {'alpha': {'label': 'x', 'fail': true}}}");

        assertThatCode(() -> ctx.inputs().processInputs(ctx, ProcessScope.SAFE_ONLY)).doesNotThrowAnyException();
        assertThat(ctx.inputs().findSlot("alpha", 0).orElseThrow().state()).isEqualTo(SlotState.UNBUILT);

        BuildOutcome outcome = ctx.inputs().buildOrUnsafe("alpha", 0, ctx);
        assertThat(outcome).isInstanceOfSatisfying(BuildOutcome.Unsafe.class,
                u -> assertThat(u.reason()).contains("cannot read x"));
        assertThatThrownBy(() -> ctx.inputs().ensureBuilt("alpha", 0, ctx))
                .isInstanceOf(InputConstructionException.class);
    }

    @Test
    void shouldRejectUnregisteredInputKey() {
        JobContext ctx = context("{'input': {'gamma': {'label': 'g'}}}");

        assertThatThrownBy(() -> ctx.inputs().processInputs(ctx, ProcessScope.ALL))
                .isInstanceOf(ConfigValidationException.class)
                .hasMessageContaining("gamma");
    }

    @Test
    void shouldServeInputObjectsWithRangeChecks() {
        JobContext ctx = context("{'input': {'alpha': [{'label': 'a'}, {'label': 'b'}]}}");

        assertThatThrownBy(() -> ctx.inputs().getInputObject("alpha", 0, "AlphaValue"))
                .isInstanceOf(InputNotAvailableException.class)
                .hasMessage("No input alpha available for type = AlphaValue");

        ctx.inputs().processInputs(ctx, ProcessScope.ALL);

        assertThat(((CountingLoader.Counted) ctx.inputs().getInputObject("alpha", 1, "AlphaValue")).label())
                .isEqualTo("b");
        assertThatThrownBy(() -> ctx.inputs().getInputObject("alpha", -1, "AlphaValue"))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("num < 0");
        assertThatThrownBy(() -> ctx.inputs().getInputObject("alpha", 2, "AlphaValue"))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("too large");
    }

    @Test
    void shouldCountFromFirstCountCapableInRegistryOrder() {
        CountingLoader gamma = new CountingLoader("gamma");
        registry.register(gamma);
        JobContext ctx = context("{'input': {'gamma': {'label': 'g', 'n': 7}, 'alpha': {'label': 'a', 'n': 4}}}");

        NObjectsProbe probe = ctx.inputs().processInputNObjects(ctx).orElseThrow();

        assertThat(probe).isEqualTo(new NObjectsProbe("alpha", 4));
        assertThat(alpha.countOnlyConstructions).hasValue(1);
        assertThat(alpha.constructions).hasValue(0);
        assertThat(gamma.countOnlyConstructions).hasValue(0);
    }

    @Test
    void shouldCountFromBuiltSlotWithoutConstructing() {
        JobContext ctx = context("{'input': {'alpha': {'label': 'a', 'n': 12}}}");
        ctx.inputs().ensureBuilt("alpha", 0, ctx);

        assertThat(ctx.inputs().processInputNObjects(ctx)).contains(new NObjectsProbe("alpha", 12));
        assertThat(alpha.countOnlyConstructions).hasValue(0);
    }

    @Test
    void shouldShareOnlySafeObjectsWithWorkers() {
        JobContext ctx = context("{'input': {'alpha': [{'label': 'a'}, {'label': {'type': 'NumberedFile', 'root': 'x'}}]}}");
        ctx.inputs().processInputs(ctx, ProcessScope.ALL);

        InputObjectCache view = ctx.inputs().workerView();
        InputObjectCache snapshot = ctx.inputs().snapshot();

        assertThat(view.findSlot("alpha", 0).orElseThrow().object())
                .isSameAs(ctx.inputs().findSlot("alpha", 0).orElseThrow().object());
        assertThat(view.findSlot("alpha", 1).orElseThrow().state()).isEqualTo(SlotState.UNBUILT);
        assertThat(snapshot.findSlot("alpha", 1).orElseThrow().state()).isEqualTo(SlotState.BUILT_UNSAFE);
    }

    @Test
    void shouldTreatRngLoadersAsUnsafe() {
        var noisy = new CountingLoader("noisy") {
            @Override
            public boolean takesRng() {
                return true;
            }
        };
        registry.register(noisy);
        JobContext ctx = context("{'input': {'noisy': {'label': 'n'}}}");

        BuildOutcome outcome = ctx.inputs().buildOrUnsafe("noisy", 0, ctx);
        ctx.inputs().ensureBuilt("noisy", 0, ctx);

        assertThat(outcome).isInstanceOf(BuildOutcome.Unsafe.class);
        assertThat(ctx.inputs().findSlot("noisy", 0).orElseThrow().state()).isEqualTo(SlotState.BUILT_UNSAFE);
    }

    @Test
    void shouldSkipSafeOnlyBuildWhenLoaderDeclaresUnsafe() {
        var declared = new CountingLoader("declared") {
            @Override
            public Optional<Boolean> isSafeWithoutBuilding(Map<String, Object> field, JobContext ctx) {
                return Optional.of(false);
            }
        };
        registry.register(declared);
        JobContext ctx = context("{'input': {'declared': {'label': 'd'}}}");

        ctx.inputs().processInputs(ctx, ProcessScope.SAFE_ONLY);

        assertThat(declared.constructions).hasValue(0);
        assertThat(ctx.inputs().findSlot("declared", 0).orElseThrow().isBuilt()).isFalse();
    }

    @Test
    void shouldRunImageHookOnBuiltObjects() {
        List<Integer> seen = new ArrayList<>();
        var hooked = new CountingLoader("hooked") {
            @Override
            public void setupImage(Counted object, Map<String, Object> field, JobContext ctx) {
                seen.add(ctx.imageNum());
            }
        };
        registry.register(hooked);
        JobContext ctx = context("{'input': {'hooked': [{'label': 'a'}, {'label': 'b'}]}}");
        ctx.inputs().ensureBuilt("hooked", 0, ctx);

        ctx.startImage(3);
        ctx.inputs().setupForImage(ctx);

        assertThat(seen).containsExactly(3);
    }
}
