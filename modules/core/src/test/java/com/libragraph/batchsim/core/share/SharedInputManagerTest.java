package com.libragraph.batchsim.core.share;

import com.libragraph.batchsim.core.config.ParamSpec;
import com.libragraph.batchsim.core.input.CountingLoader;
import com.libragraph.batchsim.core.input.InputConstructionException;
import com.libragraph.batchsim.core.input.InputLoader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Proxy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class SharedInputManagerTest {

    public interface Gate {
        int pass() throws Exception;
    }

    /** Builds a gate that only opens once {@code parties} callers are inside it together. */
    static class GateLoader implements InputLoader<Gate> {

        private final int parties;

        GateLoader(int parties) {
            this.parties = parties;
        }

        @Override
        public String typeName() {
            return "gate";
        }

        @Override
        public Class<Gate> objectType() {
            return Gate.class;
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
        public Gate construct(Map<String, Object> kwargs, boolean nobjectsOnly) {
            CyclicBarrier barrier = new CyclicBarrier(parties);
            return () -> barrier.await(5, TimeUnit.SECONDS);
        }
    }

    private SharedInputManager manager;

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.close();
        }
    }

    @Test
    void shouldBuildOnOwnerThreadAndForwardCalls() throws Exception {
        manager = new SharedInputManager();
        manager.start();
        manager.bind("alpha0", new CountingLoader("alpha"));

        CountingLoader.Counted proxy = manager.construct("alpha0", Map.of("label", "shared", "n", 6));

        assertThat(Proxy.isProxyClass(proxy.getClass())).isTrue();
        assertThat(proxy.label()).isEqualTo("shared");
        assertThat(proxy.getNObjects()).isEqualTo(6);
        assertThat(proxy.builtOn()).isEqualTo("shared-input-manager");
        assertThat(proxy.toString()).isEqualTo("SharedInput[alpha0]");
        assertThat(manager.instanceCount()).isEqualTo(1);
        assertThat(manager.isBound("alpha0")).isTrue();
    }

    @Test
    void shouldServeConcurrentReadersInParallel() throws Exception {
        manager = new SharedInputManager();
        manager.start();
        manager.bind("gate0", new GateLoader(4));
        Gate gate = manager.construct("gate0", Map.of());

        ExecutorService callers = Executors.newFixedThreadPool(4);
        try {
            List<Future<Integer>> arrivals = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                arrivals.add(callers.submit(gate::pass));
            }
            List<Integer> indexes = new ArrayList<>();
            for (Future<Integer> f : arrivals) {
                indexes.add(f.get(10, TimeUnit.SECONDS));
            }
            assertThat(indexes).containsExactlyInAnyOrder(0, 1, 2, 3);
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void shouldStartAndStopIdempotently() throws Exception {
        manager = new SharedInputManager();
        manager.start();
        manager.start();
        assertThat(manager.isRunning()).isTrue();

        manager.stop();
        manager.stop();
        assertThat(manager.state()).isEqualTo(SharedInputManager.State.STOPPED);

        manager.start();
        assertThat(manager.isRunning()).isTrue();
    }

    @Test
    void shouldReplaceInstanceOnRebuild() throws Exception {
        manager = new SharedInputManager();
        manager.start();
        CountingLoader loader = new CountingLoader("alpha");
        manager.bind("alpha0", loader);

        CountingLoader.Counted first = manager.construct("alpha0", Map.of("label", "a"));
        Object owned = manager.instance("alpha0");
        CountingLoader.Counted second = manager.construct("alpha0", Map.of("label", "b"));

        assertThat(manager.instance("alpha0")).isNotSameAs(owned);
        assertThat(first.label()).isEqualTo("a");
        assertThat(second.label()).isEqualTo("b");
        assertThat(loader.constructions).hasValue(2);
    }

    @Test
    void shouldWrapConstructionFailure() throws Exception {
        manager = new SharedInputManager();
        manager.start();
        manager.bind("alpha0", new CountingLoader("alpha"));

        assertThatThrownBy(() -> manager.construct("alpha0", Map.of("label", "x", "fail", true)))
                .isInstanceOf(InputConstructionException.class)
                .hasMessageContaining("alpha0");
    }

    @Test
    void shouldFailStartupWhenThreadCannotBeCreated() {
        manager = new SharedInputManager(r -> null, Duration.ofSeconds(1));

        assertThatThrownBy(() -> manager.start())
                .isInstanceOf(ManagerStartupException.class);
        assertThat(manager.state()).isEqualTo(SharedInputManager.State.FAILED);
        assertThat(manager.isRunning()).isFalse();
    }

    @Test
    void shouldRefuseWorkWhenStopped() throws Exception {
        manager = new SharedInputManager();
        manager.start();
        manager.bind("alpha0", new CountingLoader("alpha"));
        manager.stop();

        assertThat(manager.state()).isEqualTo(SharedInputManager.State.STOPPED);
        assertThatThrownBy(() -> manager.construct("alpha0", Map.of("label", "x")))
                .isInstanceOf(IllegalStateException.class);
    }
}
