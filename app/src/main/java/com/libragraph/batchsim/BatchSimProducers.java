package com.libragraph.batchsim;

import com.libragraph.batchsim.core.input.InputLoader;
import com.libragraph.batchsim.core.input.InputRegistry;
import com.libragraph.batchsim.core.output.OutputTypeRegistry;
import com.libragraph.batchsim.core.process.JobProcessor;
import com.libragraph.batchsim.core.process.JobSettings;
import com.libragraph.batchsim.core.render.FlatStampRenderer;
import com.libragraph.batchsim.core.value.DefaultValueEvaluator;
import com.libragraph.batchsim.formats.fits.FitsImageWriter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Wires the orchestration classes from CDI beans and application config.
 */
@ApplicationScoped
public class BatchSimProducers {

    private static final Logger log = Logger.getLogger(BatchSimProducers.class);

    @Inject
    @Any
    Instance<InputLoader<?>> loaders;

    @Inject
    FlatStampRenderer renderer;

    @Inject
    FitsImageWriter writer;

    @Inject
    DefaultValueEvaluator evaluator;

    @ConfigProperty(name = "batchsim.workers.default-nproc", defaultValue = "1")
    int defaultNproc;

    @ConfigProperty(name = "batchsim.output.dir", defaultValue = ".")
    String outputDir;

    @ConfigProperty(name = "batchsim.manager.startup-timeout-ms", defaultValue = "10000")
    long managerStartupTimeoutMs;

    /** Every {@link InputLoader} bean, registered in type-name order. */
    @Produces
    @Singleton
    public InputRegistry inputRegistry() {
        List<InputLoader<?>> sorted = StreamSupport.stream(loaders.spliterator(), false)
                .sorted(Comparator.comparing((InputLoader<?> l) -> l.typeName()))
                .collect(Collectors.toList());
        InputRegistry registry = new InputRegistry();
        sorted.forEach(registry::register);
        log.infof("Registered %d input types: %s", registry.size(), registry.typeNames());
        return registry;
    }

    @Produces
    @Singleton
    public OutputTypeRegistry outputTypeRegistry() {
        return OutputTypeRegistry.withBuiltins(renderer, writer);
    }

    @Produces
    @Singleton
    public JobSettings jobSettings() {
        return new JobSettings(Path.of(outputDir), Duration.ofMillis(managerStartupTimeoutMs),
                Runtime.getRuntime().availableProcessors(), defaultNproc);
    }

    @Produces
    @Singleton
    public JobProcessor jobProcessor(InputRegistry inputs, OutputTypeRegistry outputs, JobSettings settings) {
        return new JobProcessor(inputs, outputs, evaluator, settings);
    }
}
