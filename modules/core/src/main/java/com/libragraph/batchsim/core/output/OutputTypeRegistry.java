package com.libragraph.batchsim.core.output;

import com.libragraph.batchsim.core.config.ConfigValidationException;
import com.libragraph.batchsim.core.image.ImageBatchBuilder;
import com.libragraph.batchsim.core.render.ImageRenderer;
import com.libragraph.batchsim.formats.api.ImageWriter;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Output types by {@code output.type} name.
 */
public class OutputTypeRegistry {

    private static final Logger log = Logger.getLogger(OutputTypeRegistry.class);

    private final Map<String, OutputType> types = new ConcurrentHashMap<>();

    public static OutputTypeRegistry withBuiltins(ImageRenderer renderer, ImageWriter writer) {
        ImageBatchBuilder builder = new ImageBatchBuilder(renderer);
        OutputTypeRegistry registry = new OutputTypeRegistry();
        registry.register(new FitsOutputType(builder, writer));
        registry.register(new MultiFitsOutputType(builder, writer));
        registry.register(new DataCubeOutputType(builder, writer));
        return registry;
    }

    public void register(OutputType type) {
        types.put(type.typeName(), type);
        log.debugf("Registered output type '%s' -> %s", type.typeName(), type.getClass().getSimpleName());
    }

    /**
     * @throws ConfigValidationException for an unregistered name
     */
    public OutputType resolve(String name) {
        OutputType type = types.get(name);
        if (type == null) {
            throw new ConfigValidationException("Invalid output.type=" + name
                    + " (registered: " + List.copyOf(types.keySet()) + ")");
        }
        return type;
    }
}
