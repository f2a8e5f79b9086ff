package com.devstats.core.normalize;

import com.devstats.core.model.JsonSupport;
import com.devstats.core.runtime.CustomFunctionRegistry;
import com.devstats.core.spi.CustomFunction;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Invoca una función registrada con {@code {data: <árbol>} + args}.
 * {@code data} es reservado: si viene en args se rechaza antes de invocar.
 */
public class CustomFunctionDispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(CustomFunctionDispatcher.class);

    public static final String DATA_ARG = "data";

    private final CustomFunctionRegistry registry;

    public CustomFunctionDispatcher(CustomFunctionRegistry registry) {
        this.registry = registry;
    }

    public JsonNode dispatch(JsonNode data, String func, ObjectNode args) {
        if (args != null && args.has(DATA_ARG))
            throw new IllegalArgumentException("Named argument (data) is not allowed");

        ObjectNode merged = JsonSupport.NODES.objectNode();
        merged.set(DATA_ARG, data);
        if (args != null) args.fields().forEachRemaining(en -> merged.set(en.getKey(), en.getValue()));

        try {
            CustomFunction f = registry.find(func)
                    .orElseThrow(() -> new IllegalArgumentException("unknown custom function '" + func + "'"));
            LOG.debug("Running custom function {}", func);
            return f.apply(merged);
        } catch (RuntimeException e) {
            throw new CustomFunctionException(e.getMessage() != null ? e.getMessage() : e.toString(), e);
        }
    }
}
