package com.devstats.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

@FunctionalInterface
public interface CustomFunction {
    /** {@code args.data} trae el árbol actual; el resto son argumentos nombrados. */
    JsonNode apply(ObjectNode args);
}
