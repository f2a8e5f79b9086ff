package com.devstats.plugins.functions;

import com.devstats.core.spi.CustomFunction;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Funciones aprobadas para {@code runCustomFunction}. El conjunto es cerrado. */
public enum BuiltinFunction implements CustomFunction {
    GET_SUM("getSum", StatsFunctions::getSum),
    GET_AVERAGE("getAverage", StatsFunctions::getAverage),
    GET_FIRST_KEY("getFirstKey", StatsFunctions::getFirstKey),
    GET_PERCENT_FROM_KEYS("getPercentFromKeys", StatsFunctions::getPercentFromKeys),
    CONVERT_MAP_TO_ARRAY("convertMapToArray", StatsFunctions::convertMapToArray);

    private final String functionName;
    private final CustomFunction impl;

    BuiltinFunction(String functionName, CustomFunction impl) {
        this.functionName = functionName;
        this.impl = impl;
    }

    /** Nombre usado en las opciones ({@code runCustomFunction.name}). */
    public String functionName() { return functionName; }

    @Override
    public JsonNode apply(ObjectNode args) { return impl.apply(args); }
}
