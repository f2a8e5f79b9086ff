package com.devstats.core.normalize;

/** Falla de lookup o ejecución de una función registrada. El mensaje siempre empieza con {@link #PREFIX}. */
public class CustomFunctionException extends NormalizationException {
    public static final String PREFIX = "runCustomFunction failed: ";

    public CustomFunctionException(String detail, Throwable cause) {
        super(PREFIX + detail, cause);
    }
}
