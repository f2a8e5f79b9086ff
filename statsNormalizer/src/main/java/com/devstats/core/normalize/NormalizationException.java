package com.devstats.core.normalize;

public class NormalizationException extends RuntimeException {
    public NormalizationException(String message) { super(message); }
    public NormalizationException(String message, Throwable cause) { super(message, cause); }

    static NormalizationException tooDeep(int maxDepth) {
        return new NormalizationException("payload nesting exceeds maxDepth=" + maxDepth);
    }
}
