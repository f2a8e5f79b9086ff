package com.devstats.core.normalize;

import com.devstats.config.NormalizerConfig;
import com.devstats.core.model.NormalizationOptions;
import com.devstats.core.runtime.CustomFunctionRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pipeline de normalización. El orden es fijo y cada etapa asume la salida de la anterior:
 * reduce -> key -> filterByKeys -> renameKeysByPattern -> runCustomFunction.
 * Sin estado entre llamadas; cualquier error aborta la llamada completa.
 */
public class NormalizationOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(NormalizationOrchestrator.class);

    private final Reducer reducer;
    private final KeyPathResolver resolver;
    private final KeyFilter filter;
    private final KeyRenamer renamer;
    private final CustomFunctionDispatcher dispatcher;

    public NormalizationOrchestrator(Reducer reducer, KeyPathResolver resolver, KeyFilter filter,
                                     KeyRenamer renamer, CustomFunctionDispatcher dispatcher) {
        this.reducer = reducer;
        this.resolver = resolver;
        this.filter = filter;
        this.renamer = renamer;
        this.dispatcher = dispatcher;
    }

    public static NormalizationOrchestrator create(NormalizerConfig cfg) {
        return create(cfg, CustomFunctionRegistry.builtin());
    }

    public static NormalizationOrchestrator create(NormalizerConfig cfg, CustomFunctionRegistry registry) {
        int maxDepth = cfg.maxDepth;
        return new NormalizationOrchestrator(
                new Reducer(new KeyFieldArrayToMapConverter(), maxDepth),
                new KeyPathResolver(),
                new KeyFilter(maxDepth),
                new KeyRenamer(maxDepth),
                new CustomFunctionDispatcher(registry));
    }

    public JsonNode normalize(JsonNode data, NormalizationOptions options) {
        NormalizationOptions o = options != null ? options : NormalizationOptions.NONE;

        JsonNode ret = reducer.reduce(data, o.convertArrayToMap());

        if (o.key() != null) {
            ret = resolver.resolve(ret, o.key());
            if (KeyPathResolver.isMissing(ret)) LOG.debug("Key path '{}' not present in payload", o.key());
        }
        if (o.filterByKeys() != null) ret = filter.filter(ret, o.filterByKeys());
        if (o.renameKeysByPattern() != null) ret = renamer.rename(ret, o.renameKeysByPattern());
        if (o.runCustomFunction() != null) {
            var call = o.runCustomFunction();
            ret = dispatcher.dispatch(ret, call.name(), call.args());
        }
        return ret;
    }
}
