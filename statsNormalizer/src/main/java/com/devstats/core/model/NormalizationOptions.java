package com.devstats.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.*;

/**
 * Opciones de normalización de una respuesta del device. Todas opcionales;
 * cada una habilita su etapa en el pipeline.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record NormalizationOptions(
        String key,                                      // path "a::b::c"
        List<String> filterByKeys,                       // substrings a conservar
        Map<String, RenamePattern> renameKeysByPattern,  // trigger -> pattern (orden de inserción)
        ArrayToMap convertArrayToMap,
        CustomFunctionCall runCustomFunction
) {
    public static final NormalizationOptions NONE = new NormalizationOptions(null, null, null, null, null);

    @JsonCreator
    public NormalizationOptions(
            @JsonProperty("key") String key,
            @JsonProperty("filterByKeys") List<String> filterByKeys,
            @JsonProperty("renameKeysByPattern") Map<String, RenamePattern> renameKeysByPattern,
            @JsonProperty("convertArrayToMap") ArrayToMap convertArrayToMap,
            @JsonProperty("runCustomFunction") CustomFunctionCall runCustomFunction
    ) {
        this.key = key;
        this.filterByKeys = filterByKeys == null ? null : List.copyOf(filterByKeys);
        this.renameKeysByPattern = renameKeysByPattern == null ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(renameKeysByPattern));
        this.convertArrayToMap = convertArrayToMap;
        this.runCustomFunction = runCustomFunction;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ArrayToMap(
            @JsonProperty("keyName") String keyName,
            @JsonProperty("keyNamePrefix") String keyNamePrefix
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CustomFunctionCall(
            @JsonProperty(value = "name", required = true) String name,
            @JsonProperty("args") ObjectNode args     // sin "data"
    ) {
        public CustomFunctionCall {
            Objects.requireNonNull(name, "name");
            args = args == null ? null : args.deepCopy();
        }

        /** Copia; las opciones no cambian aunque el llamador modifique lo devuelto. */
        @Override
        public ObjectNode args() { return args == null ? null : args.deepCopy(); }
    }

    // --- builder ---
    public static Builder builder() { return new Builder(); }
    public static final class Builder {
        private String key;
        private List<String> filterByKeys;
        private final Map<String, RenamePattern> rename = new LinkedHashMap<>();
        private ArrayToMap convertArrayToMap;
        private CustomFunctionCall runCustomFunction;

        public Builder key(String k){ this.key = k; return this; }
        public Builder filterByKeys(String... keys){ this.filterByKeys = List.of(keys); return this; }
        public Builder filterByKeys(List<String> keys){ this.filterByKeys = keys; return this; }
        public Builder renameKey(String trigger, RenamePattern p){ this.rename.put(trigger, p); return this; }
        public Builder renameKey(String trigger, String regex, int group){ return renameKey(trigger, RenamePattern.of(regex, group)); }
        public Builder convertArrayToMap(String keyName){ return convertArrayToMap(keyName, null); }
        public Builder convertArrayToMap(String keyName, String prefix){ this.convertArrayToMap = new ArrayToMap(keyName, prefix); return this; }
        public Builder runCustomFunction(String name){ return runCustomFunction(name, null); }
        public Builder runCustomFunction(String name, ObjectNode args){ this.runCustomFunction = new CustomFunctionCall(name, args); return this; }

        public NormalizationOptions build() {
            return new NormalizationOptions(key, filterByKeys,
                    rename.isEmpty() ? null : rename, convertArrayToMap, runCustomFunction);
        }
    }
}
