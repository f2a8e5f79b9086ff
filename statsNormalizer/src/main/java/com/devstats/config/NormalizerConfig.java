package com.devstats.config;

import com.devstats.core.model.JsonSupport;
import com.devstats.core.normalize.NormalizationException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.IOException;
import java.io.InputStream;

@JsonIgnoreProperties(ignoreUnknown = true)
public class NormalizerConfig {
    public static final String DEFAULT_RESOURCE = "normalizer.yaml";

    /** Recurso de classpath con el catálogo de stats. */
    public String catalog = "stats-catalog.yaml";
    /** Profundidad máxima de anidamiento aceptada en un payload. */
    public int maxDepth = 512;

    public static NormalizerConfig load(InputStream yaml) {
        try {
            NormalizerConfig cfg = JsonSupport.YAML.readValue(yaml, NormalizerConfig.class);
            if (cfg == null) cfg = new NormalizerConfig();   // yaml vacío
            if (cfg.maxDepth <= 0) throw new IllegalArgumentException("maxDepth must be > 0: " + cfg.maxDepth);
            return cfg;
        } catch (IOException e) {
            throw new NormalizationException("Error loading normalizer config", e);
        }
    }

    /** Lee {@value #DEFAULT_RESOURCE} del classpath; si no está, usa los defaults. */
    public static NormalizerConfig fromClasspath() {
        try (InputStream in = NormalizerConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            return in == null ? new NormalizerConfig() : load(in);
        } catch (IOException e) {
            throw new NormalizationException("Error reading " + DEFAULT_RESOURCE, e);
        }
    }
}
