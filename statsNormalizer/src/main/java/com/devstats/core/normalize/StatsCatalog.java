package com.devstats.core.normalize;

import com.devstats.core.model.JsonSupport;
import com.devstats.core.model.NormalizationOptions;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Catálogo declarativo de stats: nombre -> endpoint del device + opciones de normalización.
 *
 * <pre>
 * stats:
 *   cpu:
 *     endpoint: /mgmt/tm/sys/host-info
 *     normalization:
 *       key: "0::cpuInfo"
 * </pre>
 */
public class StatsCatalog {
    private static final Logger LOG = LoggerFactory.getLogger(StatsCatalog.class);

    private final Map<String, CatalogConfig.StatDefinition> stats;
    private final NormalizationOrchestrator orchestrator;

    public StatsCatalog(CatalogConfig cfg, NormalizationOrchestrator orchestrator) {
        this.stats = compile(cfg);
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    }

    public static StatsCatalog load(InputStream yaml, NormalizationOrchestrator orchestrator) {
        CatalogConfig cfg;
        try {
            cfg = JsonSupport.YAML.readValue(yaml, CatalogConfig.class);
        } catch (Exception e) {
            throw new NormalizationException("Error loading stats catalog", e);
        }
        StatsCatalog catalog = new StatsCatalog(cfg, orchestrator);
        LOG.info("Loaded stats catalog with {} stats", catalog.stats.size());
        return catalog;
    }

    public static StatsCatalog fromClasspath(String resource, NormalizationOrchestrator orchestrator) {
        InputStream in = StatsCatalog.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) throw new NormalizationException("Stats catalog not found on classpath: " + resource);
        try (in) {
            return load(in, orchestrator);
        } catch (IOException e) {
            throw new NormalizationException("Error reading " + resource, e);
        }
    }

    public Set<String> names() { return stats.keySet(); }

    public Optional<CatalogConfig.StatDefinition> definition(String stat) {
        return Optional.ofNullable(stats.get(stat));
    }

    public JsonNode normalize(String stat, JsonNode payload) {
        var def = definition(stat).orElseThrow(() -> new NormalizationException("Unknown stat '" + stat + "'"));
        return orchestrator.normalize(payload, options(def));
    }

    /**
     * Normaliza todos los stats cuyo endpoint está en {@code payloadsByEndpoint}.
     * Los stats sin payload se omiten.
     */
    public ObjectNode normalizeAll(Map<String, JsonNode> payloadsByEndpoint) {
        ObjectNode out = JsonSupport.NODES.objectNode();
        for (var en : stats.entrySet()) {
            JsonNode payload = payloadsByEndpoint.get(en.getValue().endpoint());
            if (payload == null) {
                LOG.warn("No payload for endpoint {} (stat {}), skipping", en.getValue().endpoint(), en.getKey());
                continue;
            }
            out.set(en.getKey(), orchestrator.normalize(payload, options(en.getValue())));
        }
        return out;
    }

    // ===== Helpers =====

    private static NormalizationOptions options(CatalogConfig.StatDefinition def) {
        return def.normalization() != null ? def.normalization() : NormalizationOptions.NONE;
    }

    private static Map<String, CatalogConfig.StatDefinition> compile(CatalogConfig cfg) {
        Map<String, CatalogConfig.StatDefinition> map = new LinkedHashMap<>();
        if (cfg == null || cfg.stats() == null) return Collections.unmodifiableMap(map);
        for (var en : cfg.stats().entrySet()) {
            var def = en.getValue();
            if (def == null || def.endpoint() == null || def.endpoint().isBlank())
                throw new NormalizationException("Stat '" + en.getKey() + "' has no endpoint");
            map.put(en.getKey(), def);
        }
        return Collections.unmodifiableMap(map);
    }
}
