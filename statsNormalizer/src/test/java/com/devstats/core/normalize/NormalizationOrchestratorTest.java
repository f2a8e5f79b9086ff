package com.devstats.core.normalize;

import com.devstats.config.NormalizerConfig;
import com.devstats.core.model.NormalizationOptions;
import com.devstats.core.model.RenamePattern;
import com.devstats.core.runtime.CustomFunctionRegistry;
import com.devstats.core.spi.CustomFunction;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.devstats.TestPayloads.fixture;
import static com.devstats.TestPayloads.json;
import static org.junit.jupiter.api.Assertions.*;

class NormalizationOrchestratorTest {

    private final List<JsonNode> seenByFunction = new ArrayList<>();
    private NormalizationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        CustomFunction capture = args -> { seenByFunction.add(args.get("data")); return args.get("data"); };
        orchestrator = NormalizationOrchestrator.create(new NormalizerConfig(),
                new CustomFunctionRegistry(Map.of("capture", capture)));
    }

    @Test
    void reducesWithEmptyOptions() {
        JsonNode in = json("{'entries':{'https://localhost/mgmt/tm/sys/tmm-info/0.0/stats':"
                + "{'nestedStats':{'entries':{'oneMinAverageSystem':{'value':5}}}}}}");
        assertEquals(json("{'tmm-info/0.0/stats':{'oneMinAverageSystem':5}}"),
                orchestrator.normalize(in, NormalizationOptions.NONE));
        assertEquals(json("{'tmm-info/0.0/stats':{'oneMinAverageSystem':5}}"), orchestrator.normalize(in, null));
    }

    @Test
    void stagesRunInFixedOrder() {
        JsonNode in = json("{'entries':{'https://localhost/mgmt/tm/sys/perf':{'nestedStats':{'entries':{"
                + "'tmm_0':{'nestedStats':{'entries':{'cpuUtil':{'value':1},'memUtil':{'value':2},'junk':{'value':3}}}},"
                + "'tmm_1':{'nestedStats':{'entries':{'cpuUtil':{'value':4}}}},"
                + "'other':{'value':9}}}}}}");
        var options = NormalizationOptions.builder()
                .key("perf")
                .filterByKeys("tmm", "Util")
                .renameKey("tmm", "tmm_(\\d+)", 1)
                .runCustomFunction("capture")
                .build();

        JsonNode out = orchestrator.normalize(in, options);

        JsonNode expected = json("{'0':{'cpuUtil':1,'memUtil':2},'1':{'cpuUtil':4}}");
        assertEquals(expected, out);
        // la función recibe la salida del renombrado
        assertEquals(List.of(expected), seenByFunction);
    }

    @Test
    void customFunctionReceivesLastExecutedStage() {
        var options = NormalizationOptions.builder().key("a").runCustomFunction("capture").build();
        orchestrator.normalize(json("{'a':{'value':3}}"), options);
        assertEquals(List.of(json("3")), seenByFunction);
    }

    @Test
    void missingKeyFlowsThroughLaterStages() {
        var options = NormalizationOptions.builder().key("nope::deeper").filterByKeys("x").build();
        JsonNode out = orchestrator.normalize(json("{'a':1}"), options);
        assertTrue(KeyPathResolver.isMissing(out));
    }

    @Test
    void rejectsDataArgBeforeRunningFunction() {
        var options = NormalizationOptions.builder()
                .runCustomFunction("capture", (ObjectNode) json("{'data':'x'}"))
                .build();
        assertThrows(IllegalArgumentException.class, () -> orchestrator.normalize(json("{'a':1}"), options));
        assertTrue(seenByFunction.isEmpty());
    }

    @Test
    void convertArrayToMapIsAppliedDuringReduction() {
        var options = NormalizationOptions.builder().convertArrayToMap("name").key("items").build();
        JsonNode out = orchestrator.normalize(fixture("interface.json"), options);
        assertEquals(1500, out.path("1.1").path("mtu").asInt());
        assertFalse(out.path("1.2").path("enabled").asBoolean(true));
        assertFalse(out.path("1.1").has("name"));
    }

    @Test
    void builtinFunctionsAreWiredByDefault() {
        var real = NormalizationOrchestrator.create(new NormalizerConfig());
        var options = NormalizationOptions.builder().runCustomFunction("getSum").build();
        JsonNode out = real.normalize(json("{'a':{'x':{'value':1}},'b':{'x':{'value':2}}}"), options);
        assertEquals(3, out.path("x").asLong());
    }

    @Test
    void failureAbortsWholeCall() {
        var options = NormalizationOptions.builder().runCustomFunction("unknown").build();
        assertThrows(CustomFunctionException.class, () -> orchestrator.normalize(json("{'a':1}"), options));
    }

    @Test
    void renamesVirtualServerKeys() {
        var options = NormalizationOptions.builder()
                .renameKey("virtual", RenamePattern.of("ltm/virtual/(.*)/stats", 1))
                .filterByKeys("virtual", "curConns")
                .build();
        JsonNode out = orchestrator.normalize(fixture("virtual-stats.json"), options);
        assertEquals(json("{'~Common~app_vs':{'clientside.curConns':3}}"), out);
    }
}
