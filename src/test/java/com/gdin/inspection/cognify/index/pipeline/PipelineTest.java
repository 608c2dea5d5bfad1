package com.gdin.inspection.cognify.index.pipeline;

import com.gdin.inspection.cognify.exception.FatalPipelineException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class PipelineTest {

    private static final WorkflowFunction<Object> NOOP = (cfg, ctx) -> WorkflowFunctionOutput.builder().build();

    private static List<String> names(Pipeline<Object> p) {
        return p.ordered().stream().map(Pipeline.Step::getName).toList();
    }

    @Test
    public void testTopologicalOrderWithDeclarationTieBreak() {
        Pipeline<Object> p = new Pipeline<>("p")
                .add("persist", List.of("extract", "summarize"), NOOP)
                .add("classify", List.of(), NOOP)
                .add("summarize", List.of("chunk"), NOOP)
                .add("extract", List.of("chunk"), NOOP)
                .add("chunk", List.of("classify"), NOOP);

        Assertions.assertEquals(List.of("classify", "chunk", "summarize", "extract", "persist"), names(p));
        Assertions.assertEquals(Set.of("summarize", "extract", "persist"), p.downstreamOf("chunk"));
        Assertions.assertEquals(Set.of(), p.downstreamOf("persist"));
    }

    @Test
    public void testCycleAndUnknownUpstreamAreFatal() {
        Pipeline<Object> cyclic = new Pipeline<>("cyclic")
                .add("a", List.of("b"), NOOP)
                .add("b", List.of("a"), NOOP);
        Assertions.assertThrows(FatalPipelineException.class, cyclic::ordered);

        Pipeline<Object> dangling = new Pipeline<>("dangling").add("a", List.of("missing"), NOOP);
        Assertions.assertThrows(FatalPipelineException.class, dangling::ordered);

        Pipeline<Object> dup = new Pipeline<>("dup").add("a", List.of(), NOOP);
        Assertions.assertThrows(FatalPipelineException.class, () -> dup.add("a", List.of(), NOOP));
    }

    @Test
    public void testFactoryRejectsUnregisteredNames() {
        PipelineFactory<Object> factory = new PipelineFactory<>();
        factory.register("a", NOOP);
        Map<String, List<String>> tasks = new LinkedHashMap<>();
        tasks.put("a", List.of());
        tasks.put("b", List.of("a"));
        factory.registerPipeline("p", tasks);

        Assertions.assertTrue(factory.hasPipeline("p"));
        Assertions.assertThrows(FatalPipelineException.class, () -> factory.createPipeline("missing"));
        Assertions.assertThrows(FatalPipelineException.class, () -> factory.createPipeline("p"));

        factory.register("b", NOOP);
        Assertions.assertEquals(2, factory.createPipeline("p").size());
    }
}
