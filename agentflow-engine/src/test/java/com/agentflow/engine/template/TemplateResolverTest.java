package com.agentflow.engine.template;

import com.agentflow.engine.state.ExecutionState;
import com.agentflow.engine.state.StateRecordBuilder;
import com.agentflow.workflow.WorkflowConfigs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TemplateResolverTest {

    private final TemplateResolver resolver = new TemplateResolver();
    private ExecutionState state;

    @BeforeEach
    void setUp() {
        state = new StateRecordBuilder().build(WorkflowConfigs.fromYaml("""
                state:
                  fields:
                    - {name: topic, type: str}
                    - {name: score, type: int}
                    - {name: tags, type: "list[str]"}
                    - {name: meta, type: dict}
                    - {name: summary, type: str}
                """).getState()).initialize(Map.of(
                "topic", "rivers",
                "score", 7,
                "tags", List.of("a", "b"),
                "meta", Map.of("author", Map.of("name", "Ada"))));
    }

    @Test
    void resolve_substitutesStateFieldsWithAndWithoutPrefix() {
        String out = resolver.resolve("Write about {state.topic} ({score}/10)", Map.of(), state);

        assertEquals("Write about rivers (7/10)", out);
    }

    @Test
    void resolve_inputsOverrideStateUnlessPrefixed() {
        Map<String, Object> inputs = Map.of("topic", "lakes");

        assertEquals("lakes", resolver.resolve("{topic}", inputs, state));
        assertEquals("rivers", resolver.resolve("{state.topic}", inputs, state));
    }

    @Test
    void resolve_nestedPathAndJsonRendering() {
        assertEquals("Ada", resolver.resolve("{state.meta.author.name}", Map.of(), state));
        assertEquals("[\"a\",\"b\"]", resolver.resolve("{tags}", Map.of(), state));
    }

    @Test
    void resolve_unsetFieldRendersEmpty() {
        assertEquals("[]", resolver.resolve("[{summary}]", Map.of(), state));
    }

    @Test
    void resolve_unknownVariableNamesItAndSuggests() {
        TemplateException e = assertThrows(TemplateException.class,
                () -> resolver.resolve("About {state.topc}", Map.of(), state));

        assertEquals("state.topc", e.getVariable());
        assertEquals("topic", e.getSuggestion());
        assertTrue(e.getMessage().startsWith("Variable 'state.topc' not found in inputs or state"), e.getMessage());
    }

    @Test
    void resolve_missingNestedKeyFails() {
        assertThrows(TemplateException.class, () -> resolver.resolve("{meta.editor}", Map.of(), state));
    }

    @Test
    void resolveInputs_singlePlaceholderKeepsRawValue() {
        Map<String, Object> inputs = resolver.resolveInputs(
                Map.of("labels", "{state.tags}", "line", "Topic: {topic}"), state);

        assertEquals(List.of("a", "b"), inputs.get("labels"));
        assertEquals("Topic: rivers", inputs.get("line"));
    }
}
