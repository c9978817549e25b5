package com.agentflow.workflow.condition;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConditionParserTest {

    private static Map<String, Object> state(Object... kv) {
        Map<String, Object> m = new HashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put((String) kv[i], kv[i + 1]);
        }
        return m;
    }

    @Test
    void parse_defaultIsAlways() {
        assertSame(Condition.ALWAYS, ConditionParser.parse(" default "));
    }

    @Test
    void test_numericComparisonsAcrossNumberTypes() {
        Condition c = ConditionParser.parse("state.score >= 8");

        assertTrue(c.test(state("score", 8L)));
        assertTrue(c.test(state("score", 9.5)));
        assertFalse(c.test(state("score", 5L)));
    }

    @Test
    void test_booleanCombinatorsAndParentheses() {
        Condition c = ConditionParser.parse("(score > 5 and verdict == 'ok') or not done");

        assertTrue(c.test(state("score", 6L, "verdict", "ok", "done", true)));
        assertFalse(c.test(state("score", 6L, "verdict", "bad", "done", true)));
        assertTrue(c.test(state("score", 1L, "verdict", "bad", "done", false)));
    }

    @Test
    void test_unsetFieldComparisonIsFalse() {
        assertFalse(ConditionParser.parse("state.score >= 8").test(state("score", null)));
        assertFalse(ConditionParser.parse("state.score < 8").test(state()));
    }

    @Test
    void test_bareFieldIsTruthiness() {
        Condition c = ConditionParser.parse("state.notes");

        assertFalse(c.test(state("notes", List.of())));
        assertTrue(c.test(state("notes", List.of("x"))));
    }

    @Test
    void test_mixedTypeOrderingNeverMatches() {
        assertFalse(ConditionParser.parse("verdict > 3").test(state("verdict", "ok")));
    }

    @Test
    void referencedFields_listsRootNames() {
        Condition c = ConditionParser.parse("state.meta.level == 2 and score != None");

        assertEquals(Set.of("meta", "score"), c.referencedFields());
    }

    @Test
    void parse_rejectsMalformedExpressions() {
        assertThrows(ConditionSyntaxException.class, () -> ConditionParser.parse("score >="));
        assertThrows(ConditionSyntaxException.class, () -> ConditionParser.parse("(score > 1"));
        assertThrows(ConditionSyntaxException.class, () -> ConditionParser.parse("__import__('os')"));
        assertThrows(ConditionSyntaxException.class, () -> ConditionParser.parse(""));
    }
}
