package org.dfasim.automata.simulation;

import org.dfasim.automata.SampleAutomata;
import org.dfasim.automata.models.AutomatonDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TraceFormatterTest {

    private final AutomatonDefinition parity = SampleAutomata.parity();
    private final Evaluator evaluator = new Evaluator();
    private final TraceFormatter formatter = new TraceFormatter();

    @Test
    void testStepLines() {
        List<String> lines = formatter.format(evaluator.evaluate(parity, "10"));

        assertEquals(List.of(
                "1. From state (S0) reading '1' move to state (S1).",
                "2. From state (S1) reading '0' move to state (S1).",
                "Finished in state (S1).",
                "Result: REJECTED"), lines);
    }

    @Test
    void testEmptyInput() {
        assertEquals(List.of(
                "(empty string)",
                "Finished in state (S0).",
                "Result: ACCEPTED"), formatter.format(evaluator.evaluate(parity, "")));
    }

    @Test
    void testUnknownSymbol() {
        assertEquals(List.of("Symbol '2' at position 3 is not in the alphabet."),
                formatter.format(evaluator.evaluate(parity, "012")));
    }

    @Test
    void testFormatTextJoinsLines() {
        String text = formatter.formatText(evaluator.evaluate(parity, "11"));

        assertTrue(text.endsWith("Result: ACCEPTED"));
        assertEquals(4, text.lines().count());
    }
}
