package org.dfasim.automata.simulation;

import java.util.ArrayList;
import java.util.List;

/**
 * 把求值结果渲染成逐行的可读说明，供界面的轨迹面板直接显示。
 */
public final class TraceFormatter {

    public List<String> format(EvaluationResult result) {
        List<String> lines = new ArrayList<>();
        if (result.getUnknownSymbol().isPresent()) {
            lines.add(result.getUnknownSymbol().get().getMessage());
            return lines;
        }
        Trace trace = result.getTrace().orElseThrow();
        List<TraceStep> steps = trace.getSteps();
        if (steps.size() == 1) {
            lines.add("(empty string)");
        }
        for (int i = 1; i < steps.size(); i++) {
            TraceStep previous = steps.get(i - 1);
            TraceStep step = steps.get(i);
            lines.add(String.format("%d. From state (%s) reading '%s' move to state (%s).",
                    i, previous.getState(), step.getConsumed().orElseThrow(), step.getState()));
        }
        lines.add("Finished in state (" + trace.getFinalState() + ").");
        lines.add("Result: " + (result.isAccepted() ? "ACCEPTED" : "REJECTED"));
        return lines;
    }

    public String formatText(EvaluationResult result) {
        return String.join(System.lineSeparator(), format(result));
    }
}
