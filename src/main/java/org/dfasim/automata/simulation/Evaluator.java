package org.dfasim.automata.simulation;

import org.dfasim.automata.base.State;
import org.dfasim.automata.base.Symbol;
import org.dfasim.automata.models.AutomatonDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 在一个已校验的 DFA 上逐步运行输入串，记录完整轨迹。
 * 求值是纯函数：不修改定义，也不持有任何状态。
 */
public final class Evaluator {

    private static final Logger logger = LoggerFactory.getLogger(Evaluator.class);

    /**
     * 运行输入串，每个码点视为一个符号。
     *
     * @param definition 已校验的 DFA。
     * @param input      输入串，可以为空串。
     * @return 求值结果；输入含字母表之外的符号时结果中只有 {@link UnknownSymbol}。
     */
    public EvaluationResult evaluate(AutomatonDefinition definition, String input) {
        Objects.requireNonNull(input, "Input cannot be null");
        return evaluate(definition, Symbol.split(input));
    }

    public EvaluationResult evaluate(AutomatonDefinition definition, List<Symbol> input) {
        Objects.requireNonNull(definition, "Definition cannot be null");
        Objects.requireNonNull(input, "Input cannot be null");

        // 先整体检查符号，保证失败时不产生任何部分轨迹
        for (int i = 0; i < input.size(); i++) {
            Symbol symbol = input.get(i);
            if (!definition.getAlphabet().contains(symbol)) {
                logger.warn("输入在位置 {} 含有未知符号 '{}'", i, symbol);
                return EvaluationResult.aborted(new UnknownSymbol(symbol.getText(), i));
            }
        }

        State current = definition.getStart();
        List<TraceStep> steps = new ArrayList<>(input.size() + 1);
        steps.add(new TraceStep(current, null));
        for (Symbol symbol : input) {
            // 全函数性保证这里不会失败
            current = definition.next(current, symbol);
            steps.add(new TraceStep(current, symbol));
        }

        boolean accepted = definition.isAccepting(current);
        logger.debug("求值 '{}' 结束于状态 {}，结果: {}", Symbol.join(input), current, accepted ? "接受" : "拒绝");
        return EvaluationResult.completed(accepted, new Trace(steps));
    }

    /**
     * 便捷方法：输入串是否被接受。含未知符号的输入视为不被接受。
     */
    public boolean accepts(AutomatonDefinition definition, String input) {
        return evaluate(definition, input).isAccepted();
    }
}
