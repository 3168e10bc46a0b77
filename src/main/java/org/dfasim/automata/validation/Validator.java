package org.dfasim.automata.validation;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.dfasim.automata.base.Alphabet;
import org.dfasim.automata.base.State;
import org.dfasim.automata.base.Symbol;
import org.dfasim.automata.base.Transition;
import org.dfasim.automata.models.AutomatonDefinition;
import org.dfasim.automata.models.DefinitionDraft;
import org.dfasim.automata.models.DefinitionDraft.TransitionRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 把原始草稿翻译为不可变的 {@link AutomatonDefinition}。
 * <p>
 * 校验会收集全部错误而不是遇到第一个就停止：重复的状态或符号、无效的初始状态和接受状态、
 * 引用未知状态或符号的迁移行、同一 (状态, 符号) 的冲突迁移，以及每个缺失的迁移单元格。
 * 空白条目和整行空白的迁移行会被忽略；完全相同的重复迁移行会被合并。
 * 校验没有副作用，不会修改草稿。
 */
public final class Validator {

    private static final Logger logger = LoggerFactory.getLogger(Validator.class);

    public ValidationResult validate(DefinitionDraft draft) {
        Objects.requireNonNull(draft, "Draft cannot be null");
        List<ValidationError> errors = new ArrayList<>();

        // 1. 状态集合 Q
        Set<String> stateLabels = new LinkedHashSet<>();
        Set<String> reportedStates = new HashSet<>();
        for (String raw : draft.getStates()) {
            if (StringUtils.isBlank(raw)) {
                continue;
            }
            String label = raw.strip();
            if (!stateLabels.add(label) && reportedStates.add(label)) {
                errors.add(ValidationError.duplicateState(label));
            }
        }
        if (stateLabels.isEmpty()) {
            errors.add(ValidationError.noStates());
        }

        // 2. 字母表 Σ，保留声明顺序
        Set<String> symbolTexts = new LinkedHashSet<>();
        Set<String> reportedSymbols = new HashSet<>();
        boolean alphabetUsable = true;
        for (String raw : draft.getAlphabet()) {
            if (StringUtils.isBlank(raw)) {
                continue;
            }
            String text = raw.strip();
            if (!Symbol.isSingleCodePoint(text)) {
                errors.add(ValidationError.invalidSymbol(text));
                alphabetUsable = false;
                continue;
            }
            if (!symbolTexts.add(text) && reportedSymbols.add(text)) {
                errors.add(ValidationError.duplicateSymbol(text));
            }
        }
        if (symbolTexts.isEmpty() && alphabetUsable) {
            errors.add(ValidationError.noSymbols());
        }

        // 3. 初始状态 q₀
        String start = StringUtils.strip(draft.getStart());
        if (StringUtils.isEmpty(start)) {
            errors.add(ValidationError.missingStart());
        } else if (!stateLabels.contains(start)) {
            errors.add(ValidationError.unknownStart(start));
        }

        // 4. 接受状态 F ⊆ Q，重复条目直接合并
        Set<String> accepting = new LinkedHashSet<>();
        for (String raw : draft.getAccepting()) {
            if (StringUtils.isBlank(raw)) {
                continue;
            }
            String label = raw.strip();
            if (accepting.add(label) && !stateLabels.contains(label)) {
                errors.add(ValidationError.unknownAcceptingState(label));
            }
        }

        // 5. 迁移行：先检查引用完整性和冲突，再折叠成函数
        Map<Pair<String, String>, String> delta = new LinkedHashMap<>();
        Set<Pair<String, String>> attempted = new HashSet<>();
        List<TransitionRow> rows = draft.getTransitions();
        for (int row = 0; row < rows.size(); row++) {
            TransitionRow r = rows.get(row);
            if (r.isBlank()) {
                continue;
            }
            String source = StringUtils.strip(r.getSource());
            String symbol = StringUtils.strip(r.getSymbol());
            String target = StringUtils.strip(r.getTarget());
            if (r.isIncomplete()) {
                errors.add(ValidationError.incompleteRow(row, source, symbol, target));
                continue;
            }
            boolean sourceKnown = stateLabels.contains(source);
            boolean symbolKnown = symbolTexts.contains(symbol);
            boolean targetKnown = stateLabels.contains(target);
            if (!sourceKnown) {
                errors.add(ValidationError.unknownSource(row, source, symbol, target));
            }
            if (!symbolKnown) {
                errors.add(ValidationError.unknownSymbol(row, source, symbol, target));
            }
            if (!targetKnown) {
                errors.add(ValidationError.unknownTarget(row, source, symbol, target));
            }
            Pair<String, String> key = Pair.of(source, symbol);
            if (sourceKnown && symbolKnown) {
                // 该单元格已有（错误的）填写，不再重复报告为缺失
                attempted.add(key);
            }
            if (!sourceKnown || !symbolKnown || !targetKnown) {
                continue;
            }
            String existing = delta.putIfAbsent(key, target);
            if (existing != null && !existing.equals(target)) {
                errors.add(ValidationError.conflictingTransition(row, source, symbol, target, existing));
            }
        }

        // 6. 全函数性：逐个报告缺失的 (状态, 符号) 单元格
        for (String state : stateLabels) {
            for (String symbol : symbolTexts) {
                Pair<String, String> key = Pair.of(state, symbol);
                if (!delta.containsKey(key) && !attempted.contains(key)) {
                    errors.add(ValidationError.missingTransition(state, symbol));
                }
            }
        }

        if (!errors.isEmpty()) {
            logger.warn("DFA 定义校验失败，共 {} 个错误", errors.size());
            logger.debug("校验错误详情：{}", errors);
            return ValidationResult.invalid(errors);
        }

        List<State> states = stateLabels.stream().map(State::of).toList();
        Alphabet alphabet = Alphabet.of(symbolTexts.stream().map(Symbol::of).toList());
        List<State> acceptingStates = accepting.stream().map(State::of).toList();
        List<Transition> transitions = new ArrayList<>(delta.size());
        for (Map.Entry<Pair<String, String>, String> entry : delta.entrySet()) {
            transitions.add(new Transition(
                    State.of(entry.getKey().getLeft()),
                    Symbol.of(entry.getKey().getRight()),
                    State.of(entry.getValue())));
        }
        return ValidationResult.valid(
                AutomatonDefinition.of(states, alphabet, State.of(start), acceptingStates, transitions));
    }
}
