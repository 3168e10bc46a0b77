package org.dfasim.automata.models;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.dfasim.automata.base.Transition;
import org.dfasim.automata.validation.ValidationResult;
import org.dfasim.automata.validation.Validator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 用户界面持有的原始草稿：状态、字母表、初始状态、接受状态和迁移表格中的原始文本。
 * 草稿是可变的、非线程安全的，本身不保证任何不变量；
 * 每次调用 {@link #validate()} 成功都会得到一个新的不可变 {@link AutomatonDefinition}。
 */
public final class DefinitionDraft {

    private final List<String> states = new ArrayList<>();
    private final List<String> alphabet = new ArrayList<>();
    private final List<String> accepting = new ArrayList<>();
    private final List<TransitionRow> transitions = new ArrayList<>();
    private String start;

    /**
     * 迁移表格中的一行原始输入，三个单元格都可能为空。
     */
    @Getter
    public static final class TransitionRow {
        private final String source;
        private final String symbol;
        private final String target;

        public TransitionRow(String source, String symbol, String target) {
            this.source = source;
            this.symbol = symbol;
            this.target = target;
        }

        public boolean isBlank() {
            return StringUtils.isAllBlank(source, symbol, target);
        }

        public boolean isIncomplete() {
            return StringUtils.isAnyBlank(source, symbol, target);
        }

        @Override
        public String toString() {
            return "(" + source + ", " + symbol + ", " + target + ")";
        }
    }

    /**
     * 由已有定义回填草稿，用于在其基础上继续编辑。
     */
    public static DefinitionDraft from(AutomatonDefinition definition) {
        DefinitionDraft draft = new DefinitionDraft();
        definition.getStates().forEach(s -> draft.state(s.getLabel()));
        definition.getAlphabet().getSymbols().forEach(a -> draft.symbol(a.getText()));
        draft.start(definition.getStart().getLabel());
        definition.getAccepting().forEach(s -> draft.accepting(s.getLabel()));
        for (Transition t : definition.getTransitions()) {
            draft.transition(t.getSource().getLabel(), t.getSymbol().getText(), t.getTarget().getLabel());
        }
        return draft;
    }

    public DefinitionDraft state(String label) {
        states.add(label);
        return this;
    }

    public DefinitionDraft states(String... labels) {
        states.addAll(Arrays.asList(labels));
        return this;
    }

    /**
     * 以逗号分隔的文本设置状态列表，替换已有内容。
     */
    public DefinitionDraft statesText(String text) {
        states.clear();
        states.addAll(splitFieldText(text));
        return this;
    }

    public DefinitionDraft symbol(String symbol) {
        alphabet.add(symbol);
        return this;
    }

    public DefinitionDraft symbols(String... symbols) {
        alphabet.addAll(Arrays.asList(symbols));
        return this;
    }

    public DefinitionDraft alphabetText(String text) {
        alphabet.clear();
        alphabet.addAll(splitFieldText(text));
        return this;
    }

    public DefinitionDraft start(String label) {
        this.start = label;
        return this;
    }

    public DefinitionDraft accepting(String... labels) {
        accepting.addAll(Arrays.asList(labels));
        return this;
    }

    public DefinitionDraft acceptingText(String text) {
        accepting.clear();
        accepting.addAll(splitFieldText(text));
        return this;
    }

    public DefinitionDraft transition(String source, String symbol, String target) {
        transitions.add(new TransitionRow(source, symbol, target));
        return this;
    }

    /**
     * 删除指定行，与界面中删除表格行对应。
     * @param row 0 起始的行号。
     */
    public DefinitionDraft removeTransition(int row) {
        transitions.remove(row);
        return this;
    }

    public List<String> getStates() {
        return Collections.unmodifiableList(states);
    }

    public List<String> getAlphabet() {
        return Collections.unmodifiableList(alphabet);
    }

    public String getStart() {
        return start;
    }

    public List<String> getAccepting() {
        return Collections.unmodifiableList(accepting);
    }

    public List<TransitionRow> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }

    /**
     * 校验当前草稿。草稿本身不会被修改。
     */
    public ValidationResult validate() {
        return new Validator().validate(this);
    }

    private static List<String> splitFieldText(String text) {
        if (StringUtils.isBlank(text)) {
            return List.of();
        }
        return Arrays.stream(StringUtils.split(text, ','))
                .map(String::strip)
                .filter(StringUtils::isNotEmpty)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "DefinitionDraft(states=" + states + ", alphabet=" + alphabet + ", start=" + start
                + ", accepting=" + accepting + ", transitions=" + transitions + ")";
    }
}
