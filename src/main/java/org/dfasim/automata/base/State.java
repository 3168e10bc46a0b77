package org.dfasim.automata.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 代表确定有限自动机（DFA）中的一个状态。
 * State 是不可变对象，以标签唯一标识：两个标签相同的状态相等。
 */
public final class State implements Comparable<State> {

    private static final Logger logger = LoggerFactory.getLogger(State.class);

    @Getter
    private final String label;

    private final int hashCode;

    /**
     * 私有构造函数，外部应通过工厂方法创建 State。
     * @param label 状态的标签，已去除首尾空白。
     */
    private State(String label) {
        this.label = label;
        this.hashCode = Objects.hash(label);
        logger.debug("创建了一个State: {}", label);
    }

    /**
     * 工厂方法：以给定标签创建状态。
     * @param label 状态的标签，不能为空白。
     * @return 新的 State 实例。
     */
    public static State of(String label) {
        Objects.requireNonNull(label, "State label cannot be null");
        String trimmed = label.strip();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("State label cannot be blank");
        }
        return new State(trimmed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        State state = (State) o;
        return label.equals(state.label);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return label;
    }

    @Override
    public int compareTo(State other) {
        return this.label.compareTo(other.label);
    }
}
