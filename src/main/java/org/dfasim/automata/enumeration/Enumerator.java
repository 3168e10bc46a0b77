package org.dfasim.automata.enumeration;

import lombok.Getter;
import org.dfasim.automata.base.State;
import org.dfasim.automata.base.Symbol;
import org.dfasim.automata.base.Transition;
import org.dfasim.automata.models.AutomatonDefinition;
import org.dfasim.config.EngineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 按长度优先、同长度按字典序的顺序，枚举 DFA 接受的前 k 个串。
 * <p>
 * 搜索逐层扩展格局 (q, w)：每一层把上一层的每个格局按字母表声明顺序扩展一个符号，
 * 因此发现顺序本身就是所需的顺序，不需要额外排序。
 * 无法再到达任何接受状态的格局会被剪掉，它们永远不会产生输出。
 * 搜索受最大探索长度和前沿规模上限约束，总会终止。
 */
public final class Enumerator {

    private static final Logger logger = LoggerFactory.getLogger(Enumerator.class);

    @Getter
    private final EngineSettings settings;

    public Enumerator() {
        this(EngineSettings.load());
    }

    public Enumerator(EngineSettings settings) {
        this.settings = Objects.requireNonNull(settings, "Settings cannot be null");
    }

    /**
     * 使用设置中的默认数量上限进行枚举。
     */
    public EnumerationResult enumerate(AutomatonDefinition definition) {
        return enumerate(definition, settings.getEnumerationLimit());
    }

    /**
     * @param definition 已校验的 DFA。
     * @param limit      要找的串的数量，必须为正。
     * @return 至多 limit 个被接受的串；数量不足时附带 {@link LimitNotReached}。
     */
    public EnumerationResult enumerate(AutomatonDefinition definition, int limit) {
        Objects.requireNonNull(definition, "Definition cannot be null");
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }
        int maxLength = settings.getMaxWordLength();
        int maxFrontier = settings.getMaxFrontierSize();

        Set<State> live = liveStates(definition);
        List<List<Symbol>> found = new ArrayList<>();
        State start = definition.getStart();

        if (!live.contains(start)) {
            logger.debug("初始状态 {} 无法到达任何接受状态，语言为空", start);
            return notReached(found, limit, 0, LimitNotReached.Reason.LANGUAGE_EXHAUSTED);
        }

        List<Configuration> frontier = List.of(Configuration.initial(start));
        if (definition.isAccepting(start)) {
            found.add(List.of());
            if (found.size() == limit) {
                return new EnumerationResult(found, null);
            }
        }

        int length = 0;
        while (true) {
            if (length >= maxLength) {
                return notReached(found, limit, length, LimitNotReached.Reason.MAX_LENGTH_REACHED);
            }
            length++;
            List<Configuration> next = new ArrayList<>();
            for (Configuration configuration : frontier) {
                for (Symbol symbol : definition.getAlphabet().getSymbols()) {
                    State target = definition.next(configuration.getState(), symbol);
                    if (!live.contains(target)) {
                        continue;
                    }
                    Configuration successor = configuration.extend(symbol, target);
                    if (definition.isAccepting(target)) {
                        found.add(successor.getWord());
                        if (found.size() == limit) {
                            logger.debug("在长度 {} 处找到了全部 {} 个串", length, limit);
                            return new EnumerationResult(found, null);
                        }
                    }
                    next.add(successor);
                    if (next.size() > maxFrontier) {
                        logger.warn("长度 {} 的前沿超过上限 {}，提前停止枚举", length, maxFrontier);
                        return notReached(found, limit, length, LimitNotReached.Reason.FRONTIER_LIMIT_REACHED);
                    }
                }
            }
            if (next.isEmpty()) {
                return notReached(found, limit, length, LimitNotReached.Reason.LANGUAGE_EXHAUSTED);
            }
            frontier = next;
        }
    }

    private EnumerationResult notReached(List<List<Symbol>> found, int limit, int length, LimitNotReached.Reason reason) {
        LimitNotReached condition = new LimitNotReached(limit, found.size(), length, reason);
        logger.debug("枚举未达到上限: {}", condition);
        return new EnumerationResult(found, condition);
    }

    /**
     * 计算所有能到达某个接受状态的状态（含接受状态本身），沿反向迁移做广度优先搜索。
     */
    static Set<State> liveStates(AutomatonDefinition definition) {
        Map<State, List<State>> predecessors = new HashMap<>();
        for (Transition t : definition.getTransitions()) {
            predecessors.computeIfAbsent(t.getTarget(), k -> new ArrayList<>()).add(t.getSource());
        }
        Set<State> live = new HashSet<>(definition.getAccepting());
        Deque<State> queue = new ArrayDeque<>(definition.getAccepting());
        while (!queue.isEmpty()) {
            State state = queue.poll();
            for (State predecessor : predecessors.getOrDefault(state, List.of())) {
                if (live.add(predecessor)) {
                    queue.add(predecessor);
                }
            }
        }
        return live;
    }
}
