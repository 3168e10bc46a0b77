package org.dfasim.automata.enumeration;

import lombok.Getter;

import java.util.Objects;

/**
 * 枚举在达到请求数量之前停止。这不是失败，而是带限定条件的成功。
 */
@Getter
public final class LimitNotReached {

    public enum Reason {
        /** 所有仍可能到达接受状态的格局都已探索完，语言是有限的（或为空）。 */
        LANGUAGE_EXHAUSTED,
        /** 达到了最大探索长度。 */
        MAX_LENGTH_REACHED,
        /** 前沿规模超过了上限。 */
        FRONTIER_LIMIT_REACHED
    }

    private final int requested;
    private final int found;
    private final int exploredLength;
    private final Reason reason;

    LimitNotReached(int requested, int found, int exploredLength, Reason reason) {
        this.requested = requested;
        this.found = found;
        this.exploredLength = exploredLength;
        this.reason = Objects.requireNonNull(reason, "Reason cannot be null.");
    }

    /**
     * 区分“一个都没找到”和“找到的少于请求的数量”。
     */
    public boolean isEmpty() {
        return found == 0;
    }

    @Override
    public String toString() {
        return "LimitNotReached(found " + found + " of " + requested + ", explored length " + exploredLength
                + ", " + reason + ")";
    }
}
