package org.dfasim.automata.validation;

import lombok.Getter;
import org.dfasim.automata.models.AutomatonDefinition;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 校验结果：要么是一个可用的 {@link AutomatonDefinition}，要么是一组非空的校验错误。
 */
public final class ValidationResult {

    private final AutomatonDefinition definition;
    @Getter
    private final List<ValidationError> errors;

    private ValidationResult(AutomatonDefinition definition, List<ValidationError> errors) {
        this.definition = definition;
        this.errors = List.copyOf(errors);
    }

    public static ValidationResult valid(AutomatonDefinition definition) {
        return new ValidationResult(Objects.requireNonNull(definition, "Definition cannot be null"), List.of());
    }

    public static ValidationResult invalid(List<ValidationError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("An invalid result needs at least one error");
        }
        return new ValidationResult(null, errors);
    }

    public boolean isValid() {
        return definition != null;
    }

    public Optional<AutomatonDefinition> getDefinition() {
        return Optional.ofNullable(definition);
    }

    /**
     * 取出定义，仅在确定校验成功时调用。
     * @throws IllegalStateException 如果校验失败。
     */
    public AutomatonDefinition orElseThrow() {
        if (definition == null) {
            throw new IllegalStateException("Definition is invalid: " + errors);
        }
        return definition;
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult(valid " + definition + ")" : "ValidationResult(errors=" + errors + ")";
    }
}
