package org.dfasim.codec;

import lombok.Getter;
import org.dfasim.automata.models.AutomatonDefinition;
import org.dfasim.automata.validation.ValidationError;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 解码结果，三者必居其一：一个定义；一个文档结构错误；或者文档结构完好但定义本身不合法时的校验错误列表。
 * 失败时从不返回部分定义。
 */
public final class DecodeResult {

    private final AutomatonDefinition definition;
    private final DecodeError decodeError;
    @Getter
    private final List<ValidationError> validationErrors;

    private DecodeResult(AutomatonDefinition definition, DecodeError decodeError, List<ValidationError> validationErrors) {
        this.definition = definition;
        this.decodeError = decodeError;
        this.validationErrors = List.copyOf(validationErrors);
    }

    static DecodeResult decoded(AutomatonDefinition definition) {
        return new DecodeResult(Objects.requireNonNull(definition, "Definition cannot be null"), null, List.of());
    }

    static DecodeResult failed(DecodeError error) {
        return new DecodeResult(null, Objects.requireNonNull(error, "Error cannot be null"), List.of());
    }

    static DecodeResult invalid(List<ValidationError> errors) {
        return new DecodeResult(null, null, errors);
    }

    public boolean isSuccess() {
        return definition != null;
    }

    public Optional<AutomatonDefinition> getDefinition() {
        return Optional.ofNullable(definition);
    }

    public Optional<DecodeError> getDecodeError() {
        return Optional.ofNullable(decodeError);
    }

    /**
     * @throws IllegalStateException 如果解码失败。
     */
    public AutomatonDefinition orElseThrow() {
        if (definition == null) {
            throw new IllegalStateException("Decoding failed: " + (decodeError != null ? decodeError : validationErrors));
        }
        return definition;
    }

    @Override
    public String toString() {
        if (definition != null) {
            return "DecodeResult(" + definition + ")";
        }
        return "DecodeResult(" + (decodeError != null ? decodeError : validationErrors) + ")";
    }
}
