package org.dfasim.codec;

import lombok.Getter;

import java.util.Objects;
import java.util.Optional;

/**
 * 交换文档格式错误或结构不完整。语义错误（例如迁移函数不完整）不在此列，
 * 它们以校验错误的形式报告。
 */
public final class DecodeError {

    public enum Kind {
        MALFORMED_DOCUMENT,
        MISSING_FIELD,
        INVALID_FIELD
    }

    @Getter
    private final Kind kind;
    private final String field;
    @Getter
    private final String message;

    private DecodeError(Kind kind, String field, String message) {
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.field = field;
        this.message = message;
    }

    static DecodeError malformed(String detail) {
        return new DecodeError(Kind.MALFORMED_DOCUMENT, null, "Document is not valid JSON: " + detail);
    }

    static DecodeError missingField(String field) {
        return new DecodeError(Kind.MISSING_FIELD, field, "Required field '" + field + "' is missing.");
    }

    static DecodeError invalidField(String field, String expected) {
        return new DecodeError(Kind.INVALID_FIELD, field, "Field '" + field + "' must be " + expected + ".");
    }

    /**
     * 出错字段的名称或路径，例如 {@code start} 或 {@code transitions[2].symbol}。
     */
    public Optional<String> getField() {
        return Optional.ofNullable(field);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DecodeError that = (DecodeError) o;
        return kind == that.kind && Objects.equals(field, that.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, field);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
