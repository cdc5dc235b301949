package com.contextbus.context;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Typed value carried by a {@link ContextEntry}.
 *
 * Conflict detection checks the domain first and only compares values
 * that share a domain.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ContextValue.Text.class, name = "text"),
    @JsonSubTypes.Type(value = ContextValue.Numeric.class, name = "number"),
    @JsonSubTypes.Type(value = ContextValue.Flag.class, name = "bool"),
    @JsonSubTypes.Type(value = ContextValue.Reference.class, name = "ref")
})
public sealed interface ContextValue {

    ValueDomain domain();

    /** Human-readable rendering, used in rationales and size estimates. */
    String render();

    static ContextValue text(String value) {
        return new Text(value);
    }

    static ContextValue number(BigDecimal value) {
        return new Numeric(value);
    }

    static ContextValue number(long value) {
        return new Numeric(BigDecimal.valueOf(value));
    }

    static ContextValue flag(boolean value) {
        return new Flag(value);
    }

    static ContextValue reference(String refType, String refId) {
        return new Reference(refType, refId);
    }

    /**
     * Wraps a raw submission parameter. Strings, numbers and booleans keep
     * their domain; anything else is rendered as text.
     */
    static ContextValue of(Object raw) {
        if (raw instanceof Boolean b) {
            return new Flag(b);
        }
        if (raw instanceof BigDecimal d) {
            return new Numeric(d);
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
            return new Numeric(BigDecimal.valueOf(((Number) raw).longValue()));
        }
        if (raw instanceof Number n) {
            return new Numeric(BigDecimal.valueOf(n.doubleValue()));
        }
        return new Text(String.valueOf(raw));
    }

    record Text(String value) implements ContextValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ValueDomain domain() {
            return ValueDomain.TEXT;
        }

        @Override
        public String render() {
            return value;
        }
    }

    record Numeric(BigDecimal value) implements ContextValue {
        public Numeric {
            Objects.requireNonNull(value, "value");
            value = value.stripTrailingZeros();
        }

        @Override
        public ValueDomain domain() {
            return ValueDomain.NUMBER;
        }

        @Override
        public String render() {
            return value.toPlainString();
        }
    }

    record Flag(boolean value) implements ContextValue {
        @Override
        public ValueDomain domain() {
            return ValueDomain.BOOLEAN;
        }

        @Override
        public String render() {
            return Boolean.toString(value);
        }
    }

    record Reference(String refType, String refId) implements ContextValue {
        public Reference {
            Objects.requireNonNull(refType, "refType");
            Objects.requireNonNull(refId, "refId");
        }

        @Override
        public ValueDomain domain() {
            return ValueDomain.REFERENCE;
        }

        @Override
        public String render() {
            return refType + ":" + refId;
        }
    }
}
