package com.contextbus.context;

/**
 * Value domains a {@link ContextValue} can be drawn from. Values from
 * different domains are never comparable.
 */
public enum ValueDomain {
    TEXT,
    NUMBER,
    BOOLEAN,
    REFERENCE
}
