package com.contextbus.conflict;

import com.contextbus.context.ContextValue;
import com.contextbus.context.SemanticKeys;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Expected text shapes per key or namespace, e.g. {@code version -> ^\d+\.\d+}.
 * A full-key entry takes precedence over its namespace.
 */
public class KeySchemaTable {

    private final Map<String, Pattern> schemas;

    public KeySchemaTable(Map<String, String> rawSchemas) {
        Map<String, Pattern> compiled = new LinkedHashMap<>();
        rawSchemas.forEach((scope, regex) -> compiled.put(scope, Pattern.compile(regex)));
        this.schemas = Map.copyOf(compiled);
    }

    public static KeySchemaTable empty() {
        return new KeySchemaTable(Map.of());
    }

    public Optional<Pattern> schemaFor(String key) {
        Pattern exact = schemas.get(key);
        if (exact != null) {
            return Optional.of(exact);
        }
        return Optional.ofNullable(schemas.get(SemanticKeys.namespace(key)));
    }

    /**
     * Whether a value fits the schema declared for {@code key}. Keys without
     * a schema, and non-text values, always conform.
     */
    public boolean conforms(String key, ContextValue value) {
        if (!(value instanceof ContextValue.Text text)) {
            return true;
        }
        return schemaFor(key).map(p -> p.matcher(text.value()).matches()).orElse(true);
    }
}
