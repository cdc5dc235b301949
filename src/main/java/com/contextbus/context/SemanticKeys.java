package com.contextbus.context;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Helpers for semantic keys of the form {@code namespace.name}.
 *
 * Two keys denote the same concept when their canonical forms match:
 * case is ignored and separators ({@code -}, {@code _}, whitespace) inside
 * the name are dropped. The namespace split is preserved.
 */
public final class SemanticKeys {

    /** Source label used for entries seeded from submission parameters. */
    public static final String FOUNDATION_SOURCE = "foundation";

    private SemanticKeys() {}

    public static String namespace(String key) {
        int dot = key.indexOf('.');
        return dot < 0 ? "" : key.substring(0, dot);
    }

    public static String name(String key) {
        int dot = key.indexOf('.');
        return dot < 0 ? key : key.substring(dot + 1);
    }

    public static String canonical(String key) {
        String ns = namespace(key).toLowerCase(Locale.ROOT);
        String name = name(key).replaceAll("[-_\\s]", "").toLowerCase(Locale.ROOT);
        return ns.isEmpty() ? name : ns + "." + name;
    }

    public static boolean sameConcept(String left, String right) {
        return canonical(left).equals(canonical(right));
    }

    /**
     * Picks the label two aliased keys are rewritten to: the longer label,
     * ties broken by natural ordering so the choice never depends on
     * arrival order.
     */
    public static String canonicalLabel(String left, String right) {
        if (left.length() != right.length()) {
            return left.length() > right.length() ? left : right;
        }
        return left.compareTo(right) <= 0 ? left : right;
    }

    /**
     * Splits the name part into lowercase tokens on separators and
     * camel-case boundaries: {@code clusterCurator-upgrade} gives
     * {@code [cluster, curator, upgrade]}.
     */
    public static Set<String> tokens(String key) {
        String spaced = name(key)
            .replaceAll("([a-z0-9])([A-Z])", "$1 $2")
            .replaceAll("[-_.\\s]+", " ")
            .trim()
            .toLowerCase(Locale.ROOT);
        Set<String> tokens = new LinkedHashSet<>();
        if (spaced.isEmpty()) {
            return tokens;
        }
        List<String> parts = new ArrayList<>(List.of(spaced.split(" ")));
        tokens.addAll(parts);
        return tokens;
    }
}
