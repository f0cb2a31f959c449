package io.github.eutro.flowlint.lint;

import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.regex.Pattern;

/**
 * A flat namespace of rules by identifier.
 * <p>
 * An identifier may be registered without a rule: it is then recognised, so requesting it
 * is not an error, but it is never run.
 */
public final class Registry {
    private static final Pattern ID = Pattern.compile("[A-Za-z0-9]+");

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    /**
     * Register a rule reporting warnings.
     *
     * @param id   The identifier.
     * @param rule The rule, or null for a disabled placeholder.
     * @return This registry.
     * @throws IllegalArgumentException If the identifier is malformed or already registered.
     */
    public Registry register(String id, @Nullable Rule rule) {
        return register(id, rule, Severity.WARNING);
    }

    /**
     * Register a rule.
     *
     * @param id       The identifier.
     * @param rule     The rule, or null for a disabled placeholder.
     * @param severity The severity of the rule's diagnostics.
     * @return This registry.
     * @throws IllegalArgumentException If the identifier is malformed or already registered.
     */
    public synchronized Registry register(String id, @Nullable Rule rule, Severity severity) {
        if (!ID.matcher(id).matches()) throw new IllegalArgumentException("malformed rule identifier: " + id);
        if (entries.containsKey(id)) throw new IllegalArgumentException("rule already registered: " + id);
        entries.put(id, new Entry(id, rule, Objects.requireNonNull(severity, "severity")));
        return this;
    }

    public synchronized boolean contains(String id) {
        return entries.containsKey(id);
    }

    /**
     * Get the rule registered under an identifier.
     *
     * @param id The identifier.
     * @return The rule, or null if the identifier is unknown or a placeholder.
     */
    @Nullable
    public synchronized Rule get(String id) {
        Entry entry = entries.get(id);
        return entry == null ? null : entry.rule;
    }

    /**
     * Get every registered identifier, in registration order.
     *
     * @return The identifiers.
     */
    public synchronized List<String> ids() {
        return new ArrayList<>(entries.keySet());
    }

    synchronized Entry entry(String id) {
        Entry entry = entries.get(id);
        if (entry == null) throw new IllegalArgumentException("unknown rule: " + id);
        return entry;
    }

    static final class Entry {
        final String id;
        @Nullable
        final Rule rule;
        final Severity severity;

        Entry(String id, @Nullable Rule rule, Severity severity) {
            this.id = id;
            this.rule = rule;
            this.severity = severity;
        }
    }
}
