package io.incrementaltests.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Structured test identifier: the test's home file ({@code module}), an optional
 * class scope and the test name.
 *
 * <p>Serialized as {@code module::scope::name}, or {@code module::name} when the
 * test has no enclosing scope. {@link #parse(String)} is the inverse of
 * {@link #serialize()}.
 */
public record NodeId(String module, String scope, String name) implements Comparable<NodeId> {

    static final String SEPARATOR = "::";

    public NodeId {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(name, "name");
        if (module.isBlank() || name.isBlank()) {
            throw new IllegalArgumentException("module and name must not be blank");
        }
        if (module.contains(SEPARATOR) || name.contains(SEPARATOR)
                || (scope != null && scope.contains(SEPARATOR))) {
            throw new IllegalArgumentException("segments must not contain '" + SEPARATOR + "'");
        }
        if (scope != null && scope.isBlank()) {
            scope = null;
        }
    }

    public static NodeId of(String module, String name) {
        return new NodeId(module, null, name);
    }

    public static NodeId of(String module, String scope, String name) {
        return new NodeId(module, scope, name);
    }

    /**
     * Parses the serialized form produced by {@link #serialize()}.
     *
     * @throws IllegalArgumentException if the value does not have two or three segments
     */
    public static NodeId parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("node id must not be null");
        }
        String[] parts = value.split(SEPARATOR, -1);
        return switch (parts.length) {
            case 2 -> new NodeId(parts[0], null, parts[1]);
            case 3 -> new NodeId(parts[0], parts[1], parts[2]);
            default -> throw new IllegalArgumentException("Malformed node id: " + value);
        };
    }

    public Optional<String> scopeSegment() {
        return Optional.ofNullable(scope);
    }

    public String serialize() {
        return scope == null
                ? module + SEPARATOR + name
                : module + SEPARATOR + scope + SEPARATOR + name;
    }

    /** Key of the containing module, used to aggregate durations per home file. */
    public String moduleKey() {
        return module;
    }

    /** Key of the containing class, or empty when the test is not inside a class. */
    public Optional<String> classKey() {
        return scope == null ? Optional.empty() : Optional.of(module + SEPARATOR + scope);
    }

    @Override
    public int compareTo(NodeId other) {
        return serialize().compareTo(other.serialize());
    }

    @Override
    public String toString() {
        return serialize();
    }
}
