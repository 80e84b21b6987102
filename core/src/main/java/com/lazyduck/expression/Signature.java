package com.lazyduck.expression;

import com.lazyduck.exception.PlanConstructionException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Declared parameters of an operator kind: ordered names, defaults for
 * trailing parameters, and the factory that rebuilds a node from operands.
 *
 * <p>Every expression class owns one signature, declared as a static field:
 * <pre>
 *   static final Signature&lt;Head&gt; SIGNATURE = Signature.builder("head", Head::new)
 *       .required("frame")
 *       .optional("n", 5)
 *       .build();
 * </pre>
 *
 * @param <T> the expression class
 */
public final class Signature<T extends Expr> {

    private static final Object REQUIRED = new Object() {
        @Override
        public String toString() {
            return "<required>";
        }
    };

    private final String kind;
    private final List<String> parameters;
    private final List<Object> defaults;
    private final Function<List<Object>, T> factory;

    private Signature(String kind, List<String> parameters, List<Object> defaults,
                      Function<List<Object>, T> factory) {
        this.kind = kind;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.defaults = Collections.unmodifiableList(new ArrayList<>(defaults));
        this.factory = factory;
    }

    public static <T extends Expr> Builder<T> builder(String kind, Function<List<Object>, T> factory) {
        return new Builder<>(kind, factory);
    }

    public String kind() {
        return kind;
    }

    public List<String> parameters() {
        return parameters;
    }

    /**
     * Returns the position of a parameter, or -1 if it is not declared.
     *
     * @param parameter the parameter name
     * @return the index or -1
     */
    public int indexOf(String parameter) {
        return parameters.indexOf(parameter);
    }

    public boolean isRequired(String parameter) {
        int index = indexOf(parameter);
        return index >= 0 && defaults.get(index) == REQUIRED;
    }

    /**
     * Returns the declared default of an optional parameter.
     *
     * @param parameter the parameter name
     * @return the default value
     * @throws PlanConstructionException if the parameter is unknown or required
     */
    public Object defaultValue(String parameter) {
        int index = indexOf(parameter);
        if (index < 0) {
            throw new PlanConstructionException(kind, "unknown parameter '" + parameter + "'");
        }
        if (defaults.get(index) == REQUIRED) {
            throw new PlanConstructionException(kind, "parameter '" + parameter + "' has no default");
        }
        return defaults.get(index);
    }

    /**
     * Completes a positional operand list with the defaults of omitted trailing parameters.
     *
     * @param positional the supplied operands
     * @return the full operand list
     * @throws PlanConstructionException on too many operands or a missing required one
     */
    List<Object> bind(List<?> positional) {
        if (positional.size() > parameters.size()) {
            throw new PlanConstructionException(kind, String.format(
                "expected at most %d operands %s, got %d", parameters.size(), parameters, positional.size()));
        }
        List<Object> bound = new ArrayList<>(parameters.size());
        bound.addAll(positional);
        for (int i = positional.size(); i < parameters.size(); i++) {
            Object fallback = defaults.get(i);
            if (fallback == REQUIRED) {
                throw new PlanConstructionException(kind, "missing required operand '" + parameters.get(i) + "'");
            }
            bound.add(fallback);
        }
        return Collections.unmodifiableList(bound);
    }

    /**
     * Builds a node from positional operands.
     *
     * @param positional the operands
     * @return the new node
     */
    public T create(Object... positional) {
        return factory.apply(Arrays.asList(positional));
    }

    /**
     * Builds a node from a full or partial operand list.
     *
     * @param operands the operands
     * @return the new node
     */
    public T create(List<Object> operands) {
        return factory.apply(operands);
    }

    /**
     * Builds a node from positional and named operands.
     *
     * @param positional leading operands, may be empty
     * @param named remaining operands by parameter name
     * @return the new node
     * @throws PlanConstructionException on unknown names, duplicates or missing required operands
     */
    public T create(List<?> positional, Map<String, ?> named) {
        Objects.requireNonNull(named, "named must not be null");
        List<Object> operands = new ArrayList<>(Collections.nCopies(parameters.size(), REQUIRED));
        for (int i = 0; i < positional.size(); i++) {
            if (i >= parameters.size()) {
                throw new PlanConstructionException(kind, String.format(
                    "expected at most %d operands %s, got %d", parameters.size(), parameters, positional.size()));
            }
            operands.set(i, positional.get(i));
        }
        for (Map.Entry<String, ?> entry : named.entrySet()) {
            int index = indexOf(entry.getKey());
            if (index < 0) {
                throw new PlanConstructionException(kind, String.format(
                    "unknown parameter '%s', expected one of %s", entry.getKey(), parameters));
            }
            if (index < positional.size()) {
                throw new PlanConstructionException(kind,
                    "parameter '" + entry.getKey() + "' given both by position and by name");
            }
            operands.set(index, entry.getValue());
        }
        for (int i = 0; i < operands.size(); i++) {
            if (operands.get(i) == REQUIRED) {
                if (defaults.get(i) == REQUIRED) {
                    throw new PlanConstructionException(kind, "missing required operand '" + parameters.get(i) + "'");
                }
                operands.set(i, defaults.get(i));
            }
        }
        return factory.apply(operands);
    }

    public T create(Map<String, ?> named) {
        return create(List.of(), named);
    }

    @Override
    public String toString() {
        return kind + parameters;
    }

    /**
     * Builder for signatures. Required parameters must precede optional ones.
     *
     * @param <T> the expression class
     */
    public static final class Builder<T extends Expr> {
        private final String kind;
        private final Function<List<Object>, T> factory;
        private final List<String> parameters = new ArrayList<>();
        private final List<Object> defaults = new ArrayList<>();

        private Builder(String kind, Function<List<Object>, T> factory) {
            this.kind = Objects.requireNonNull(kind, "kind must not be null");
            this.factory = Objects.requireNonNull(factory, "factory must not be null");
        }

        public Builder<T> required(String parameter) {
            if (!defaults.isEmpty() && defaults.get(defaults.size() - 1) != REQUIRED) {
                throw new IllegalStateException("Required parameter '" + parameter + "' follows an optional one");
            }
            return add(parameter, REQUIRED);
        }

        public Builder<T> optional(String parameter, Object defaultValue) {
            return add(parameter, defaultValue);
        }

        private Builder<T> add(String parameter, Object value) {
            if (parameters.contains(parameter)) {
                throw new IllegalStateException("Duplicate parameter '" + parameter + "'");
            }
            parameters.add(parameter);
            defaults.add(value);
            return this;
        }

        public Signature<T> build() {
            return new Signature<>(kind, parameters, defaults, factory);
        }
    }
}
