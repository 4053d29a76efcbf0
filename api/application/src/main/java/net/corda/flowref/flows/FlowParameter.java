package net.corda.flowref.flows;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.invoke.MethodType;
import java.util.Objects;

/**
 * Declares one parameter of a {@link FlowConstructor}: its name, its type, whether it accepts {@code null}
 * and whether it may be left out, in which case the {@link FlowInstantiator} supplies a default.
 */
public final class FlowParameter {
    private final String name;
    private final Class<?> type;
    private final boolean nullable;
    private final boolean optional;

    private FlowParameter(@NotNull String name, @NotNull Class<?> type, boolean nullable, boolean optional) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Parameter name must not be blank");
        }
        Objects.requireNonNull(type, "type");
        if (nullable && type.isPrimitive()) {
            throw new IllegalArgumentException("Primitive parameter " + name + " cannot be nullable");
        }
        this.name = name;
        this.type = type;
        this.nullable = nullable;
        this.optional = optional;
    }

    /**
     * A parameter which must be supplied with a non-null value.
     */
    @NotNull
    public static FlowParameter required(@NotNull String name, @NotNull Class<?> type) {
        return new FlowParameter(name, type, false, false);
    }

    /**
     * A parameter which must be supplied, but may be {@code null}.
     */
    @NotNull
    public static FlowParameter nullable(@NotNull String name, @NotNull Class<?> type) {
        return new FlowParameter(name, type, true, false);
    }

    /**
     * A parameter which has a default value and may be left out. When supplied it must not be {@code null}.
     */
    @NotNull
    public static FlowParameter optional(@NotNull String name, @NotNull Class<?> type) {
        return new FlowParameter(name, type, false, true);
    }

    /**
     * A parameter which has a default value, and accepts {@code null} when supplied.
     */
    @NotNull
    public static FlowParameter optionalNullable(@NotNull String name, @NotNull Class<?> type) {
        return new FlowParameter(name, type, true, true);
    }

    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    public Class<?> getType() {
        return type;
    }

    /**
     * The declared type, with primitives replaced by their wrapper class.
     */
    @NotNull
    public Class<?> getBoxedType() {
        return type.isPrimitive() ? MethodType.methodType(type).wrap().returnType() : type;
    }

    public boolean isNullable() {
        return nullable;
    }

    public boolean isOptional() {
        return optional;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (this == obj) {
            return true;
        } else if (!(obj instanceof FlowParameter)) {
            return false;
        }
        final FlowParameter other = (FlowParameter) obj;
        return name.equals(other.name) && type == other.type && nullable == other.nullable && optional == other.optional;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, nullable, optional);
    }

    @Override
    @NotNull
    public String toString() {
        return name + ": " + type.getSimpleName() + (nullable ? "?" : "") + (optional ? " = <default>" : "");
    }
}
