package net.corda.flowref.flows;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.invoke.MethodType;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Collections.unmodifiableMap;

/**
 * The arguments bound to the parameters of a {@link FlowConstructor}, keyed by parameter name.
 * Optional parameters which were not supplied are absent.
 */
public final class FlowArguments {
    private final Map<String, Object> values;

    private FlowArguments(@NotNull Map<String, Object> values) {
        this.values = values;
    }

    @NotNull
    public static FlowArguments of(@NotNull Map<String, ?> values) {
        return new FlowArguments(unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public boolean contains(@NotNull String name) {
        return values.containsKey(name);
    }

    /**
     * @throws IllegalArgumentException if no argument is bound to {@code name}.
     * @throws ClassCastException if the argument is not a {@code type}.
     */
    @Nullable
    public <V> V get(@NotNull String name, @NotNull Class<V> type) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("No argument bound to parameter " + name);
        }
        return cast(values.get(name), type);
    }

    /**
     * Returns the argument bound to {@code name}, or {@code defaultValue} when an optional
     * parameter was left out.
     */
    @Nullable
    public <V> V getOrDefault(@NotNull String name, @NotNull Class<V> type, @Nullable V defaultValue) {
        return values.containsKey(name) ? cast(values.get(name), type) : defaultValue;
    }

    @NotNull
    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @SuppressWarnings("unchecked")
    @Nullable
    private static <V> V cast(@Nullable Object value, @NotNull Class<V> type) {
        // Boxing turns int.class into Integer.class, so get("a", int.class) works.
        return (V) MethodType.methodType(type).wrap().returnType().cast(value);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        return this == obj || (obj instanceof FlowArguments && values.equals(((FlowArguments) obj).values));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    @NotNull
    public String toString() {
        return values.toString();
    }
}
