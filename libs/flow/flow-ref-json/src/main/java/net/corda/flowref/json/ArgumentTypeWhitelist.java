package net.corda.flowref.json;

import net.corda.flowref.crypto.SecureHash;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static java.util.Collections.unmodifiableMap;

/**
 * The types a flow argument may have when a {@link net.corda.flowref.flows.FlowLogicRef} crosses a process
 * boundary. A decoder only ever maps a type name in the payload to one of these classes.
 */
public final class ArgumentTypeWhitelist {
    private static final List<Class<?>> DEFAULT_TYPES = List.of(
        Boolean.class, Byte.class, Character.class, Short.class, Integer.class, Long.class, Float.class, Double.class,
        String.class, BigDecimal.class, BigInteger.class, UUID.class, Instant.class, SecureHash.class
    );

    @NotNull
    public static final ArgumentTypeWhitelist DEFAULT = new ArgumentTypeWhitelist(index(DEFAULT_TYPES));

    private final Map<String, Class<?>> types;

    private ArgumentTypeWhitelist(@NotNull Map<String, Class<?>> types) {
        this.types = types;
    }

    /**
     * Returns a whitelist of the default types plus {@code extraTypes}.
     */
    @NotNull
    public ArgumentTypeWhitelist with(@NotNull Collection<? extends Class<?>> extraTypes) {
        final Map<String, Class<?>> merged = new LinkedHashMap<>(types);
        for (Class<?> type : extraTypes) {
            if (type.isPrimitive() || type.isArray()) {
                throw new IllegalArgumentException("Argument type must be a boxed or object type: " + type.getName());
            }
            merged.put(type.getName(), type);
        }
        return new ArgumentTypeWhitelist(unmodifiableMap(merged));
    }

    public boolean isAllowed(@NotNull Class<?> type) {
        return types.get(type.getName()) == type;
    }

    /**
     * @return the whitelisted class called {@code typeName}, or {@code null}.
     */
    @Nullable
    public Class<?> lookup(@NotNull String typeName) {
        return types.get(typeName);
    }

    @NotNull
    private static Map<String, Class<?>> index(@NotNull Collection<Class<?>> classes) {
        final Map<String, Class<?>> result = new LinkedHashMap<>();
        classes.forEach(type -> result.put(type.getName(), type));
        return unmodifiableMap(result);
    }

    @Override
    @NotNull
    public String toString() {
        return "ArgumentTypeWhitelist" + types.keySet();
    }
}
