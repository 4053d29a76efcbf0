package net.corda.flowref.impl;

import net.corda.flowref.flows.AmbiguousFlowConstructorException;
import net.corda.flowref.flows.FlowArguments;
import net.corda.flowref.flows.FlowConstructor;
import net.corda.flowref.flows.FlowDefinition;
import net.corda.flowref.flows.FlowLogic;
import net.corda.flowref.flows.FlowParameter;
import net.corda.flowref.flows.NoMatchingFlowConstructorException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static java.util.stream.Collectors.toList;

/**
 * Matches arguments against the constructors of a {@link FlowDefinition}.
 * <p>
 * Positional arguments must match exactly one constructor. Named arguments select the first constructor,
 * in declaration order, that they satisfy completely; several satisfiable constructors are not an error.
 */
final class FlowConstructorResolver {
    private FlowConstructorResolver() {
    }

    /**
     * @throws NoMatchingFlowConstructorException if no constructor accepts {@code args}.
     * @throws AmbiguousFlowConstructorException if more than one does.
     */
    @NotNull
    static <T extends FlowLogic<?>> FlowConstructor<T> matchPositional(
        @NotNull FlowDefinition<T> definition,
        @NotNull Object[] args
    ) {
        final List<FlowConstructor<T>> candidates = new ArrayList<>();
        for (FlowConstructor<T> constructor : definition.getConstructors()) {
            if (acceptsPositional(constructor, args)) {
                candidates.add(constructor);
            }
        }
        if (candidates.isEmpty()) {
            throw new NoMatchingFlowConstructorException(definition.getFlowClassName(),
                "due to missing constructor for arguments: " + argumentTypes(args));
        } else if (candidates.size() > 1) {
            throw new AmbiguousFlowConstructorException(definition.getFlowClassName(),
                "due to ambiguous match against the constructors: " + argumentTypes(args));
        }
        return candidates.get(0);
    }

    /**
     * Binds positional arguments to the parameter names of {@code constructor}.
     */
    @NotNull
    static Map<String, Object> bindPositional(@NotNull FlowConstructor<?> constructor, @NotNull Object[] args) {
        final List<FlowParameter> parameters = constructor.getParameters();
        final Map<String, Object> named = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            named.put(parameters.get(i).getName(), args[i]);
        }
        return named;
    }

    /**
     * @throws NoMatchingFlowConstructorException if no constructor can be satisfied by {@code args}.
     */
    @NotNull
    static <T extends FlowLogic<?>> ConstructorMatch<T> matchNamed(
        @NotNull FlowDefinition<T> definition,
        @NotNull Map<String, ?> args
    ) {
        for (FlowConstructor<T> constructor : definition.getConstructors()) {
            final Optional<FlowArguments> arguments = bindNamed(constructor, args);
            if (arguments.isPresent()) {
                // First declared match wins, even if a later constructor would also fit.
                return new ConstructorMatch<>(constructor, arguments.get());
            }
        }
        throw new NoMatchingFlowConstructorException(definition.getFlowClassName(),
            "as could not find matching constructor for: " + args.keySet());
    }

    private static boolean acceptsPositional(@NotNull FlowConstructor<?> constructor, @NotNull Object[] args) {
        final List<FlowParameter> parameters = constructor.getParameters();
        if (parameters.size() != args.length) {
            return false;
        }
        for (int i = 0; i < args.length; i++) {
            // null arguments are checked against nullability once the constructor is chosen.
            if (args[i] != null && !isAssignable(parameters.get(i), args[i])) {
                return false;
            }
        }
        return true;
    }

    @NotNull
    private static Optional<FlowArguments> bindNamed(@NotNull FlowConstructor<?> constructor, @NotNull Map<String, ?> args) {
        final Map<String, Object> bound = new LinkedHashMap<>();
        final Set<String> usedKeys = new HashSet<>();
        for (FlowParameter parameter : constructor.getParameters()) {
            final String name = parameter.getName();
            if (args.containsKey(name)) {
                final Object value = args.get(name);
                if (!canBind(parameter, value)) {
                    return Optional.empty();
                }
                bound.put(name, value);
                usedKeys.add(name);
            } else if (!parameter.isOptional()) {
                return Optional.empty();
            }
        }
        if (!usedKeys.containsAll(args.keySet())) {
            // Not all args were used.
            return Optional.empty();
        }
        return Optional.of(FlowArguments.of(bound));
    }

    private static boolean canBind(@NotNull FlowParameter parameter, @Nullable Object value) {
        return value == null ? parameter.isNullable() : isAssignable(parameter, value);
    }

    /**
     * Primitive parameters only accept their own wrapper type, so an {@code int} parameter
     * takes an {@link Integer} but not a {@link Short}.
     */
    private static boolean isAssignable(@NotNull FlowParameter parameter, @NotNull Object value) {
        return parameter.getBoxedType().isAssignableFrom(value.getClass());
    }

    @NotNull
    private static List<String> argumentTypes(@NotNull Object[] args) {
        return Arrays.stream(args)
            .map(arg -> arg == null ? null : arg.getClass().getName())
            .map(name -> Objects.toString(name, "null"))
            .collect(toList());
    }
}
