package net.corda.flowref.impl;

import net.corda.flowref.base.exceptions.CordaRuntimeException;
import net.corda.flowref.flows.FlowArguments;
import net.corda.flowref.flows.FlowConstructor;
import net.corda.flowref.flows.FlowDefinition;
import net.corda.flowref.flows.FlowLogic;
import net.corda.flowref.flows.FlowParameter;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import static java.util.stream.Collectors.joining;

/**
 * Builds a {@link FlowDefinition} from the public constructors of a flow class, for registering flows at startup
 * without writing out their parameters by hand.
 * <p>
 * Parameter names come from the class file, so the flow must be compiled with {@code -parameters}. Reference
 * parameters accept {@code null}, primitive parameters do not, and no parameter is optional.
 * <p>
 * Constructors are declared fewest parameters first, then by the names of their parameter types, so named
 * matching picks the same overload on every JVM. Register overloaded constructors explicitly when a different
 * order is needed.
 */
public final class ReflectiveFlowDefinitions {
    private static final Logger log = LoggerFactory.getLogger(ReflectiveFlowDefinitions.class);

    private static final Comparator<Constructor<?>> DECLARATION_ORDER =
        Comparator.<Constructor<?>>comparingInt(Constructor::getParameterCount)
            .thenComparing(ReflectiveFlowDefinitions::signature);

    private ReflectiveFlowDefinitions() {
    }

    /**
     * @throws IllegalArgumentException if {@code flowClass} is abstract, an inner class, or was compiled
     * without parameter names.
     */
    @NotNull
    public static <T extends FlowLogic<?>> FlowDefinition<T> forClass(@NotNull Class<T> flowClass) {
        final int modifiers = flowClass.getModifiers();
        if (Modifier.isAbstract(modifiers) || flowClass.isInterface()) {
            throw new IllegalArgumentException("Flow " + flowClass.getName() + " cannot be abstract");
        }
        if (flowClass.isMemberClass() && !Modifier.isStatic(modifiers)) {
            throw new IllegalArgumentException("Flow " + flowClass.getName() + " must not be an inner class");
        }
        final FlowDefinition.Builder<T> builder = FlowDefinition.builder(flowClass);
        final Constructor<?>[] constructors = flowClass.getConstructors();
        Arrays.sort(constructors, DECLARATION_ORDER);
        for (Constructor<?> constructor : constructors) {
            builder.constructor(toFlowConstructor(flowClass, constructor));
        }
        final FlowDefinition<T> definition = builder.build();
        if (definition.getConstructors().isEmpty()) {
            log.warn("Flow {} has no public constructor, so no reference to it can be created", flowClass.getName());
        }
        return definition;
    }

    @NotNull
    private static String signature(@NotNull Constructor<?> constructor) {
        return Arrays.stream(constructor.getParameterTypes()).map(Class::getName).collect(joining(","));
    }

    @NotNull
    private static <T extends FlowLogic<?>> FlowConstructor<T> toFlowConstructor(
        @NotNull Class<T> flowClass,
        @NotNull Constructor<?> constructor
    ) {
        final List<FlowParameter> parameters = new ArrayList<>();
        for (Parameter parameter : constructor.getParameters()) {
            if (!parameter.isNamePresent()) {
                throw new IllegalArgumentException("Flow " + flowClass.getName()
                    + " must be compiled with -parameters to be registered reflectively");
            }
            final Class<?> type = parameter.getType();
            parameters.add(type.isPrimitive()
                ? FlowParameter.required(parameter.getName(), type)
                : FlowParameter.nullable(parameter.getName(), type));
        }
        // A public constructor of a non-public nested class still needs this.
        constructor.trySetAccessible();
        return new FlowConstructor<>(parameters, arguments -> invoke(flowClass, constructor, parameters, arguments));
    }

    @NotNull
    private static <T extends FlowLogic<?>> T invoke(
        @NotNull Class<T> flowClass,
        @NotNull Constructor<?> constructor,
        @NotNull List<FlowParameter> parameters,
        @NotNull FlowArguments arguments
    ) {
        final Object[] values = new Object[parameters.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = arguments.get(parameters.get(i).getName(), Object.class);
        }
        try {
            return flowClass.cast(constructor.newInstance(values));
        } catch (InvocationTargetException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw CordaRuntimeException.wrap(cause);
        } catch (InstantiationException | IllegalAccessException e) {
            throw new IllegalStateException("Cannot invoke constructor of " + flowClass.getName(), e);
        }
    }
}
