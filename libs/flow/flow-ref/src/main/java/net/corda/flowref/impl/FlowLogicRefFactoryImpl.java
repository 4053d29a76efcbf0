package net.corda.flowref.impl;

import net.corda.flowref.flows.AppContext;
import net.corda.flowref.flows.FlowConstructor;
import net.corda.flowref.flows.FlowDefinition;
import net.corda.flowref.flows.FlowLogic;
import net.corda.flowref.flows.FlowLogicRef;
import net.corda.flowref.flows.FlowLogicRefFactory;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * {@link FlowLogicRefFactory} for a single trust domain: one {@link FlowWhitelist} and one
 * {@link FlowLogicRegistry}.
 * <p>
 * Validation happens on the way in and on the way out, because a {@link FlowLogicRef} may be created by a
 * process with a different whitelist from the one that resolves it.
 */
public final class FlowLogicRefFactoryImpl implements FlowLogicRefFactory {
    private static final Logger log = LoggerFactory.getLogger(FlowLogicRefFactoryImpl.class);

    private static final Object[] SINGLE_NULL_ARGUMENT = { null };

    private final FlowWhitelist flowWhitelist;
    private final FlowLogicRegistry registry;

    public FlowLogicRefFactoryImpl(@NotNull FlowWhitelist flowWhitelist, @NotNull FlowLogicRegistry registry) {
        this.flowWhitelist = Objects.requireNonNull(flowWhitelist, "flowWhitelist");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @NotNull
    public FlowWhitelist getFlowWhitelist() {
        return flowWhitelist;
    }

    @NotNull
    public FlowLogicRegistry getRegistry() {
        return registry;
    }

    /**
     * {@inheritDoc}
     * <p>
     * A bare {@code null} passed as {@code args} is taken to be a single {@code null} argument.
     */
    @Override
    @NotNull
    public FlowLogicRef create(@NotNull Class<? extends FlowLogic<?>> type, @Nullable Object... args) {
        final Object[] positional = args == null ? SINGLE_NULL_ARGUMENT : args;
        final String flowClassName = type.getName();
        flowWhitelist.validate(flowClassName, AppContext.EMPTY);

        final FlowDefinition<?> definition = registry.load(flowClassName, AppContext.EMPTY);
        final FlowConstructor<?> constructor = FlowConstructorResolver.matchPositional(definition, positional);
        return create(flowClassName, AppContext.EMPTY, FlowConstructorResolver.bindPositional(constructor, positional));
    }

    @Override
    @NotNull
    public FlowLogicRef create(@NotNull String flowClassName, @NotNull Map<String, ?> args) {
        return create(flowClassName, AppContext.EMPTY, args);
    }

    @Override
    @NotNull
    public FlowLogicRef create(@NotNull String flowClassName, @NotNull AppContext appContext, @NotNull Map<String, ?> args) {
        flowWhitelist.validate(flowClassName, appContext);
        final FlowDefinition<?> definition = registry.load(flowClassName, appContext);

        // Check we can find a constructor and populate the args to it, but don't call it.
        final ConstructorMatch<?> match = FlowConstructorResolver.matchNamed(definition, args);
        if (log.isDebugEnabled()) {
            log.debug("Created reference to {} using constructor {}", flowClassName, match.getConstructor());
        }
        return new FlowLogicRef(flowClassName, appContext, args);
    }

    @Override
    @NotNull
    public FlowLogic<?> toFlowLogic(@NotNull FlowLogicRef ref) {
        final String flowClassName = ref.getFlowLogicClassName();
        flowWhitelist.validate(flowClassName, ref.getAppContext());
        final FlowDefinition<?> definition = registry.load(flowClassName, ref.getAppContext());

        final ConstructorMatch<?> match = FlowConstructorResolver.matchNamed(definition, ref.getArgs());
        log.debug("Constructing {} using constructor {}", flowClassName, match.getConstructor());
        return match.newInstance();
    }
}
