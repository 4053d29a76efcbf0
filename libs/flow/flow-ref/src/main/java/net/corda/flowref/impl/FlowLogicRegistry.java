package net.corda.flowref.impl;

import net.corda.flowref.flows.AppContext;
import net.corda.flowref.flows.FlowClassNotFoundException;
import net.corda.flowref.flows.FlowDefinition;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Collections.emptyMap;
import static java.util.Collections.unmodifiableMap;

/**
 * The flows one trust domain knows how to construct, keyed by flow class name.
 * <p>
 * This stands in for loading classes by name: a flow which is not registered here cannot be resolved,
 * whatever is on the class path. A sending process and a receiving process each hold their own registry.
 */
public final class FlowLogicRegistry {
    @NotNull
    public static final FlowLogicRegistry EMPTY = new FlowLogicRegistry(emptyMap());

    private final Map<String, FlowDefinition<?>> definitions;

    private FlowLogicRegistry(@NotNull Map<String, FlowDefinition<?>> definitions) {
        this.definitions = definitions;
    }

    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the definition of {@code flowClassName} if it is visible in {@code appContext}. Flows installed on
     * the node are always visible; flows registered from an attachment only when {@code appContext} lists it.
     *
     * @throws FlowClassNotFoundException if there is no such visible definition.
     */
    @NotNull
    public FlowDefinition<?> load(@NotNull String flowClassName, @NotNull AppContext appContext) {
        final FlowDefinition<?> definition = definitions.get(flowClassName);
        if (definition == null || (definition.getAttachment() != null && !appContext.contains(definition.getAttachment()))) {
            throw new FlowClassNotFoundException(flowClassName, appContext);
        }
        return definition;
    }

    @NotNull
    public Optional<FlowDefinition<?>> find(@NotNull String flowClassName) {
        return Optional.ofNullable(definitions.get(flowClassName));
    }

    @NotNull
    public Set<String> getFlowClassNames() {
        return definitions.keySet();
    }

    public int size() {
        return definitions.size();
    }

    @Override
    @NotNull
    public String toString() {
        return "FlowLogicRegistry" + definitions.keySet();
    }

    public static final class Builder {
        private final Map<String, FlowDefinition<?>> definitions = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if a flow of the same class name is already registered.
         */
        @NotNull
        public Builder register(@NotNull FlowDefinition<?> definition) {
            final FlowDefinition<?> existing = definitions.putIfAbsent(definition.getFlowClassName(), definition);
            if (existing != null) {
                throw new IllegalArgumentException("Flow " + definition.getFlowClassName() + " is already registered");
            }
            return this;
        }

        @NotNull
        public Builder registerAll(@NotNull Collection<? extends FlowDefinition<?>> definitions) {
            definitions.forEach(this::register);
            return this;
        }

        @NotNull
        public FlowLogicRegistry build() {
            return new FlowLogicRegistry(unmodifiableMap(new LinkedHashMap<>(definitions)));
        }
    }
}
