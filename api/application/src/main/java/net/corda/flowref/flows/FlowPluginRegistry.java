package net.corda.flowref.flows;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Set;

import static java.util.Collections.emptyList;
import static java.util.Collections.emptySet;

/**
 * Implemented by applications to contribute flows to a node. Implementations are discovered with
 * {@link java.util.ServiceLoader}, so they need a public no-argument constructor and an entry in
 * {@code META-INF/services/net.corda.flowref.flows.FlowPluginRegistry}.
 */
public abstract class FlowPluginRegistry {

    /**
     * The flows this application ships. They become resolvable, but not startable by reference unless
     * they are also whitelisted.
     */
    @NotNull
    public List<FlowDefinition<?>> getFlowDefinitions() {
        return emptyList();
    }

    /**
     * Flows which this application needs to be startable by reference, for example over RPC.
     * These are added to the node's whitelist.
     */
    @NotNull
    public Set<Class<? extends FlowLogic<?>>> getRequiredFlows() {
        return emptySet();
    }
}
