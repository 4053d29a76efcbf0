package net.corda.flowref.flows;

import org.jetbrains.annotations.NotNull;

/**
 * Creates a flow from its bound constructor arguments. Exceptions thrown here are the flow's own
 * and reach the caller of {@link FlowLogicRefFactory#toFlowLogic} as they are.
 */
@FunctionalInterface
public interface FlowInstantiator<T extends FlowLogic<?>> {
    @NotNull
    T newInstance(@NotNull FlowArguments arguments);
}
