package net.corda.flowref.flows;

import org.jetbrains.annotations.NotNull;

/**
 * No flow of the requested name is registered, or it was registered from an attachment which the
 * reference's {@link AppContext} does not list.
 */
public class FlowClassNotFoundException extends IllegalFlowLogicException {
    public FlowClassNotFoundException(@NotNull String flowClassName, @NotNull AppContext appContext) {
        super(flowClassName, cannotConstruct(flowClassName, "as no such flow is registered for " + appContext));
    }
}
