package net.corda.flowref.flows;

import org.jetbrains.annotations.NotNull;

public class FlowNotWhitelistedException extends IllegalFlowLogicException {
    public FlowNotWhitelistedException(@NotNull String flowClassName) {
        super(flowClassName, FlowLogic.class.getSimpleName() + " of " + FlowLogicRef.class.getSimpleName()
            + " must have type on the whitelist: " + flowClassName);
    }
}
