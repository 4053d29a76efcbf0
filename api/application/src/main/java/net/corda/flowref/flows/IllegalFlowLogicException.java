package net.corda.flowref.flows;

import net.corda.flowref.base.exceptions.CordaRuntimeException;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a {@link FlowLogicRef} cannot be created for, or resolved back into, a {@link FlowLogic}.
 * Subclasses tell the reasons apart so that an RPC endpoint can report them precisely.
 */
public abstract class IllegalFlowLogicException extends CordaRuntimeException {
    private final String flowClassName;

    protected IllegalFlowLogicException(@NotNull String flowClassName, @NotNull String message) {
        super(message);
        this.flowClassName = flowClassName;
    }

    @NotNull
    protected static String cannotConstruct(@NotNull String flowClassName, @NotNull String reason) {
        return FlowLogicRef.class.getSimpleName() + " cannot be constructed for "
            + FlowLogic.class.getSimpleName() + " of type " + flowClassName + ' ' + reason;
    }

    /**
     * The class name as supplied by the caller.
     */
    @NotNull
    public String getFlowClassName() {
        return flowClassName;
    }
}
