package net.corda.flowref.flows;

import org.jetbrains.annotations.NotNull;

public class NoMatchingFlowConstructorException extends IllegalFlowLogicException {
    public NoMatchingFlowConstructorException(@NotNull String flowClassName, @NotNull String msg) {
        super(flowClassName, cannotConstruct(flowClassName, msg));
    }
}
