package net.corda.flowref.flows;

import org.jetbrains.annotations.NotNull;

/**
 * More than one constructor accepts the given positional arguments. Pass the arguments by name, or pass
 * non-null values for the parameters which tell the constructors apart.
 */
public class AmbiguousFlowConstructorException extends IllegalFlowLogicException {
    public AmbiguousFlowConstructorException(@NotNull String flowClassName, @NotNull String msg) {
        super(flowClassName, cannotConstruct(flowClassName, msg));
    }
}
