package net.corda.flowref.json;

import net.corda.flowref.base.annotations.CordaSerializable;
import net.corda.flowref.base.exceptions.CordaRuntimeException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a {@link net.corda.flowref.flows.FlowLogicRef} cannot be written to or read from JSON.
 */
@CordaSerializable
public class FlowLogicRefSerializationException extends CordaRuntimeException {
    public FlowLogicRefSerializationException(@NotNull String message) {
        super(message);
    }

    public FlowLogicRefSerializationException(@NotNull String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
