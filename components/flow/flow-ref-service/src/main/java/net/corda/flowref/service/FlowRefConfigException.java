package net.corda.flowref.service;

import net.corda.flowref.base.exceptions.CordaRuntimeException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public class FlowRefConfigException extends CordaRuntimeException {
    public FlowRefConfigException(@NotNull String message) {
        super(message);
    }

    public FlowRefConfigException(@NotNull String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
