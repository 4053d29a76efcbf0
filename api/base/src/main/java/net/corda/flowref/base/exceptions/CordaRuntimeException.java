package net.corda.flowref.base.exceptions;

import net.corda.flowref.base.annotations.CordaSerializable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Base class for runtime errors that may be reported back across the RPC boundary.
 * <p>
 * When a third party exception has to be reported but cannot itself be serialized, its class name is kept
 * in {@link #getOriginalExceptionClassName()} and the message is prefixed with it.
 */
@CordaSerializable
public class CordaRuntimeException extends RuntimeException {
    private final String originalExceptionClassName;
    private final String originalMessage;

    public CordaRuntimeException(
        @Nullable String originalExceptionClassName,
        @Nullable String message,
        @Nullable Throwable cause
    ) {
        super(message, cause);
        this.originalExceptionClassName = originalExceptionClassName;
        this.originalMessage = message;
    }

    public CordaRuntimeException(@Nullable String message, @Nullable Throwable cause) {
        this(null, message, cause);
    }

    public CordaRuntimeException(@Nullable String message) {
        this(null, message, null);
    }

    /**
     * Wraps a foreign exception, remembering its class name.
     */
    @NotNull
    public static CordaRuntimeException wrap(@NotNull Throwable throwable) {
        return new CordaRuntimeException(throwable.getClass().getName(), throwable.getMessage(), throwable);
    }

    @Nullable
    public String getOriginalExceptionClassName() {
        return originalExceptionClassName;
    }

    @Nullable
    public String getOriginalMessage() {
        return originalMessage;
    }

    @Override
    @Nullable
    public String getMessage() {
        if (originalExceptionClassName == null) {
            return originalMessage;
        } else if (originalMessage == null) {
            return originalExceptionClassName;
        } else {
            return originalExceptionClassName + ": " + originalMessage;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), originalExceptionClassName, originalMessage);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (this == obj) {
            return true;
        } else if (obj == null || obj.getClass() != getClass()) {
            return false;
        } else {
            final CordaRuntimeException other = (CordaRuntimeException) obj;
            return Objects.equals(originalExceptionClassName, other.originalExceptionClassName) &&
                    Objects.equals(originalMessage, other.originalMessage) &&
                    Objects.equals(getCause(), other.getCause());
        }
    }
}
