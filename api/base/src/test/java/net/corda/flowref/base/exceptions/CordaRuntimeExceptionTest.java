package net.corda.flowref.base.exceptions;

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

public class CordaRuntimeExceptionTest {

    private final Throwable throwable = new Throwable();
    private final CordaRuntimeException cordaRuntimeException = new CordaRuntimeException(
            "testOriginalExceptionClassName",
            "testMessage",
            throwable);

    @Test
    public void getMessage() {
        String result = cordaRuntimeException.getMessage();

        Assertions.assertThat(result).isEqualTo("testOriginalExceptionClassName: testMessage");
    }

    @Test
    public void getMessageWithoutOriginalClassName() {
        CordaRuntimeException exception = new CordaRuntimeException("plain");

        Assertions.assertThat(exception.getMessage()).isEqualTo("plain");
        Assertions.assertThat(exception.getOriginalExceptionClassName()).isNull();
    }

    @Test
    public void getMessageWithoutOriginalMessage() {
        CordaRuntimeException exception = new CordaRuntimeException("some.Exception", null, null);

        Assertions.assertThat(exception.getMessage()).isEqualTo("some.Exception");
    }

    @Test
    public void getCause() {
        Assertions.assertThat(cordaRuntimeException.getCause()).isSameAs(throwable);
    }

    @Test
    public void wrapKeepsOriginalClassName() {
        IllegalStateException original = new IllegalStateException("broken");

        CordaRuntimeException wrapped = CordaRuntimeException.wrap(original);

        Assertions.assertThat(wrapped.getOriginalExceptionClassName()).isEqualTo(IllegalStateException.class.getName());
        Assertions.assertThat(wrapped.getOriginalMessage()).isEqualTo("broken");
        Assertions.assertThat(wrapped.getMessage()).isEqualTo("java.lang.IllegalStateException: broken");
        Assertions.assertThat(wrapped.getCause()).isSameAs(original);
    }

    @Test
    public void equality() {
        CordaRuntimeException same = new CordaRuntimeException("testOriginalExceptionClassName", "testMessage", throwable);
        CordaRuntimeException different = new CordaRuntimeException("testOriginalExceptionClassName", "other", throwable);

        Assertions.assertThat(cordaRuntimeException).isEqualTo(same).hasSameHashCodeAs(same);
        Assertions.assertThat(cordaRuntimeException).isNotEqualTo(different);
    }
}
