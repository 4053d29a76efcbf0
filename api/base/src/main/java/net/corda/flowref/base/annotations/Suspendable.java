package net.corda.flowref.base.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks a method that the flow state machine may suspend and later resume from a checkpoint.
 */
@Target({ TYPE, METHOD })
@Retention(RUNTIME)
@Documented
public @interface Suspendable {
}
