package net.corda.flowref.base.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.CLASS;

/**
 * Marks an interface that the platform implements on behalf of applications.
 * <p>
 * New methods may be added to such interfaces in later releases. Applications should consume them
 * and never provide their own implementation.
 */
@Retention(CLASS)
@Target(TYPE)
@Documented
@Inherited
public @interface DoNotImplement {
}
