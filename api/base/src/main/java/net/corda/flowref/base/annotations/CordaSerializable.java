package net.corda.flowref.base.annotations;

import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks a class as permitted and intended to cross a process boundary, for example inside a
 * flow reference sent over RPC or stored with a scheduled state.
 * <p>
 * Only annotated classes, or classes with an explicitly registered encoding, are written to or read from
 * the wire. Nothing that merely happens to be on the class path can be instantiated by a remote party.
 */

// Do NOT add ElementType.TYPE_USE here, lambdas and anonymous types must never be serializable.

@Target(TYPE)
@Retention(RUNTIME)
@Inherited
public @interface CordaSerializable {
}
