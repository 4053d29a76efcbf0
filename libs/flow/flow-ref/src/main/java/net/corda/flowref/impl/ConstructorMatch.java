package net.corda.flowref.impl;

import net.corda.flowref.flows.FlowArguments;
import net.corda.flowref.flows.FlowConstructor;
import net.corda.flowref.flows.FlowLogic;
import org.jetbrains.annotations.NotNull;

/**
 * A constructor together with the arguments bound to its parameters. Never stored or sent anywhere.
 */
final class ConstructorMatch<T extends FlowLogic<?>> {
    private final FlowConstructor<T> constructor;
    private final FlowArguments arguments;

    ConstructorMatch(@NotNull FlowConstructor<T> constructor, @NotNull FlowArguments arguments) {
        this.constructor = constructor;
        this.arguments = arguments;
    }

    @NotNull
    FlowConstructor<T> getConstructor() {
        return constructor;
    }

    @NotNull
    FlowArguments getArguments() {
        return arguments;
    }

    @NotNull
    T newInstance() {
        return constructor.newInstance(arguments);
    }
}
