package net.corda.flowref.service;

import net.corda.flowref.impl.FlowWhitelist;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static java.util.Collections.emptyList;
import static java.util.Collections.unmodifiableList;

/**
 * Operator supplied settings for one trust domain: which flows may be started by reference, and which
 * extra argument types may appear in encoded references.
 */
public final class FlowRefConfig {
    @NotNull
    public static final FlowRefConfig EMPTY = new FlowRefConfig(FlowWhitelist.EMPTY, emptyList());

    private final FlowWhitelist flowWhitelist;
    private final List<Class<?>> argumentTypes;

    public FlowRefConfig(@NotNull FlowWhitelist flowWhitelist, @NotNull List<Class<?>> argumentTypes) {
        this.flowWhitelist = Objects.requireNonNull(flowWhitelist, "flowWhitelist");
        this.argumentTypes = unmodifiableList(new ArrayList<>(argumentTypes));
    }

    @NotNull
    public FlowWhitelist getFlowWhitelist() {
        return flowWhitelist;
    }

    @NotNull
    public List<Class<?>> getArgumentTypes() {
        return argumentTypes;
    }

    @Override
    @NotNull
    public String toString() {
        return "FlowRefConfig(flowWhitelist=" + flowWhitelist + ", argumentTypes=" + argumentTypes + ')';
    }
}
