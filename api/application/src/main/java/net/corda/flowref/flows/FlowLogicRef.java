package net.corda.flowref.flows;

import net.corda.flowref.base.annotations.CordaSerializable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static java.util.Collections.unmodifiableMap;

/**
 * A reference to a {@link FlowLogic} which is safe to pass out of the process: only the name of the flow class,
 * the {@link AppContext} to resolve it in and the constructor arguments by parameter name.
 * <p>
 * Instances produced by {@link FlowLogicRefFactory#create} have passed that factory's whitelist. An instance built
 * with the public constructor, or decoded from the wire, has not been checked against any whitelist and its
 * arguments have not been matched to any constructor. Either way a node must hand it to
 * {@link FlowLogicRefFactory#toFlowLogic}, which checks the node's own whitelist and registry, before anything runs.
 */
@CordaSerializable
public final class FlowLogicRef {
    private final String flowLogicClassName;
    private final AppContext appContext;
    private final Map<String, Object> args;

    public FlowLogicRef(
        @NotNull String flowLogicClassName,
        @NotNull AppContext appContext,
        @NotNull Map<String, ?> args
    ) {
        if (flowLogicClassName == null || flowLogicClassName.isBlank()) {
            throw new IllegalArgumentException("flowLogicClassName must not be blank");
        }
        final Map<String, Object> copy = new LinkedHashMap<>(args);
        if (copy.containsKey(null)) {
            throw new IllegalArgumentException("Argument names must not be null");
        }
        this.flowLogicClassName = flowLogicClassName;
        this.appContext = Objects.requireNonNull(appContext, "appContext");
        this.args = unmodifiableMap(copy);
    }

    @NotNull
    public String getFlowLogicClassName() {
        return flowLogicClassName;
    }

    @NotNull
    public AppContext getAppContext() {
        return appContext;
    }

    /**
     * Constructor arguments keyed by parameter name. Values may be {@code null}.
     */
    @NotNull
    public Map<String, Object> getArgs() {
        return args;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (this == obj) {
            return true;
        } else if (!(obj instanceof FlowLogicRef)) {
            return false;
        }
        final FlowLogicRef other = (FlowLogicRef) obj;
        return flowLogicClassName.equals(other.flowLogicClassName)
            && appContext.equals(other.appContext)
            && args.equals(other.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(flowLogicClassName, appContext, args);
    }

    @Override
    @NotNull
    public String toString() {
        return "FlowLogicRef(flowLogicClassName=" + flowLogicClassName + ", appContext=" + appContext + ", args=" + args + ')';
    }
}
