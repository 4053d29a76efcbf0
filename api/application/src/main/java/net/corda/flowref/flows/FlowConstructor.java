package net.corda.flowref.flows;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static java.util.Collections.unmodifiableList;
import static java.util.stream.Collectors.joining;

/**
 * One way of constructing a flow: an ordered list of {@link FlowParameter}s and the function which
 * builds the flow from them.
 */
public final class FlowConstructor<T extends FlowLogic<?>> {
    private final List<FlowParameter> parameters;
    private final FlowInstantiator<T> instantiator;

    public FlowConstructor(@NotNull List<FlowParameter> parameters, @NotNull FlowInstantiator<T> instantiator) {
        final List<FlowParameter> copy = new ArrayList<>(parameters);
        final Set<String> names = new HashSet<>();
        for (FlowParameter parameter : copy) {
            if (!names.add(parameter.getName())) {
                throw new IllegalArgumentException("Duplicate parameter name: " + parameter.getName());
            }
        }
        this.parameters = unmodifiableList(copy);
        this.instantiator = Objects.requireNonNull(instantiator, "instantiator");
    }

    @NotNull
    public List<FlowParameter> getParameters() {
        return parameters;
    }

    @NotNull
    public T newInstance(@NotNull FlowArguments arguments) {
        return instantiator.newInstance(arguments);
    }

    @Override
    @NotNull
    public String toString() {
        return parameters.stream().map(FlowParameter::toString).collect(joining(", ", "(", ")"));
    }
}
