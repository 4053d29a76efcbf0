package net.corda.flowref.impl.sample.flows;

import net.corda.flowref.flows.FlowDefinition;
import net.corda.flowref.flows.FlowLogic;

import static net.corda.flowref.flows.FlowParameter.required;

public class FailingConstructorFlow extends FlowLogic<Void> {
    public static final FlowDefinition<FailingConstructorFlow> DEFINITION = FlowDefinition.builder(FailingConstructorFlow.class)
        .constructor(args -> new FailingConstructorFlow(args.get("message", String.class)), required("message", String.class))
        .build();

    public FailingConstructorFlow(String message) {
        throw new IllegalStateException(message);
    }

    @Override
    public Void call() {
        throw new IllegalStateException("Should not reach this point");
    }
}
