package net.corda.flowref.impl.sample.flows;

import net.corda.flowref.flows.FlowDefinition;
import net.corda.flowref.flows.FlowLogic;

import static net.corda.flowref.flows.FlowParameter.required;

public class ExampleFlow extends FlowLogic<String> {
    public static final FlowDefinition<ExampleFlow> DEFINITION = FlowDefinition.builder(ExampleFlow.class)
        .constructor(args -> new ExampleFlow(args.get("a", int.class), args.get("b", String.class)),
            required("a", int.class),
            required("b", String.class))
        .build();

    private final int a;
    private final String b;

    public ExampleFlow(int a, String b) {
        this.a = a;
        this.b = b;
    }

    public int getA() {
        return a;
    }

    public String getB() {
        return b;
    }

    @Override
    public String call() {
        return b + a;
    }
}
