package net.corda.flowref.impl.sample.flows;

import net.corda.flowref.flows.FlowDefinition;
import net.corda.flowref.flows.FlowLogic;

import static net.corda.flowref.flows.FlowParameter.nullable;
import static net.corda.flowref.flows.FlowParameter.optional;
import static net.corda.flowref.flows.FlowParameter.required;

public class IssueFlow extends FlowLogic<String> {
    public static final String DEFAULT_CURRENCY = "GBP";

    public static final FlowDefinition<IssueFlow> DEFINITION = FlowDefinition.builder(IssueFlow.class)
        .constructor(args -> new IssueFlow(
                args.get("amount", long.class),
                args.getOrDefault("currency", String.class, DEFAULT_CURRENCY),
                args.get("memo", String.class)),
            required("amount", long.class),
            optional("currency", String.class),
            nullable("memo", String.class))
        .build();

    private final long amount;
    private final String currency;
    private final String memo;

    public IssueFlow(long amount, String currency, String memo) {
        this.amount = amount;
        this.currency = currency;
        this.memo = memo;
    }

    public long getAmount() {
        return amount;
    }

    public String getCurrency() {
        return currency;
    }

    public String getMemo() {
        return memo;
    }

    @Override
    public String call() {
        return amount + " " + currency;
    }
}
