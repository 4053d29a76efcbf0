package net.corda.flowref.service.sample;

import net.corda.flowref.flows.FlowDefinition;
import net.corda.flowref.flows.FlowLogic;

import java.util.Currency;

import static net.corda.flowref.flows.FlowParameter.optional;
import static net.corda.flowref.flows.FlowParameter.required;

public class PaymentFlow extends FlowLogic<String> {
    public static final Currency DEFAULT_CURRENCY = Currency.getInstance("GBP");

    public static final FlowDefinition<PaymentFlow> DEFINITION = FlowDefinition.builder(PaymentFlow.class)
        .constructor(
            args -> new PaymentFlow(
                args.get("amount", long.class),
                args.get("payee", String.class),
                args.getOrDefault("currency", Currency.class, DEFAULT_CURRENCY)),
            required("amount", long.class),
            required("payee", String.class),
            optional("currency", Currency.class))
        .build();

    private final long amount;
    private final String payee;
    private final Currency currency;

    public PaymentFlow(long amount, String payee, Currency currency) {
        this.amount = amount;
        this.payee = payee;
        this.currency = currency;
    }

    public long getAmount() {
        return amount;
    }

    public String getPayee() {
        return payee;
    }

    public Currency getCurrency() {
        return currency;
    }

    @Override
    public String call() {
        return amount + " " + currency.getCurrencyCode() + " to " + payee;
    }
}
