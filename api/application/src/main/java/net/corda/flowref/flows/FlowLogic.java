package net.corda.flowref.flows;

import net.corda.flowref.base.annotations.Suspendable;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

import java.util.UUID;

/**
 * A unit of business logic that a node can be asked to run by name, via a {@link FlowLogicRef}.
 * <p>
 * Subclasses take their inputs through a constructor. A node can only construct a subclass from a
 * {@link FlowLogicRef} if the class is registered with a {@link FlowDefinition} and appears on the node's
 * whitelist, see {@link FlowLogicRefFactory}.
 * <p>
 * Example:
 * <pre>{@code
 * public class IssueCashFlow extends FlowLogic<String> {
 *     private final long amount;
 *     private final String currency;
 *
 *     public IssueCashFlow(long amount, String currency) {
 *         this.amount = amount;
 *         this.currency = currency;
 *     }
 *
 *     @Suspendable
 *     @Override
 *     public String call() {
 *         getLogger().info("Issuing {} {}", amount, currency);
 *         return currency + amount;
 *     }
 * }
 * }</pre>
 *
 * @param <T> The type returned by {@link #call()}.
 */
public abstract class FlowLogic<T> {
    private FlowStateMachine stateMachine;

    /**
     * This is where the business logic goes.
     */
    @Suspendable
    public abstract T call();

    /**
     * Only available once the flow has been started, never from inside the constructor.
     *
     * @throws IllegalStateException if the flow has not been started.
     */
    @NotNull
    public final FlowStateMachine getStateMachine() {
        final FlowStateMachine current = stateMachine;
        if (current == null) {
            throw new IllegalStateException("This can only be done after the flow has been started.");
        }
        return current;
    }

    /**
     * Called by the state machine when it starts running this flow.
     */
    public final void setStateMachine(@NotNull FlowStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    /**
     * This is where flows should log things to.
     */
    @NotNull
    public Logger getLogger() {
        return getStateMachine().getLogger();
    }

    @NotNull
    public UUID getRunId() {
        return getStateMachine().getId();
    }
}
