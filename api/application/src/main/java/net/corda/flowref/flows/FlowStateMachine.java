package net.corda.flowref.flows;

import net.corda.flowref.base.annotations.DoNotImplement;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

import java.util.UUID;

/**
 * The view a running {@link FlowLogic} has of the state machine executing it. The state machine itself,
 * which suspends and checkpoints flows, lives outside this library.
 */
@DoNotImplement
public interface FlowStateMachine {

    /**
     * Identifies this state machine run. Sub-flows share the id of the flow that started them.
     */
    @NotNull
    UUID getId();

    @NotNull
    Logger getLogger();
}
