package net.corda.flowref.flows;

import net.corda.flowref.base.annotations.DoNotImplement;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * Converts between {@link FlowLogic} instances and {@link FlowLogicRef}s.
 * <p>
 * The flow class is checked against the whitelist on the way in and again on the way out, since a reference
 * may be passed between processes with differing whitelists. Constructors are matched using the
 * {@link FlowDefinition}s registered with the factory, never by loading arbitrary classes.
 *
 * @see FlowNotWhitelistedException
 * @see FlowClassNotFoundException
 * @see NoMatchingFlowConstructorException
 * @see AmbiguousFlowConstructorException
 */
@DoNotImplement
public interface FlowLogicRefFactory {

    /**
     * Creates a {@link FlowLogicRef} from positional arguments.
     * <p>
     * Exactly one registered constructor of {@code type} must accept {@code args}: same number of parameters,
     * and every non-null argument assignable to the (boxed) parameter type. {@code null} arguments are only
     * checked against the nullability of the chosen constructor's parameters.
     *
     * @throws AmbiguousFlowConstructorException if more than one constructor accepts {@code args}.
     * @throws NoMatchingFlowConstructorException if no constructor accepts {@code args}.
     */
    @NotNull
    FlowLogicRef create(@NotNull Class<? extends FlowLogic<?>> type, @Nullable Object... args);

    /**
     * Creates a {@link FlowLogicRef} from arguments keyed by parameter name, with an empty {@link AppContext}.
     *
     * @see #create(String, AppContext, Map)
     */
    @NotNull
    FlowLogicRef create(@NotNull String flowClassName, @NotNull Map<String, ?> args);

    /**
     * Creates a {@link FlowLogicRef} from arguments keyed by parameter name.
     * <p>
     * The first registered constructor, in declaration order, whose parameters are all satisfied by
     * {@code args} and which consumes every entry of {@code args} is the one the reference will use.
     * The constructor is not called.
     *
     * @throws FlowNotWhitelistedException if {@code flowClassName} is not on the whitelist.
     * @throws FlowClassNotFoundException if no flow of that name is visible in {@code appContext}.
     * @throws NoMatchingFlowConstructorException if no constructor can be satisfied.
     */
    @NotNull
    FlowLogicRef create(@NotNull String flowClassName, @NotNull AppContext appContext, @NotNull Map<String, ?> args);

    /**
     * Constructs the flow a {@link FlowLogicRef} refers to, after checking it against this factory's whitelist.
     * Any exception thrown by the flow's constructor is rethrown as it is.
     *
     * @throws FlowNotWhitelistedException if the flow class is not on this factory's whitelist.
     * @throws FlowClassNotFoundException if the flow class is not registered with this factory.
     * @throws NoMatchingFlowConstructorException if the registered constructors no longer match the arguments.
     */
    @NotNull
    FlowLogic<?> toFlowLogic(@NotNull FlowLogicRef ref);
}
