package net.corda.flowref.flows;

import net.corda.flowref.crypto.SecureHash;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import static java.util.Collections.unmodifiableList;

/**
 * Everything a node needs to construct a flow from a {@link FlowLogicRef} without loading classes by name:
 * the flow class and its constructors, in declaration order. A definition without constructors registers
 * the class, but no reference to it can ever be created.
 * <p>
 * A definition may be tagged with the attachment it was shipped in. Such a definition is only visible to
 * references whose {@link AppContext} lists that attachment.
 * <p>
 * Example:
 * <pre>{@code
 * FlowDefinition<IssueCashFlow> definition = FlowDefinition.builder(IssueCashFlow.class)
 *     .constructor(
 *         args -> new IssueCashFlow(args.get("amount", long.class), args.getOrDefault("currency", String.class, "GBP")),
 *         FlowParameter.required("amount", long.class),
 *         FlowParameter.optional("currency", String.class))
 *     .build();
 * }</pre>
 */
public final class FlowDefinition<T extends FlowLogic<?>> {
    private final Class<T> flowClass;
    private final List<FlowConstructor<T>> constructors;
    private final SecureHash attachment;

    private FlowDefinition(
        @NotNull Class<T> flowClass,
        @NotNull List<FlowConstructor<T>> constructors,
        @Nullable SecureHash attachment
    ) {
        this.flowClass = flowClass;
        this.constructors = unmodifiableList(new ArrayList<>(constructors));
        this.attachment = attachment;
    }

    @NotNull
    public static <T extends FlowLogic<?>> Builder<T> builder(@NotNull Class<T> flowClass) {
        return new Builder<>(flowClass);
    }

    @NotNull
    public Class<T> getFlowClass() {
        return flowClass;
    }

    @NotNull
    public String getFlowClassName() {
        return flowClass.getName();
    }

    @NotNull
    public List<FlowConstructor<T>> getConstructors() {
        return constructors;
    }

    /**
     * The attachment this flow was shipped in, or {@code null} for flows installed on the node itself.
     */
    @Nullable
    public SecureHash getAttachment() {
        return attachment;
    }

    /**
     * Returns a copy of this definition tagged with {@code attachment}.
     */
    @NotNull
    public FlowDefinition<T> withAttachment(@Nullable SecureHash attachment) {
        return new FlowDefinition<>(flowClass, constructors, attachment);
    }

    @Override
    @NotNull
    public String toString() {
        return "FlowDefinition(" + flowClass.getName() + ", constructors=" + constructors
            + (attachment == null ? "" : ", attachment=" + attachment) + ')';
    }

    public static final class Builder<T extends FlowLogic<?>> {
        private final Class<T> flowClass;
        private final List<FlowConstructor<T>> constructors = new ArrayList<>();
        private SecureHash attachment;

        private Builder(@NotNull Class<T> flowClass) {
            this.flowClass = Objects.requireNonNull(flowClass, "flowClass");
        }

        /**
         * Declares the next constructor. Named arguments are matched against constructors in the order
         * they are declared here.
         */
        @NotNull
        public Builder<T> constructor(@NotNull FlowInstantiator<T> instantiator, @NotNull FlowParameter... parameters) {
            return constructor(new FlowConstructor<>(Arrays.asList(parameters), instantiator));
        }

        @NotNull
        public Builder<T> constructor(@NotNull FlowConstructor<T> constructor) {
            constructors.add(Objects.requireNonNull(constructor, "constructor"));
            return this;
        }

        @NotNull
        public Builder<T> attachment(@Nullable SecureHash attachment) {
            this.attachment = attachment;
            return this;
        }

        @NotNull
        public FlowDefinition<T> build() {
            return new FlowDefinition<>(flowClass, constructors, attachment);
        }
    }
}
