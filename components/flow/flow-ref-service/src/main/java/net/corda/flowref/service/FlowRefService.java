package net.corda.flowref.service;

import net.corda.flowref.flows.FlowDefinition;
import net.corda.flowref.flows.FlowLogic;
import net.corda.flowref.flows.FlowLogicRef;
import net.corda.flowref.flows.FlowLogicRefFactory;
import net.corda.flowref.flows.FlowPluginRegistry;
import net.corda.flowref.impl.FlowLogicRefFactoryImpl;
import net.corda.flowref.impl.FlowLogicRegistry;
import net.corda.flowref.impl.FlowWhitelist;
import net.corda.flowref.json.ArgumentTypeWhitelist;
import net.corda.flowref.json.FlowLogicRefJsonSerializer;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * One trust domain, put together: the flows it can construct, the flows it lets be started by reference,
 * and the wire encoding of references.
 * <p>
 * The whitelist is the configured one plus the required flows of every plugin. The registry holds the flows
 * every plugin defines, plus any registered on the {@link Builder} directly.
 */
public final class FlowRefService {
    private static final Logger logger = LoggerFactory.getLogger(FlowRefService.class);

    private final FlowLogicRefFactoryImpl factory;
    private final FlowLogicRefJsonSerializer serializer;

    private FlowRefService(@NotNull FlowLogicRefFactoryImpl factory, @NotNull FlowLogicRefJsonSerializer serializer) {
        this.factory = factory;
        this.serializer = serializer;
    }

    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Assembles a trust domain from {@link FlowRefConfigLoader#DEFAULT_RESOURCE} and the plugins found on the
     * class path of {@code classLoader}.
     */
    @NotNull
    public static FlowRefService fromClassPath(@NotNull ClassLoader classLoader) {
        return builder()
            .config(new FlowRefConfigLoader(classLoader).loadDefault())
            .plugins(FlowPluginLoader.load(classLoader))
            .build();
    }

    @NotNull
    public FlowLogicRefFactory getFactory() {
        return factory;
    }

    @NotNull
    public FlowWhitelist getFlowWhitelist() {
        return factory.getFlowWhitelist();
    }

    @NotNull
    public FlowLogicRegistry getRegistry() {
        return factory.getRegistry();
    }

    @NotNull
    public FlowLogicRefJsonSerializer getSerializer() {
        return serializer;
    }

    @NotNull
    public byte[] encode(@NotNull FlowLogicRef ref) {
        return serializer.serializeToBytes(ref);
    }

    /**
     * Decodes a reference received from another process and constructs the flow it names, applying this
     * domain's whitelist and registry.
     *
     * @throws net.corda.flowref.json.FlowLogicRefSerializationException if {@code bytes} is not a valid reference.
     * @throws net.corda.flowref.flows.IllegalFlowLogicException if this domain refuses or cannot construct the flow.
     */
    @NotNull
    public FlowLogic<?> decodeAndResolve(@NotNull byte[] bytes) {
        final FlowLogicRef ref = serializer.deserialize(bytes);
        logger.debug("Resolving received reference to {}", ref.getFlowLogicClassName());
        return factory.toFlowLogic(ref);
    }

    public static final class Builder {
        private FlowRefConfig config = FlowRefConfig.EMPTY;
        private final List<FlowPluginRegistry> plugins = new ArrayList<>();
        private final List<FlowDefinition<?>> definitions = new ArrayList<>();

        private Builder() {
        }

        @NotNull
        public Builder config(@NotNull FlowRefConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        @NotNull
        public Builder plugins(@NotNull Collection<? extends FlowPluginRegistry> plugins) {
            this.plugins.addAll(plugins);
            return this;
        }

        @NotNull
        public Builder register(@NotNull FlowDefinition<?> definition) {
            definitions.add(Objects.requireNonNull(definition, "definition"));
            return this;
        }

        /**
         * @throws IllegalArgumentException if two sources register the same flow class.
         */
        @NotNull
        public FlowRefService build() {
            final FlowLogicRegistry.Builder registry = FlowLogicRegistry.builder().registerAll(definitions);
            final FlowWhitelist.Builder required = FlowWhitelist.builder();
            for (FlowPluginRegistry plugin : plugins) {
                registry.registerAll(plugin.getFlowDefinitions());
                plugin.getRequiredFlows().forEach(required::allow);
            }
            final FlowWhitelist whitelist = config.getFlowWhitelist().union(required.build());
            final FlowLogicRefFactoryImpl factory = new FlowLogicRefFactoryImpl(whitelist, registry.build());
            final FlowLogicRefJsonSerializer serializer = new FlowLogicRefJsonSerializer(
                ArgumentTypeWhitelist.DEFAULT.with(config.getArgumentTypes()));
            logger.info("Flow reference service ready with {} registered flow(s) and {} whitelisted.",
                factory.getRegistry().size(), whitelist.getFlowClassNames().size());
            return new FlowRefService(factory, serializer);
        }
    }
}
