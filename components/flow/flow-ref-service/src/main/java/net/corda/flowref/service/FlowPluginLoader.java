package net.corda.flowref.service;

import net.corda.flowref.flows.FlowPluginRegistry;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

import static java.util.Collections.unmodifiableList;

/**
 * Finds the {@link FlowPluginRegistry} implementations on a class path.
 */
public final class FlowPluginLoader {
    private static final Logger logger = LoggerFactory.getLogger(FlowPluginLoader.class);

    private FlowPluginLoader() {
    }

    /**
     * @throws FlowRefConfigException if a registered plugin cannot be instantiated.
     */
    @NotNull
    public static List<FlowPluginRegistry> load(@NotNull ClassLoader classLoader) {
        final List<FlowPluginRegistry> plugins = new ArrayList<>();
        try {
            for (FlowPluginRegistry plugin : ServiceLoader.load(FlowPluginRegistry.class, classLoader)) {
                if (logger.isDebugEnabled()) {
                    logger.debug("Found flow plugin {} with {} flow(s), {} required.", plugin.getClass().getName(),
                        plugin.getFlowDefinitions().size(), plugin.getRequiredFlows().size());
                }
                plugins.add(plugin);
            }
        } catch (ServiceConfigurationError e) {
            throw new FlowRefConfigException("Unable to load flow plugins: " + e.getMessage(), e);
        }
        logger.info("Loaded {} flow plugin(s).", plugins.size());
        return unmodifiableList(plugins);
    }
}
