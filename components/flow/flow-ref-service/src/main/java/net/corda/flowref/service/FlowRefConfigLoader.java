package net.corda.flowref.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.corda.flowref.crypto.SecureHash;
import net.corda.flowref.impl.FlowWhitelist;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reads a {@link FlowRefConfig} from JSON of the form:
 * <pre>{@code
 * {
 *   "flowWhitelist": [
 *     "com.example.IssueFlow",
 *     { "className": "com.example.PayFlow", "attachments": ["SHA-256:98AF..."] }
 *   ],
 *   "argumentTypes": ["java.time.LocalDate"]
 * }
 * }</pre>
 * A plain string permits the flow in any {@link net.corda.flowref.flows.AppContext}. Both fields are optional.
 */
public final class FlowRefConfigLoader {
    public static final String DEFAULT_RESOURCE = "flow-ref.json";

    static final String FLOW_WHITELIST = "flowWhitelist";
    static final String CLASS_NAME = "className";
    static final String ATTACHMENTS = "attachments";
    static final String ARGUMENT_TYPES = "argumentTypes";

    private static final Set<String> FIELDS = Set.of(FLOW_WHITELIST, ARGUMENT_TYPES);

    private static final Logger logger = LoggerFactory.getLogger(FlowRefConfigLoader.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final ClassLoader classLoader;

    public FlowRefConfigLoader(@NotNull ClassLoader classLoader) {
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
    }

    @NotNull
    public FlowRefConfig loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    /**
     * @throws FlowRefConfigException if the resource is missing or invalid.
     */
    @NotNull
    public FlowRefConfig loadResource(@NotNull String resource) {
        logger.trace("Requested flow reference config at {}.", resource);
        final URL url = classLoader.getResource(resource);
        if (url == null) {
            final String msg = "Flow reference config at " + resource + " cannot be found.";
            logger.error(msg);
            throw new FlowRefConfigException(msg);
        }
        try (InputStream input = url.openStream()) {
            return parse(input, resource);
        } catch (IOException e) {
            throw new FlowRefConfigException(e.getMessage(), e);
        }
    }

    /**
     * @throws FlowRefConfigException if the file is missing or invalid.
     */
    @NotNull
    public FlowRefConfig load(@NotNull Path path) {
        if (!Files.isRegularFile(path)) {
            final String msg = "Flow reference config file " + path + " cannot be found.";
            logger.error(msg);
            throw new FlowRefConfigException(msg);
        }
        try (InputStream input = Files.newInputStream(path)) {
            return parse(input, path.toString());
        } catch (IOException e) {
            throw new FlowRefConfigException(e.getMessage(), e);
        }
    }

    @NotNull
    private FlowRefConfig parse(@NotNull InputStream input, @NotNull String source) throws IOException {
        final JsonNode root;
        try {
            root = mapper.readTree(input);
        } catch (JsonProcessingException e) {
            throw new FlowRefConfigException("Flow reference config at " + source + " is not valid JSON: "
                + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw invalid(source, "the root must be an object");
        }
        final Iterator<String> fieldNames = root.fieldNames();
        while (fieldNames.hasNext()) {
            final String field = fieldNames.next();
            if (!FIELDS.contains(field)) {
                throw invalid(source, "unknown field " + field);
            }
        }

        final FlowRefConfig config = new FlowRefConfig(
            readWhitelist(root.get(FLOW_WHITELIST), source),
            readArgumentTypes(root.get(ARGUMENT_TYPES), source)
        );
        if (logger.isDebugEnabled()) {
            logger.debug("Loaded {} from {}", config, source);
        }
        return config;
    }

    @NotNull
    private static FlowWhitelist readWhitelist(JsonNode node, @NotNull String source) {
        if (node == null) {
            return FlowWhitelist.EMPTY;
        } else if (!node.isArray()) {
            throw invalid(source, FLOW_WHITELIST + " must be an array");
        }
        final FlowWhitelist.Builder builder = FlowWhitelist.builder();
        try {
            for (JsonNode entry : node) {
                allow(builder, entry, source);
            }
        } catch (IllegalArgumentException e) {
            throw new FlowRefConfigException("Flow reference config at " + source + " is invalid: " + e.getMessage(), e);
        }
        return builder.build();
    }

    private static void allow(@NotNull FlowWhitelist.Builder builder, @NotNull JsonNode entry, @NotNull String source) {
        if (entry.isTextual()) {
            builder.allow(entry.textValue());
        } else if (entry.isObject() && entry.path(CLASS_NAME).isTextual()) {
            final JsonNode attachments = entry.get(ATTACHMENTS);
            if (attachments == null) {
                builder.allow(entry.get(CLASS_NAME).textValue());
            } else {
                builder.allow(entry.get(CLASS_NAME).textValue(), readAttachments(attachments, source));
            }
        } else {
            throw invalid(source, "whitelist entry " + entry + " must be a class name or an object with a " + CLASS_NAME);
        }
    }

    @NotNull
    private static List<SecureHash> readAttachments(@NotNull JsonNode node, @NotNull String source) {
        if (!node.isArray() || node.isEmpty()) {
            throw invalid(source, ATTACHMENTS + " must be a non-empty array");
        }
        final List<SecureHash> result = new ArrayList<>(node.size());
        for (JsonNode attachment : node) {
            result.add(SecureHash.parse(attachment.asText()));
        }
        return result;
    }

    @NotNull
    private List<Class<?>> readArgumentTypes(JsonNode node, @NotNull String source) {
        final List<Class<?>> result = new ArrayList<>();
        if (node == null) {
            return result;
        } else if (!node.isArray()) {
            throw invalid(source, ARGUMENT_TYPES + " must be an array");
        }
        for (JsonNode typeName : node) {
            if (!typeName.isTextual()) {
                throw invalid(source, "argument type " + typeName + " must be a class name");
            }
            try {
                // Configuration is trusted, unlike the references it governs.
                result.add(Class.forName(typeName.textValue(), false, classLoader));
            } catch (ClassNotFoundException e) {
                throw new FlowRefConfigException("Argument type " + typeName.textValue() + " named in " + source
                    + " cannot be found.", e);
            }
        }
        return result;
    }

    @NotNull
    private static FlowRefConfigException invalid(@NotNull String source, @NotNull String reason) {
        final String msg = "Flow reference config at " + source + " is invalid: " + reason;
        logger.error(msg);
        return new FlowRefConfigException(msg);
    }
}
