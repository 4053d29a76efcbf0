package net.corda.flowref.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.type.LogicalType;
import net.corda.flowref.crypto.SecureHash;
import net.corda.flowref.flows.AppContext;
import net.corda.flowref.flows.FlowLogicRef;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Writes a {@link FlowLogicRef} as JSON and reads it back:
 * <pre>{@code
 * {
 *   "flowLogicClassName": "com.example.IssueFlow",
 *   "appContext": { "attachments": ["SHA-256:98AF..."] },
 *   "args": {
 *     "amount": { "type": "java.lang.Long", "value": 100 },
 *     "memo": null
 *   }
 * }
 * }</pre>
 * Every non-null argument carries its type name, which must be on the {@link ArgumentTypeWhitelist} when
 * writing and when reading. Reading never loads a class by name.
 * <p>
 * The decoded reference has not been checked against any flow whitelist. Pass it to
 * {@link net.corda.flowref.flows.FlowLogicRefFactory#toFlowLogic} to do that.
 */
public final class FlowLogicRefJsonSerializer {
    static final String FLOW_LOGIC_CLASS_NAME = "flowLogicClassName";
    static final String APP_CONTEXT = "appContext";
    static final String ATTACHMENTS = "attachments";
    static final String ARGS = "args";
    static final String TYPE = "type";
    static final String VALUE = "value";

    private static final Logger log = LoggerFactory.getLogger(FlowLogicRefJsonSerializer.class);

    private final ObjectMapper mapper;
    private final ArgumentTypeWhitelist argumentTypes;

    public FlowLogicRefJsonSerializer() {
        this(ArgumentTypeWhitelist.DEFAULT);
    }

    public FlowLogicRefJsonSerializer(@NotNull ArgumentTypeWhitelist argumentTypes) {
        this.argumentTypes = Objects.requireNonNull(argumentTypes, "argumentTypes");
        this.mapper = createMapper();
    }

    /**
     * A mapper which refuses to convert a wire value into its argument type when the conversion could change it.
     */
    @NotNull
    private static ObjectMapper createMapper() {
        final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new FlowRefJsonModule())
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        mapper.coercionConfigFor(LogicalType.Integer)
            .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
            .setCoercion(CoercionInputShape.Float, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Float)
            .setCoercion(CoercionInputShape.String, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Boolean)
            .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
            .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Textual)
            .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
            .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
            .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        return mapper;
    }

    @NotNull
    public ArgumentTypeWhitelist getArgumentTypes() {
        return argumentTypes;
    }

    /**
     * @throws FlowLogicRefSerializationException if an argument's type is not whitelisted.
     */
    @NotNull
    public String serialize(@NotNull FlowLogicRef ref) {
        try {
            return mapper.writeValueAsString(toTree(ref));
        } catch (JsonProcessingException e) {
            throw new FlowLogicRefSerializationException("Unable to write " + ref.getFlowLogicClassName() + " as JSON", e);
        }
    }

    @NotNull
    public byte[] serializeToBytes(@NotNull FlowLogicRef ref) {
        return serialize(ref).getBytes(UTF_8);
    }

    /**
     * @throws FlowLogicRefSerializationException if {@code json} is not a well formed reference, or an argument's
     *                                            type is not whitelisted.
     */
    @NotNull
    public FlowLogicRef deserialize(@NotNull String json) {
        final JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new FlowLogicRefSerializationException("Malformed FlowLogicRef JSON: " + e.getOriginalMessage(), e);
        }
        return fromTree(root);
    }

    @NotNull
    public FlowLogicRef deserialize(@NotNull byte[] bytes) {
        final JsonNode root;
        try {
            root = mapper.readTree(bytes);
        } catch (IOException e) {
            throw new FlowLogicRefSerializationException("Malformed FlowLogicRef JSON: " + e.getMessage(), e);
        }
        return fromTree(root);
    }

    @NotNull
    private ObjectNode toTree(@NotNull FlowLogicRef ref) {
        final ObjectNode root = mapper.createObjectNode();
        root.put(FLOW_LOGIC_CLASS_NAME, ref.getFlowLogicClassName());
        final ArrayNode attachments = root.putObject(APP_CONTEXT).putArray(ATTACHMENTS);
        ref.getAppContext().getAttachments().forEach(attachment -> attachments.add(attachment.toString()));

        final ObjectNode args = root.putObject(ARGS);
        for (Map.Entry<String, Object> arg : ref.getArgs().entrySet()) {
            final Object value = arg.getValue();
            if (value == null) {
                args.putNull(arg.getKey());
                continue;
            }
            if (!argumentTypes.isAllowed(value.getClass())) {
                throw new FlowLogicRefSerializationException("Argument " + arg.getKey() + " of "
                    + ref.getFlowLogicClassName() + " has type " + value.getClass().getName()
                    + " which is not on the argument type whitelist");
            }
            final ObjectNode typed = args.putObject(arg.getKey());
            typed.put(TYPE, value.getClass().getName());
            typed.set(VALUE, mapper.valueToTree(value));
        }
        return root;
    }

    @NotNull
    private FlowLogicRef fromTree(@Nullable JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new FlowLogicRefSerializationException("FlowLogicRef JSON must be an object");
        }
        final String flowClassName = requireText(root, FLOW_LOGIC_CLASS_NAME);
        final AppContext appContext = readAppContext(root.get(APP_CONTEXT));

        final JsonNode argsNode = root.get(ARGS);
        if (argsNode == null || !argsNode.isObject()) {
            throw new FlowLogicRefSerializationException("Field " + ARGS + " must be an object");
        }
        final Map<String, Object> args = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = argsNode.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            args.put(field.getKey(), readArgument(field.getKey(), field.getValue()));
        }

        if (log.isDebugEnabled()) {
            log.debug("Decoded reference to {} with arguments {} in {}", flowClassName, args.keySet(), appContext);
        }
        try {
            return new FlowLogicRef(flowClassName, appContext, args);
        } catch (IllegalArgumentException e) {
            throw new FlowLogicRefSerializationException(e.getMessage(), e);
        }
    }

    @NotNull
    private static AppContext readAppContext(@Nullable JsonNode node) {
        if (node == null || node.isNull()) {
            return AppContext.EMPTY;
        }
        final JsonNode attachments = node.get(ATTACHMENTS);
        if (!node.isObject() || attachments == null || !attachments.isArray()) {
            throw new FlowLogicRefSerializationException("Field " + APP_CONTEXT + " must contain an array of " + ATTACHMENTS);
        }
        final List<SecureHash> hashes = new ArrayList<>(attachments.size());
        for (JsonNode attachment : attachments) {
            if (!attachment.isTextual()) {
                throw new FlowLogicRefSerializationException("Attachment ids must be strings, not " + attachment);
            }
            try {
                hashes.add(SecureHash.parse(attachment.textValue()));
            } catch (IllegalArgumentException e) {
                throw new FlowLogicRefSerializationException(e.getMessage(), e);
            }
        }
        return new AppContext(hashes);
    }

    @Nullable
    private Object readArgument(@NotNull String name, @NotNull JsonNode node) {
        if (node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new FlowLogicRefSerializationException("Argument " + name + " must be null or an object with "
                + TYPE + " and " + VALUE);
        }
        final String typeName = requireText(node, TYPE);
        final Class<?> type = argumentTypes.lookup(typeName);
        if (type == null) {
            throw new FlowLogicRefSerializationException("Argument " + name + " has type " + typeName
                + " which is not on the argument type whitelist");
        }
        final JsonNode value = node.get(VALUE);
        if (value == null || value.isNull()) {
            throw new FlowLogicRefSerializationException("Argument " + name + " has no " + VALUE);
        }
        if (value.isIntegralNumber() && !fitsIn(value, type)) {
            throw new FlowLogicRefSerializationException("Argument " + name + " value " + value
                + " is out of range for " + typeName);
        }
        try {
            return mapper.treeToValue(value, type);
        } catch (JsonProcessingException e) {
            throw new FlowLogicRefSerializationException("Argument " + name + " is not a valid " + typeName
                + ": " + e.getOriginalMessage(), e);
        }
    }

    // Jackson reads 128 to 255 into a Byte as negative values.
    private static boolean fitsIn(@NotNull JsonNode value, @NotNull Class<?> type) {
        if (type == Byte.class) {
            return value.canConvertToInt() && value.intValue() >= Byte.MIN_VALUE && value.intValue() <= Byte.MAX_VALUE;
        } else if (type == Short.class) {
            return value.canConvertToInt() && value.intValue() >= Short.MIN_VALUE && value.intValue() <= Short.MAX_VALUE;
        }
        return true;
    }

    @NotNull
    private static String requireText(@NotNull JsonNode node, @NotNull String field) {
        final JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new FlowLogicRefSerializationException("Field " + field + " must be a string");
        }
        return value.textValue();
    }
}
