package net.corda.flowref.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import net.corda.flowref.crypto.SecureHash;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.function.Function;

/**
 * Jackson support for the value types that appear in flow references. {@link SecureHash}, {@link Instant} and
 * {@link BigDecimal} are written as their string forms, so a decimal keeps its scale.
 */
public final class FlowRefJsonModule extends SimpleModule {
    private static final long serialVersionUID = 1L;

    public FlowRefJsonModule() {
        super("FlowRefJsonModule");
        addSerializer(SecureHash.class, ToStringSerializer.instance);
        addDeserializer(SecureHash.class, new FromStringDeserializer<>(SecureHash.class, SecureHash::parse));
        addSerializer(Instant.class, ToStringSerializer.instance);
        addDeserializer(Instant.class, new FromStringDeserializer<>(Instant.class, Instant::parse));
        addSerializer(BigDecimal.class, ToStringSerializer.instance);
        addDeserializer(BigDecimal.class, new FromStringDeserializer<>(BigDecimal.class, BigDecimal::new));
    }

    private static final class FromStringDeserializer<T> extends StdDeserializer<T> {
        private static final long serialVersionUID = 1L;

        private final Class<T> type;
        private final transient Function<String, T> parser;

        FromStringDeserializer(@NotNull Class<T> type, @NotNull Function<String, T> parser) {
            super(type);
            this.type = type;
            this.parser = parser;
        }

        @Override
        public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() != JsonToken.VALUE_STRING) {
                return type.cast(ctxt.handleUnexpectedToken(type, p));
            }
            final String text = p.getText();
            try {
                return parser.apply(text);
            } catch (RuntimeException e) {
                throw ctxt.weirdStringException(text, type, e.getMessage());
            }
        }
    }
}
