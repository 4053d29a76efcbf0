package net.corda.flowref.flows;

import net.corda.flowref.crypto.SecureHash;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static net.corda.flowref.flows.FlowParameter.nullable;
import static net.corda.flowref.flows.FlowParameter.optional;
import static net.corda.flowref.flows.FlowParameter.optionalNullable;
import static net.corda.flowref.flows.FlowParameter.required;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FlowDefinitionTest {

    public static class GreetingFlow extends FlowLogic<String> {
        private final String name;
        private final int times;

        public GreetingFlow(String name, int times) {
            this.name = name;
            this.times = times;
        }

        @Override
        public String call() {
            return ("Hello " + name + ' ').repeat(times).trim();
        }
    }

    @Test
    public void builderKeepsConstructorOrder() {
        FlowDefinition<GreetingFlow> definition = FlowDefinition.builder(GreetingFlow.class)
            .constructor(args -> new GreetingFlow(args.get("name", String.class), args.get("times", int.class)),
                required("name", String.class), required("times", int.class))
            .constructor(args -> new GreetingFlow(args.get("name", String.class), 1),
                nullable("name", String.class))
            .build();

        assertThat(definition.getFlowClassName()).isEqualTo(GreetingFlow.class.getName());
        assertThat(definition.getConstructors()).hasSize(2);
        assertThat(definition.getConstructors().get(0).getParameters()).extracting(FlowParameter::getName)
            .containsExactly("name", "times");
        assertThat(definition.getAttachment()).isNull();

        GreetingFlow flow = definition.getConstructors().get(0)
            .newInstance(FlowArguments.of(Map.of("name", "Alice", "times", 2)));
        assertThat(flow.call()).isEqualTo("Hello Alice Hello Alice");
    }

    @Test
    public void withAttachmentCopiesDefinition() {
        SecureHash attachment = SecureHash.parse("SHA-256:FFEE");
        FlowDefinition<GreetingFlow> definition = FlowDefinition.builder(GreetingFlow.class).build();

        FlowDefinition<GreetingFlow> tagged = definition.withAttachment(attachment);

        assertThat(tagged.getAttachment()).isEqualTo(attachment);
        assertThat(definition.getAttachment()).isNull();
        assertThat(tagged.getConstructors()).isEmpty();
    }

    @Test
    public void duplicateParameterNamesAreRejected() {
        assertThatThrownBy(() -> FlowDefinition.builder(GreetingFlow.class)
            .constructor(args -> new GreetingFlow("x", 1), required("name", String.class), optional("name", String.class)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("name");
    }

    @Test
    public void primitiveParametersCannotBeNullable() {
        assertThatThrownBy(() -> nullable("count", int.class)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> optionalNullable("count", long.class)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> required(" ", String.class)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void parameterFlags() {
        FlowParameter parameter = optionalNullable("memo", String.class);

        assertThat(parameter.isOptional()).isTrue();
        assertThat(parameter.isNullable()).isTrue();
        assertThat(required("count", int.class).getBoxedType()).isEqualTo(Integer.class);
        assertThat(required("flag", boolean.class).getBoxedType()).isEqualTo(Boolean.class);
        assertThat(required("name", String.class).getBoxedType()).isEqualTo(String.class);
        assertThat(List.of(required("a", int.class), optional("b", String.class), nullable("c", Object.class)))
            .extracting(FlowParameter::toString)
            .containsExactly("a: int", "b: String = <default>", "c: Object?");
    }
}
