package net.corda.flowref.impl;

import net.corda.flowref.crypto.SecureHash;
import net.corda.flowref.flows.AppContext;
import net.corda.flowref.flows.FlowClassNotFoundException;
import net.corda.flowref.impl.sample.flows.ExampleFlow;
import net.corda.flowref.impl.sample.flows.NoArgFlow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FlowLogicRegistryTest {
    private static final SecureHash ATTACHMENT = SecureHash.parse("SHA-256:0A0B0C");

    @Test
    public void loadsRegisteredFlows() {
        FlowLogicRegistry registry = FlowLogicRegistry.builder()
            .registerAll(List.of(ExampleFlow.DEFINITION, NoArgFlow.DEFINITION))
            .build();

        assertThat(registry.load(ExampleFlow.class.getName(), AppContext.EMPTY)).isSameAs(ExampleFlow.DEFINITION);
        assertThat(registry.load(NoArgFlow.class.getName(), AppContext.of(ATTACHMENT))).isSameAs(NoArgFlow.DEFINITION);
        assertThat(registry.getFlowClassNames()).containsExactly(ExampleFlow.class.getName(), NoArgFlow.class.getName());
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    public void unknownFlowIsNotFound() {
        assertThatThrownBy(() -> FlowLogicRegistry.EMPTY.load("com.example.Missing", AppContext.EMPTY))
            .isInstanceOf(FlowClassNotFoundException.class)
            .hasMessageContaining("com.example.Missing");
        assertThat(FlowLogicRegistry.EMPTY.find("com.example.Missing")).isEmpty();
    }

    @Test
    public void flowFromAttachmentNeedsAttachmentInContext() {
        FlowLogicRegistry registry = FlowLogicRegistry.builder()
            .register(ExampleFlow.DEFINITION.withAttachment(ATTACHMENT))
            .build();

        assertThat(registry.load(ExampleFlow.class.getName(), AppContext.of(ATTACHMENT)).getAttachment()).isEqualTo(ATTACHMENT);
        assertThatThrownBy(() -> registry.load(ExampleFlow.class.getName(), AppContext.EMPTY))
            .isInstanceOf(FlowClassNotFoundException.class);
        assertThat(registry.find(ExampleFlow.class.getName())).isPresent();
    }

    @Test
    public void duplicateRegistrationIsRejected() {
        FlowLogicRegistry.Builder builder = FlowLogicRegistry.builder().register(ExampleFlow.DEFINITION);

        assertThatThrownBy(() -> builder.register(ExampleFlow.DEFINITION.withAttachment(ATTACHMENT)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("already registered");
    }
}
