package net.corda.flowref.service.sample;

import net.corda.flowref.flows.FlowDefinition;
import net.corda.flowref.flows.FlowLogic;
import net.corda.flowref.flows.FlowPluginRegistry;

import java.util.List;
import java.util.Set;

public class SampleFlowPlugin extends FlowPluginRegistry {
    @Override
    public List<FlowDefinition<?>> getFlowDefinitions() {
        return List.of(PaymentFlow.DEFINITION, AuditFlow.DEFINITION, AttachmentFlow.DEFINITION);
    }

    @Override
    public Set<Class<? extends FlowLogic<?>>> getRequiredFlows() {
        return Set.of(PaymentFlow.class);
    }
}
