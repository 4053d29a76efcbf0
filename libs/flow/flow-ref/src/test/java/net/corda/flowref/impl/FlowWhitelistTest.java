package net.corda.flowref.impl;

import net.corda.flowref.crypto.SecureHash;
import net.corda.flowref.flows.AppContext;
import net.corda.flowref.flows.FlowNotWhitelistedException;
import net.corda.flowref.impl.sample.flows.ExampleFlow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FlowWhitelistTest {
    private static final SecureHash ATTACHMENT = SecureHash.parse("SHA-256:0102");
    private static final SecureHash OTHER_ATTACHMENT = SecureHash.parse("SHA-256:0304");

    @Test
    public void emptyWhitelistAllowsNothing() {
        assertThat(FlowWhitelist.EMPTY.isAllowed(ExampleFlow.class.getName(), AppContext.EMPTY)).isFalse();
        assertThat(FlowWhitelist.of().getFlowClassNames()).isEmpty();
    }

    @Test
    public void allowsListedNamesInAnyContext() {
        FlowWhitelist whitelist = FlowWhitelist.of("com.example.A", "com.example.B", "com.example.A");

        assertThat(whitelist.isAllowed("com.example.A", AppContext.EMPTY)).isTrue();
        assertThat(whitelist.isAllowed("com.example.B", AppContext.of(ATTACHMENT))).isTrue();
        assertThat(whitelist.isAllowed("com.example.C", AppContext.EMPTY)).isFalse();
        assertThat(whitelist.getFlowClassNames()).containsExactlyInAnyOrder("com.example.A", "com.example.B");
    }

    @Test
    public void namesAreMatchedExactly() {
        FlowWhitelist whitelist = FlowWhitelist.of("com.example.A");

        assertThat(whitelist.isAllowed("com.example.a", AppContext.EMPTY)).isFalse();
        assertThat(whitelist.isAllowed("com.example.A$Inner", AppContext.EMPTY)).isFalse();
        assertThat(whitelist.isAllowed("com.example", AppContext.EMPTY)).isFalse();
    }

    @Test
    public void validateThrowsWithClassName() {
        assertThatCode(() -> FlowWhitelist.of("com.example.A").validate("com.example.A", AppContext.EMPTY))
            .doesNotThrowAnyException();
        assertThatThrownBy(() -> FlowWhitelist.EMPTY.validate("com.example.A", AppContext.EMPTY))
            .isInstanceOf(FlowNotWhitelistedException.class)
            .extracting("flowClassName").isEqualTo("com.example.A");
    }

    @Test
    public void attachmentRestrictedEntry() {
        FlowWhitelist whitelist = FlowWhitelist.builder()
            .allow("com.example.A", List.of(ATTACHMENT))
            .build();

        assertThat(whitelist.isAllowed("com.example.A", AppContext.of(ATTACHMENT))).isTrue();
        assertThat(whitelist.isAllowed("com.example.A", AppContext.of(OTHER_ATTACHMENT, ATTACHMENT))).isTrue();
        assertThat(whitelist.isAllowed("com.example.A", AppContext.of(OTHER_ATTACHMENT))).isFalse();
        assertThat(whitelist.isAllowed("com.example.A", AppContext.EMPTY)).isFalse();
    }

    @Test
    public void unrestrictedEntryTakesPrecedence() {
        FlowWhitelist whitelist = FlowWhitelist.builder()
            .allow("com.example.A", List.of(ATTACHMENT))
            .allow("com.example.A")
            .allow("com.example.A", List.of(OTHER_ATTACHMENT))
            .build();

        assertThat(whitelist.isAllowed("com.example.A", AppContext.EMPTY)).isTrue();
    }

    @Test
    public void unionCombinesEntries() {
        FlowWhitelist first = FlowWhitelist.builder().allow("com.example.A", List.of(ATTACHMENT)).build();
        FlowWhitelist second = FlowWhitelist.builder()
            .allow("com.example.A", List.of(OTHER_ATTACHMENT))
            .allow(ExampleFlow.class)
            .build();

        FlowWhitelist union = first.union(second);

        assertThat(union.isAllowed("com.example.A", AppContext.of(ATTACHMENT))).isTrue();
        assertThat(union.isAllowed("com.example.A", AppContext.of(OTHER_ATTACHMENT))).isTrue();
        assertThat(union.isAllowed("com.example.A", AppContext.EMPTY)).isFalse();
        assertThat(union.isAllowed(ExampleFlow.class.getName(), AppContext.EMPTY)).isTrue();
        assertThat(first.getFlowClassNames()).containsExactly("com.example.A");
    }

    @Test
    public void rejectsBlankNamesAndEmptyRestrictions() {
        assertThatThrownBy(() -> FlowWhitelist.of(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FlowWhitelist.builder().allow("com.example.A", List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
