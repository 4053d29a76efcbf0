package net.corda.flowref.service;

import net.corda.flowref.flows.AppContext;
import net.corda.flowref.impl.FlowWhitelist;
import net.corda.flowref.service.sample.AttachmentFlow;
import net.corda.flowref.service.sample.AuditFlow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Currency;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FlowRefConfigLoaderTest {
    private final FlowRefConfigLoader loader = new FlowRefConfigLoader(getClass().getClassLoader());

    @TempDir
    Path tempDir;

    @Test
    public void loadsDefaultResource() {
        final FlowRefConfig config = loader.loadDefault();
        final FlowWhitelist whitelist = config.getFlowWhitelist();

        assertThat(whitelist.getFlowClassNames())
            .containsExactlyInAnyOrder(AuditFlow.class.getName(), AttachmentFlow.class.getName());
        assertThat(whitelist.isAllowed(AuditFlow.class.getName(), AppContext.EMPTY)).isTrue();
        assertThat(whitelist.isAllowed(AttachmentFlow.class.getName(), AppContext.EMPTY)).isFalse();
        assertThat(whitelist.isAllowed(AttachmentFlow.class.getName(), AppContext.of(AttachmentFlow.ATTACHMENT))).isTrue();
        assertThat(config.getArgumentTypes()).containsExactly(Currency.class);
    }

    @Test
    public void loadsNamedResourceWithoutArgumentTypes() {
        final FlowRefConfig config = loader.loadResource("config/audit-only.json");

        assertThat(config.getFlowWhitelist()).isEqualTo(FlowWhitelist.of(AuditFlow.class.getName()));
        assertThat(config.getArgumentTypes()).isEmpty();
    }

    @Test
    public void missingResourceIsReported() {
        assertThatThrownBy(() -> loader.loadResource("config/missing.json"))
            .isInstanceOf(FlowRefConfigException.class)
            .hasMessage("Flow reference config at config/missing.json cannot be found.");
    }

    @Test
    public void missingFileIsReported() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.json")))
            .isInstanceOf(FlowRefConfigException.class)
            .hasMessageContaining("cannot be found");
    }

    @Test
    public void loadsFile() throws IOException {
        final Path file = write("{\"flowWhitelist\":[{\"className\":\"com.example.Flow\"}]}");

        final FlowRefConfig config = loader.load(file);

        assertThat(config.getFlowWhitelist().isAllowed("com.example.Flow", AppContext.EMPTY)).isTrue();
    }

    @Test
    public void emptyObjectIsAnEmptyConfig() throws IOException {
        final FlowRefConfig config = loader.load(write("{}"));

        assertThat(config.getFlowWhitelist()).isEqualTo(FlowWhitelist.EMPTY);
        assertThat(config.getArgumentTypes()).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "not json",
        "[]",
        "{\"flowWhiteList\":[]}",
        "{\"flowWhitelist\":\"com.example.Flow\"}",
        "{\"flowWhitelist\":[42]}",
        "{\"flowWhitelist\":[{\"attachments\":[\"SHA-256:00\"]}]}",
        "{\"flowWhitelist\":[{\"className\":\"com.example.Flow\",\"attachments\":[]}]}",
        "{\"flowWhitelist\":[{\"className\":\"com.example.Flow\",\"attachments\":[\"bad\"]}]}",
        "{\"argumentTypes\":[\"com.example.NoSuchType\"]}",
        "{\"argumentTypes\":[1]}"
    })
    public void invalidConfigIsRejected(String json) throws IOException {
        final Path file = write(json);

        assertThatThrownBy(() -> loader.load(file)).isInstanceOf(FlowRefConfigException.class);
    }

    private Path write(String json) throws IOException {
        return Files.write(tempDir.resolve("flow-ref.json"), json.getBytes(UTF_8));
    }
}
