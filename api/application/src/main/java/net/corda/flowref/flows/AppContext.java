package net.corda.flowref.flows;

import net.corda.flowref.base.annotations.CordaSerializable;
import net.corda.flowref.crypto.SecureHash;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static java.util.Collections.emptyList;
import static java.util.Collections.unmodifiableList;

/**
 * Identifies the code attachments which must be visible when resolving the flow class of a {@link FlowLogicRef}.
 * An empty context means the node's own flows, with no attachment scoping.
 */
@CordaSerializable
public final class AppContext {
    @NotNull
    public static final AppContext EMPTY = new AppContext(emptyList());

    private final List<SecureHash> attachments;

    public AppContext(@NotNull List<SecureHash> attachments) {
        final List<SecureHash> copy = new ArrayList<>(attachments);
        if (copy.contains(null)) {
            throw new IllegalArgumentException("Attachment ids must not be null");
        }
        this.attachments = unmodifiableList(copy);
    }

    @NotNull
    public static AppContext of(@NotNull SecureHash... attachments) {
        return attachments.length == 0 ? EMPTY : new AppContext(Arrays.asList(attachments));
    }

    @NotNull
    public List<SecureHash> getAttachments() {
        return attachments;
    }

    public boolean isEmpty() {
        return attachments.isEmpty();
    }

    public boolean contains(@NotNull SecureHash attachment) {
        return attachments.contains(attachment);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        return this == obj || (obj instanceof AppContext && attachments.equals(((AppContext) obj).attachments));
    }

    @Override
    public int hashCode() {
        return attachments.hashCode();
    }

    @Override
    @NotNull
    public String toString() {
        return "AppContext(attachments=" + attachments + ')';
    }
}
