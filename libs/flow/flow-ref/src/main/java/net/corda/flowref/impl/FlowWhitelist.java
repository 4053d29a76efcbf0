package net.corda.flowref.impl;

import net.corda.flowref.crypto.SecureHash;
import net.corda.flowref.flows.AppContext;
import net.corda.flowref.flows.FlowLogic;
import net.corda.flowref.flows.FlowNotWhitelistedException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import static java.util.Collections.emptyMap;
import static java.util.Collections.unmodifiableMap;
import static java.util.Collections.unmodifiableSet;

/**
 * The flow classes which may be referenced by name, and so started by a party outside the node.
 * <p>
 * Entries are flow class names, not classes, so that a caller never needs the flow class loaded to be refused.
 * An entry may be restricted to a set of attachments, in which case it only permits references whose
 * {@link AppContext} lists one of them.
 * <p>
 * Instances are immutable and safe to share between threads.
 */
public final class FlowWhitelist {
    private static final Logger log = LoggerFactory.getLogger(FlowWhitelist.class);

    /**
     * Permits nothing.
     */
    @NotNull
    public static final FlowWhitelist EMPTY = new FlowWhitelist(emptyMap());

    // An empty attachment set means the entry is not restricted.
    private final Map<String, Set<SecureHash>> entries;

    private FlowWhitelist(@NotNull Map<String, Set<SecureHash>> entries) {
        this.entries = entries;
    }

    @NotNull
    public static FlowWhitelist of(@NotNull Collection<String> flowClassNames) {
        return builder().allowAll(flowClassNames).build();
    }

    @NotNull
    public static FlowWhitelist of(@NotNull String... flowClassNames) {
        return of(Arrays.asList(flowClassNames));
    }

    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    public boolean isAllowed(@NotNull String flowClassName, @NotNull AppContext appContext) {
        final Set<SecureHash> attachments = entries.get(flowClassName);
        if (attachments == null) {
            return false;
        } else if (attachments.isEmpty()) {
            return true;
        }
        return appContext.getAttachments().stream().anyMatch(attachments::contains);
    }

    /**
     * @throws FlowNotWhitelistedException if {@code flowClassName} is not permitted in {@code appContext}.
     */
    public void validate(@NotNull String flowClassName, @NotNull AppContext appContext) {
        if (!isAllowed(flowClassName, appContext)) {
            log.warn("Refusing flow {} which is not on the whitelist for {}", flowClassName, appContext);
            throw new FlowNotWhitelistedException(flowClassName);
        }
    }

    @NotNull
    public Set<String> getFlowClassNames() {
        return entries.keySet();
    }

    /**
     * Returns a whitelist permitting everything either whitelist permits.
     */
    @NotNull
    public FlowWhitelist union(@NotNull FlowWhitelist other) {
        final Builder builder = builder();
        builder.merge(entries);
        builder.merge(other.entries);
        return builder.build();
    }

    @Override
    public boolean equals(Object obj) {
        return this == obj || (obj instanceof FlowWhitelist && entries.equals(((FlowWhitelist) obj).entries));
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    @NotNull
    public String toString() {
        return "FlowWhitelist" + entries.keySet();
    }

    public static final class Builder {
        private final Map<String, Set<SecureHash>> entries = new LinkedHashMap<>();
        private final Set<String> unrestricted = new LinkedHashSet<>();

        private Builder() {
        }

        @NotNull
        public Builder allow(@NotNull String flowClassName) {
            requireName(flowClassName);
            unrestricted.add(flowClassName);
            entries.remove(flowClassName);
            return this;
        }

        @NotNull
        public Builder allow(@NotNull Class<? extends FlowLogic<?>> flowClass) {
            return allow(flowClass.getName());
        }

        @NotNull
        public Builder allowAll(@NotNull Collection<String> flowClassNames) {
            flowClassNames.forEach(this::allow);
            return this;
        }

        /**
         * Permits {@code flowClassName} only when loaded from one of {@code attachments}.
         * An unrestricted entry for the same name takes precedence.
         */
        @NotNull
        public Builder allow(@NotNull String flowClassName, @NotNull Collection<SecureHash> attachments) {
            requireName(flowClassName);
            if (attachments.isEmpty()) {
                throw new IllegalArgumentException("Attachment restriction for " + flowClassName + " must not be empty");
            }
            if (!unrestricted.contains(flowClassName)) {
                entries.computeIfAbsent(flowClassName, name -> new LinkedHashSet<>()).addAll(attachments);
            }
            return this;
        }

        private void merge(@NotNull Map<String, Set<SecureHash>> other) {
            other.forEach((name, attachments) -> {
                if (attachments.isEmpty()) {
                    allow(name);
                } else {
                    allow(name, attachments);
                }
            });
        }

        private static void requireName(String flowClassName) {
            if (flowClassName == null || flowClassName.isBlank()) {
                throw new IllegalArgumentException("Whitelisted flow class name must not be blank");
            }
        }

        @NotNull
        public FlowWhitelist build() {
            final Map<String, Set<SecureHash>> result = new LinkedHashMap<>();
            unrestricted.forEach(name -> result.put(name, Set.of()));
            entries.forEach((name, attachments) -> result.put(name, unmodifiableSet(new LinkedHashSet<>(attachments))));
            return new FlowWhitelist(unmodifiableMap(result));
        }
    }
}
