package net.corda.flowref.crypto;

import net.corda.flowref.base.annotations.CordaSerializable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.regex.Pattern;

/**
 * Name of a digest algorithm used to compute a {@link SecureHash}. Names compare case-insensitively.
 */
@CordaSerializable
public final class DigestAlgorithmName {
    private static final Pattern NAME_PATTERN = Pattern.compile("[a-zA-Z_][a-zA-Z_0-9\\-/]*");

    @NotNull
    public static final DigestAlgorithmName SHA2_256 = new DigestAlgorithmName("SHA-256");

    @NotNull
    public static final DigestAlgorithmName SHA2_384 = new DigestAlgorithmName("SHA-384");

    @NotNull
    public static final DigestAlgorithmName SHA2_512 = new DigestAlgorithmName("SHA-512");

    private final String name;

    /**
     * @throws IllegalArgumentException if {@code name} is blank or contains characters
     * that would clash with {@link SecureHash#DELIMITER}.
     */
    public DigestAlgorithmName(@NotNull String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Hash algorithm name unavailable or not specified");
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid hash algorithm name: " + name);
        }
        this.name = name;
    }

    @NotNull
    public String getName() {
        return name;
    }

    @Override
    @NotNull
    public String toString() {
        return name;
    }

    @Override
    public int hashCode() {
        return name.toUpperCase().hashCode();
    }

    @Override
    public boolean equals(@Nullable Object other) {
        if (this == other) return true;
        if (!(other instanceof DigestAlgorithmName)) return false;
        return name.equalsIgnoreCase(((DigestAlgorithmName) other).name);
    }
}
