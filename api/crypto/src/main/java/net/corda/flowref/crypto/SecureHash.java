package net.corda.flowref.crypto;

import net.corda.flowref.base.annotations.CordaSerializable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * A content hash, used to identify the code attachments a flow class is loaded from.
 * <p>
 * The string form is the algorithm name and the upper case hexadecimal digest separated by
 * {@link #DELIMITER}, for example {@code SHA-256:98AF8725385586B41FEFF205B4E05A000823F78B5F8F5C02439CE8F67A781D90}.
 */
@CordaSerializable
public final class SecureHash {
    public static final char DELIMITER = ':';

    private static final HexFormat HEX = HexFormat.of().withUpperCase();

    private final DigestAlgorithmName algorithm;
    private final byte[] bytes;

    public SecureHash(@NotNull DigestAlgorithmName algorithm, @NotNull byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new IllegalArgumentException("Hash bytes must not be empty");
        }
        this.algorithm = algorithm;
        this.bytes = bytes.clone();
    }

    /**
     * Parses the string form produced by {@link #toString()}.
     *
     * @throws IllegalArgumentException if {@code str} is not {@code ALGORITHM:HEX}.
     */
    @NotNull
    public static SecureHash parse(@NotNull String str) {
        final int idx = str.indexOf(DELIMITER);
        if (idx <= 0 || idx == str.length() - 1) {
            throw new IllegalArgumentException("Provided string: " + str + " should be of format algorithm:hexadecimal");
        }
        final byte[] digest;
        try {
            digest = HEX.parseHex(str.substring(idx + 1));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hexadecimal digest in: " + str, e);
        }
        return new SecureHash(new DigestAlgorithmName(str.substring(0, idx)), digest);
    }

    /**
     * Computes the hash of {@code content} with {@code algorithm}.
     *
     * @throws IllegalArgumentException if the JVM has no provider for {@code algorithm}.
     */
    @NotNull
    public static SecureHash hashOf(@NotNull DigestAlgorithmName algorithm, @NotNull byte[] content) {
        final MessageDigest digest;
        try {
            digest = MessageDigest.getInstance(algorithm.getName());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Unsupported digest algorithm: " + algorithm, e);
        }
        return new SecureHash(algorithm, digest.digest(content));
    }

    @NotNull
    public static SecureHash sha256(@NotNull byte[] content) {
        return hashOf(DigestAlgorithmName.SHA2_256, content);
    }

    @NotNull
    public String getAlgorithm() {
        return algorithm.getName();
    }

    @NotNull
    public DigestAlgorithmName getAlgorithmName() {
        return algorithm;
    }

    @NotNull
    public byte[] getBytes() {
        return bytes.clone();
    }

    @NotNull
    public String toHexString() {
        return HEX.formatHex(bytes);
    }

    @Override
    @NotNull
    public String toString() {
        return algorithm.getName() + DELIMITER + toHexString();
    }

    @Override
    public int hashCode() {
        return 31 * algorithm.hashCode() + Arrays.hashCode(bytes);
    }

    @Override
    public boolean equals(@Nullable Object other) {
        if (this == other) return true;
        if (!(other instanceof SecureHash)) return false;
        final SecureHash that = (SecureHash) other;
        return algorithm.equals(that.algorithm) && Arrays.equals(bytes, that.bytes);
    }
}
