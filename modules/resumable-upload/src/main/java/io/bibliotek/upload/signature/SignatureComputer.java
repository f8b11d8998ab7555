package io.bibliotek.upload.signature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Computes the resume signature of a file from what a client can observe about it.
 * <p>
 * The signature is the first 8 bytes of SHA-256 over {@code "{name}:{size}:{lastModifiedMillis}"},
 * rendered as 16 lowercase hex characters. Browser clients compute the same value with
 * {@code crypto.subtle.digest}, so the input format must not change.
 * It identifies a file for resume matching only; it is not an integrity check.
 */
public final class SignatureComputer {

    public static final int SIGNATURE_LENGTH = 16;

    private static final int DIGEST_BYTES = SIGNATURE_LENGTH / 2;
    private static final Pattern SIGNATURE_PATTERN = Pattern.compile("[0-9a-f]{" + SIGNATURE_LENGTH + "}");

    private SignatureComputer() {
    }

    public static String compute(String name, long size, long lastModifiedMillis) {
        if (name == null) {
            throw new IllegalArgumentException("File name is required to compute a signature");
        }
        String identity = name + ":" + size + ":" + lastModifiedMillis;
        byte[] digest = sha256().digest(identity.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest, 0, DIGEST_BYTES);
    }

    public static boolean isValid(String signature) {
        return signature != null && SIGNATURE_PATTERN.matcher(signature).matches();
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-256
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
