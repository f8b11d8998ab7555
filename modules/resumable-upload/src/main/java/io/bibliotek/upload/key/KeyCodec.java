package io.bibliotek.upload.key;

import io.bibliotek.upload.config.UploadLimits;
import io.bibliotek.upload.exception.KeyTooLongException;
import io.bibliotek.upload.exception.MalformedKeyException;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Builds and parses upload keys of the form {@code uploads/{signature}/{urlEncodedFileName}}.
 * <p>
 * The file name is percent-encoded (RFC 3986, everything but unreserved characters), so it
 * never contains a {@code /} and the key always splits into exactly three segments.
 */
public final class KeyCodec {

    public static final String ROOT = "uploads";
    public static final String ROOT_PREFIX = ROOT + "/";

    private KeyCodec() {
    }

    public static String encode(String signature, String fileName) {
        String key = signaturePrefix(signature) + UriUtils.encode(fileName, StandardCharsets.UTF_8);

        int length = key.getBytes(StandardCharsets.UTF_8).length;
        if (length > UploadLimits.MAX_KEY_LENGTH_BYTES) {
            throw new KeyTooLongException(length, UploadLimits.MAX_KEY_LENGTH_BYTES);
        }
        return key;
    }

    public static ObjectKey decode(String key) {
        if (key == null || !key.startsWith(ROOT_PREFIX)) {
            throw new MalformedKeyException(String.valueOf(key), "must start with '" + ROOT_PREFIX + "'");
        }

        String[] segments = key.split("/", -1);
        if (segments.length != 3) {
            throw new MalformedKeyException(key, "expected 3 segments, found " + segments.length);
        }
        if (segments[1].isEmpty() || segments[2].isEmpty()) {
            throw new MalformedKeyException(key, "signature and file name must not be empty");
        }

        try {
            return new ObjectKey(segments[1], UriUtils.decode(segments[2], StandardCharsets.UTF_8), key);
        } catch (IllegalArgumentException e) {
            throw new MalformedKeyException(key, "file name is not valid percent-encoding", e);
        }
    }

    /**
     * Decodes a key reported by the backend, where foreign or legacy keys may show up.
     */
    public static Optional<ObjectKey> tryDecode(String key) {
        try {
            return Optional.of(decode(key));
        } catch (MalformedKeyException e) {
            return Optional.empty();
        }
    }

    /**
     * The listing scope of every session started for a signature.
     */
    public static String signaturePrefix(String signature) {
        return ROOT_PREFIX + signature + "/";
    }
}
