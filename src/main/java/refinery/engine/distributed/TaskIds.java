package refinery.engine.distributed;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable task identifiers: the same (index, item) always hashes to the same ID.
 */
public final class TaskIds {

    /** Only this many characters of the item's string form feed the hash */
    static final int PAYLOAD_PREFIX = 100;
    private static final int ID_LENGTH = 16;

    private TaskIds() {
    }

    public static String of(int index, Object item) {
        String text = String.valueOf(item);
        if (text.length() > PAYLOAD_PREFIX) {
            text = text.substring(0, PAYLOAD_PREFIX);
        }
        byte[] digest = sha256().digest((index + ":" + text).getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest).substring(0, ID_LENGTH);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
