package com.advisory.lock.key;

import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Maps lock names to the integer keys that advisory-lock backends accept.
 *
 * <p>Numbers keep their own (truncated) integer value. Everything else is
 * reduced to the CRC32 checksum of its string form, which is stable across
 * JVM restarts and hosts. {@link Object#hashCode()} must not be used here:
 * multiple processes have to agree on the key for the same name.</p>
 */
public final class LockKeys {

    private LockKeys() {
        // Utility class
    }

    /**
     * Encodes the given input as a lock key.
     *
     * @param input a {@link Number} or any object whose {@code toString()} names the lock
     * @return the stable integer key
     */
    public static long encode(Object input) {
        if (input == null) {
            throw new IllegalArgumentException("lock name must not be null");
        }
        if (input instanceof Number number) {
            return number.longValue();
        }
        return crc32(input.toString());
    }

    /**
     * Returns the unsigned CRC32 checksum of the UTF-8 bytes of the given string.
     */
    public static long crc32(String value) {
        CRC32 crc = new CRC32();
        crc.update(value.getBytes(StandardCharsets.UTF_8));
        return crc.getValue();
    }
}
