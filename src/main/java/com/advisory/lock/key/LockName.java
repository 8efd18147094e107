package com.advisory.lock.key;

/**
 * A resolved lock name: the prefixed string form used by name-keyed backends
 * and the integer key used by integer-keyed backends.
 *
 * @param value the lock name with the process-wide prefix applied
 * @param key   the integer key derived from {@code value}
 */
public record LockName(String value, long key) {

    public LockName {
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
    }

    /**
     * Resolves a caller-supplied lock name against a prefix.
     *
     * <p>Without a prefix a numeric name keeps its own value as the key. With a
     * prefix the name becomes a string and is checksummed like any other.</p>
     *
     * @param prefix  the global prefix, may be null or empty
     * @param rawName a string or numeric lock name
     */
    public static LockName resolve(String prefix, Object rawName) {
        if (rawName == null) {
            throw new IllegalArgumentException("lock name must not be null");
        }
        if (prefix == null || prefix.isEmpty()) {
            return new LockName(stringForm(rawName), LockKeys.encode(rawName));
        }
        String prefixed = prefix + stringForm(rawName);
        return new LockName(prefixed, LockKeys.encode(prefixed));
    }

    private static String stringForm(Object rawName) {
        if (rawName instanceof Number number) {
            return Long.toString(number.longValue());
        }
        return rawName.toString();
    }

    @Override
    public String toString() {
        return value + "#" + key;
    }
}
