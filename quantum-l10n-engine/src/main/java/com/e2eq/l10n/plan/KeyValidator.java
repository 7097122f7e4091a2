package com.e2eq.l10n.plan;

import org.apache.commons.lang3.StringUtils;

import java.util.regex.Pattern;

/**
 * Normalizes raw keys and rejects malformed ones.
 * <p>
 * A raw key may carry a single {@code DefType/} prefix which is dropped: it classifies the
 * definition but is not part of its identity. The normalized key must be usable as an XML element
 * name, since that is how it is persisted.
 */
public final class KeyValidator {

    public static final char NAMESPACE_SEPARATOR = '/';

    private static final Pattern ELEMENT_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.\\-]*");

    private KeyValidator() {
    }

    /**
     * Result of checking one raw key. Exactly one of {@code key} and {@code problem} is non-null.
     */
    public record KeyCheck(String key, String problem) {
        public boolean isValid() {
            return problem == null;
        }
    }

    public static KeyCheck check(String rawKey) {
        if (StringUtils.isBlank(rawKey)) {
            return new KeyCheck(null, "key is empty");
        }
        if (StringUtils.containsWhitespace(rawKey)) {
            return new KeyCheck(null, "key contains whitespace");
        }
        int separators = StringUtils.countMatches(rawKey, NAMESPACE_SEPARATOR);
        String key = rawKey;
        if (separators > 1) {
            return new KeyCheck(null, "key contains more than one '" + NAMESPACE_SEPARATOR + "'");
        }
        if (separators == 1) {
            String prefix = StringUtils.substringBefore(rawKey, String.valueOf(NAMESPACE_SEPARATOR));
            key = StringUtils.substringAfter(rawKey, String.valueOf(NAMESPACE_SEPARATOR));
            if (prefix.isEmpty() || key.isEmpty()) {
                return new KeyCheck(null, "type prefix or field path around '" + NAMESPACE_SEPARATOR + "' is empty");
            }
        }
        if (!ELEMENT_NAME.matcher(key).matches()) {
            return new KeyCheck(null, "'" + key + "' is not a valid element name");
        }
        return new KeyCheck(key, null);
    }
}
