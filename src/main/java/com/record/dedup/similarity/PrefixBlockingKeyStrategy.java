package com.record.dedup.similarity;

import com.record.dedup.core.exception.InvalidParameterException;

import java.util.Locale;

/**
 * Blocking by leading characters: the key is the first {@code prefixLength}
 * characters of the lowercased text, or the whole text when it is shorter.
 *
 * <p>Near-duplicates that differ within their first {@code prefixLength}
 * characters (a leading typo, leading whitespace) land in different buckets and
 * are never compared. Longer prefixes mean smaller buckets and faster runs at the
 * price of more such misses.</p>
 */
public class PrefixBlockingKeyStrategy implements BlockingKeyStrategy {

    public static final int MIN_PREFIX_LENGTH = 1;
    public static final int MAX_PREFIX_LENGTH = 10;

    private final int prefixLength;

    public PrefixBlockingKeyStrategy(int prefixLength) {
        this.prefixLength = InvalidParameterException.requireInRange(
                "prefixLength", prefixLength, MIN_PREFIX_LENGTH, MAX_PREFIX_LENGTH);
    }

    @Override
    public String blockingKey(String normalizedText) {
        if (normalizedText == null || normalizedText.isEmpty()) {
            return "";
        }
        String lowered = normalizedText.toLowerCase(Locale.ROOT);
        return lowered.substring(0, Math.min(prefixLength, lowered.length()));
    }

    public int getPrefixLength() {
        return prefixLength;
    }
}
