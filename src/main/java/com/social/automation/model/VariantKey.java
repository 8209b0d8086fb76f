package com.social.automation.model;

/**
 * A selected variant, encoded on the wire and in storage as {@code testId::variantId}.
 */
public record VariantKey(String testId, String variantId) {

    public static final String SEPARATOR = "::";
    public static final VariantKey DEFAULT = new VariantKey("default", "A");

    public static VariantKey parse(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            return DEFAULT;
        }
        int idx = encoded.indexOf(SEPARATOR);
        if (idx < 0) {
            return new VariantKey("default", encoded);
        }
        return new VariantKey(encoded.substring(0, idx), encoded.substring(idx + SEPARATOR.length()));
    }

    public String encode() {
        return testId + SEPARATOR + variantId;
    }

    @Override
    public String toString() {
        return encode();
    }
}
