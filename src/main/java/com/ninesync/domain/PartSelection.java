package com.ninesync.domain;

import java.util.regex.Pattern;

/**
 * Which leaves of a message to fetch: only part "1", or every leaf whose
 * {@code type/subtype} matches a pattern.
 */
public final class PartSelection {

    private static final PartSelection FIRST_PART = new PartSelection(null);

    private final Pattern contentType;

    private PartSelection(Pattern contentType) {
        this.contentType = contentType;
    }

    public static PartSelection firstPartOnly() {
        return FIRST_PART;
    }

    public static PartSelection contentType(String regex) {
        return new PartSelection(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }

    public boolean wants(BodyPart leaf) {
        if (contentType == null) {
            return "1".equals(leaf.partId());
        }
        return contentType.matcher(leaf.contentType()).find();
    }

    @Override
    public String toString() {
        return contentType == null ? "first-part" : "content-type ~ " + contentType.pattern();
    }
}
