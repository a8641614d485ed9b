package com.ninesync.domain;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One node of a BODYSTRUCTURE tree.
 *
 * @param partId   dotted part specifier ("1", "2.1"); empty for a multipart root
 * @param type     lower-cased media type, "multipart" for branching nodes
 * @param params   body parameters with lower-cased names
 * @param encoding transfer encoding of a leaf, null for multiparts
 */
public record BodyPart(String partId,
                       String type,
                       String subtype,
                       Map<String, String> params,
                       String encoding,
                       List<BodyPart> children) {

    public BodyPart {
        params = Map.copyOf(params);
        children = List.copyOf(children);
    }

    public boolean isMultipart() {
        return "multipart".equals(type);
    }

    /** {@code type/subtype}, lower-cased. */
    public String contentType() {
        return type + "/" + subtype;
    }

    public String param(String name) {
        return params.get(name.toLowerCase(Locale.ROOT));
    }

    public String boundary() {
        return param("boundary");
    }

    public String charset() {
        return param("charset");
    }
}
