package com.apisurface.signature.model;

import java.util.Map;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * An annotation applied to a package, class, member, parameter or type.
 */
@Value
@Builder(toBuilder = true)
public class AnnotationItem {

    /**
     * Qualified name as written in the signature file. Short forms such as
     * {@code Nullable} are kept as written.
     */
    @NonNull
    String qualifiedName;

    /**
     * Attribute name to literal or expression source, in declaration order.
     */
    @Singular
    Map<String, String> attributes;

    public static AnnotationItem of(String qualifiedName) {
        return AnnotationItem.builder().qualifiedName(qualifiedName).build();
    }

    public String simpleName() {
        return qualifiedName.substring(qualifiedName.lastIndexOf('.') + 1);
    }

    /**
     * True when the given name equals either the qualified or the simple name.
     */
    public boolean matches(String name) {
        return qualifiedName.equals(name) || simpleName().equals(name);
    }

    public String toSource() {
        if (attributes.isEmpty()) {
            return "@" + qualifiedName;
        }
        if (attributes.size() == 1 && attributes.containsKey("value")) {
            return "@" + qualifiedName + "(" + attributes.get("value") + ")";
        }
        return "@" + qualifiedName + attributes.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
