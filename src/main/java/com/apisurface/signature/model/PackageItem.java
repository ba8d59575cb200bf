package com.apisurface.signature.model;

import java.util.List;
import java.util.stream.Stream;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class PackageItem {

    @NonNull
    String name;

    /**
     * Package-level annotations; visibility is unused.
     */
    @NonNull
    @Builder.Default
    ModifierSet modifiers = ModifierSet.empty();

    /**
     * Top-level classes. Nested classes are owned by their outer class.
     */
    @Singular("cls")
    List<ClassItem> classes;

    public ClassItem findClass(String fullName) {
        for (ClassItem cls : classes) {
            if (cls.getFullName().equals(fullName)) {
                return cls;
            }
            if (fullName.startsWith(cls.getFullName() + ".")) {
                ClassItem nested = cls.findNestedClass(fullName);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }

    public Stream<ClassItem> allClasses() {
        return classes.stream().flatMap(ClassItem::selfAndNested);
    }

    public boolean isEmpty() {
        return classes.isEmpty();
    }
}
