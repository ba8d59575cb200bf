package com.apisurface.signature.merge;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apisurface.signature.model.ClassItem;
import com.apisurface.signature.model.Codebase;
import com.apisurface.signature.model.MemberItem;
import com.apisurface.signature.model.PackageItem;

import lombok.NoArgsConstructor;

/**
 * Removes one codebase's surface from another.
 *
 * Members match by signature (kind, name and erased parameter types); modifiers,
 * annotations and return types are not compared. A class disappears only when every
 * one of its members and nested classes was subtracted.
 */
@NoArgsConstructor
public class CodebaseSubtractor {
    private static final Logger log = LoggerFactory.getLogger(CodebaseSubtractor.class);

    public Codebase subtract(Codebase minuend, Codebase subtrahend) {
        Codebase.CodebaseBuilder builder = minuend.toBuilder().clearPackages();
        int removedPackages = 0;
        for (PackageItem pkg : minuend.getPackages()) {
            List<ClassItem> classes = new ArrayList<>();
            for (ClassItem cls : pkg.getClasses()) {
                ClassItem remaining = subtractClass(cls, subtrahend);
                if (remaining != null) {
                    classes.add(remaining);
                }
            }
            if (classes.isEmpty() && !pkg.isEmpty()) {
                removedPackages++;
                continue;
            }
            builder.pkg(pkg.toBuilder().clearClasses().classes(classes).build());
        }
        log.debug("Subtracted {} from {}: {} package(s) emptied", subtrahend.getOrigin(), minuend.getOrigin(),
                removedPackages);
        return builder.build();
    }

    /**
     * Returns what is left of {@code cls}, or null when nothing is left.
     */
    private ClassItem subtractClass(ClassItem cls, Codebase subtrahend) {
        ClassItem other = subtrahend.findClass(cls.qualifiedName());
        if (other == null) {
            return cls;
        }
        Set<String> removedKeys = other.getMembers().stream()
                .map(MemberItem::signatureKey)
                .collect(Collectors.toSet());
        List<MemberItem> members = cls.getMembers().stream()
                .filter(m -> !removedKeys.contains(m.signatureKey()))
                .collect(Collectors.toList());
        List<ClassItem> nested = new ArrayList<>();
        for (ClassItem nestedClass : cls.getNestedClasses()) {
            ClassItem remaining = subtractClass(nestedClass, subtrahend);
            if (remaining != null) {
                nested.add(remaining);
            }
        }
        if (members.isEmpty() && nested.isEmpty()) {
            return null;
        }
        return cls.toBuilder()
                .clearMembers()
                .members(members)
                .clearNestedClasses()
                .nestedClasses(nested)
                .build();
    }
}
