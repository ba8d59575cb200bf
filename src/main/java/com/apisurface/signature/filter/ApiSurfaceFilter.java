package com.apisurface.signature.filter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apisurface.signature.model.ClassItem;
import com.apisurface.signature.model.Codebase;
import com.apisurface.signature.model.MemberItem;
import com.apisurface.signature.model.ModifierSet;
import com.apisurface.signature.model.PackageItem;
import com.apisurface.signature.model.TypeReference;
import com.apisurface.signature.model.Visibility;

import lombok.RequiredArgsConstructor;

/**
 * Applies show and hide annotations to a codebase.
 *
 * A kept class whose superclass was removed inherits ("inlines") the visible members of
 * the removed ancestors, and its supertypes are rewritten to skip them, so the
 * surface a client can call stays the same.
 */
@RequiredArgsConstructor
public class ApiSurfaceFilter {
    private static final Logger log = LoggerFactory.getLogger(ApiSurfaceFilter.class);

    private final FilterConfig config;

    public Codebase filter(Codebase codebase) {
        if (config.isEmpty()) {
            return codebase;
        }

        Set<String> kept = new HashSet<>();
        for (PackageItem pkg : codebase.getPackages()) {
            if (config.isPackageHidden(pkg.getName()) || isHidden(pkg.getModifiers())) {
                continue;
            }
            boolean shown = isShown(pkg.getModifiers());
            for (ClassItem cls : pkg.getClasses()) {
                collectKept(cls, shown, kept);
            }
        }

        Map<String, ClassItem> index = codebase.classIndex();
        Codebase.CodebaseBuilder builder = codebase.toBuilder().clearPackages();
        for (PackageItem pkg : codebase.getPackages()) {
            boolean shown = isShown(pkg.getModifiers());
            List<ClassItem> classes = new ArrayList<>();
            for (ClassItem cls : pkg.getClasses()) {
                if (kept.contains(cls.qualifiedName())) {
                    classes.add(rebuild(cls, shown, kept, index));
                }
            }
            if (!classes.isEmpty()) {
                builder.pkg(pkg.toBuilder().clearClasses().classes(classes).build());
            }
        }
        Codebase filtered = builder.build();
        log.debug("Filtered {}: kept {} of {} classes", codebase.getOrigin(), kept.size(), index.size());
        return filtered;
    }

    /**
     * Adds the names of kept classes; returns true when {@code cls} is kept.
     */
    private boolean collectKept(ClassItem cls, boolean outerShown, Set<String> kept) {
        if (isHidden(cls.getModifiers())) {
            return false;
        }
        boolean shown = outerShown || isShown(cls.getModifiers());
        boolean keep = shown || cls.getMembers().stream().anyMatch(m -> isMemberKept(m, false));
        for (ClassItem nested : cls.getNestedClasses()) {
            keep |= collectKept(nested, shown, kept);
        }
        if (keep) {
            kept.add(cls.qualifiedName());
        }
        return keep;
    }

    private ClassItem rebuild(ClassItem cls, boolean outerShown, Set<String> kept, Map<String, ClassItem> index) {
        boolean shown = outerShown || isShown(cls.getModifiers());
        List<MemberItem> members = new ArrayList<>();
        Set<String> declared = new HashSet<>();
        for (MemberItem member : cls.getMembers()) {
            if (isMemberKept(member, shown)) {
                members.add(member);
                declared.add(member.signatureKey());
            }
        }

        Map<String, TypeReference> interfaces = new LinkedHashMap<>();
        for (TypeReference iface : cls.getInterfaces()) {
            addVisibleInterfaces(iface, kept, index, interfaces, new HashSet<>());
        }

        TypeReference superclass = cls.getSuperclass();
        Set<String> visited = new HashSet<>();
        while (superclass != null && !kept.contains(superclass.getName()) && visited.add(superclass.getName())) {
            ClassItem ancestor = index.get(superclass.getName());
            if (ancestor == null) {
                break;
            }
            for (MemberItem member : ancestor.getMembers()) {
                if (isInheritable(member) && declared.add(member.signatureKey())) {
                    members.add(member);
                }
            }
            for (TypeReference iface : ancestor.getInterfaces()) {
                addVisibleInterfaces(iface, kept, index, interfaces, new HashSet<>());
            }
            superclass = ancestor.getSuperclass();
        }

        ClassItem.ClassItemBuilder builder = cls.toBuilder()
                .superclass(superclass)
                .clearInterfaces()
                .interfaces(interfaces.values())
                .clearMembers()
                .members(members)
                .clearNestedClasses();
        for (ClassItem nested : cls.getNestedClasses()) {
            if (kept.contains(nested.qualifiedName())) {
                builder.nestedClass(rebuild(nested, shown, kept, index));
            }
        }
        return builder.build();
    }

    /**
     * Adds {@code iface} when it is visible, otherwise its own super-interfaces.
     */
    private static void addVisibleInterfaces(TypeReference iface, Set<String> kept, Map<String, ClassItem> index,
            Map<String, TypeReference> target, Set<String> visited) {
        ClassItem resolved = index.get(iface.getName());
        if (resolved == null || kept.contains(iface.getName())) {
            target.putIfAbsent(iface.getName(), iface);
            return;
        }
        if (!visited.add(iface.getName())) {
            return;
        }
        for (TypeReference parent : resolved.getInterfaces()) {
            addVisibleInterfaces(parent, kept, index, target, visited);
        }
    }

    private boolean isMemberKept(MemberItem member, boolean classShown) {
        if (isHidden(member.getModifiers())) {
            return false;
        }
        return config.getShowAnnotations().isEmpty() || classShown || isShown(member.getModifiers());
    }

    private boolean isInheritable(MemberItem member) {
        return !member.isConstructor()
                && member.visibility() != Visibility.PRIVATE
                && !isHidden(member.getModifiers());
    }

    private boolean isHidden(ModifierSet modifiers) {
        return modifiers.hasAnyAnnotation(config.getHideAnnotations());
    }

    private boolean isShown(ModifierSet modifiers) {
        return config.getShowAnnotations().isEmpty() || modifiers.hasAnyAnnotation(config.getShowAnnotations());
    }
}
