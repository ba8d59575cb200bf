package com.apisurface.signature.merge;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apisurface.signature.format.FileFormat;
import com.apisurface.signature.model.AnnotationItem;
import com.apisurface.signature.model.ClassItem;
import com.apisurface.signature.model.Codebase;
import com.apisurface.signature.model.MemberItem;
import com.apisurface.signature.model.ModifierSet;
import com.apisurface.signature.model.PackageItem;
import com.apisurface.signature.ordering.SignatureOrdering;

/**
 * Combines partial codebases into one.
 *
 * Fragments are folded left to right and the later declaration of a class or member
 * wins. Members already known keep their position; new members are inserted where the
 * member ordering puts them. Inputs are never modified.
 */
public class CodebaseMerger {
    private static final Logger log = LoggerFactory.getLogger(CodebaseMerger.class);

    /**
     * Format of the result; null to keep the first fragment's format.
     */
    private final FileFormat formatOverride;

    public CodebaseMerger() {
        this(null);
    }

    public CodebaseMerger(FileFormat formatOverride) {
        this.formatOverride = formatOverride;
    }

    public Codebase merge(List<Codebase> fragments) {
        if (fragments.isEmpty()) {
            return Codebase.empty(formatOverride != null ? formatOverride : FileFormat.defaultFormat());
        }
        Codebase result = fragments.get(0);
        for (int i = 1; i < fragments.size(); i++) {
            result = merge(result, fragments.get(i));
        }
        if (formatOverride != null && !formatOverride.equals(result.getFormat())) {
            result = result.toBuilder().format(formatOverride).build();
        }
        return result;
    }

    /**
     * Merges two codebases, {@code later} overriding {@code earlier}.
     */
    public Codebase merge(Codebase earlier, Codebase later) {
        FileFormat format = formatOverride != null ? formatOverride : earlier.getFormat();
        Comparator<MemberItem> memberOrder = SignatureOrdering.memberOrder(format);

        Map<String, PackageItem> packages = new LinkedHashMap<>();
        earlier.getPackages().forEach(pkg -> packages.merge(pkg.getName(), pkg, (a, b) -> mergePackage(a, b, memberOrder)));
        later.getPackages().forEach(pkg -> packages.merge(pkg.getName(), pkg, (a, b) -> mergePackage(a, b, memberOrder)));

        log.debug("Merged {} into {}: {} package(s)", later.getOrigin(), earlier.getOrigin(), packages.size());
        return Codebase.builder()
                .format(format)
                .packages(packages.values())
                .origin(joinOrigins(earlier.getOrigin(), later.getOrigin()))
                .build();
    }

    private PackageItem mergePackage(PackageItem earlier, PackageItem later, Comparator<MemberItem> memberOrder) {
        List<ClassItem> classes = new ArrayList<>(earlier.getClasses());
        for (ClassItem cls : later.getClasses()) {
            classes = placeClass(classes, cls, memberOrder);
        }
        return PackageItem.builder()
                .name(earlier.getName())
                .modifiers(mergeModifiers(earlier.getModifiers(), later.getModifiers()))
                .classes(rehomeNested(classes, memberOrder))
                .build();
    }

    /**
     * Puts {@code cls} into the class list: merged with a class of the same name, nested
     * into its outer class when that is present, appended otherwise.
     */
    private List<ClassItem> placeClass(List<ClassItem> classes, ClassItem cls, Comparator<MemberItem> memberOrder) {
        List<ClassItem> result = new ArrayList<>(classes.size() + 1);
        boolean placed = false;
        for (ClassItem existing : classes) {
            if (!placed && existing.getFullName().equals(cls.getFullName())) {
                result.add(mergeClass(existing, cls, memberOrder));
                placed = true;
            } else if (!placed && cls.getFullName().startsWith(existing.getFullName() + ".")) {
                result.add(existing.toBuilder()
                        .clearNestedClasses()
                        .nestedClasses(placeClass(existing.getNestedClasses(), cls, memberOrder))
                        .build());
                placed = true;
            } else {
                result.add(existing);
            }
        }
        if (!placed) {
            result.add(cls);
        }
        return result;
    }

    /**
     * Moves dotted top-level classes under their outer class once a later fragment has
     * supplied it.
     */
    private List<ClassItem> rehomeNested(List<ClassItem> classes, Comparator<MemberItem> memberOrder) {
        List<String> topLevelNames = classes.stream().map(ClassItem::getFullName).collect(Collectors.toList());
        List<ClassItem> orphans = classes.stream()
                .filter(cls -> cls.isNested() && hasOuter(cls.getFullName(), topLevelNames))
                .sorted(Comparator.comparingInt((ClassItem cls) -> cls.getFullName().length()))
                .collect(Collectors.toList());
        if (orphans.isEmpty()) {
            return classes;
        }
        List<ClassItem> result = new ArrayList<>(classes);
        result.removeAll(orphans);
        for (ClassItem orphan : orphans) {
            result = placeClass(result, orphan, memberOrder);
        }
        return result;
    }

    private static boolean hasOuter(String fullName, List<String> topLevelNames) {
        return topLevelNames.stream().anyMatch(name -> fullName.startsWith(name + "."));
    }

    private ClassItem mergeClass(ClassItem earlier, ClassItem later, Comparator<MemberItem> memberOrder) {
        List<MemberItem> members = new ArrayList<>(earlier.getMembers());
        Map<String, Integer> positions = new LinkedHashMap<>();
        for (int i = 0; i < members.size(); i++) {
            positions.put(members.get(i).signatureKey(), i);
        }
        List<MemberItem> added = new ArrayList<>();
        for (MemberItem member : later.getMembers()) {
            Integer position = positions.get(member.signatureKey());
            if (position != null) {
                members.set(position, member);
            } else {
                added.add(member);
            }
        }
        for (MemberItem member : added) {
            insertInOrder(members, member, memberOrder);
        }

        List<ClassItem> nested = new ArrayList<>(earlier.getNestedClasses());
        for (ClassItem cls : later.getNestedClasses()) {
            nested = placeClass(nested, cls, memberOrder);
        }

        return later.toBuilder()
                .modifiers(mergeModifiers(earlier.getModifiers(), later.getModifiers()))
                .clearMembers()
                .members(members)
                .clearNestedClasses()
                .nestedClasses(nested)
                .build();
    }

    private static void insertInOrder(List<MemberItem> members, MemberItem member, Comparator<MemberItem> order) {
        for (int i = 0; i < members.size(); i++) {
            if (order.compare(members.get(i), member) > 0) {
                members.add(i, member);
                return;
            }
        }
        members.add(member);
    }

    /**
     * The later modifiers with annotations from both sides; an annotation present on
     * both sides takes the later attributes.
     */
    static ModifierSet mergeModifiers(ModifierSet earlier, ModifierSet later) {
        Map<String, AnnotationItem> annotations = new LinkedHashMap<>();
        earlier.getAnnotations().forEach(a -> annotations.put(a.getQualifiedName(), a));
        later.getAnnotations().forEach(a -> annotations.put(a.getQualifiedName(), a));
        return later.toBuilder()
                .clearAnnotations()
                .annotations(annotations.values())
                .build();
    }

    private static String joinOrigins(String earlier, String later) {
        if (earlier == null) {
            return later;
        }
        return later == null ? earlier : earlier + ", " + later;
    }
}
