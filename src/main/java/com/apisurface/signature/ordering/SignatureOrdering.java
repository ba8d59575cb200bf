package com.apisurface.signature.ordering;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.apisurface.signature.format.FileFormat;
import com.apisurface.signature.format.OverloadedMethodOrder;
import com.apisurface.signature.model.ClassItem;
import com.apisurface.signature.model.Codebase;
import com.apisurface.signature.model.MemberItem;
import com.apisurface.signature.model.PackageItem;
import com.apisurface.signature.model.ParameterItem;
import com.apisurface.signature.model.TypeReference;

import lombok.experimental.UtilityClass;

/**
 * Canonical order of packages, classes, members and interface lists, shared by
 * the writer and the compatibility comparator.
 *
 * All sorts are stable, so items that compare equal keep their declaration order.
 */
@UtilityClass
public class SignatureOrdering {

    public static final Comparator<PackageItem> PACKAGE_ORDER = Comparator.comparing(PackageItem::getName);

    public static final Comparator<ClassItem> CLASS_ORDER = Comparator.comparing(ClassItem::qualifiedName);

    /**
     * Member order for the given overload policy: kind group, then name, then (in
     * signature mode) parameter count and the parameter type strings pairwise.
     */
    public static Comparator<MemberItem> memberOrder(OverloadedMethodOrder overloadOrder) {
        Comparator<MemberItem> byKindAndName = Comparator
                .comparingInt((MemberItem m) -> m.getKind().getPriority())
                .thenComparing(MemberItem::getName);
        if (overloadOrder == OverloadedMethodOrder.SOURCE) {
            return byKindAndName;
        }
        return byKindAndName.thenComparing(SignatureOrdering::compareParameterLists);
    }

    public static Comparator<MemberItem> memberOrder(FileFormat format) {
        return memberOrder(format.getOverloadedMethodOrder());
    }

    /**
     * Compares parameter lists by length, then by type string position by position.
     */
    public static int compareParameterLists(MemberItem a, MemberItem b) {
        List<ParameterItem> pa = a.getParameters();
        List<ParameterItem> pb = b.getParameters();
        int bySize = Integer.compare(pa.size(), pb.size());
        if (bySize != 0) {
            return bySize;
        }
        for (int i = 0; i < pa.size(); i++) {
            int byType = pa.get(i).getType().toCanonicalString()
                    .compareTo(pb.get(i).getType().toCanonicalString());
            if (byType != 0) {
                return byType;
            }
        }
        return 0;
    }

    public static List<PackageItem> sortedPackages(List<PackageItem> packages) {
        List<PackageItem> sorted = new ArrayList<>(packages);
        sorted.sort(PACKAGE_ORDER);
        return sorted;
    }

    public static List<ClassItem> sortedClasses(List<ClassItem> classes) {
        List<ClassItem> sorted = new ArrayList<>(classes);
        sorted.sort(CLASS_ORDER);
        return sorted;
    }

    public static List<MemberItem> sortedMembers(List<MemberItem> members, FileFormat format) {
        List<MemberItem> sorted = new ArrayList<>(members);
        sorted.sort(memberOrder(format));
        return sorted;
    }

    /**
     * Order in which a class's interfaces are written.
     *
     * With {@code sort-whole-extends-list} the list is sorted by qualified name and then
     * by full type string. Otherwise it is sorted by qualified name only, and for an
     * interface the first declared super-interface is kept in front.
     */
    public static List<TypeReference> orderedInterfaces(ClassItem cls, FileFormat format) {
        List<TypeReference> interfaces = cls.getInterfaces();
        if (interfaces.size() < 2) {
            return interfaces;
        }
        if (format.isSortWholeExtendsList()) {
            List<TypeReference> sorted = new ArrayList<>(interfaces);
            sorted.sort(Comparator.comparing(TypeReference::getName)
                    .thenComparing(TypeReference::toCanonicalString));
            return sorted;
        }
        List<TypeReference> sorted = new ArrayList<>();
        List<TypeReference> rest = new ArrayList<>(interfaces);
        if (cls.isInterface()) {
            sorted.add(rest.remove(0));
        }
        rest.sort(Comparator.comparing(TypeReference::getName));
        sorted.addAll(rest);
        return sorted;
    }

    /**
     * Rebuilds the codebase with every list in canonical order for the given format.
     */
    public static Codebase canonicalize(Codebase codebase, FileFormat format) {
        Codebase.CodebaseBuilder builder = codebase.toBuilder().format(format).clearPackages();
        for (PackageItem pkg : sortedPackages(codebase.getPackages())) {
            PackageItem.PackageItemBuilder pkgBuilder = pkg.toBuilder().clearClasses();
            sortedClasses(pkg.getClasses()).forEach(cls -> pkgBuilder.cls(canonicalize(cls, format)));
            builder.pkg(pkgBuilder.build());
        }
        return builder.build();
    }

    public static ClassItem canonicalize(ClassItem cls, FileFormat format) {
        ClassItem.ClassItemBuilder builder = cls.toBuilder()
                .clearMembers()
                .members(sortedMembers(cls.getMembers(), format))
                .clearInterfaces()
                .interfaces(orderedInterfaces(cls, format))
                .clearNestedClasses();
        sortedClasses(cls.getNestedClasses()).forEach(nested -> builder.nestedClass(canonicalize(nested, format)));
        return builder.build();
    }
}
