package com.apisurface.signature.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import com.apisurface.signature.format.FileFormat;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

/**
 * Root of an API surface: packages, the classes they declare and the format the
 * surface was read with or should be written with.
 *
 * Immutable. Operations that change a codebase (merge, subtract, filter) build a new one.
 */
@Value
@Builder(toBuilder = true)
public class Codebase {

    @NonNull
    @Builder.Default
    FileFormat format = FileFormat.defaultFormat();

    @Singular("pkg")
    List<PackageItem> packages;

    /**
     * Where this codebase came from (file names), for diagnostics only.
     */
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    String origin;

    public static Codebase empty(FileFormat format) {
        return Codebase.builder().format(format).build();
    }

    public PackageItem findPackage(String name) {
        for (PackageItem pkg : packages) {
            if (pkg.getName().equals(name)) {
                return pkg;
            }
        }
        return null;
    }

    /**
     * Finds a class, nested or not, by qualified name.
     */
    public ClassItem findClass(String qualifiedName) {
        ClassItem found = null;
        int bestPackageLength = -1;
        for (PackageItem pkg : packages) {
            String prefix = pkg.getName().isEmpty() ? "" : pkg.getName() + ".";
            if (!qualifiedName.startsWith(prefix) || pkg.getName().length() <= bestPackageLength) {
                continue;
            }
            ClassItem cls = pkg.findClass(qualifiedName.substring(prefix.length()));
            if (cls != null) {
                found = cls;
                bestPackageLength = pkg.getName().length();
            }
        }
        return found;
    }

    public Stream<ClassItem> allClasses() {
        return packages.stream().flatMap(PackageItem::allClasses);
    }

    /**
     * Every class keyed by qualified name, for repeated lookups.
     */
    public Map<String, ClassItem> classIndex() {
        Map<String, ClassItem> index = new LinkedHashMap<>();
        allClasses().forEach(cls -> index.put(cls.qualifiedName(), cls));
        return index;
    }

    public boolean isEmpty() {
        return packages.stream().allMatch(PackageItem::isEmpty);
    }

    public void accept(CodebaseVisitor visitor) {
        for (PackageItem pkg : packages) {
            visitor.visitPackage(pkg);
            for (ClassItem cls : pkg.getClasses()) {
                acceptClass(cls, visitor);
            }
            visitor.afterPackage(pkg);
        }
    }

    private static void acceptClass(ClassItem cls, CodebaseVisitor visitor) {
        visitor.visitClass(cls);
        for (MemberItem member : cls.getMembers()) {
            visitor.visitMember(cls, member);
        }
        for (ClassItem nested : cls.getNestedClasses()) {
            acceptClass(nested, visitor);
        }
        visitor.afterClass(cls);
    }
}
