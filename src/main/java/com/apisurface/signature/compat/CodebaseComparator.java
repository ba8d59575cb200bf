package com.apisurface.signature.compat;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

import com.apisurface.signature.model.ClassItem;
import com.apisurface.signature.model.Codebase;
import com.apisurface.signature.model.MemberItem;
import com.apisurface.signature.model.PackageItem;
import com.apisurface.signature.ordering.SignatureOrdering;

import lombok.experimental.UtilityClass;

/**
 * Walks two codebases in lock step.
 *
 * Packages, classes and members are sorted on both sides and joined by key, so an
 * insertion or deletion on one side never misaligns the rest. A class or package present
 * on one side only is reported once; its contents are not visited.
 */
@UtilityClass
public class CodebaseComparator {

    private static final Comparator<ClassItem> CLASS_JOIN_ORDER = Comparator.comparing(ClassItem::getFullName);

    private static final Comparator<MemberItem> MEMBER_JOIN_ORDER = Comparator
            .comparingInt((MemberItem m) -> m.getKind().getPriority())
            .thenComparing(MemberItem::getName)
            .thenComparing(MemberItem::erasedParameterList);

    public static void compare(Codebase oldCodebase, Codebase newCodebase, ComparisonVisitor visitor) {
        join(oldCodebase.getPackages(), newCodebase.getPackages(), SignatureOrdering.PACKAGE_ORDER,
                (oldPackage, newPackage) -> {
                    visitor.compare(oldPackage, newPackage);
                    compareClasses(oldPackage.getClasses(), newPackage.getClasses(), visitor);
                },
                visitor::removed,
                visitor::added);
    }

    private static void compareClasses(List<ClassItem> oldClasses, List<ClassItem> newClasses,
            ComparisonVisitor visitor) {
        join(oldClasses, newClasses, CLASS_JOIN_ORDER,
                (oldClass, newClass) -> compareClass(oldClass, newClass, visitor),
                visitor::removed,
                visitor::added);
    }

    private static void compareClass(ClassItem oldClass, ClassItem newClass, ComparisonVisitor visitor) {
        visitor.compare(oldClass, newClass);
        join(oldClass.getMembers(), newClass.getMembers(), MEMBER_JOIN_ORDER,
                (oldMember, newMember) -> visitor.compare(oldClass, oldMember, newClass, newMember),
                oldMember -> visitor.removed(oldClass, oldMember, newClass),
                newMember -> visitor.added(oldClass, newClass, newMember));
        compareClasses(oldClass.getNestedClasses(), newClass.getNestedClasses(), visitor);
    }

    /**
     * Merge join of two lists under {@code order}; elements comparing equal are matched.
     */
    static <T> void join(List<T> olds, List<T> news, Comparator<? super T> order,
            BiConsumer<T, T> both, Consumer<T> onlyOld, Consumer<T> onlyNew) {
        List<T> left = new ArrayList<>(olds);
        List<T> right = new ArrayList<>(news);
        left.sort(order);
        right.sort(order);
        int i = 0;
        int j = 0;
        while (i < left.size() && j < right.size()) {
            int cmp = order.compare(left.get(i), right.get(j));
            if (cmp == 0) {
                both.accept(left.get(i++), right.get(j++));
            } else if (cmp < 0) {
                onlyOld.accept(left.get(i++));
            } else {
                onlyNew.accept(right.get(j++));
            }
        }
        while (i < left.size()) {
            onlyOld.accept(left.get(i++));
        }
        while (j < right.size()) {
            onlyNew.accept(right.get(j++));
        }
    }
}
