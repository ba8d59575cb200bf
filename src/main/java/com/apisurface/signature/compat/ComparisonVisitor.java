package com.apisurface.signature.compat;

import com.apisurface.signature.model.ClassItem;
import com.apisurface.signature.model.MemberItem;
import com.apisurface.signature.model.PackageItem;

/**
 * Callbacks of {@link CodebaseComparator}. Items present on both sides are passed to
 * {@code compare}, items on one side only to {@code added} or {@code removed}.
 */
public interface ComparisonVisitor {

    default void compare(PackageItem oldPackage, PackageItem newPackage) {
    }

    default void added(PackageItem newPackage) {
    }

    default void removed(PackageItem oldPackage) {
    }

    default void compare(ClassItem oldClass, ClassItem newClass) {
    }

    default void added(ClassItem newClass) {
    }

    default void removed(ClassItem oldClass) {
    }

    default void compare(ClassItem oldOwner, MemberItem oldMember, ClassItem newOwner, MemberItem newMember) {
    }

    default void added(ClassItem oldOwner, ClassItem newOwner, MemberItem newMember) {
    }

    default void removed(ClassItem oldOwner, MemberItem oldMember, ClassItem newOwner) {
    }
}
