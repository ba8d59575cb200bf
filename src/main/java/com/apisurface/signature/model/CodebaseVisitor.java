package com.apisurface.signature.model;

/**
 * Visitor for walking a codebase in tree order. Every callback defaults to a no-op.
 */
public interface CodebaseVisitor {

    default void visitPackage(PackageItem pkg) {
    }

    default void visitClass(ClassItem cls) {
    }

    default void visitMember(ClassItem owner, MemberItem member) {
    }

    default void afterClass(ClassItem cls) {
    }

    default void afterPackage(PackageItem pkg) {
    }
}
