package com.apisurface.signature.compat;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apisurface.signature.format.ConstantValueRenderer;
import com.apisurface.signature.model.ClassItem;
import com.apisurface.signature.model.ClassKind;
import com.apisurface.signature.model.Codebase;
import com.apisurface.signature.model.MemberItem;
import com.apisurface.signature.model.MemberKind;
import com.apisurface.signature.model.Modifier;
import com.apisurface.signature.model.ModifierSet;
import com.apisurface.signature.model.Nullability;
import com.apisurface.signature.model.PackageItem;
import com.apisurface.signature.model.ParameterItem;
import com.apisurface.signature.model.TypeReference;
import com.apisurface.signature.model.Visibility;

/**
 * Compares a previously released codebase with the current one and reports every
 * incompatible change as an {@link Issue}.
 *
 * Never throws on valid codebases: problems are collected, never raised. Supertypes
 * are resolved by name through the codebase they belong to; names that do not resolve
 * are treated as external classes.
 */
public class CompatibilityChecker implements ComparisonVisitor {
    private static final Logger log = LoggerFactory.getLogger(CompatibilityChecker.class);

    private static final Set<String> UNCHECKED_ROOTS = Set.of("java.lang.RuntimeException", "java.lang.Error");

    /**
     * Unchecked JDK exceptions commonly declared in throws clauses.
     */
    private static final Set<String> KNOWN_UNCHECKED = Set.of(
            "java.lang.RuntimeException",
            "java.lang.Error",
            "java.lang.ArithmeticException",
            "java.lang.ArrayIndexOutOfBoundsException",
            "java.lang.ClassCastException",
            "java.lang.IllegalArgumentException",
            "java.lang.IllegalMonitorStateException",
            "java.lang.IllegalStateException",
            "java.lang.IndexOutOfBoundsException",
            "java.lang.NegativeArraySizeException",
            "java.lang.NullPointerException",
            "java.lang.NumberFormatException",
            "java.lang.SecurityException",
            "java.lang.StringIndexOutOfBoundsException",
            "java.lang.UnsupportedOperationException",
            "java.lang.AssertionError",
            "java.lang.OutOfMemoryError",
            "java.lang.StackOverflowError",
            "java.io.UncheckedIOException",
            "java.util.ConcurrentModificationException",
            "java.util.NoSuchElementException",
            "java.util.MissingResourceException",
            "java.util.regex.PatternSyntaxException",
            "java.nio.charset.IllegalCharsetNameException",
            "java.nio.charset.UnsupportedCharsetException");

    private final Codebase oldCodebase;
    private final Codebase newCodebase;
    private final CompatibilityConfig config;
    private final IssueReporter reporter;

    public CompatibilityChecker(Codebase oldCodebase, Codebase newCodebase, CompatibilityConfig config) {
        this.oldCodebase = oldCodebase;
        this.newCodebase = newCodebase;
        this.config = config;
        this.reporter = new IssueReporter(config.getIssueConfiguration(), config.getBaseline());
    }

    public static CompatibilityResult check(Codebase oldCodebase, Codebase newCodebase, CompatibilityConfig config) {
        return new CompatibilityChecker(oldCodebase, newCodebase, config).check();
    }

    public CompatibilityResult check() {
        CodebaseComparator.compare(oldCodebase, newCodebase, this);
        CompatibilityResult result = CompatibilityResult.builder()
                .issues(reporter.getIssues())
                .unfilteredIssues(reporter.getAllIssues())
                .baselinedCount(reporter.getBaselinedCount())
                .build();
        log.debug("Compatibility check of {} against {}: {} issue(s), {} baselined",
                newCodebase.getOrigin(), oldCodebase.getOrigin(), result.getIssues().size(),
                result.getBaselinedCount());
        return result;
    }

    // ------------------------------------------------------------------
    // Packages
    // ------------------------------------------------------------------

    @Override
    public void added(PackageItem newPackage) {
        if (!newPackage.isEmpty()) {
            reporter.report(IssueType.ADDED_PACKAGE, newPackage.getName(), "Added package " + newPackage.getName());
        }
    }

    @Override
    public void removed(PackageItem oldPackage) {
        if (oldPackage.isEmpty() || config.getRemovedApi() != null
                && config.getRemovedApi().findPackage(oldPackage.getName()) != null) {
            return;
        }
        reporter.report(IssueType.REMOVED_PACKAGE, oldPackage.getName(), "Removed package " + oldPackage.getName());
    }

    // ------------------------------------------------------------------
    // Classes
    // ------------------------------------------------------------------

    @Override
    public void added(ClassItem newClass) {
        if (isSuppressed(newCodebase, newClass)) {
            return;
        }
        reporter.report(IssueType.ADDED_CLASS, newClass.qualifiedName(), "Added " + describe(newClass));
    }

    @Override
    public void removed(ClassItem oldClass) {
        if (isSuppressed(oldCodebase, oldClass) || isInRemovedApi(oldClass)) {
            return;
        }
        IssueType type;
        if (oldClass.getModifiers().isDeprecated()) {
            type = IssueType.REMOVED_DEPRECATED_CLASS;
        } else if (oldClass.isInterface()) {
            type = IssueType.REMOVED_INTERFACE;
        } else {
            type = IssueType.REMOVED_CLASS;
        }
        String deprecated = oldClass.getModifiers().isDeprecated() ? "deprecated " : "";
        reporter.report(type, oldClass.qualifiedName(), "Removed " + deprecated + describe(oldClass));
    }

    @Override
    public void compare(ClassItem oldClass, ClassItem newClass) {
        String location = newClass.qualifiedName();
        if (!isSuppressed(oldCodebase, oldClass) && isSuppressed(newClass.getModifiers())) {
            reporter.report(IssueType.BECAME_UNCHECKED, location,
                    "Removed " + describe(oldClass) + " from compatibility checked API surface");
            return;
        }
        if (isSuppressed(newCodebase, newClass)) {
            return;
        }
        ModifierSet oldModifiers = oldClass.getModifiers();
        ModifierSet newModifiers = newClass.getModifiers();
        String subject = capitalize(describe(newClass));

        compareAnnotations(oldModifiers, newModifiers, describe(newClass), location);
        compareVisibility(oldModifiers, newModifiers, subject, location);
        compareDeprecation(oldModifiers, newModifiers, subject, location);

        if (oldClass.getKind() != newClass.getKind()) {
            reporter.report(IssueType.CHANGED_CLASS, location,
                    capitalize(describe(oldClass)) + " changed class/interface declaration");
            return;
        }

        Set<String> newInterfaces = allInterfaceNames(newCodebase, newClass);
        for (TypeReference iface : oldClass.getInterfaces()) {
            if (!newInterfaces.contains(iface.getName())) {
                reporter.report(IssueType.REMOVED_INTERFACE, location,
                        capitalize(describe(oldClass)) + " no longer implements " + iface.getName());
            }
        }
        Set<String> oldInterfaces = allInterfaceNames(oldCodebase, oldClass);
        for (TypeReference iface : newClass.getInterfaces()) {
            if (!oldInterfaces.contains(iface.getName())) {
                reporter.report(IssueType.ADDED_INTERFACE, location,
                        "Added interface " + iface.getName() + " to " + describe(oldClass));
            }
        }

        if (!oldModifiers.has(Modifier.SEALED) && newModifiers.has(Modifier.SEALED)) {
            reporter.report(IssueType.ADD_SEALED, location,
                    "Cannot add 'sealed' modifier to " + describe(newClass) + ": Incompatible change");
        }
        if (newClass.getKind() == ClassKind.CLASS && !oldModifiers.isAbstract() && newModifiers.isAbstract()) {
            reporter.report(IssueType.CHANGED_ABSTRACT, location, subject + " changed 'abstract' qualifier");
        }
        if (newClass.getKind() == ClassKind.CLASS && !oldModifiers.isFinal() && newModifiers.isFinal()) {
            if (oldClass.isExtensibleByClients()) {
                reporter.report(IssueType.ADDED_FINAL, location, subject + " added 'final' qualifier");
            } else {
                reporter.report(IssueType.ADDED_FINAL_UNINSTANTIABLE, location, subject
                        + " added 'final' qualifier but was previously uninstantiable and therefore could not be subclassed");
            }
        }
        if (oldClass.isNested() && newClass.isNested() && oldModifiers.isStatic() != newModifiers.isStatic()) {
            reporter.report(IssueType.CHANGED_STATIC, location, subject + " changed 'static' qualifier");
        }

        TypeReference oldSuperclass = oldClass.getSuperclass();
        if (oldSuperclass != null && !oldSuperclass.isJavaLangObject()
                && !superclassNames(newCodebase, newClass).contains(oldSuperclass.getName())) {
            TypeReference newSuperclass = newClass.getSuperclass();
            reporter.report(IssueType.CHANGED_SUPERCLASS, location, subject + " superclass changed from "
                    + oldSuperclass.getName() + " to "
                    + (newSuperclass == null ? TypeReference.JAVA_LANG_OBJECT : newSuperclass.getName()));
        }

        int oldTypeParameters = oldClass.getTypeParameters().size();
        int newTypeParameters = newClass.getTypeParameters().size();
        if (oldTypeParameters != newTypeParameters) {
            reporter.report(IssueType.CHANGED_TYPE, location, subject + " changed number of type parameters from "
                    + oldTypeParameters + " to " + newTypeParameters);
        }
    }

    // ------------------------------------------------------------------
    // Members
    // ------------------------------------------------------------------

    @Override
    public void added(ClassItem oldOwner, ClassItem newOwner, MemberItem newMember) {
        if (isSuppressed(newCodebase, newOwner) || isSuppressed(newMember.getModifiers())) {
            return;
        }
        String location = newMember.location(newOwner);
        String message = "Added " + describeFull(newOwner, newMember);
        if (newMember.isMethod() && newMember.getModifiers().isAbstract() && newMember.getAnnotationDefault() == null
                && oldOwner.isExtensibleByClients()
                && findInherited(oldCodebase, oldOwner, newMember.signatureKey()) == null) {
            reporter.report(IssueType.ADDED_ABSTRACT_METHOD, location, message);
            return;
        }
        reporter.report(newMember.isCallable() ? IssueType.ADDED_METHOD : IssueType.ADDED_FIELD, location, message);
    }

    @Override
    public void removed(ClassItem oldOwner, MemberItem oldMember, ClassItem newOwner) {
        if (isSuppressed(oldCodebase, oldOwner) || isSuppressed(oldMember.getModifiers())) {
            return;
        }
        if (isInRemovedApi(oldOwner, oldMember)) {
            return;
        }
        InheritedMember inherited = findInherited(newCodebase, newOwner, oldMember.signatureKey());
        if (inherited != null) {
            compare(oldOwner, oldMember, inherited.owner, inherited.member);
            return;
        }
        boolean deprecated = oldMember.getModifiers().isDeprecated() || oldOwner.getModifiers().isDeprecated();
        IssueType type;
        if (oldMember.isCallable()) {
            type = deprecated ? IssueType.REMOVED_DEPRECATED_METHOD : IssueType.REMOVED_METHOD;
        } else {
            type = deprecated ? IssueType.REMOVED_DEPRECATED_FIELD : IssueType.REMOVED_FIELD;
        }
        reporter.report(type, oldMember.location(oldOwner),
                "Removed " + (deprecated ? "deprecated " : "") + describeFull(oldOwner, oldMember));
    }

    @Override
    public void compare(ClassItem oldOwner, MemberItem oldMember, ClassItem newOwner, MemberItem newMember) {
        String location = newMember.location(newOwner);
        if (!isSuppressed(oldCodebase, oldOwner) && !isSuppressed(oldMember.getModifiers())
                && isSuppressed(newMember.getModifiers())) {
            reporter.report(IssueType.BECAME_UNCHECKED, location,
                    "Removed " + describeFull(oldOwner, oldMember) + " from compatibility checked API surface");
            return;
        }
        if (isSuppressed(newCodebase, newOwner) || isSuppressed(newMember.getModifiers())) {
            return;
        }
        ModifierSet oldModifiers = oldMember.getModifiers();
        ModifierSet newModifiers = newMember.getModifiers();
        String subject = describeShort(newOwner, newMember);

        compareAnnotations(oldModifiers, newModifiers, uncapitalize(subject), location);
        compareVisibility(oldModifiers, newModifiers, subject, location);
        compareDeprecation(oldModifiers, newModifiers, subject, location);

        switch (newMember.getKind()) {
            case CONSTRUCTOR:
            case METHOD:
                compareCallable(oldOwner, oldMember, newOwner, newMember, subject, location);
                break;
            case FIELD:
                compareField(oldMember, newMember, subject, location);
                break;
            case PROPERTY:
            case ENUM_CONSTANT:
            default:
                compareType(oldMember.getType(), newMember.getType(), subject + " has changed type from ", location);
                compareNullability(oldMember.getType(), newMember.getType(), false, false, uncapitalize(subject),
                        location);
                break;
        }
    }

    private void compareCallable(ClassItem oldOwner, MemberItem oldMember, ClassItem newOwner, MemberItem newMember,
            String subject, String location) {
        ModifierSet oldModifiers = oldMember.getModifiers();
        ModifierSet newModifiers = newMember.getModifiers();
        boolean overridable = isOverridable(oldOwner, oldMember);

        if (newMember.isMethod()) {
            compareType(oldMember.getType(), newMember.getType(), subject + " has changed return type from ", location);
            compareNullability(oldMember.getType(), newMember.getType(), false, overridable, uncapitalize(subject),
                    location);

            if (newOwner.getKind() == ClassKind.CLASS && !oldModifiers.isAbstract() && newModifiers.isAbstract()
                    && !newOwner.getModifiers().isFinal()) {
                reporter.report(IssueType.CHANGED_ABSTRACT, location, subject + " has changed 'abstract' qualifier");
            }
            if (oldModifiers.has(Modifier.DEFAULT) && !newModifiers.has(Modifier.DEFAULT)
                    && newOwner.getKind().isInterfaceLike() && !newModifiers.isStatic()) {
                reporter.report(IssueType.CHANGED_DEFAULT, location, subject + " has changed 'default' qualifier");
            }
            if (!oldModifiers.isFinal() && newModifiers.isFinal()) {
                if (overridable) {
                    reporter.report(IssueType.ADDED_FINAL, location, subject + " has added 'final' qualifier");
                } else {
                    reporter.report(IssueType.ADDED_FINAL_UNINSTANTIABLE, location, subject
                            + " added 'final' qualifier but containing " + describe(oldOwner)
                            + " was previously uninstantiable and therefore could not be subclassed");
                }
            }
            if (oldModifiers.isStatic() != newModifiers.isStatic()) {
                reporter.report(IssueType.CHANGED_STATIC, location, subject + " has changed 'static' qualifier");
            }
            compareAnnotationDefault(oldMember, newMember, subject, location);
        }

        compareThrows(oldMember, newMember, subject, location);
        compareParameters(oldMember, newMember, overridable, location);
    }

    private void compareThrows(MemberItem oldMember, MemberItem newMember, String subject, String location) {
        Set<String> oldThrown = thrownNames(oldMember);
        Set<String> newThrown = thrownNames(newMember);
        for (String thrown : oldThrown) {
            if (!newThrown.contains(thrown) && !isUnchecked(thrown)) {
                reporter.report(IssueType.CHANGED_THROWS, location, subject + " no longer throws exception " + thrown);
            }
        }
        for (String thrown : newThrown) {
            if (!oldThrown.contains(thrown) && !isUnchecked(thrown)) {
                reporter.report(IssueType.CHANGED_THROWS, location, subject + " added thrown exception " + thrown);
            }
        }
    }

    private static Set<String> thrownNames(MemberItem member) {
        return member.getThrownTypes().stream()
                .map(TypeReference::toErasedString)
                .sorted()
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private void compareParameters(MemberItem oldMember, MemberItem newMember, boolean overridable, String location) {
        List<ParameterItem> oldParameters = oldMember.getParameters();
        List<ParameterItem> newParameters = newMember.getParameters();
        boolean namesMatter = newCodebase.getFormat().isKotlinNameTypeOrder();
        for (int i = 0; i < oldParameters.size() && i < newParameters.size(); i++) {
            ParameterItem oldParameter = oldParameters.get(i);
            ParameterItem newParameter = newParameters.get(i);
            String parameter = "parameter " + parameterName(newParameter, i) + " in "
                    + uncapitalize(describeShort(newMember, location));

            if (oldParameter.isVarargs() && !newParameter.isVarargs()) {
                reporter.report(IssueType.VARARG_REMOVAL, location,
                        "Changing from varargs to array is an incompatible change: " + parameter);
            }

            if (namesMatter || oldParameter.isOptional()) {
                String oldName = oldParameter.getName();
                String newName = newParameter.getName();
                if (oldName != null && newName == null) {
                    reporter.report(IssueType.PARAMETER_NAME_CHANGE, location,
                            "Attempted to remove parameter name from " + parameter);
                } else if (oldName != null && !oldName.equals(newName)) {
                    reporter.report(IssueType.PARAMETER_NAME_CHANGE, location, "Attempted to change parameter name from "
                            + oldName + " to " + newName + " in " + uncapitalize(describeShort(newMember, location)));
                }
            }

            if (oldParameter.isOptional() && !newParameter.isOptional()) {
                reporter.report(IssueType.DEFAULT_VALUE_CHANGE, location,
                        "Attempted to remove default value from " + parameter);
            }

            compareAnnotations(oldParameter.getModifiers(), newParameter.getModifiers(), parameter, location);
            compareNullability(oldParameter.getType(), newParameter.getType(), true, overridable, parameter, location);
        }
    }

    private void compareAnnotationDefault(MemberItem oldMember, MemberItem newMember, String subject, String location) {
        String oldDefault = oldMember.getAnnotationDefault();
        String newDefault = newMember.getAnnotationDefault();
        if (oldDefault != null && !oldDefault.equals(newDefault)) {
            reporter.report(IssueType.CHANGED_VALUE, location, subject + " has changed value from " + oldDefault
                    + " to " + (newDefault == null ? "nothing" : newDefault));
        }
    }

    private void compareField(MemberItem oldField, MemberItem newField, String subject, String location) {
        ModifierSet oldModifiers = oldField.getModifiers();
        ModifierSet newModifiers = newField.getModifiers();

        compareType(oldField.getType(), newField.getType(), subject + " has changed type from ", location);
        compareNullability(oldField.getType(), newField.getType(), false, false, uncapitalize(subject), location);

        Object oldValue = oldField.getConstantValue();
        Object newValue = newField.getConstantValue();
        if (!Objects.equals(oldValue, newValue)) {
            reporter.report(IssueType.CHANGED_VALUE, location, subject + " has changed value from "
                    + constantText(oldValue) + " to " + constantText(newValue));
        }

        if (oldModifiers.isStatic() != newModifiers.isStatic()) {
            reporter.report(IssueType.CHANGED_STATIC, location, subject + " has changed 'static' qualifier");
        }
        if (!oldModifiers.isFinal() && newModifiers.isFinal()) {
            reporter.report(IssueType.ADDED_FINAL, location, subject + " has added 'final' qualifier");
        } else if (oldModifiers.isFinal() && !newModifiers.isFinal() && oldValue != null) {
            reporter.report(IssueType.REMOVED_FINAL, location, subject + " has removed 'final' qualifier");
        }
        if (oldModifiers.has(Modifier.VOLATILE) != newModifiers.has(Modifier.VOLATILE)) {
            reporter.report(IssueType.CHANGED_VOLATILE, location, subject + " has changed 'volatile' qualifier");
        }
        if (oldModifiers.has(Modifier.TRANSIENT) != newModifiers.has(Modifier.TRANSIENT)) {
            reporter.report(IssueType.CHANGED_TRANSIENT, location, subject + " has changed 'transient' qualifier");
        }
    }

    private static String constantText(Object value) {
        return value == null ? "nothing/not constant" : ConstantValueRenderer.literal(value);
    }

    // ------------------------------------------------------------------
    // Shared rules
    // ------------------------------------------------------------------

    private void compareType(TypeReference oldType, TypeReference newType, String prefix, String location) {
        if (oldType == null || newType == null) {
            return;
        }
        String oldText = oldType.toCanonicalString();
        String newText = newType.toCanonicalString();
        if (!oldText.equals(newText)) {
            reporter.report(IssueType.CHANGED_TYPE, location, prefix + oldText + " to " + newText);
        }
    }

    /**
     * Nullability may be added, but not removed. A returned value may not become
     * nullable, and a parameter of an overridable method may not become non-null.
     */
    private void compareNullability(TypeReference oldType, TypeReference newType, boolean parameter,
            boolean overridable, String context, String location) {
        if (oldType == null || newType == null || oldType.isPrimitive() || newType.isPrimitive()) {
            return;
        }
        Nullability oldNullability = oldType.getNullability();
        Nullability newNullability = newType.getNullability();
        if (oldNullability == newNullability) {
            return;
        }
        if (oldNullability.isSpecified() && !newNullability.isSpecified()) {
            reporter.report(IssueType.INVALID_NULL_CONVERSION, location, "Attempted to remove nullability from "
                    + newType.toCanonicalString() + " (was " + oldNullability + ") in " + context);
            return;
        }
        boolean invalid = parameter
                ? overridable && oldNullability == Nullability.NULLABLE && newNullability == Nullability.NONNULL
                : oldNullability == Nullability.NONNULL && newNullability == Nullability.NULLABLE;
        if (invalid) {
            reporter.report(IssueType.INVALID_NULL_CONVERSION, location, "Attempted to change nullability of "
                    + newType.toCanonicalString() + " (from " + oldNullability + " to " + newNullability + ") in "
                    + context);
        }
    }

    private void compareVisibility(ModifierSet oldModifiers, ModifierSet newModifiers, String subject,
            String location) {
        Visibility oldVisibility = oldModifiers.getVisibility();
        Visibility newVisibility = newModifiers.getVisibility();
        if (newVisibility.isNarrowerThan(oldVisibility)) {
            reporter.report(IssueType.CHANGED_SCOPE, location, subject + " changed visibility from "
                    + visibilityLabel(oldVisibility) + " to " + visibilityLabel(newVisibility));
        }
    }

    private void compareDeprecation(ModifierSet oldModifiers, ModifierSet newModifiers, String subject,
            String location) {
        if (oldModifiers.isDeprecated() != newModifiers.isDeprecated()) {
            reporter.report(IssueType.CHANGED_DEPRECATED, location, subject + " has changed deprecation state "
                    + oldModifiers.isDeprecated() + " --> " + newModifiers.isDeprecated());
        }
    }

    private void compareAnnotations(ModifierSet oldModifiers, ModifierSet newModifiers, String description,
            String location) {
        for (String annotation : config.getCompatibilityAnnotations()) {
            boolean before = oldModifiers.hasAnnotation(annotation);
            boolean after = newModifiers.hasAnnotation(annotation);
            if (before && !after) {
                reporter.report(IssueType.REMOVED_ANNOTATION, location,
                        "Cannot remove @" + annotation + " annotation from " + description + ": Incompatible change");
            } else if (!before && after) {
                reporter.report(IssueType.ADDED_ANNOTATION, location,
                        "Cannot add @" + annotation + " annotation to " + description + ": Incompatible change");
            }
        }
    }

    // ------------------------------------------------------------------
    // Suppression and removed API
    // ------------------------------------------------------------------

    private boolean isSuppressed(ModifierSet modifiers) {
        return modifiers.hasAnnotation(config.getSuppressionAnnotation());
    }

    /**
     * True when the class, an enclosing class or its package carries the suppression annotation.
     */
    private boolean isSuppressed(Codebase codebase, ClassItem cls) {
        if (isSuppressed(cls.getModifiers())) {
            return true;
        }
        PackageItem pkg = codebase.findPackage(cls.getPackageName());
        if (pkg != null && isSuppressed(pkg.getModifiers())) {
            return true;
        }
        String fullName = cls.getFullName();
        for (int dot = fullName.lastIndexOf('.'); dot > 0; dot = fullName.lastIndexOf('.', dot - 1)) {
            ClassItem outer = pkg == null ? null : pkg.findClass(fullName.substring(0, dot));
            if (outer != null && isSuppressed(outer.getModifiers())) {
                return true;
            }
        }
        return false;
    }

    private boolean isInRemovedApi(ClassItem oldClass) {
        Codebase removedApi = config.getRemovedApi();
        return removedApi != null && removedApi.findClass(oldClass.qualifiedName()) != null;
    }

    private boolean isInRemovedApi(ClassItem oldOwner, MemberItem oldMember) {
        Codebase removedApi = config.getRemovedApi();
        if (removedApi == null) {
            return false;
        }
        ClassItem removedClass = removedApi.findClass(oldOwner.qualifiedName());
        return removedClass != null && removedClass.findMember(oldMember.signatureKey()) != null;
    }

    // ------------------------------------------------------------------
    // Hierarchy
    // ------------------------------------------------------------------

    private static final class InheritedMember {
        private final ClassItem owner;
        private final MemberItem member;

        private InheritedMember(ClassItem owner, MemberItem member) {
            this.owner = owner;
            this.member = member;
        }
    }

    /**
     * Finds a non-constructor member with the given key in the supertypes of {@code cls}.
     */
    private static InheritedMember findInherited(Codebase codebase, ClassItem cls, String signatureKey) {
        if (signatureKey.startsWith(MemberKind.CONSTRUCTOR.getKeyword() + " ")) {
            return null;
        }
        Set<String> visited = new HashSet<>();
        Deque<TypeReference> pending = new ArrayDeque<>(supertypes(cls));
        while (!pending.isEmpty()) {
            TypeReference type = pending.poll();
            if (!visited.add(type.getName())) {
                continue;
            }
            ClassItem ancestor = codebase.findClass(type.getName());
            if (ancestor == null) {
                continue;
            }
            MemberItem member = ancestor.findMember(signatureKey);
            if (member != null) {
                return new InheritedMember(ancestor, member);
            }
            pending.addAll(supertypes(ancestor));
        }
        return null;
    }

    private static List<TypeReference> supertypes(ClassItem cls) {
        List<TypeReference> supertypes = new ArrayList<>();
        if (cls.getSuperclass() != null) {
            supertypes.add(cls.getSuperclass());
        }
        supertypes.addAll(cls.getInterfaces());
        return supertypes;
    }

    /**
     * Names of the superclass chain, as far as it resolves in {@code codebase}.
     */
    private static Set<String> superclassNames(Codebase codebase, ClassItem cls) {
        Set<String> names = new LinkedHashSet<>();
        TypeReference superclass = cls.getSuperclass();
        while (superclass != null && names.add(superclass.getName())) {
            ClassItem resolved = codebase.findClass(superclass.getName());
            superclass = resolved == null ? null : resolved.getSuperclass();
        }
        return names;
    }

    /**
     * Names of every interface implemented directly or through a resolvable supertype.
     */
    private static Set<String> allInterfaceNames(Codebase codebase, ClassItem cls) {
        Set<String> names = new LinkedHashSet<>();
        Set<String> visited = new HashSet<>();
        Deque<ClassItem> pending = new ArrayDeque<>();
        pending.add(cls);
        while (!pending.isEmpty()) {
            ClassItem current = pending.poll();
            if (!visited.add(current.qualifiedName())) {
                continue;
            }
            current.getInterfaces().forEach(iface -> names.add(iface.getName()));
            for (TypeReference supertype : supertypes(current)) {
                ClassItem resolved = codebase.findClass(supertype.getName());
                if (resolved != null) {
                    pending.add(resolved);
                }
            }
        }
        return names;
    }

    private boolean isUnchecked(String exceptionName) {
        if (KNOWN_UNCHECKED.contains(exceptionName)) {
            return true;
        }
        for (Codebase codebase : List.of(newCodebase, oldCodebase)) {
            ClassItem cls = codebase.findClass(exceptionName);
            if (cls != null) {
                Set<String> chain = superclassNames(codebase, cls);
                return chain.stream().anyMatch(name -> UNCHECKED_ROOTS.contains(name) || KNOWN_UNCHECKED.contains(name));
            }
        }
        return false;
    }

    /**
     * A method that code outside the API can override.
     */
    private static boolean isOverridable(ClassItem owner, MemberItem member) {
        if (!member.isMethod() || member.getModifiers().isStatic() || member.getModifiers().isFinal()) {
            return false;
        }
        if (member.visibility().isNarrowerThan(Visibility.PROTECTED)) {
            return false;
        }
        return owner.isExtensibleByClients();
    }

    // ------------------------------------------------------------------
    // Descriptions
    // ------------------------------------------------------------------

    static String describe(ClassItem cls) {
        String label;
        switch (cls.getKind()) {
            case INTERFACE:
                label = "interface";
                break;
            case ANNOTATION:
                label = "annotation";
                break;
            case ENUM:
                label = "enum";
                break;
            case RECORD:
                label = "record";
                break;
            case CLASS:
            default:
                label = "class";
                break;
        }
        return label + " " + cls.qualifiedName();
    }

    /**
     * Short form used by change messages, e.g. {@code Method test.pkg.Foo.m}.
     */
    static String describeShort(ClassItem owner, MemberItem member) {
        return describeShort(member, member.location(owner));
    }

    private static String describeShort(MemberItem member, String location) {
        String target = location.contains("(") ? location.substring(0, location.indexOf('(')) : location;
        target = target.replace('#', '.');
        if (member.isConstructor()) {
            target = target.substring(0, target.lastIndexOf('.'));
        }
        return capitalize(kindLabel(member.getKind())) + " " + target;
    }

    /**
     * Full form used by addition and removal messages, e.g. {@code method test.pkg.Foo.m(int,java.lang.String)}.
     */
    static String describeFull(ClassItem owner, MemberItem member) {
        String target = owner.qualifiedName();
        if (!member.isConstructor()) {
            target = target + "." + member.getName();
        }
        if (member.isCallable()) {
            target = target + "(" + member.erasedParameterList() + ")";
        }
        return kindLabel(member.getKind()) + " " + target;
    }

    private static String kindLabel(MemberKind kind) {
        switch (kind) {
            case CONSTRUCTOR:
                return "constructor";
            case ENUM_CONSTANT:
                return "enum constant";
            default:
                return kind.getKeyword();
        }
    }

    private static String parameterName(ParameterItem parameter, int index) {
        return parameter.getName() != null ? parameter.getName() : "arg" + (index + 1);
    }

    private static String visibilityLabel(Visibility visibility) {
        return visibility == Visibility.PACKAGE_PRIVATE ? "package private" : visibility.getKeyword();
    }

    private static String capitalize(String text) {
        return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    private static String uncapitalize(String text) {
        return text.isEmpty() ? text : Character.toLowerCase(text.charAt(0)) + text.substring(1);
    }
}
