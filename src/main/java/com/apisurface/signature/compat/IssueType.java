package com.apisurface.signature.compat;

import java.util.Arrays;
import java.util.stream.Collectors;

import lombok.Getter;

/**
 * Compatibility rules with their stable ids and default severities.
 */
@Getter
public enum IssueType {
    ADDED_ABSTRACT_METHOD("AddedAbstractMethod", Severity.ERROR),
    ADDED_ANNOTATION("AddedAnnotation", Severity.ERROR),
    ADDED_CLASS("AddedClass", Severity.HIDDEN),
    ADDED_FIELD("AddedField", Severity.HIDDEN),
    ADDED_FINAL("AddedFinal", Severity.ERROR),
    ADDED_FINAL_UNINSTANTIABLE("AddedFinalUninstantiable", Severity.HIDDEN),
    ADDED_INTERFACE("AddedInterface", Severity.HIDDEN),
    ADDED_METHOD("AddedMethod", Severity.HIDDEN),
    ADDED_PACKAGE("AddedPackage", Severity.HIDDEN),
    ADD_SEALED("AddSealed", Severity.ERROR),
    BECAME_UNCHECKED("BecameUnchecked", Severity.ERROR),
    CHANGED_ABSTRACT("ChangedAbstract", Severity.ERROR),
    CHANGED_CLASS("ChangedClass", Severity.ERROR),
    CHANGED_DEFAULT("ChangedDefault", Severity.ERROR),
    CHANGED_DEPRECATED("ChangedDeprecated", Severity.HIDDEN),
    CHANGED_SCOPE("ChangedScope", Severity.ERROR),
    CHANGED_STATIC("ChangedStatic", Severity.ERROR),
    CHANGED_SUPERCLASS("ChangedSuperclass", Severity.ERROR),
    CHANGED_THROWS("ChangedThrows", Severity.ERROR),
    CHANGED_TRANSIENT("ChangedTransient", Severity.ERROR),
    CHANGED_TYPE("ChangedType", Severity.ERROR),
    CHANGED_VALUE("ChangedValue", Severity.ERROR),
    CHANGED_VOLATILE("ChangedVolatile", Severity.ERROR),
    DEFAULT_VALUE_CHANGE("DefaultValueChange", Severity.ERROR),
    INVALID_NULL_CONVERSION("InvalidNullConversion", Severity.ERROR),
    PARAMETER_NAME_CHANGE("ParameterNameChange", Severity.ERROR),
    REMOVED_ANNOTATION("RemovedAnnotation", Severity.ERROR),
    REMOVED_CLASS("RemovedClass", Severity.ERROR),
    REMOVED_DEPRECATED_CLASS("RemovedDeprecatedClass", Severity.ERROR),
    REMOVED_DEPRECATED_FIELD("RemovedDeprecatedField", Severity.ERROR),
    REMOVED_DEPRECATED_METHOD("RemovedDeprecatedMethod", Severity.ERROR),
    REMOVED_FIELD("RemovedField", Severity.ERROR),
    REMOVED_FINAL("RemovedFinal", Severity.ERROR),
    REMOVED_INTERFACE("RemovedInterface", Severity.ERROR),
    REMOVED_METHOD("RemovedMethod", Severity.ERROR),
    REMOVED_PACKAGE("RemovedPackage", Severity.ERROR),
    VARARG_REMOVAL("VarargRemoval", Severity.ERROR);

    private final String ruleId;
    private final Severity defaultSeverity;

    IssueType(String ruleId, Severity defaultSeverity) {
        this.ruleId = ruleId;
        this.defaultSeverity = defaultSeverity;
    }

    public static IssueType fromRuleId(String ruleId) {
        for (IssueType type : values()) {
            if (type.ruleId.equals(ruleId)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown issue id '" + ruleId + "', expected one of "
                + Arrays.stream(values()).map(IssueType::getRuleId).collect(Collectors.joining(", ")));
    }
}
