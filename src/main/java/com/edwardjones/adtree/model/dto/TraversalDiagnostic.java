package com.edwardjones.adtree.model.dto;

/**
 * A non-terminating error tied to the identity that caused it.
 */
public record TraversalDiagnostic(
    String errorId,
    ErrorCategory category,
    String target,
    String message
) {

    public static TraversalDiagnostic identityNotFound(String identity, Exception e) {
        return new TraversalDiagnostic("IdentityNotFound", ErrorCategory.OBJECT_NOT_FOUND, identity, e.getMessage());
    }

    public static TraversalDiagnostic ambiguousIdentity(String identity, Exception e) {
        return new TraversalDiagnostic("AmbiguousIdentity", ErrorCategory.INVALID_RESULT, identity, e.getMessage());
    }

    public static TraversalDiagnostic enumerationError(String target, Exception e) {
        return new TraversalDiagnostic("EnumerationError", ErrorCategory.NOT_SPECIFIED, target, e.getMessage());
    }

    public static TraversalDiagnostic unspecified(String identity, Exception e) {
        return new TraversalDiagnostic("Unspecified", ErrorCategory.NOT_SPECIFIED, identity, e.getMessage());
    }
}
