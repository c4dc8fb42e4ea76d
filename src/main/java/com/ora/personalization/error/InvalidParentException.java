package com.ora.personalization.error;

public class InvalidParentException extends TaxonomyValidationException {
    public static final String MISSING_PARENT = "PARENT_NOT_FOUND";
    public static final String SELF_PARENT = "SELF_PARENT";
    public static final String CYCLE = "CYCLE_DETECTED";
    public static final String DEPTH = "MAX_DEPTH_EXCEEDED";
    public static final String INACTIVE_PARENT = "PARENT_INACTIVE";

    public InvalidParentException(String code, String message) {
        super(code, "parentId", message);
    }
}
