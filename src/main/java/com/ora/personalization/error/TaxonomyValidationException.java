package com.ora.personalization.error;

/**
 * Rejected taxonomy mutation. {@code field} names the request field the admin has to correct.
 */
public class TaxonomyValidationException extends RuntimeException {
    private final String code;
    private final String field;

    public TaxonomyValidationException(String code, String field, String message) {
        super(message);
        this.code = code;
        this.field = field;
    }

    public String code() {
        return code;
    }

    public String field() {
        return field;
    }
}
