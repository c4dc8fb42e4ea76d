package com.ora.personalization.error;

public class TasteGraphUnavailableException extends RuntimeException {
    private final String userId;

    public TasteGraphUnavailableException(String userId, Throwable cause) {
        super("Taste graph unavailable for user " + userId, cause);
        this.userId = userId;
    }

    public String userId() {
        return userId;
    }
}
