package io.sendflow.utils;

import io.sendflow.core.exception.InvalidInputException;

public final class MessageTexts {

    /**
     * WhatsApp text message limit.
     */
    public static final int MAX_LENGTH = 4096;

    private MessageTexts() {
    }

    public static String requireValid(String message) {
        if (message == null || message.isBlank()) {
            throw new InvalidInputException("message", "Message cannot be empty");
        }
        if (message.length() > MAX_LENGTH) {
            throw new InvalidInputException("message", "Message cannot exceed " + MAX_LENGTH + " characters");
        }
        return message;
    }
}
