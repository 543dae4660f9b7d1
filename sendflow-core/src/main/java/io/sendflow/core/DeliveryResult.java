package io.sendflow.core;

/**
 * Outcome of one delivery attempt.
 */
public record DeliveryResult(
        boolean success,
        String providerMessageId,
        String error
) {
    public static DeliveryResult ok() {
        return new DeliveryResult(true, null, null);
    }

    public static DeliveryResult ok(String providerMessageId) {
        return new DeliveryResult(true, providerMessageId, null);
    }

    public static DeliveryResult failed(String reason) {
        return new DeliveryResult(false, null, reason == null ? "unknown error" : reason);
    }
}
