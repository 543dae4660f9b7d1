package io.sendflow.core;

/**
 * A contact as exposed by the {@link io.sendflow.ContactDirectory}.
 *
 * @param phone WhatsApp destination number
 */
public record Contact(
        String id,
        String name,
        String phone
) {
}
