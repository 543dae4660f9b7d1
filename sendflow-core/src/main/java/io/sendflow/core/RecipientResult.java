package io.sendflow.core;

/**
 * One entry of a job's result list.
 */
public record RecipientResult(
        String recipientName,
        String contactId,
        boolean success,
        String error
) {
    public static RecipientResult delivered(Contact contact) {
        return new RecipientResult(contact.name(), contact.id(), true, null);
    }

    public static RecipientResult failed(Contact contact, String error) {
        return new RecipientResult(contact.name(), contact.id(), false, error);
    }
}
