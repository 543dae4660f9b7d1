package io.sendflow.core;

import io.sendflow.core.exception.InvalidInputException;

/**
 * Destination of an individual send: either a known contact or a raw phone number.
 */
public sealed interface Recipient permits Recipient.ByContact, Recipient.ByPhone {

    static Recipient contact(String contactId) {
        return new ByContact(contactId);
    }

    static Recipient phone(String phone) {
        return new ByPhone(phone);
    }

    record ByContact(String contactId) implements Recipient {
        public ByContact {
            if (contactId == null || contactId.isBlank()) {
                throw new InvalidInputException("contactId", "contactId must not be blank");
            }
        }
    }

    record ByPhone(String phone) implements Recipient {
        public ByPhone {
            if (phone == null || phone.isBlank()) {
                throw new InvalidInputException("phone", "phone must not be blank");
            }
        }
    }
}
