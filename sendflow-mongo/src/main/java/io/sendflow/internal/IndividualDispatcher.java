package io.sendflow.internal;

import io.sendflow.ContactDirectory;
import io.sendflow.core.Contact;
import io.sendflow.core.DeliveryResult;
import io.sendflow.core.MessageLog;
import io.sendflow.core.Recipient;
import io.sendflow.core.exception.InvalidInputException;
import io.sendflow.core.exception.NotFoundException;
import io.sendflow.utils.MessageTexts;
import io.sendflow.utils.PhoneNumbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Single-message send path: resolve the recipient, deliver once, record and report the outcome.
 */
public class IndividualDispatcher {
    private static final Logger log = LoggerFactory.getLogger(IndividualDispatcher.class);

    private final ContactDirectory directory;
    private final BoundedMessageSender sender;
    private final MessageHistory history;
    private final String defaultCountryCode;

    public IndividualDispatcher(ContactDirectory directory,
                                BoundedMessageSender sender,
                                MessageLog messageLog,
                                Clock clock,
                                String defaultCountryCode) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.sender = Objects.requireNonNull(sender, "sender must not be null");
        this.history = new MessageHistory(messageLog, clock);
        this.defaultCountryCode = defaultCountryCode;
    }

    /**
     * @throws NotFoundException     if a contact recipient does not exist
     * @throws InvalidInputException if the message or the phone number is malformed
     */
    public DeliveryResult send(Recipient recipient, String message) {
        if (recipient == null) {
            throw new InvalidInputException("recipient", "Either contactId or phone number must be provided");
        }
        MessageTexts.requireValid(message);

        String contactId = null;
        String destination;
        if (recipient instanceof Recipient.ByContact byContact) {
            Contact contact = directory.findContact(byContact.contactId())
                    .orElseThrow(() -> new NotFoundException("contact", byContact.contactId()));
            contactId = contact.id();
            destination = PhoneNumbers.normalize(contact.phone(), defaultCountryCode);
        } else {
            destination = PhoneNumbers.normalize(((Recipient.ByPhone) recipient).phone(), defaultCountryCode);
        }

        DeliveryResult result = sender.send(destination, message);

        if (result.success()) {
            log.info("sendflow message sent destination={} providerMessageId={}",
                    PhoneNumbers.mask(destination), result.providerMessageId());
        } else {
            log.warn("sendflow message failed destination={} msg={}", PhoneNumbers.mask(destination), result.error());
        }
        history.record(contactId, destination, message, null, result);
        return result;
    }
}
