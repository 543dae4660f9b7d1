package io.sendflow;

import io.sendflow.core.DeliveryResult;

/**
 * Provider-side capability that attempts one message delivery.
 *
 * <p>Implementations wrap a WhatsApp provider (Z-API, Meta Cloud API, ...). Exceptions thrown here
 * are treated as a failed delivery for that destination, the same as {@link DeliveryResult#failed}.
 */
public interface MessageSender {

    /**
     * @param destination E.164 phone number without the leading '+'
     */
    DeliveryResult send(String destination, String text) throws Exception;
}
