package io.sendflow;

import io.sendflow.core.Contact;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the contact and group store owned by the host application.
 */
public interface ContactDirectory {

    Optional<Contact> findContact(String contactId);

    /**
     * Contacts of a group in a stable retrieval order; empty when the group has no members.
     */
    List<Contact> listContactsByGroup(String groupId);

    boolean groupExists(String groupId);
}
