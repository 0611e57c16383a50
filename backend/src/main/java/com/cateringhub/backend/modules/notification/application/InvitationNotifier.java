package com.cateringhub.backend.modules.notification.application;

/**
 * Delivers invitation links to invitees.
 */
public interface InvitationNotifier {

    /**
     * @throws NotificationDeliveryException when the message could not be handed to the transport
     */
    void sendInvitation(InvitationMessage message);
}
