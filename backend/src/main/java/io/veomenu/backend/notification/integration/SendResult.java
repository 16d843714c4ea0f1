package io.veomenu.backend.notification.integration;

/**
 * Result of handing a message to an external transport.
 *
 * @param success whether the transport accepted the message
 * @param providerMessageId transport-assigned id, null on failure
 * @param errorMessage failure description, null on success
 */
public record SendResult(boolean success, String providerMessageId, String errorMessage) {}
