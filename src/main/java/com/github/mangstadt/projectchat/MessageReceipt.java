package com.github.mangstadt.projectchat;

/**
 * The result of a message that a room accepted.
 * @param messageId the ID the server assigned to the message
 * @param sequence the room-scoped sequence number of the message
 */
public record MessageReceipt(String messageId, long sequence) {
}
