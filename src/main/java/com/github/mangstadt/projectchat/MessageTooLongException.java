package com.github.mangstadt.projectchat;

/**
 * Thrown when a message body exceeds the room's maximum message length.
 */
@SuppressWarnings("serial")
public class MessageTooLongException extends ChatOperationException {
	public MessageTooLongException(int maxLength) {
		super(ErrorCode.MESSAGE_TOO_LONG, "Message too long (max " + maxLength + " chars).");
	}
}
