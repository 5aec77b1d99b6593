package com.github.mangstadt.projectchat;

/**
 * Thrown when a message body is empty or contains only whitespace. No
 * sequence number is consumed and nothing is broadcast.
 */
@SuppressWarnings("serial")
public class EmptyMessageException extends ChatOperationException {
	public EmptyMessageException() {
		super(ErrorCode.EMPTY_MESSAGE, "Empty message.");
	}
}
