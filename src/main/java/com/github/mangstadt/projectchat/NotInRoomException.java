package com.github.mangstadt.projectchat;

/**
 * Thrown when a message or typing notification is sent by a connection that
 * has not joined a room. Recoverable: the client should join first.
 */
@SuppressWarnings("serial")
public class NotInRoomException extends ChatOperationException {
	public NotInRoomException() {
		super(ErrorCode.NOT_IN_ROOM, "Not in a project room.");
	}
}
