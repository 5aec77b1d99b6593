package com.github.mangstadt.projectchat;

import java.io.IOException;

/**
 * Thrown by the client when an operation that must reach the server is
 * attempted while the room connection is down. Nothing is queued.
 */
@SuppressWarnings("serial")
public class NotConnectedException extends IOException {
	public NotConnectedException(String roomId) {
		super("Not connected to room " + roomId + ".");
	}
}
