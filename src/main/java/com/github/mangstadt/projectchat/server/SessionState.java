package com.github.mangstadt.projectchat.server;

/**
 * The lifecycle states of a {@link ConnectionSession}.
 */
public enum SessionState {
	/**
	 * Waiting for a credential.
	 */
	CONNECTING,

	/**
	 * Authenticated, but has never joined a room.
	 */
	AUTHENTICATED,

	/**
	 * Member of a room.
	 */
	IN_ROOM,

	/**
	 * Authenticated, not in a room (left, or a join was refused).
	 */
	IDLE,

	/**
	 * The transport is closed. Terminal.
	 */
	CLOSED
}
