package com.github.mangstadt.projectchat.client;

/**
 * The states of a {@link RoomConnection}.
 */
public enum ConnectionState {
	/**
	 * The first connection attempt is in progress.
	 */
	CONNECTING,

	/**
	 * The socket is open and the server accepted the join.
	 */
	CONNECTED,

	/**
	 * The connection dropped and is being re-established.
	 */
	RECONNECTING,

	/**
	 * The connection gave up: the retry budget is spent, the credential was
	 * rejected, or the user is not a member of the project. Terminal.
	 */
	DISCONNECTED,

	/**
	 * The user left the room. Terminal.
	 */
	CLOSED;

	/**
	 * Determines whether this is a terminal state.
	 * @return true if no further connection attempts will be made
	 */
	public boolean isTerminal() {
		return this == DISCONNECTED || this == CLOSED;
	}
}
