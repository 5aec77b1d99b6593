package com.github.mangstadt.projectchat.protocol;

/**
 * Web socket close codes used by the chat server.
 */
public final class CloseCodes {
	public static final int NORMAL = 1000;
	public static final int GOING_AWAY = 1001;

	/**
	 * The credential was missing or rejected. Clients must not reconnect with
	 * the same credential.
	 */
	public static final int AUTHENTICATION_FAILED = 4001;

	/**
	 * The client did not read its frames fast enough and its outbound buffer
	 * overflowed.
	 */
	public static final int SLOW_CONSUMER = 4008;

	private CloseCodes() {
		//hide constructor
	}
}
