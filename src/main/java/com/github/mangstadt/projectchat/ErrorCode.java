package com.github.mangstadt.projectchat;

/**
 * The error codes that can appear in a failed acknowledgment.
 */
public enum ErrorCode {
	/**
	 * Bad or missing credential. Fatal to the connection.
	 */
	AUTHENTICATION_FAILED,

	/**
	 * The identity is not a member of the project, or a room operation was
	 * attempted before authenticating. The connection stays open.
	 */
	AUTHORIZATION_DENIED,

	/**
	 * A send or typing operation was attempted without an active join.
	 */
	NOT_IN_ROOM,

	/**
	 * The message body was empty or whitespace-only.
	 */
	EMPTY_MESSAGE,

	/**
	 * The message body exceeded the maximum length.
	 */
	MESSAGE_TOO_LONG,

	/**
	 * The frame could not be understood.
	 */
	BAD_REQUEST,

	/**
	 * The server failed unexpectedly while processing the operation.
	 */
	INTERNAL_ERROR;

	/**
	 * Gets an error code by name.
	 * @param name the name
	 * @return the error code, or {@link #INTERNAL_ERROR} if not recognized
	 */
	public static ErrorCode parse(String name) {
		for (var code : values()) {
			if (code.name().equals(name)) {
				return code;
			}
		}
		return INTERNAL_ERROR;
	}
}
