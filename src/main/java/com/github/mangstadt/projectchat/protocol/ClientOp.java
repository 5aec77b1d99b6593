package com.github.mangstadt.projectchat.protocol;

import java.util.Arrays;

/**
 * Defines each operation a client can send to the server.
 */
public enum ClientOp {
	//@formatter:off
	AUTH("auth"),
	JOIN("join"),
	LEAVE("leave"),
	SEND("send"),
	TYPING("typing"),
	STOP_TYPING("stopTyping");
	//@formatter:on

	/**
	 * The value of the "op" field in the JSON object.
	 */
	private final String value;

	/**
	 * @param value the op value
	 */
	private ClientOp(String value) {
		this.value = value;
	}

	/**
	 * Gets the value of the "op" field.
	 * @return the value
	 */
	public String value() {
		return value;
	}

	/**
	 * Determines whether this operation acts on a room (as opposed to
	 * authenticating the connection).
	 * @return true if it's a room operation
	 */
	public boolean isRoomOperation() {
		return this != AUTH;
	}

	/**
	 * Gets an operation given its value.
	 * @param value the op value
	 * @return the operation or null if not found
	 */
	public static ClientOp get(String value) {
		//@formatter:off
		return Arrays.stream(values())
			.filter(op -> op.value.equals(value))
		.findAny().orElse(null);
		//@formatter:on
	}
}
