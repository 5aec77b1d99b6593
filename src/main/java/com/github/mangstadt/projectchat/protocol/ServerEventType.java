package com.github.mangstadt.projectchat.protocol;

import java.util.Arrays;

/**
 * Defines each kind of frame the server sends to clients.
 */
public enum ServerEventType {
	//@formatter:off
	/**
	 * The result of one client operation. Only sent to the client that
	 * issued the operation.
	 */
	ACK("ack"),

	/**
	 * A message that was accepted by the room. Sent to every member,
	 * including the sender.
	 */
	MESSAGE("message"),

	/**
	 * A member joined or left.
	 */
	PRESENCE("presence"),

	/**
	 * A member started or stopped typing.
	 */
	TYPING("typing");
	//@formatter:on

	/**
	 * The value of the "event" field in the JSON object.
	 */
	private final String value;

	private ServerEventType(String value) {
		this.value = value;
	}

	/**
	 * Gets the value of the "event" field.
	 * @return the value
	 */
	public String value() {
		return value;
	}

	/**
	 * Gets an event type given its value.
	 * @param value the event value
	 * @return the event type or null if not found
	 */
	public static ServerEventType get(String value) {
		//@formatter:off
		return Arrays.stream(values())
			.filter(type -> type.value.equals(value))
		.findAny().orElse(null);
		//@formatter:on
	}
}
