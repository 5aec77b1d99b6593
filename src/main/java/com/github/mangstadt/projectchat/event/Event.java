package com.github.mangstadt.projectchat.event;

import java.time.Instant;

/**
 * Base class for the events a room connection publishes to its listeners.
 */
public abstract class Event {
	private final String roomId;
	private final Instant timestamp;

	protected Event(Builder<?, ?> builder) {
		roomId = builder.roomId;
		timestamp = builder.timestamp;
	}

	/**
	 * Gets the ID of the room the event happened in.
	 * @return the room ID
	 */
	public String getRoomId() {
		return roomId;
	}

	/**
	 * Gets the time the event occurred.
	 * @return the timestamp (server clock where the server supplied one,
	 * otherwise the time the client received the event)
	 */
	public Instant getTimestamp() {
		return timestamp;
	}

	/**
	 * Used for constructing {@link Event} instances.
	 * @param <T> the event class
	 * @param <U> the builder class
	 */
	@SuppressWarnings("unchecked")
	public abstract static class Builder<T extends Event, U extends Builder<T, U>> {
		private String roomId;
		private Instant timestamp;
		protected final U this_ = (U) this;

		protected Builder() {
			//empty
		}

		/**
		 * Sets the room ID.
		 * @param roomId the room ID
		 * @return this
		 */
		public U roomId(String roomId) {
			this.roomId = roomId;
			return this_;
		}

		/**
		 * Sets the time the event occurred.
		 * @param timestamp the timestamp
		 * @return this
		 */
		public U timestamp(Instant timestamp) {
			this.timestamp = timestamp;
			return this_;
		}

		/**
		 * Builds the event.
		 * @return the built event
		 */
		public abstract T build();
	}
}
