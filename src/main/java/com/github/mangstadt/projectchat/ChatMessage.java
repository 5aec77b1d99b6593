package com.github.mangstadt.projectchat;

import java.time.Instant;

/**
 * Represents a chat message that was accepted by a room. Use its
 * {@link Builder} class to construct new instances.
 * @param id the message ID. This ID is unique across all rooms
 * @param roomId the ID of the room (project) the message was posted in
 * @param senderId the user ID of the message author
 * @param senderName the display name of the message author
 * @param body the message text
 * @param sequence the room-scoped sequence number. The first message of a
 * room is 1, and each following message is exactly one higher
 * @param timestamp the time the room accepted the message (server clock)
 */
public record ChatMessage(String id, String roomId, String senderId, String senderName, String body, long sequence, Instant timestamp) {
	/**
	 * Used for constructing {@link ChatMessage} instances.
	 */
	public static class Builder {
		private String id;
		private String roomId;
		private String senderId;
		private String senderName;
		private String body;
		private long sequence;
		private Instant timestamp;

		/**
		 * Creates an empty builder.
		 */
		public Builder() {
			//empty
		}

		/**
		 * Sets the ID of the message.
		 * @param id the message ID
		 * @return this
		 */
		public Builder id(String id) {
			this.id = id;
			return this;
		}

		/**
		 * Sets the ID of the room the message was posted in.
		 * @param roomId the room ID
		 * @return this
		 */
		public Builder roomId(String roomId) {
			this.roomId = roomId;
			return this;
		}

		/**
		 * Sets the message author.
		 * @param sender the author
		 * @return this
		 */
		public Builder sender(Identity sender) {
			senderId = sender.id();
			senderName = sender.displayName();
			return this;
		}

		/**
		 * Sets the user ID of the message author.
		 * @param senderId the user ID
		 * @return this
		 */
		public Builder senderId(String senderId) {
			this.senderId = senderId;
			return this;
		}

		/**
		 * Sets the display name of the message author.
		 * @param senderName the display name
		 * @return this
		 */
		public Builder senderName(String senderName) {
			this.senderName = senderName;
			return this;
		}

		/**
		 * Sets the message text.
		 * @param body the text
		 * @return this
		 */
		public Builder body(String body) {
			this.body = body;
			return this;
		}

		/**
		 * Sets the room-scoped sequence number.
		 * @param sequence the sequence number
		 * @return this
		 */
		public Builder sequence(long sequence) {
			this.sequence = sequence;
			return this;
		}

		/**
		 * Sets the time the message was accepted.
		 * @param timestamp the timestamp
		 * @return this
		 */
		public Builder timestamp(Instant timestamp) {
			this.timestamp = timestamp;
			return this;
		}

		/**
		 * Builds the chat message.
		 * @return the built object
		 */
		public ChatMessage build() {
			return new ChatMessage(id, roomId, senderId, senderName, body, sequence, timestamp);
		}
	}
}
