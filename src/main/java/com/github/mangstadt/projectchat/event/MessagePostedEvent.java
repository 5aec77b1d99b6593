package com.github.mangstadt.projectchat.event;

import com.github.mangstadt.projectchat.ChatMessage;

/**
 * Triggered when a message is broadcast to the room. The sender receives
 * this event for its own messages too; that echo is how delivery is
 * confirmed.
 */
public class MessagePostedEvent extends Event {
	private final ChatMessage message;

	private MessagePostedEvent(Builder builder) {
		super(builder);
		message = builder.message;
	}

	/**
	 * Gets the message that was posted.
	 * @return the message
	 */
	public ChatMessage getMessage() {
		return message;
	}

	/**
	 * Used for constructing {@link MessagePostedEvent} instances.
	 */
	public static class Builder extends Event.Builder<MessagePostedEvent, Builder> {
		private ChatMessage message;

		/**
		 * Creates an empty builder.
		 */
		public Builder() {
			super();
		}

		/**
		 * Sets the message that was posted.
		 * @param message the message
		 * @return this
		 */
		public Builder message(ChatMessage message) {
			this.message = message;
			return this;
		}

		@Override
		public MessagePostedEvent build() {
			return new MessagePostedEvent(this);
		}
	}
}
