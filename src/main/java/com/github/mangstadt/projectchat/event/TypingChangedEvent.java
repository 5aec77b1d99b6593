package com.github.mangstadt.projectchat.event;

/**
 * Triggered when another user starts or stops typing. Typing notifications
 * are best-effort: they may arrive late, out of order, or not at all.
 */
public class TypingChangedEvent extends Event {
	private final String userId;
	private final String username;
	private final boolean typing;

	private TypingChangedEvent(Builder builder) {
		super(builder);
		userId = builder.userId;
		username = builder.username;
		typing = builder.typing;
	}

	/**
	 * Gets the ID of the user.
	 * @return the user ID
	 */
	public String getUserId() {
		return userId;
	}

	/**
	 * Gets the display name of the user.
	 * @return the display name
	 */
	public String getUsername() {
		return username;
	}

	/**
	 * Determines whether the user started or stopped typing.
	 * @return true if the user is typing, false if the user stopped
	 */
	public boolean isTyping() {
		return typing;
	}

	/**
	 * Used for constructing {@link TypingChangedEvent} instances.
	 */
	public static class Builder extends Event.Builder<TypingChangedEvent, Builder> {
		private String userId;
		private String username;
		private boolean typing;

		/**
		 * Creates an empty builder.
		 */
		public Builder() {
			super();
		}

		public Builder userId(String userId) {
			this.userId = userId;
			return this;
		}

		public Builder username(String username) {
			this.username = username;
			return this;
		}

		public Builder typing(boolean typing) {
			this.typing = typing;
			return this;
		}

		@Override
		public TypingChangedEvent build() {
			return new TypingChangedEvent(this);
		}
	}
}
