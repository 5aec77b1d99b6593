package com.github.mangstadt.projectchat.event;

/**
 * Triggered when another user leaves the room, either explicitly or because its connection dropped.
 */
public class UserLeftEvent extends Event {
	private final String userId;
	private final String username;

	private UserLeftEvent(Builder builder) {
		super(builder);
		userId = builder.userId;
		username = builder.username;
	}

	/**
	 * Gets the ID of the user who left.
	 * @return the user ID
	 */
	public String getUserId() {
		return userId;
	}

	/**
	 * Gets the display name of the user who left.
	 * @return the display name
	 */
	public String getUsername() {
		return username;
	}

	/**
	 * Used for constructing {@link UserLeftEvent} instances.
	 */
	public static class Builder extends Event.Builder<UserLeftEvent, Builder> {
		private String userId;
		private String username;

		/**
		 * Creates an empty builder.
		 */
		public Builder() {
			super();
		}

		/**
		 * Sets the ID of the user who left.
		 * @param userId the user ID
		 * @return this
		 */
		public Builder userId(String userId) {
			this.userId = userId;
			return this;
		}

		/**
		 * Sets the display name of the user who left.
		 * @param username the display name
		 * @return this
		 */
		public Builder username(String username) {
			this.username = username;
			return this;
		}

		@Override
		public UserLeftEvent build() {
			return new UserLeftEvent(this);
		}
	}
}
