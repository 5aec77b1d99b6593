package com.github.mangstadt.projectchat.event;

/**
 * Triggered when another user joins the room. Not triggered for the user's own join.
 */
public class UserEnteredEvent extends Event {
	private final String userId;
	private final String username;

	private UserEnteredEvent(Builder builder) {
		super(builder);
		userId = builder.userId;
		username = builder.username;
	}

	/**
	 * Gets the ID of the user who joined.
	 * @return the user ID
	 */
	public String getUserId() {
		return userId;
	}

	/**
	 * Gets the display name of the user who joined.
	 * @return the display name
	 */
	public String getUsername() {
		return username;
	}

	/**
	 * Used for constructing {@link UserEnteredEvent} instances.
	 */
	public static class Builder extends Event.Builder<UserEnteredEvent, Builder> {
		private String userId;
		private String username;

		/**
		 * Creates an empty builder.
		 */
		public Builder() {
			super();
		}

		/**
		 * Sets the ID of the user who joined.
		 * @param userId the user ID
		 * @return this
		 */
		public Builder userId(String userId) {
			this.userId = userId;
			return this;
		}

		/**
		 * Sets the display name of the user who joined.
		 * @param username the display name
		 * @return this
		 */
		public Builder username(String username) {
			this.username = username;
			return this;
		}

		@Override
		public UserEnteredEvent build() {
			return new UserEnteredEvent(this);
		}
	}
}
