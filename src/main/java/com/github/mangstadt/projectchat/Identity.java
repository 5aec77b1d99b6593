package com.github.mangstadt.projectchat;

import static java.util.Objects.requireNonNull;

/**
 * An authenticated principal. An identity is bound to a connection for the
 * connection's whole lifetime.
 * @param id the stable, unique user ID
 * @param displayName the name shown to other room members
 * @param email the email address (never broadcast to other members)
 */
public record Identity(String id, String displayName, String email) {
	public Identity {
		requireNonNull(id);
		if (displayName == null) {
			displayName = (email == null) ? "Unknown" : email;
		}
	}

	/**
	 * Creates an identity that only has the fields that are shared with other
	 * room members.
	 * @param id the user ID
	 * @param displayName the display name
	 * @return the identity
	 */
	public static Identity publicView(String id, String displayName) {
		return new Identity(id, displayName, null);
	}
}
