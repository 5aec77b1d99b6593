package com.github.mangstadt.projectchat;

/**
 * Thrown when an identity tries to join the room of a project it is not a
 * member of, or tries a room operation before authenticating.
 */
@SuppressWarnings("serial")
public class AuthorizationDeniedException extends ChatOperationException {
	public AuthorizationDeniedException(String message) {
		super(ErrorCode.AUTHORIZATION_DENIED, message);
	}

	public static AuthorizationDeniedException notMember(String userId, String roomId) {
		return new AuthorizationDeniedException("User " + userId + " is not a member of project " + roomId + ".");
	}

	public static AuthorizationDeniedException notAuthenticated() {
		return new AuthorizationDeniedException("Not authenticated.");
	}
}
