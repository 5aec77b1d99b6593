package com.github.mangstadt.projectchat;

/**
 * Thrown when a credential is missing or is not accepted.
 * @see com.github.mangstadt.projectchat.server.Authenticator
 */
@SuppressWarnings("serial")
public class AuthenticationFailedException extends ChatOperationException {
	public AuthenticationFailedException() {
		super(ErrorCode.AUTHENTICATION_FAILED, "Credential was rejected.");
	}
}
