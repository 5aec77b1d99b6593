package com.github.mangstadt.projectchat.server;

import com.github.mangstadt.projectchat.AuthenticationFailedException;
import com.github.mangstadt.projectchat.Identity;

/**
 * Turns a bearer credential into an identity. Consulted once per connection,
 * at the start of its lifecycle.
 */
public interface Authenticator {
	/**
	 * Authenticates a credential.
	 * @param token the bearer credential
	 * @return the identity
	 * @throws AuthenticationFailedException if the credential is missing or
	 * not accepted
	 */
	Identity authenticate(String token) throws AuthenticationFailedException;
}
