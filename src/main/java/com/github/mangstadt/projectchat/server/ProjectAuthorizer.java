package com.github.mangstadt.projectchat.server;

import com.github.mangstadt.projectchat.Identity;

/**
 * Decides who may join a project's room. Consulted on every join.
 */
public interface ProjectAuthorizer {
	/**
	 * Determines whether an identity is a member of a project.
	 * @param identity the identity
	 * @param projectId the project ID (same as the room ID)
	 * @return true if the identity may join the project's room
	 */
	boolean isMember(Identity identity, String projectId);
}
