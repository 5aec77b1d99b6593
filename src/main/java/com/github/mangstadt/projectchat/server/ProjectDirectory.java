package com.github.mangstadt.projectchat.server;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.mangstadt.projectchat.AuthenticationFailedException;
import com.github.mangstadt.projectchat.Identity;
import com.github.mangstadt.projectchat.util.JsonUtils;

/**
 * A simple user and project directory that authenticates bearer tokens and
 * answers project membership questions. An identity is a member of a project
 * if it owns the project or is listed as one of its members. This class is
 * thread-safe.
 * 
 * <p>
 * The JSON file format:
 * </p>
 * 
 * <pre>
 * {
 *   "users": [
 *     { "id": "u1", "name": "Alice", "email": "alice@example.com", "token": "secret" }
 *   ],
 *   "projects": [
 *     { "id": "P1", "ownerId": "u1", "members": [ "u2" ] }
 *   ]
 * }
 * </pre>
 */
public class ProjectDirectory implements Authenticator, ProjectAuthorizer {
	private final Map<String, Identity> identitiesByToken = new ConcurrentHashMap<>();
	private final Map<String, Project> projects = new ConcurrentHashMap<>();

	/**
	 * Loads a directory from a JSON file.
	 * @param file the file
	 * @return the directory
	 * @throws IOException if the file can't be read or isn't valid JSON
	 */
	public static ProjectDirectory load(Path file) throws IOException {
		var root = JsonUtils.parse(Files.readString(file));
		var directory = new ProjectDirectory();

		JsonUtils.streamArray(root.get("users")).forEach(user -> {
			var token = JsonUtils.text(user, "token");
			var id = JsonUtils.text(user, "id");
			if (token == null || id == null) {
				return;
			}
			directory.addUser(token, new Identity(id, JsonUtils.text(user, "name"), JsonUtils.text(user, "email")));
		});

		JsonUtils.streamArray(root.get("projects")).forEach(project -> {
			var id = JsonUtils.text(project, "id");
			if (id == null) {
				return;
			}

			//@formatter:off
			var members = JsonUtils.streamArray(project.get("members"))
				.map(JsonNode::asText)
			.toList();
			//@formatter:on

			directory.addProject(id, JsonUtils.text(project, "ownerId"), members);
		});

		return directory;
	}

	/**
	 * Registers a user.
	 * @param token the user's bearer token
	 * @param identity the user
	 */
	public void addUser(String token, Identity identity) {
		identitiesByToken.put(token, identity);
	}

	/**
	 * Registers a project.
	 * @param projectId the project ID
	 * @param ownerId the user ID of the owner (may be null)
	 * @param memberIds the user IDs of the other members
	 */
	public void addProject(String projectId, String ownerId, Collection<String> memberIds) {
		projects.put(projectId, new Project(ownerId, Set.copyOf(memberIds)));
	}

	@Override
	public Identity authenticate(String token) {
		if (token == null || token.isBlank()) {
			throw new AuthenticationFailedException();
		}

		var identity = identitiesByToken.get(token);
		if (identity == null) {
			throw new AuthenticationFailedException();
		}

		return identity;
	}

	@Override
	public boolean isMember(Identity identity, String projectId) {
		var project = projects.get(projectId);
		if (project == null) {
			return false;
		}

		var userId = identity.id();
		return userId.equals(project.ownerId) || project.memberIds.contains(userId);
	}

	private record Project(String ownerId, Set<String> memberIds) {
	}
}
