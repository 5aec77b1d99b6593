package com.github.mangstadt.projectchat.client;

import java.io.Closeable;
import java.io.IOException;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.apache.http.client.utils.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.mangstadt.projectchat.AuthenticationFailedException;
import com.github.mangstadt.projectchat.AuthorizationDeniedException;
import com.github.mangstadt.projectchat.ChatMessage;
import com.github.mangstadt.projectchat.protocol.Frames;
import com.github.mangstadt.projectchat.util.Http;
import com.github.mangstadt.projectchat.util.Http.Response;
import com.github.mangstadt.projectchat.util.JsonUtils;

/**
 * Fetches the scrollback of a room from the history endpoint.
 */
public class HistoryClient implements Closeable {
	private static final Logger logger = LoggerFactory.getLogger(HistoryClient.class);

	private final Http http;
	private final String baseUrl;
	private final String token;

	/**
	 * @param http the HTTP client
	 * @param baseUrl the base URL of the history endpoint (e.g.
	 * "http://localhost:8766")
	 * @param token the bearer credential
	 */
	public HistoryClient(Http http, String baseUrl, String token) {
		this.http = http;
		this.baseUrl = baseUrl;
		this.token = token;
	}

	/**
	 * Gets the most recent messages of a room.
	 * @param roomId the room ID
	 * @param limit the maximum number of messages to return (the server caps
	 * this at 500)
	 * @return the messages, oldest first
	 * @throws AuthenticationFailedException if the credential was rejected
	 * @throws AuthorizationDeniedException if the user is not a member of the
	 * project
	 * @throws IOException if there's a network problem or the server returned
	 * an unexpected response
	 */
	public List<ChatMessage> latest(String roomId, int limit) throws IOException {
		var url = messagesUrl(roomId, limit);
		var response = http.get(url, Map.of("Authorization", "Bearer " + token), new RateLimit429Handler());

		switch (response.getStatusCode()) {
		case 200:
			break;
		case 401:
			throw new AuthenticationFailedException();
		case 403:
			throw new AuthorizationDeniedException("Not a member of project " + roomId + ".");
		default:
			throw new IOException("History request failed [status=" + response.getStatusCode() + "; URI=" + url + "]: " + response.getBody());
		}

		var root = response.getBodyAsJson();
		if (root == null) {
			throw new IOException("History response had no body [URI=" + url + "].");
		}

		var messagesNode = root.get("messages");
		if (messagesNode == null || !messagesNode.isArray()) {
			logger.atWarn().log(() -> "[room=" + roomId + "]: History response did not have a \"messages\" array:\n" + JsonUtils.prettyPrint(root) + "\n");
			return List.of();
		}

		var messages = new ArrayList<ChatMessage>();
		JsonUtils.streamArray(messagesNode).map(Frames::extractChatMessage).forEach(messages::add);
		return messages;
	}

	private String messagesUrl(String roomId, int limit) throws IOException {
		try {
			var builder = new URIBuilder(baseUrl);

			var segments = new ArrayList<>(builder.getPathSegments());
			segments.addAll(List.of("projects", roomId, "messages"));

			//@formatter:off
			return builder
				.setPathSegments(segments)
				.setParameter("limit", Integer.toString(limit))
			.toString();
			//@formatter:on
		} catch (URISyntaxException e) {
			throw new IOException("History URL is not a valid URI: " + baseUrl, e);
		}
	}

	@Override
	public void close() throws IOException {
		http.close();
	}

	/**
	 * An HTTP 429 response means that the client is sending requests too
	 * quickly. The "Retry-After" header says how many seconds to wait.
	 */
	static class RateLimit429Handler implements Http.RateLimitHandler {
		private static final Pattern SECONDS = Pattern.compile("\\d{1,6}");

		@Override
		public int getMaxAttempts() {
			return 3;
		}

		@Override
		public boolean isRateLimited(Response response) {
			return (response.getStatusCode() == 429);
		}

		@Override
		public Duration getWaitTime(Response response) {
			/*
			 * The header can also be an HTTP date. Only the number of seconds
			 * form is supported.
			 */
			var retryAfter = response.getRetryAfter();
			var seconds = (retryAfter != null && SECONDS.matcher(retryAfter.trim()).matches()) ? Integer.parseInt(retryAfter.trim()) : 1;
			return Duration.ofSeconds(seconds);
		}
	}
}
