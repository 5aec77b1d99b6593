package com.github.mangstadt.projectchat.server;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

import org.apache.http.client.utils.URLEncodedUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.mangstadt.projectchat.AuthenticationFailedException;
import com.github.mangstadt.projectchat.Identity;
import com.github.mangstadt.projectchat.protocol.Frames;
import com.github.mangstadt.projectchat.util.JsonUtils;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

/**
 * <p>
 * Serves the scrollback of a room over plain HTTP. This is the only place the
 * history store is read from.
 * </p>
 * 
 * <pre>
 * GET /projects/{roomId}/messages?limit=N
 * Authorization: Bearer {token}
 * </pre>
 * <p>
 * Responds with 401 if the credential is bad, 403 if the user is not a
 * member of the project, and otherwise with
 * <code>{"messages":[...]}</code>, oldest first.
 * </p>
 */
public class HistoryHttpServer implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(HistoryHttpServer.class);
	private static final Pattern PATH = Pattern.compile("^/projects/([^/]+)/messages/?$");

	static final int DEFAULT_LIMIT = 50;
	static final int MAX_LIMIT = 500;

	private final HttpServer server;
	private final Authenticator authenticator;
	private final ProjectAuthorizer authorizer;
	private final HistoryStore historyStore;

	/**
	 * Binds the server. Call {@link #start} to begin serving requests.
	 * @param address the address to bind to
	 * @param authenticator validates credentials
	 * @param authorizer checks project membership
	 * @param historyStore the messages
	 * @throws IOException if the port can't be bound
	 */
	public HistoryHttpServer(InetSocketAddress address, Authenticator authenticator, ProjectAuthorizer authorizer, HistoryStore historyStore) throws IOException {
		this.authenticator = authenticator;
		this.authorizer = authorizer;
		this.historyStore = historyStore;

		server = HttpServer.create(address, 0);
		server.createContext("/projects/", this::handle);
	}

	public void start() {
		server.start();
		logger.atInfo().log(() -> "History endpoint listening on port " + getPort() + ".");
	}

	/**
	 * Gets the port the server is bound to.
	 * @return the port
	 */
	public int getPort() {
		return server.getAddress().getPort();
	}

	@Override
	public void close() {
		server.stop(0);
	}

	private void handle(HttpExchange exchange) throws IOException {
		try {
			if (!"GET".equals(exchange.getRequestMethod())) {
				respond(exchange, 405, error("Method not allowed."));
				return;
			}

			var uri = exchange.getRequestURI();
			var m = PATH.matcher(uri.getPath());
			if (!m.find()) {
				respond(exchange, 404, error("Not found."));
				return;
			}
			var roomId = m.group(1);

			var token = BearerToken.fromHeader(exchange.getRequestHeaders().getFirst("Authorization"));
			Identity identity;
			try {
				identity = authenticator.authenticate(token);
			} catch (AuthenticationFailedException e) {
				respond(exchange, 401, error(e.getMessage()));
				return;
			}

			if (!authorizer.isMember(identity, roomId)) {
				logger.atInfo().log(() -> "[room=" + roomId + "]: History request from non-member " + identity.id() + " refused.");
				respond(exchange, 403, error("Not a member of this project."));
				return;
			}

			int limit;
			try {
				limit = parseLimit(uri);
			} catch (NumberFormatException e) {
				respond(exchange, 400, error("\"limit\" must be an integer."));
				return;
			}

			var messages = historyStore.latest(roomId, limit);
			logger.atDebug().log(() -> "[room=" + roomId + "]: Serving " + messages.size() + " message(s) of history to " + identity.id() + ".");
			respond(exchange, 200, Frames.history(messages));
		} catch (RuntimeException e) {
			logger.atError().setCause(e).log(() -> "Problem serving history request: " + exchange.getRequestURI());
			respond(exchange, 500, error("Internal error."));
		} finally {
			exchange.close();
		}
	}

	/**
	 * Reads the "limit" parameter, clamped to 1..{@value #MAX_LIMIT}.
	 */
	static int parseLimit(URI uri) {
		//@formatter:off
		var value = URLEncodedUtils.parse(uri, StandardCharsets.UTF_8).stream()
			.filter(param -> "limit".equals(param.getName()))
			.map(param -> param.getValue())
		.findFirst().orElse(null);
		//@formatter:on

		if (value == null || value.isBlank()) {
			return DEFAULT_LIMIT;
		}

		var limit = Integer.parseInt(value.trim());
		return Math.max(1, Math.min(MAX_LIMIT, limit));
	}

	private static String error(String message) {
		var node = JsonUtils.newObject();
		node.put("error", message);
		return JsonUtils.toString(node);
	}

	private static void respond(HttpExchange exchange, int status, String json) throws IOException {
		var body = json.getBytes(StandardCharsets.UTF_8);
		exchange.getResponseHeaders().set("Content-Type", "application/json; charset=UTF-8");
		exchange.sendResponseHeaders(status, body.length);
		try (var out = exchange.getResponseBody()) {
			out.write(body);
		}
	}
}
