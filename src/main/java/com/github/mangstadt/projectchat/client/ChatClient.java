package com.github.mangstadt.projectchat.client;

import static java.util.Objects.requireNonNull;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.http.impl.client.HttpClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.mangstadt.projectchat.ChatMessage;
import com.github.mangstadt.projectchat.util.Http;
import com.github.mangstadt.projectchat.util.WebSocketClient;
import com.github.mangstadt.projectchat.util.WebSocketClientImpl;

/**
 * A connection to a project chat server. Holds the user's credential and
 * keeps at most one {@link RoomConnection} per room. This class is
 * thread-safe.
 */
public class ChatClient implements Closeable {
	private static final Logger logger = LoggerFactory.getLogger(ChatClient.class);

	private final String webSocketUrl;
	private final String token;
	private final WebSocketClient webSocketClient;
	private final HistoryClient historyClient;
	private final ReconnectPolicy reconnectPolicy;
	private final Map<String, RoomConnection> rooms = new LinkedHashMap<>();

	/**
	 * Creates a client with the default reconnection policy.
	 * @param webSocketUrl the URL of the chat web socket (e.g.
	 * "ws://localhost:8765")
	 * @param historyUrl the base URL of the history endpoint (e.g.
	 * "http://localhost:8766"), or null if scrollback is not needed
	 * @param token the bearer credential
	 * @return the client
	 */
	public static ChatClient connect(String webSocketUrl, String historyUrl, String token) {
		return connect(webSocketUrl, historyUrl, token, ReconnectPolicy.DEFAULT);
	}

	/**
	 * Creates a client.
	 * @param webSocketUrl the URL of the chat web socket
	 * @param historyUrl the base URL of the history endpoint, or null if
	 * scrollback is not needed
	 * @param token the bearer credential
	 * @param reconnectPolicy how dropped room connections are re-established
	 * @return the client
	 */
	public static ChatClient connect(String webSocketUrl, String historyUrl, String token, ReconnectPolicy reconnectPolicy) {
		var historyClient = (historyUrl == null) ? null : new HistoryClient(new Http(HttpClients.createDefault()), historyUrl, token);
		return new ChatClient(webSocketUrl, token, new WebSocketClientImpl(), historyClient, reconnectPolicy);
	}

	/**
	 * @param webSocketUrl the URL of the chat web socket
	 * @param token the bearer credential
	 * @param webSocketClient opens the web sockets
	 * @param historyClient fetches scrollback, or null if not needed
	 * @param reconnectPolicy how dropped room connections are re-established
	 */
	public ChatClient(String webSocketUrl, String token, WebSocketClient webSocketClient, HistoryClient historyClient, ReconnectPolicy reconnectPolicy) {
		this.webSocketUrl = requireNonNull(webSocketUrl);
		this.token = requireNonNull(token);
		this.webSocketClient = requireNonNull(webSocketClient);
		this.historyClient = historyClient;
		this.reconnectPolicy = requireNonNull(reconnectPolicy);
	}

	/**
	 * Joins a project's chat room. If the room has already been joined, the
	 * existing connection is returned.
	 * @param roomId the room ID (same as the project ID)
	 * @return the room connection. The connection is established in the
	 * background; watch its state to know when it is usable.
	 */
	public RoomConnection joinRoom(String roomId) {
		synchronized (rooms) {
			var room = rooms.get(roomId);
			if (room != null) {
				return room;
			}

			room = new RoomConnection(roomId, webSocketUrl, token, webSocketClient, reconnectPolicy, this);
			rooms.put(roomId, room);
			room.connect();
			return room;
		}
	}

	/**
	 * Gets the rooms that are joined.
	 * @return the rooms
	 */
	public List<RoomConnection> getRooms() {
		synchronized (rooms) {
			return new ArrayList<>(rooms.values());
		}
	}

	/**
	 * Gets a room that was joined.
	 * @param roomId the room ID
	 * @return the room or null if not joined
	 */
	public RoomConnection getRoom(String roomId) {
		synchronized (rooms) {
			return rooms.get(roomId);
		}
	}

	public boolean isInRoom(String roomId) {
		synchronized (rooms) {
			return rooms.containsKey(roomId);
		}
	}

	/**
	 * Removes a room from the list of joined rooms. For internal use only
	 * (called by {@link RoomConnection#leave}).
	 * @param room the room
	 */
	void removeRoom(RoomConnection room) {
		synchronized (rooms) {
			rooms.remove(room.getRoomId(), room);
		}
	}

	/**
	 * Gets the most recent messages of a room from the history endpoint. Live
	 * connections never do this on their own.
	 * @param roomId the room ID
	 * @param limit the maximum number of messages
	 * @return the messages, oldest first
	 * @throws IOException if there's a network problem
	 * @throws IllegalStateException if no history URL was configured
	 */
	public List<ChatMessage> getHistory(String roomId, int limit) throws IOException {
		if (historyClient == null) {
			throw new IllegalStateException("No history endpoint configured.");
		}
		return historyClient.latest(roomId, limit);
	}

	@Override
	public void close() throws IOException {
		getRooms().forEach(RoomConnection::leave);

		try {
			webSocketClient.close();
		} finally {
			if (historyClient != null) {
				try {
					historyClient.close();
				} catch (IOException e) {
					logger.atWarn().setCause(e).log(() -> "Problem closing HTTP client.");
				}
			}
		}
	}
}
