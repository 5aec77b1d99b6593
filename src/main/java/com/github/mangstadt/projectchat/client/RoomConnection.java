package com.github.mangstadt.projectchat.client;

import java.io.Closeable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.mangstadt.projectchat.ChatMessage;
import com.github.mangstadt.projectchat.ChatOperationException;
import com.github.mangstadt.projectchat.EmptyMessageException;
import com.github.mangstadt.projectchat.ErrorCode;
import com.github.mangstadt.projectchat.Identity;
import com.github.mangstadt.projectchat.MessageReceipt;
import com.github.mangstadt.projectchat.NotConnectedException;
import com.github.mangstadt.projectchat.PresenceEvent;
import com.github.mangstadt.projectchat.RoomSnapshot;
import com.github.mangstadt.projectchat.event.Event;
import com.github.mangstadt.projectchat.event.MessagePostedEvent;
import com.github.mangstadt.projectchat.event.TypingChangedEvent;
import com.github.mangstadt.projectchat.event.UserEnteredEvent;
import com.github.mangstadt.projectchat.event.UserLeftEvent;
import com.github.mangstadt.projectchat.protocol.CloseCodes;
import com.github.mangstadt.projectchat.protocol.Frames;
import com.github.mangstadt.projectchat.util.JsonUtils;
import com.github.mangstadt.projectchat.util.Sleeper;
import com.github.mangstadt.projectchat.util.WebSocketClient;

import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;

/**
 * <p>
 * One logical connection to one project's chat room. Use the
 * {@link ChatClient#joinRoom} method to properly create an instance of this
 * class.
 * </p>
 * <p>
 * When the socket drops, the connection waits a fixed delay and reconnects,
 * up to a bounded number of attempts in a row. Every time the socket opens,
 * the room is joined again and the member list is replaced with the one the
 * server sends back. Messages received before a drop are kept. Once the
 * attempts are used up, or the server rejects the credential or the
 * membership, the connection enters the {@link ConnectionState#DISCONNECTED}
 * state for good.
 * </p>
 * <p>
 * The local state (messages, members, typing users) is only ever built from
 * what the server sends. This class is thread-safe.
 * </p>
 */
public class RoomConnection implements Closeable {
	private static final Logger logger = LoggerFactory.getLogger(RoomConnection.class);

	private final String roomId;
	private final String url;
	private final String token;
	private final WebSocketClient webSocketClient;
	private final ReconnectPolicy reconnectPolicy;
	private final ChatClient chatClient;

	private ConnectionState state = ConnectionState.CONNECTING;
	private WebSocket webSocket;
	private WebSocketListenerImpl webSocketListener;
	private int reconnectionAttempts = 0;
	private long nextRef = 1;
	private RoomSnapshot lastSnapshot;

	private final Map<Long, PendingAck<?>> pendingAcks = new ConcurrentHashMap<>();
	private final List<ChatMessage> messages = new ArrayList<>();
	private final Map<String, Identity> members = new LinkedHashMap<>();
	private final Map<String, Identity> typingUsers = new LinkedHashMap<>();

	//@formatter:off
	private final Map<Class<? extends Event>, List<Consumer<Event>>> listeners = Map.of(
		Event.class, new ArrayList<>(),
		MessagePostedEvent.class, new ArrayList<>(),
		TypingChangedEvent.class, new ArrayList<>(),
		UserEnteredEvent.class, new ArrayList<>(),
		UserLeftEvent.class, new ArrayList<>()
	);
	//@formatter:on
	private final List<Consumer<ConnectionState>> stateListeners = new ArrayList<>();

	/**
	 * Creates a connection to a room. The socket isn't opened until
	 * {@link #connect} is called. This constructor is meant to be called by
	 * {@link ChatClient#joinRoom}.
	 * @param roomId the room ID (same as the project ID)
	 * @param url the URL of the chat web socket
	 * @param token the bearer credential
	 * @param webSocketClient opens the web socket
	 * @param reconnectPolicy how dropped connections are re-established
	 * @param chatClient the client that created this connection, or null
	 */
	RoomConnection(String roomId, String url, String token, WebSocketClient webSocketClient, ReconnectPolicy reconnectPolicy, ChatClient chatClient) {
		this.roomId = roomId;
		this.url = url;
		this.token = token;
		this.webSocketClient = webSocketClient;
		this.reconnectPolicy = reconnectPolicy;
		this.chatClient = chatClient;
	}

	/**
	 * Opens the web socket. The connection is usable once its state becomes
	 * {@link ConnectionState#CONNECTED}.
	 */
	synchronized void connect() {
		openWebSocket();
	}

	private void openWebSocket() {
		logger.atInfo().log(() -> "[room=" + roomId + "]: Connecting to web socket: " + url);

		/*
		 * Each socket gets its own listener so that late callbacks from a
		 * socket that was given up on can be recognized and ignored.
		 */
		webSocketListener = new WebSocketListenerImpl();
		webSocket = webSocketClient.connect(url, Map.of("Authorization", "Bearer " + token), webSocketListener);
	}

	public String getRoomId() {
		return roomId;
	}

	public synchronized ConnectionState getState() {
		return state;
	}

	/**
	 * Gets the messages received since this connection was created, in the
	 * order they were received. Messages are kept across reconnections.
	 * @return the messages
	 */
	public synchronized List<ChatMessage> getMessages() {
		return List.copyOf(messages);
	}

	/**
	 * Gets the users that are in the room.
	 * @return the users, in the order they joined
	 */
	public synchronized List<Identity> getMembers() {
		return List.copyOf(members.values());
	}

	/**
	 * Gets the other users that are typing.
	 * @return the users
	 */
	public synchronized List<Identity> getTypingUsers() {
		return List.copyOf(typingUsers.values());
	}

	/**
	 * Gets the room state the server sent back the last time the room was
	 * joined.
	 * @return the snapshot or null if the room hasn't been joined yet
	 */
	public synchronized RoomSnapshot getLastSnapshot() {
		return lastSnapshot;
	}

	/**
	 * Posts a message to the room.
	 * @param body the message text
	 * @return completes with the message's ID and sequence number once the
	 * server accepts it. Fails with {@link ChatOperationException} if the
	 * server refuses it, or with {@link NotConnectedException} if the
	 * connection drops before the server answers.
	 * @throws EmptyMessageException if the body is empty or only whitespace
	 * (nothing is sent)
	 * @throws NotConnectedException if the room isn't currently joined
	 * (nothing is sent or queued)
	 */
	public CompletableFuture<MessageReceipt> sendMessage(String body) throws NotConnectedException {
		if (body == null || body.isBlank()) {
			throw new EmptyMessageException();
		}

		var future = new CompletableFuture<MessageReceipt>();
		synchronized (this) {
			if (state != ConnectionState.CONNECTED) {
				throw new NotConnectedException(roomId);
			}

			var ref = nextRef++;
			pendingAcks.put(ref, new PendingAck<>(AckType.SEND, future, RoomConnection::readReceipt));
			if (!webSocket.send(Frames.send(ref, body))) {
				pendingAcks.remove(ref);
				throw new NotConnectedException(roomId);
			}
		}

		return future;
	}

	/**
	 * Tells the other members that the user is typing. Dropped silently if
	 * the room isn't currently joined.
	 */
	public void typing() {
		sendIfConnected(Frames.typing());
	}

	/**
	 * Tells the other members that the user stopped typing. Dropped silently
	 * if the room isn't currently joined.
	 */
	public void stopTyping() {
		sendIfConnected(Frames.stopTyping());
	}

	private synchronized void sendIfConnected(String frame) {
		if (state != ConnectionState.CONNECTED) {
			return;
		}

		webSocket.send(frame);
	}

	/**
	 * Adds a listener that is notified of a particular kind of event.
	 * @param <T> the event class
	 * @param clazz the event class
	 * @param listener the listener
	 */
	@SuppressWarnings("unchecked")
	public <T extends Event> void addEventListener(Class<T> clazz, Consumer<T> listener) {
		var eventListeners = listeners.get(clazz);
		if (eventListeners == null) {
			throw new IllegalArgumentException("Unsupported event class: " + clazz.getName());
		}

		synchronized (eventListeners) {
			eventListeners.add((Consumer<Event>) listener);
		}
	}

	/**
	 * Adds a listener that is notified of every event.
	 * @param listener the listener
	 */
	public void addEventListener(Consumer<Event> listener) {
		addEventListener(Event.class, listener);
	}

	/**
	 * Adds a listener that is notified whenever the connection state changes.
	 * @param listener the listener
	 */
	public void addStateListener(Consumer<ConnectionState> listener) {
		synchronized (stateListeners) {
			stateListeners.add(listener);
		}
	}

	/**
	 * Leaves the room and closes the web socket. Calling this more than once
	 * does nothing.
	 */
	public void leave() {
		synchronized (this) {
			if (state == ConnectionState.CLOSED) {
				return;
			}

			logger.atInfo().log(() -> "[room=" + roomId + "]: Leaving room.");

			var previous = state;
			state = ConnectionState.CLOSED;
			webSocketListener = null;
			if (webSocket != null) {
				if (previous == ConnectionState.CONNECTED) {
					webSocket.send(Frames.leave(null));
				}
				webSocket.close(CloseCodes.NORMAL, "Leaving room.");
			}

			failPendingAcks();
		}

		publishState(ConnectionState.CLOSED);

		if (chatClient != null) {
			chatClient.removeRoom(this);
		}
	}

	@Override
	public void close() {
		leave();
	}

	/**
	 * Handles a frame from the server.
	 * @param json the frame
	 */
	private void handleWebSocketMessage(String json) {
		JsonNode node;
		try {
			node = JsonUtils.parse(json);
		} catch (JsonProcessingException e) {
			logger.atError().setCause(e).log(() -> "[room=" + roomId + "]: Problem parsing frame: " + json);
			return;
		}

		var type = (node == null) ? null : Frames.eventType(node);
		if (type == null) {
			logger.atWarn().log(() -> "[room=" + roomId + "]: Ignoring frame with unknown \"event\":\n" + JsonUtils.prettyPrint(node) + "\n");
			return;
		}

		switch (type) {
		case ACK -> handleAck(node);
		case MESSAGE -> handleMessage(node);
		case PRESENCE -> handlePresence(node);
		case TYPING -> handleTyping(node);
		}
	}

	private void handleAck(JsonNode node) {
		var refNode = node.get("ref");
		if (refNode == null || !refNode.canConvertToLong()) {
			return;
		}

		var pending = pendingAcks.remove(refNode.asLong());
		if (pending == null) {
			return;
		}

		var success = node.path("success").asBoolean(false);
		if (!success) {
			var error = ErrorCode.parse(JsonUtils.text(node, "error"));
			var reason = JsonUtils.text(node, "reason");

			pending.future.completeExceptionally(new ChatOperationException(error, reason));

			if (pending.type == AckType.JOIN) {
				if (error == ErrorCode.AUTHORIZATION_DENIED) {
					logger.atError().log(() -> "[room=" + roomId + "]: Join refused: " + reason);
					giveUp();
				} else {
					logger.atError().log(() -> "[room=" + roomId + "]: Join failed: " + reason + " Reconnecting.");
					WebSocketListenerImpl listener;
					synchronized (this) {
						listener = webSocketListener;
					}
					connectionLost(listener);
				}
			}
			return;
		}

		pending.complete(node);
	}

	private RoomSnapshot readJoinAck(JsonNode node) {
		var snapshot = Frames.extractSnapshot(node);
		joined(snapshot);
		return snapshot;
	}

	private static MessageReceipt readReceipt(JsonNode node) {
		return new MessageReceipt(JsonUtils.text(node, "messageId"), node.path("sequence").asLong());
	}

	private void joined(RoomSnapshot snapshot) {
		synchronized (this) {
			if (state.isTerminal()) {
				return;
			}

			lastSnapshot = snapshot;
			members.clear();
			snapshot.members().forEach(member -> members.put(member.id(), member));
			typingUsers.clear();
			snapshot.typing().forEach(member -> typingUsers.put(member.id(), member));

			reconnectionAttempts = 0;
			state = ConnectionState.CONNECTED;
		}

		logger.atInfo().log(() -> "[room=" + roomId + "]: Joined room. " + snapshot.members().size() + " member(s) present.");
		publishState(ConnectionState.CONNECTED);
	}

	private void handleMessage(JsonNode node) {
		var messageNode = node.get("message");
		if (messageNode == null) {
			return;
		}

		var message = Frames.extractChatMessage(messageNode);
		synchronized (this) {
			messages.add(message);
			typingUsers.remove(message.senderId());
		}

		//@formatter:off
		publishEvent(new MessagePostedEvent.Builder()
			.roomId(roomId)
			.timestamp(message.timestamp())
			.message(message)
		.build());
		//@formatter:on
	}

	private void handlePresence(JsonNode node) {
		var identity = Frames.extractIdentity(node.get("user"));
		var kind = PresenceEvent.Kind.fromWireValue(JsonUtils.text(node, "kind"));
		if (identity == null || kind == null) {
			logger.atWarn().log(() -> "[room=" + roomId + "]: Ignoring malformed presence frame:\n" + JsonUtils.prettyPrint(node) + "\n");
			return;
		}

		var timestamp = JsonUtils.instant(node, "timestamp");
		if (timestamp == null) {
			timestamp = Instant.now();
		}

		Event event;
		synchronized (this) {
			if (kind == PresenceEvent.Kind.JOINED) {
				members.put(identity.id(), identity);

				//@formatter:off
				event = new UserEnteredEvent.Builder()
					.roomId(roomId)
					.timestamp(timestamp)
					.userId(identity.id())
					.username(identity.displayName())
				.build();
				//@formatter:on
			} else {
				members.remove(identity.id());
				typingUsers.remove(identity.id());

				//@formatter:off
				event = new UserLeftEvent.Builder()
					.roomId(roomId)
					.timestamp(timestamp)
					.userId(identity.id())
					.username(identity.displayName())
				.build();
				//@formatter:on
			}
		}

		publishEvent(event);
	}

	private void handleTyping(JsonNode node) {
		var identity = Frames.extractIdentity(node.get("user"));
		if (identity == null) {
			return;
		}

		var typing = node.path("typing").asBoolean(false);
		synchronized (this) {
			if (typing) {
				typingUsers.put(identity.id(), identity);
			} else {
				typingUsers.remove(identity.id());
			}
		}

		//@formatter:off
		publishEvent(new TypingChangedEvent.Builder()
			.roomId(roomId)
			.timestamp(Instant.now())
			.userId(identity.id())
			.username(identity.displayName())
			.typing(typing)
		.build());
		//@formatter:on
	}

	private void publishEvent(Event event) {
		var genericListeners = listeners.get(Event.class);
		synchronized (genericListeners) {
			genericListeners.forEach(listener -> notify(listener, event));
		}

		var eventListeners = listeners.get(event.getClass());
		synchronized (eventListeners) {
			eventListeners.forEach(listener -> notify(listener, event));
		}
	}

	private void publishState(ConnectionState newState) {
		synchronized (stateListeners) {
			stateListeners.forEach(listener -> notify(listener, newState));
		}
	}

	private <T> void notify(Consumer<T> listener, T value) {
		try {
			listener.accept(value);
		} catch (RuntimeException e) {
			logger.atError().setCause(e).log(() -> "[room=" + roomId + "]: Listener threw an exception.");
		}
	}

	/**
	 * Fails every outstanding acknowledgment. Must be called while holding
	 * this object's lock.
	 */
	private void failPendingAcks() {
		pendingAcks.values().forEach(pending -> pending.future.completeExceptionally(new NotConnectedException(roomId)));
		pendingAcks.clear();
	}

	/**
	 * Stops for good: the server will not accept this connection no matter how
	 * often it is retried.
	 */
	private void giveUp() {
		synchronized (this) {
			if (state.isTerminal()) {
				return;
			}

			state = ConnectionState.DISCONNECTED;
			webSocketListener = null;
			if (webSocket != null) {
				webSocket.cancel();
			}
			failPendingAcks();
		}

		publishState(ConnectionState.DISCONNECTED);
	}

	/**
	 * Called when the socket dropped or could not be opened.
	 * @param listener the listener of the socket that dropped
	 */
	private void connectionLost(WebSocketListenerImpl listener) {
		int attempt;
		synchronized (this) {
			if (listener == null || listener != webSocketListener || state.isTerminal()) {
				return;
			}

			webSocketListener = null;
			webSocket.cancel();
			failPendingAcks();

			if (reconnectionAttempts >= reconnectPolicy.maxAttempts()) {
				logger.atError().log(() -> "[room=" + roomId + "]: Unable to reconnect to web socket after " + reconnectionAttempts + " attempts. Giving up.");
				state = ConnectionState.DISCONNECTED;
				attempt = -1;
			} else {
				state = ConnectionState.RECONNECTING;
				attempt = ++reconnectionAttempts;
			}
		}

		if (attempt < 0) {
			publishState(ConnectionState.DISCONNECTED);
			return;
		}

		publishState(ConnectionState.RECONNECTING);

		var delay = reconnectPolicy.delay();
		logger.atWarn().log(() -> "[room=" + roomId + "]: Attempting to reconnect web socket in " + delay.toMillis() + "ms (attempt " + attempt + " of " + reconnectPolicy.maxAttempts() + ").");
		Sleeper.sleep(delay);

		synchronized (this) {
			if (state != ConnectionState.RECONNECTING) {
				//left the room while sleeping
				return;
			}
			openWebSocket();
		}
	}

	private enum AckType {
		JOIN, SEND
	}

	/**
	 * @param <T> the value the acknowledgment completes its future with
	 */
	private static class PendingAck<T> {
		private final AckType type;
		private final CompletableFuture<T> future;
		private final Function<JsonNode, T> reader;

		PendingAck(AckType type, CompletableFuture<T> future, Function<JsonNode, T> reader) {
			this.type = type;
			this.future = future;
			this.reader = reader;
		}

		void complete(JsonNode ack) {
			future.complete(reader.apply(ack));
		}
	}

	/**
	 * Re-joins the room every time the socket opens, and reconnects when the
	 * socket drops.
	 * @see "https://square.github.io/okhttp/5.x/okhttp/okhttp3/-web-socket-listener/index.html"
	 */
	private class WebSocketListenerImpl extends WebSocketListener {
		private boolean isCurrent() {
			synchronized (RoomConnection.this) {
				return this == webSocketListener;
			}
		}

		@Override
		public void onOpen(WebSocket webSocket, Response response) {
			synchronized (RoomConnection.this) {
				if (this != webSocketListener) {
					return;
				}

				var ref = nextRef++;
				pendingAcks.put(ref, new PendingAck<>(AckType.JOIN, new CompletableFuture<RoomSnapshot>(), RoomConnection.this::readJoinAck));
				webSocket.send(Frames.join(ref, roomId));
			}
		}

		@Override
		public void onMessage(WebSocket webSocket, String text) {
			if (!isCurrent()) {
				return;
			}

			handleWebSocketMessage(text);
		}

		@Override
		public void onFailure(WebSocket webSocket, Throwable t, Response response) {
			if (!isCurrent()) {
				return;
			}

			if (response != null && response.code() == 401) {
				logger.atError().log(() -> "[room=" + roomId + "]: Credential rejected during handshake. Not reconnecting.");
				giveUp();
				return;
			}

			logger.atError().setCause(t).log(() -> "[room=" + roomId + "]: Web socket failed.");
			connectionLost(this);
		}

		/**
		 * Invoked when the remote peer has indicated that no more incoming
		 * messages will be transmitted.
		 */
		@Override
		public void onClosing(WebSocket webSocket, int code, String reason) {
			if (!isCurrent()) {
				return;
			}

			if (code == CloseCodes.AUTHENTICATION_FAILED) {
				logger.atError().log(() -> "[room=" + roomId + "]: Credential rejected by server. Not reconnecting.");
				giveUp();
				return;
			}

			logger.atWarn().log(() -> "[room=" + roomId + "]: Web socket is being closed by the server. Reason=\"" + reason + "\" Code=" + code);
			webSocket.close(CloseCodes.NORMAL, null);
		}

		/**
		 * Invoked when both peers have indicated that no more messages will
		 * be transmitted and the connection has been successfully released.
		 * No further calls to this listener will be made.
		 */
		@Override
		public void onClosed(WebSocket webSocket, int code, String reason) {
			if (!isCurrent()) {
				return;
			}

			if (code == CloseCodes.AUTHENTICATION_FAILED) {
				giveUp();
				return;
			}

			logger.atError().log(() -> "[room=" + roomId + "]: Web socket closed by server. Reason=\"" + reason + "\" Code=" + code);
			connectionLost(this);
		}
	}
}
