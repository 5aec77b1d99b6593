package com.github.mangstadt.projectchat.server;

import java.net.InetSocketAddress;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.java_websocket.WebSocket;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.server.WebSocketServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The chat web socket endpoint. Binds each socket to a
 * {@link ConnectionSession} and forwards the socket's callbacks to it.
 */
public class ChatServer extends WebSocketServer {
	private static final Logger logger = LoggerFactory.getLogger(ChatServer.class);

	private final Authenticator authenticator;
	private final RoomRegistry registry;
	private final int outboxCapacity;
	private final ScheduledExecutorService delivery;
	private final CountDownLatch started = new CountDownLatch(1);

	/**
	 * @param address the address to bind to
	 * @param authenticator validates client credentials
	 * @param registry the rooms
	 * @param outboxCapacity the size of each client's outbound buffer
	 * @param delivery writes buffered frames to the clients
	 */
	public ChatServer(InetSocketAddress address, Authenticator authenticator, RoomRegistry registry, int outboxCapacity, ScheduledExecutorService delivery) {
		super(address);
		this.authenticator = authenticator;
		this.registry = registry;
		this.outboxCapacity = outboxCapacity;
		this.delivery = delivery;

		setReuseAddr(true);
		setConnectionLostTimeout(60);
	}

	@Override
	public void onOpen(WebSocket conn, ClientHandshake handshake) {
		var connection = new WebSocketConnection(conn);
		var session = new ConnectionSession(connection, new Outbox(connection, outboxCapacity, delivery), authenticator, registry);
		conn.setAttachment(session);

		session.open(extractToken(handshake));
	}

	@Override
	public void onMessage(WebSocket conn, String message) {
		ConnectionSession session = conn.getAttachment();
		if (session == null) {
			return;
		}

		session.onFrame(message);
	}

	@Override
	public void onClose(WebSocket conn, int code, String reason, boolean remote) {
		logger.atDebug().log(() -> "[" + conn.getRemoteSocketAddress() + "]: Socket closed. Code=" + code + " Reason=\"" + reason + "\" Remote=" + remote);

		ConnectionSession session = conn.getAttachment();
		if (session != null) {
			session.close();
		}
	}

	@Override
	public void onError(WebSocket conn, Exception ex) {
		if (conn == null) {
			logger.atError().setCause(ex).log(() -> "Web socket server error.");
			return;
		}

		logger.atWarn().setCause(ex).log(() -> "[" + conn.getRemoteSocketAddress() + "]: Socket error.");
	}

	@Override
	public void onStart() {
		logger.atInfo().log(() -> "Chat server listening on port " + getPort() + ".");
		started.countDown();
	}

	/**
	 * Waits for the server to start listening.
	 * @param timeout how long to wait
	 * @param unit the unit of the timeout
	 * @return true if the server is listening, false if the time ran out
	 * @throws InterruptedException if the thread is interrupted while waiting
	 */
	public boolean awaitStart(long timeout, TimeUnit unit) throws InterruptedException {
		return started.await(timeout, unit);
	}

	/**
	 * Gets the credential sent with the handshake. The "Authorization" header
	 * takes precedence over the "token" query parameter.
	 * @param handshake the handshake
	 * @return the credential or null if none was sent
	 */
	static String extractToken(ClientHandshake handshake) {
		var token = BearerToken.fromHeader(handshake.getFieldValue("Authorization"));
		return (token == null) ? BearerToken.fromQuery(handshake.getResourceDescriptor()) : token;
	}
}
