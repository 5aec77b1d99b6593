package com.github.mangstadt.projectchat.server;

import java.util.Objects;

import org.java_websocket.WebSocket;

/**
 * Adapts a Java-WebSocket connection.
 */
class WebSocketConnection implements Connection {
	private final WebSocket webSocket;

	WebSocketConnection(WebSocket webSocket) {
		this.webSocket = Objects.requireNonNull(webSocket);
	}

	@Override
	public void send(String frame) {
		webSocket.send(frame);
	}

	@Override
	public boolean hasBufferedData() {
		return webSocket.hasBufferedData();
	}

	@Override
	public void close(int code, String reason) {
		webSocket.close(code, reason);
	}

	@Override
	public String describe() {
		return String.valueOf(webSocket.getRemoteSocketAddress());
	}
}
