package com.github.mangstadt.projectchat.util;

import java.io.Closeable;
import java.util.Map;

import okhttp3.WebSocket;
import okhttp3.WebSocketListener;

/**
 * Creates web socket connections.
 */
public interface WebSocketClient extends Closeable {
	/**
	 * Creates a web socket connection.
	 * @param url the URL to the web socket
	 * @param headers the headers to send with the handshake request
	 * @param listener listens for incoming messages
	 * @return the web socket connection
	 */
	WebSocket connect(String url, Map<String, String> headers, WebSocketListener listener);
}
