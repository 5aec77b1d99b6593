package com.github.mangstadt.projectchat.util;

import java.time.Duration;
import java.util.Map;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;

/**
 * OkHttp-backed web socket client.
 */
public class WebSocketClientImpl implements WebSocketClient {
	private final OkHttpClient client;

	public WebSocketClientImpl() {
		this(Duration.ofSeconds(10), Duration.ofSeconds(25));
	}

	/**
	 * @param connectTimeout how long to wait for the handshake to complete
	 * @param pingInterval how often to ping the server so that dead
	 * connections are detected
	 */
	public WebSocketClientImpl(Duration connectTimeout, Duration pingInterval) {
		//@formatter:off
		client = new OkHttpClient.Builder()
			.connectTimeout(connectTimeout)
			.pingInterval(pingInterval)
		.build();
		//@formatter:on
	}

	@Override
	public WebSocket connect(String url, Map<String, String> headers, WebSocketListener listener) {
		var builder = new Request.Builder().url(url);
		headers.forEach(builder::addHeader);

		return client.newWebSocket(builder.build(), listener);
	}

	@Override
	public void close() {
		/*
		 * Without these method calls, various threads that OkHttp creates will
		 * continue to run for 1 minute after the client has shutdown,
		 * preventing its Java process from terminating right away.
		 */
		client.dispatcher().executorService().shutdown();
		client.connectionPool().evictAll();
	}
}
