package com.github.mangstadt.projectchat.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.mangstadt.projectchat.util.JsonUtils;

/**
 * A {@link Connection} that records what is written to it.
 */
class RecordingConnection implements Connection {
	private final String name;
	private final BlockingQueue<String> frames = new LinkedBlockingQueue<>();
	private volatile boolean bufferedData = false;
	private volatile Integer closeCode;

	RecordingConnection(String name) {
		this.name = name;
	}

	@Override
	public void send(String frame) {
		frames.add(frame);
	}

	@Override
	public boolean hasBufferedData() {
		return bufferedData;
	}

	/**
	 * Simulates a client that stops reading.
	 * @param bufferedData true to report that the transport has unwritten
	 * data
	 */
	void setBufferedData(boolean bufferedData) {
		this.bufferedData = bufferedData;
	}

	@Override
	public void close(int code, String reason) {
		closeCode = code;
	}

	@Override
	public String describe() {
		return name;
	}

	Integer getCloseCode() {
		return closeCode;
	}

	/**
	 * Waits for the next frame.
	 * @return the parsed frame
	 */
	JsonNode next() throws Exception {
		var frame = frames.poll(2, TimeUnit.SECONDS);
		assertNotNull(frame, name + " did not receive a frame.");
		return JsonUtils.parse(frame);
	}

	/**
	 * Waits for the next frame and checks its type.
	 * @param event the expected value of the "event" field
	 * @return the parsed frame
	 */
	JsonNode next(String event) throws Exception {
		var node = next();
		assertEquals(event, node.path("event").asText(), () -> name + " received an unexpected frame: " + node);
		return node;
	}

	/**
	 * Gets the next frame if one arrives shortly.
	 * @return the frame or null
	 */
	String poll(long millis) throws InterruptedException {
		return frames.poll(millis, TimeUnit.MILLISECONDS);
	}
}
