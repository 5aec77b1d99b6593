package com.github.mangstadt.projectchat.server;

import java.util.Queue;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.mangstadt.projectchat.protocol.CloseCodes;

/**
 * A bounded buffer of frames waiting to be written to one client. Room actors
 * hand frames to the outbox and move on; they never wait for a client. When
 * a client stops reading and the buffer fills up, the client is disconnected,
 * which then removes it from its room like any other disconnect. This class
 * is thread-safe.
 */
public class Outbox {
	private static final Logger logger = LoggerFactory.getLogger(Outbox.class);
	private static final long BACKPRESSURE_RETRY_MS = 10;

	private final Connection connection;
	private final ScheduledExecutorService scheduler;
	private final int capacity;
	private final Queue<String> frames;
	private final AtomicBoolean draining = new AtomicBoolean();
	private volatile boolean closed = false;

	/**
	 * @param connection the connection to write to
	 * @param capacity the maximum number of frames that can be waiting
	 * @param scheduler runs the drain tasks
	 */
	public Outbox(Connection connection, int capacity, ScheduledExecutorService scheduler) {
		this.connection = connection;
		this.capacity = capacity;
		this.scheduler = scheduler;
		frames = new ArrayBlockingQueue<>(capacity);
	}

	/**
	 * Adds a frame to the buffer. Never blocks.
	 * @param frame the frame
	 * @return true if the frame was accepted, false if the outbox is closed or
	 * just overflowed
	 */
	public boolean offer(String frame) {
		if (closed) {
			return false;
		}

		if (!frames.offer(frame)) {
			overflow();
			return false;
		}

		scheduleDrain(0);
		return true;
	}

	/**
	 * Discards any waiting frames and refuses new ones.
	 */
	public void close() {
		closed = true;
		frames.clear();
	}

	/**
	 * Gets the number of frames waiting to be written.
	 * @return the number of frames
	 */
	public int size() {
		return frames.size();
	}

	public boolean isClosed() {
		return closed;
	}

	private void overflow() {
		close();
		logger.atWarn().log(() -> "[" + connection.describe() + "]: Outbound buffer exceeded " + capacity + " frames. Disconnecting slow client.");
		connection.close(CloseCodes.SLOW_CONSUMER, "Outbound buffer overflow.");
	}

	private void scheduleDrain(long delayMs) {
		if (!draining.compareAndSet(false, true)) {
			return;
		}

		try {
			if (delayMs == 0) {
				scheduler.execute(this::drain);
			} else {
				scheduler.schedule(this::drain, delayMs, TimeUnit.MILLISECONDS);
			}
		} catch (RejectedExecutionException e) {
			//server is shutting down
			draining.set(false);
			close();
		}
	}

	private void drain() {
		var backpressure = false;
		try {
			while (!closed) {
				if (connection.hasBufferedData()) {
					backpressure = true;
					break;
				}

				var frame = frames.poll();
				if (frame == null) {
					break;
				}

				connection.send(frame);
			}
		} catch (RuntimeException e) {
			logger.atDebug().setCause(e).log(() -> "[" + connection.describe() + "]: Could not write frame. Discarding outbound buffer.");
			close();
		} finally {
			draining.set(false);
		}

		if (closed || frames.isEmpty()) {
			return;
		}

		scheduleDrain(backpressure ? BACKPRESSURE_RETRY_MS : 0);
	}
}
