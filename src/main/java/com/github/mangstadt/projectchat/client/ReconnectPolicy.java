package com.github.mangstadt.projectchat.client;

import java.time.Duration;

/**
 * How a {@link RoomConnection} re-establishes a dropped connection: a fixed
 * delay between attempts and a bounded number of attempts.
 * @param delay how long to wait before each attempt
 * @param maxAttempts how many consecutive attempts to make before giving up
 */
public record ReconnectPolicy(Duration delay, int maxAttempts) {
	/**
	 * One second between attempts, five attempts.
	 */
	public static final ReconnectPolicy DEFAULT = new ReconnectPolicy(Duration.ofSeconds(1), 5);

	public ReconnectPolicy {
		if (delay == null || delay.isNegative()) {
			throw new IllegalArgumentException("Delay cannot be null or negative.");
		}
		if (maxAttempts < 0) {
			throw new IllegalArgumentException("Max attempts cannot be negative.");
		}
	}
}
