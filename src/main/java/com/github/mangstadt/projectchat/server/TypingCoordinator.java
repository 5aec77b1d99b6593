package com.github.mangstadt.projectchat.server;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import com.github.mangstadt.projectchat.Identity;

/**
 * Tracks who is typing in one room. Each typing identity has a quiescence
 * timer; when the timer fires it calls the expiry callback, which is expected
 * to hand the expiry back to the room's mailbox and call {@link #expire}
 * there. Only accessed from the owning {@link RoomActor}'s mailbox, so it is
 * not thread-safe.
 */
class TypingCoordinator {
	private final Duration quiescence;
	private final ScheduledExecutorService scheduler;
	private final ExpiryCallback onExpiry;
	private final Map<String, Typist> typists = new LinkedHashMap<>();
	private long generation = 0;

	/**
	 * @param quiescence how long a typing indicator lasts without a refresh
	 * @param scheduler runs the timers
	 * @param onExpiry invoked (on a scheduler thread) when a timer fires
	 */
	TypingCoordinator(Duration quiescence, ScheduledExecutorService scheduler, ExpiryCallback onExpiry) {
		this.quiescence = quiescence;
		this.scheduler = scheduler;
		this.onExpiry = onExpiry;
	}

	/**
	 * Marks an identity as typing, starting or restarting its timer.
	 * @param identity the identity
	 * @return true if the identity was not typing before
	 */
	boolean markTyping(Identity identity) {
		var previous = typists.remove(identity.id());
		if (previous != null) {
			previous.timer.cancel(false);
		}

		var timerGeneration = ++generation;
		var timer = scheduler.schedule(() -> onExpiry.expired(identity, timerGeneration), quiescence.toMillis(), TimeUnit.MILLISECONDS);
		typists.put(identity.id(), new Typist(identity, timerGeneration, timer));

		return previous == null;
	}

	/**
	 * Marks an identity as no longer typing.
	 * @param identity the identity
	 * @return true if the identity was typing
	 */
	boolean markStopped(Identity identity) {
		var previous = typists.remove(identity.id());
		if (previous == null) {
			return false;
		}

		previous.timer.cancel(false);
		return true;
	}

	/**
	 * Removes an identity whose timer fired, unless the timer was restarted
	 * or stopped in the meantime.
	 * @param identity the identity
	 * @param timerGeneration the generation of the timer that fired
	 * @return true if the identity was removed
	 */
	boolean expire(Identity identity, long timerGeneration) {
		var current = typists.get(identity.id());
		if (current == null || current.generation != timerGeneration) {
			return false;
		}

		typists.remove(identity.id());
		return true;
	}

	boolean isTyping(Identity identity) {
		return typists.containsKey(identity.id());
	}

	/**
	 * Gets the identities that are typing.
	 * @return the identities
	 */
	List<Identity> typing() {
		return typists.values().stream().map(Typist::identity).toList();
	}

	/**
	 * Cancels every timer.
	 */
	void clear() {
		typists.values().forEach(typist -> typist.timer.cancel(false));
		typists.clear();
	}

	@FunctionalInterface
	interface ExpiryCallback {
		void expired(Identity identity, long generation);
	}

	private record Typist(Identity identity, long generation, ScheduledFuture<?> timer) {
	}
}
