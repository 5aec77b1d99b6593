package com.github.mangstadt.projectchat.server;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps room IDs to their running {@link RoomActor}. Rooms are created the
 * first time someone asks for them and are stopped once nobody holds a lease
 * on them. This is the only process-wide chat state. This class is
 * thread-safe.
 */
public class RoomRegistry implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(RoomRegistry.class);

	private final RoomServices services;
	private final Map<String, Entry> rooms = new ConcurrentHashMap<>();

	/**
	 * @param services passed to every room that is created
	 */
	public RoomRegistry(RoomServices services) {
		this.services = services;
	}

	/**
	 * Gets a room, creating it if it doesn't exist. Concurrent calls with the
	 * same room ID get the same room.
	 * @param roomId the room ID
	 * @return a new lease on the room. The caller must release it when done.
	 */
	public RoomHandle getOrCreate(String roomId) {
		var entry = rooms.compute(roomId, (id, existing) -> {
			if (existing == null) {
				logger.atInfo().log(() -> "[room=" + id + "]: Room created.");
				existing = new Entry(new RoomActor(id, services));
			}
			existing.leases++;
			return existing;
		});

		return new RoomHandle(this, entry.actor);
	}

	/**
	 * Releases a lease. If it was the room's last lease, the room is stopped
	 * and removed. Counting and removal happen atomically with respect to
	 * {@link #getOrCreate}, so a room is never removed while someone is
	 * acquiring it.
	 * @param handle the lease
	 */
	public void releaseIfEmpty(RoomHandle handle) {
		if (!handle.markReleased()) {
			return;
		}

		rooms.computeIfPresent(handle.roomId(), (id, entry) -> {
			if (entry.actor != handle.actor()) {
				//the lease belongs to a room that was already removed
				return entry;
			}

			entry.leases--;
			if (entry.leases > 0) {
				return entry;
			}

			entry.actor.stop();
			logger.atInfo().log(() -> "[room=" + id + "]: Room is empty. Removed.");
			return null;
		});
	}

	/**
	 * Gets a room if it exists.
	 * @param roomId the room ID
	 * @return the room
	 */
	public Optional<RoomActor> get(String roomId) {
		var entry = rooms.get(roomId);
		return (entry == null) ? Optional.empty() : Optional.of(entry.actor);
	}

	/**
	 * Gets the number of rooms.
	 * @return the number of rooms
	 */
	public int size() {
		return rooms.size();
	}

	/**
	 * Stops every room.
	 */
	@Override
	public void close() {
		rooms.forEach((id, entry) -> entry.actor.stop());
		rooms.clear();
	}

	private static class Entry {
		private final RoomActor actor;
		private int leases;

		Entry(RoomActor actor) {
			this.actor = actor;
		}
	}
}
