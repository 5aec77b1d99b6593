package com.github.mangstadt.projectchat.server;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A lease on a room, handed out by {@link RoomRegistry#getOrCreate}. The room
 * stays alive while at least one lease is held. Each lease must be released
 * exactly once; releasing it again does nothing.
 */
public class RoomHandle {
	private final RoomRegistry registry;
	private final RoomActor actor;
	private final AtomicBoolean released = new AtomicBoolean();

	RoomHandle(RoomRegistry registry, RoomActor actor) {
		this.registry = registry;
		this.actor = actor;
	}

	public RoomActor actor() {
		return actor;
	}

	public String roomId() {
		return actor.getRoomId();
	}

	/**
	 * Gives the lease back to the registry.
	 * @see RoomRegistry#releaseIfEmpty
	 */
	public void release() {
		registry.releaseIfEmpty(this);
	}

	public boolean isReleased() {
		return released.get();
	}

	/**
	 * @return true if this call released the lease, false if it had already
	 * been released
	 */
	boolean markReleased() {
		return released.compareAndSet(false, true);
	}
}
