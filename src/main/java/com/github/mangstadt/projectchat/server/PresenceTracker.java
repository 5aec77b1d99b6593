package com.github.mangstadt.projectchat.server;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.mangstadt.projectchat.Identity;
import com.github.mangstadt.projectchat.PresenceEvent;
import com.github.mangstadt.projectchat.PresenceEvent.Kind;

/**
 * The membership of one room. Presence is reported per identity: an identity
 * is present while at least one of its sessions is a member. Only accessed
 * from the owning {@link RoomActor}'s mailbox, so it is not thread-safe.
 */
class PresenceTracker {
	private final Clock clock;
	private final Map<ConnectionSession, Identity> members = new LinkedHashMap<>();

	PresenceTracker(Clock clock) {
		this.clock = clock;
	}

	boolean contains(ConnectionSession session) {
		return members.containsKey(session);
	}

	/**
	 * Determines if any member session belongs to the given identity.
	 * @param identity the identity
	 * @return true if the identity is present
	 */
	boolean isPresent(Identity identity) {
		return members.values().stream().anyMatch(member -> member.id().equals(identity.id()));
	}

	void add(ConnectionSession session) {
		members.put(session, session.getIdentity());
	}

	/**
	 * @param session the session to remove
	 * @return the session's identity, or null if it was not a member
	 */
	Identity remove(ConnectionSession session) {
		return members.remove(session);
	}

	/**
	 * Gets the member sessions, in join order.
	 * @return the sessions (live view)
	 */
	Collection<ConnectionSession> sessions() {
		return members.keySet();
	}

	/**
	 * Gets the identities that are present, without duplicates, in the order
	 * they first joined.
	 * @return the identities
	 */
	List<Identity> identities() {
		var seen = new LinkedHashMap<String, Identity>();
		members.values().forEach(identity -> seen.putIfAbsent(identity.id(), identity));
		return new ArrayList<>(seen.values());
	}

	boolean isEmpty() {
		return members.isEmpty();
	}

	int size() {
		return members.size();
	}

	PresenceEvent joined(Identity identity) {
		return new PresenceEvent(identity, Kind.JOINED, clock.instant());
	}

	PresenceEvent left(Identity identity) {
		return new PresenceEvent(identity, Kind.LEFT, clock.instant());
	}
}
