package com.github.mangstadt.projectchat;

import java.util.List;

/**
 * The state of a room at the moment a join was accepted. Lets a client
 * render "who's here" without waiting for presence events.
 * @param roomId the room ID
 * @param members the identities currently in the room, in the order they
 * joined (the joining identity included)
 * @param typing the identities currently typing
 * @param lastSequence the sequence number of the most recent message, or 0
 * if no message has been posted since the room was created
 */
public record RoomSnapshot(String roomId, List<Identity> members, List<Identity> typing, long lastSequence) {
	public RoomSnapshot {
		members = List.copyOf(members);
		typing = List.copyOf(typing);
	}
}
