package com.github.mangstadt.projectchat;

import java.time.Instant;

/**
 * A transient notification that an identity joined or left a room. These are
 * derived from connection lifecycle and are never persisted.
 * @param identity the identity
 * @param kind whether the identity joined or left
 * @param timestamp when it happened (server clock)
 */
public record PresenceEvent(Identity identity, Kind kind, Instant timestamp) {
	public enum Kind {
		JOINED, LEFT;

		/**
		 * Gets the value used in wire frames.
		 * @return the wire value (e.g. "joined")
		 */
		public String wireValue() {
			return name().toLowerCase();
		}

		/**
		 * Gets a kind by its wire value.
		 * @param value the wire value
		 * @return the kind or null if not recognized
		 */
		public static Kind fromWireValue(String value) {
			for (var kind : values()) {
				if (kind.wireValue().equals(value)) {
					return kind;
				}
			}
			return null;
		}
	}
}
