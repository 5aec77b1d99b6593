package com.github.mangstadt.projectchat.server;

import java.util.List;

import com.github.mangstadt.projectchat.ChatMessage;

/**
 * Append-only persistence of chat messages. The live rooms write to it, but
 * never read from it; reads are done by the scrollback endpoint.
 */
public interface HistoryStore {
	/**
	 * Persists a message.
	 * @param message the message (already has its ID and sequence number)
	 */
	void append(ChatMessage message);

	/**
	 * Gets the most recent messages of a room.
	 * @param roomId the room ID
	 * @param limit the maximum number of messages to return
	 * @return the messages, oldest first
	 */
	List<ChatMessage> latest(String roomId, int limit);
}
