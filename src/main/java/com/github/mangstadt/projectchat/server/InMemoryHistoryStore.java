package com.github.mangstadt.projectchat.server;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.github.mangstadt.projectchat.ChatMessage;

/**
 * Keeps the most recent messages of each room in memory. This class is
 * thread-safe.
 */
public class InMemoryHistoryStore implements HistoryStore {
	private final int capacityPerRoom;
	private final Map<String, Deque<ChatMessage>> rooms = new ConcurrentHashMap<>();

	/**
	 * @param capacityPerRoom how many messages to keep per room. Older
	 * messages are discarded.
	 */
	public InMemoryHistoryStore(int capacityPerRoom) {
		if (capacityPerRoom < 1) {
			throw new IllegalArgumentException("Capacity must be positive.");
		}
		this.capacityPerRoom = capacityPerRoom;
	}

	@Override
	public void append(ChatMessage message) {
		var messages = rooms.computeIfAbsent(message.roomId(), id -> new ArrayDeque<>());
		synchronized (messages) {
			messages.addLast(message);
			while (messages.size() > capacityPerRoom) {
				messages.removeFirst();
			}
		}
	}

	@Override
	public List<ChatMessage> latest(String roomId, int limit) {
		var messages = rooms.get(roomId);
		if (messages == null || limit <= 0) {
			return List.of();
		}

		synchronized (messages) {
			var list = new ArrayList<>(messages);
			var from = Math.max(0, list.size() - limit);
			return List.copyOf(list.subList(from, list.size()));
		}
	}
}
