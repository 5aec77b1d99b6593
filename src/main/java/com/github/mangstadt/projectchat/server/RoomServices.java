package com.github.mangstadt.projectchat.server;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

/**
 * The collaborators and settings shared by every room.
 * @param authorizer decides who may join a room
 * @param historyStore persists accepted messages
 * @param clock the server clock used for message and presence timestamps
 * @param workers runs the room mailboxes
 * @param timers runs the typing expiry timers
 * @param typingTimeout how long a typing indicator lasts without a refresh
 * @param maxMessageLength the maximum length of a message body
 */
public record RoomServices(ProjectAuthorizer authorizer, HistoryStore historyStore, Clock clock, Executor workers, ScheduledExecutorService timers, Duration typingTimeout, int maxMessageLength) {
}
