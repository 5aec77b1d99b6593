package com.github.mangstadt.projectchat.server;

import java.util.List;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.mangstadt.projectchat.AuthorizationDeniedException;
import com.github.mangstadt.projectchat.ChatMessage;
import com.github.mangstadt.projectchat.EmptyMessageException;
import com.github.mangstadt.projectchat.Identity;
import com.github.mangstadt.projectchat.MessageReceipt;
import com.github.mangstadt.projectchat.MessageTooLongException;
import com.github.mangstadt.projectchat.NotInRoomException;
import com.github.mangstadt.projectchat.RoomSnapshot;
import com.github.mangstadt.projectchat.protocol.Frames;

/**
 * <p>
 * Owns the state of one project's chat room: who is in it, who is typing, and
 * the last sequence number. Every operation is placed in the room's mailbox
 * and the mailbox is drained by one task at a time on the shared worker pool,
 * so the room state is never touched by two threads at once and needs no
 * locks.
 * </p>
 * <p>
 * Each operation returns a future. The overloads that take a reply callback
 * run the callback inside the mailbox, right after the operation. Frames that
 * the callback hands to a session's outbox are therefore ordered before any
 * broadcast caused by a later operation.
 * </p>
 */
public class RoomActor {
	private static final Logger logger = LoggerFactory.getLogger(RoomActor.class);
	private static final int MAX_BATCH = 64;

	private final String roomId;
	private final RoomServices services;
	private final Queue<Envelope<?>> mailbox = new ConcurrentLinkedQueue<>();
	private final AtomicBoolean draining = new AtomicBoolean();
	private volatile boolean stopped = false;

	private final PresenceTracker presence;
	private final TypingCoordinator typing;
	private long lastSequence = 0;

	/**
	 * @param roomId the room ID (same as the project ID)
	 * @param services the shared collaborators and settings
	 */
	public RoomActor(String roomId, RoomServices services) {
		this.roomId = roomId;
		this.services = services;
		presence = new PresenceTracker(services.clock());
		typing = new TypingCoordinator(services.typingTimeout(), services.timers(), this::typingExpired);
	}

	public String getRoomId() {
		return roomId;
	}

	/**
	 * Adds a session to the room.
	 * @param session the session
	 * @return the state of the room after the join. Fails with
	 * {@link AuthorizationDeniedException} if the session's identity is not a
	 * member of the project.
	 */
	public CompletableFuture<RoomSnapshot> join(ConnectionSession session) {
		return join(session, null);
	}

	/**
	 * Adds a session to the room.
	 * @param session the session
	 * @param reply called inside the mailbox once the join has been decided
	 * (may be null)
	 * @return the state of the room after the join
	 * @see #join(ConnectionSession)
	 */
	public CompletableFuture<RoomSnapshot> join(ConnectionSession session, BiConsumer<? super RoomSnapshot, ? super Throwable> reply) {
		return submit(() -> doJoin(session), reply);
	}

	/**
	 * Removes a session from the room.
	 * @param session the session
	 * @return true if the session was a member, false if not
	 */
	public CompletableFuture<Boolean> leave(ConnectionSession session) {
		return leave(session, null);
	}

	/**
	 * Removes a session from the room.
	 * @param session the session
	 * @param reply called inside the mailbox once the session has been removed
	 * (may be null)
	 * @return true if the session was a member, false if not
	 */
	public CompletableFuture<Boolean> leave(ConnectionSession session, BiConsumer<? super Boolean, ? super Throwable> reply) {
		return submit(() -> doLeave(session), reply);
	}

	/**
	 * Posts a message to the room.
	 * @param session the author's session
	 * @param body the message text
	 * @return the message ID and sequence number. Fails with
	 * {@link NotInRoomException}, {@link EmptyMessageException} or
	 * {@link MessageTooLongException} if the message is refused, or with the
	 * history store's exception if the message could not be persisted.
	 */
	public CompletableFuture<MessageReceipt> sendMessage(ConnectionSession session, String body) {
		return sendMessage(session, body, null);
	}

	/**
	 * Posts a message to the room.
	 * @param session the author's session
	 * @param body the message text
	 * @param reply called inside the mailbox once the message has been
	 * accepted or refused (may be null)
	 * @return the message ID and sequence number
	 * @see #sendMessage(ConnectionSession, String)
	 */
	public CompletableFuture<MessageReceipt> sendMessage(ConnectionSession session, String body, BiConsumer<? super MessageReceipt, ? super Throwable> reply) {
		return submit(() -> doSendMessage(session, body), reply);
	}

	/**
	 * Starts or stops the typing indicator of a session's identity.
	 * @param session the session
	 * @param typing true if the user is typing, false if they stopped
	 * @return true if the identity's typing state changed
	 */
	public CompletableFuture<Boolean> setTyping(ConnectionSession session, boolean typing) {
		return setTyping(session, typing, null);
	}

	/**
	 * Starts or stops the typing indicator of a session's identity.
	 * @param session the session
	 * @param typing true if the user is typing, false if they stopped
	 * @param reply called inside the mailbox once the change has been
	 * applied (may be null)
	 * @return true if the identity's typing state changed
	 */
	public CompletableFuture<Boolean> setTyping(ConnectionSession session, boolean typing, BiConsumer<? super Boolean, ? super Throwable> reply) {
		return submit(() -> doSetTyping(session, typing), reply);
	}

	/**
	 * Gets the current state of the room.
	 * @return the snapshot
	 */
	public CompletableFuture<RoomSnapshot> snapshot() {
		return submit(this::currentSnapshot, null);
	}

	/**
	 * Stops the room. Typing timers are cancelled and new operations are
	 * refused with {@link IllegalStateException}.
	 */
	public void stop() {
		stopped = true;
		enqueue(new Envelope<>(() -> {
			typing.clear();
			return null;
		}, null));
	}

	public boolean isStopped() {
		return stopped;
	}

	private RoomSnapshot doJoin(ConnectionSession session) {
		var identity = session.getIdentity();
		if (!services.authorizer().isMember(identity, roomId)) {
			if (presence.contains(session)) {
				//membership was revoked while the session was in the room
				doLeave(session);
			}
			throw AuthorizationDeniedException.notMember(identity.id(), roomId);
		}

		if (presence.contains(session)) {
			return currentSnapshot();
		}

		var firstSession = !presence.isPresent(identity);
		presence.add(session);

		if (firstSession) {
			logger.atInfo().log(() -> "[room=" + roomId + "]: " + identity.displayName() + " (" + identity.id() + ") joined.");
			broadcastExcept(session, Frames.presence(presence.joined(identity)));
		} else {
			logger.atDebug().log(() -> "[room=" + roomId + "]: Additional session of " + identity.id() + " joined.");
		}

		return currentSnapshot();
	}

	private boolean doLeave(ConnectionSession session) {
		var identity = presence.remove(session);
		if (identity == null) {
			return false;
		}

		if (presence.isPresent(identity)) {
			logger.atDebug().log(() -> "[room=" + roomId + "]: A session of " + identity.id() + " left. The identity still has other sessions in the room.");
			return true;
		}

		if (typing.markStopped(identity)) {
			broadcast(Frames.typing(identity, false));
		}

		logger.atInfo().log(() -> "[room=" + roomId + "]: " + identity.displayName() + " (" + identity.id() + ") left.");
		broadcast(Frames.presence(presence.left(identity)));

		return true;
	}

	private MessageReceipt doSendMessage(ConnectionSession session, String body) {
		if (!presence.contains(session)) {
			throw new NotInRoomException();
		}

		var trimmed = (body == null) ? "" : body.trim();
		if (trimmed.isEmpty()) {
			throw new EmptyMessageException();
		}

		var maxLength = services.maxMessageLength();
		if (trimmed.length() > maxLength) {
			throw new MessageTooLongException(maxLength);
		}

		var sequence = lastSequence + 1;

		//@formatter:off
		var message = new ChatMessage.Builder()
			.id(UUID.randomUUID().toString())
			.roomId(roomId)
			.sender(session.getIdentity())
			.body(trimmed)
			.sequence(sequence)
			.timestamp(services.clock().instant())
		.build();
		//@formatter:on

		/*
		 * The counter only moves once the message is persisted, so a failed
		 * write leaves no gap.
		 */
		services.historyStore().append(message);
		lastSequence = sequence;

		logger.atDebug().log(() -> "[room=" + roomId + "]: Message " + sequence + " posted by " + message.senderId() + ".");
		broadcast(Frames.message(message));

		return new MessageReceipt(message.id(), sequence);
	}

	private boolean doSetTyping(ConnectionSession session, boolean isTyping) {
		if (!presence.contains(session)) {
			throw new NotInRoomException();
		}

		var identity = session.getIdentity();
		var changed = isTyping ? typing.markTyping(identity) : typing.markStopped(identity);
		if (changed) {
			broadcastExceptIdentity(identity, Frames.typing(identity, isTyping));
		}

		return changed;
	}

	/**
	 * Called by a typing timer, on a timer thread.
	 */
	private void typingExpired(Identity identity, long generation) {
		if (stopped) {
			return;
		}

		enqueue(new Envelope<>(() -> {
			if (typing.expire(identity, generation)) {
				logger.atDebug().log(() -> "[room=" + roomId + "]: Typing indicator of " + identity.id() + " expired.");
				broadcastExceptIdentity(identity, Frames.typing(identity, false));
			}
			return null;
		}, null));
	}

	private RoomSnapshot currentSnapshot() {
		return new RoomSnapshot(roomId, presence.identities(), typing.typing(), lastSequence);
	}

	private void broadcast(String frame) {
		members().forEach(member -> member.deliver(frame));
	}

	private void broadcastExcept(ConnectionSession excluded, String frame) {
		//@formatter:off
		members().stream()
			.filter(member -> member != excluded)
		.forEach(member -> member.deliver(frame));
		//@formatter:on
	}

	private void broadcastExceptIdentity(Identity excluded, String frame) {
		//@formatter:off
		members().stream()
			.filter(member -> !member.getIdentity().id().equals(excluded.id()))
		.forEach(member -> member.deliver(frame));
		//@formatter:on
	}

	/**
	 * A delivery can disconnect a slow member, so iterate over a copy.
	 */
	private List<ConnectionSession> members() {
		return List.copyOf(presence.sessions());
	}

	private <T> CompletableFuture<T> submit(Callable<T> task, BiConsumer<? super T, ? super Throwable> reply) {
		var envelope = new Envelope<T>(task, reply);
		if (stopped) {
			envelope.abandon(new IllegalStateException("Room " + roomId + " has been stopped."));
			return envelope.future;
		}

		enqueue(envelope);
		return envelope.future;
	}

	private void enqueue(Envelope<?> envelope) {
		mailbox.add(envelope);
		scheduleDrain();
	}

	private void scheduleDrain() {
		if (!draining.compareAndSet(false, true)) {
			return;
		}

		try {
			services.workers().execute(this::drain);
		} catch (RejectedExecutionException e) {
			draining.set(false);
			logger.atWarn().log(() -> "[room=" + roomId + "]: Worker pool refused the room's mailbox. Abandoning " + mailbox.size() + " operation(s).");

			Envelope<?> envelope;
			while ((envelope = mailbox.poll()) != null) {
				envelope.abandon(e);
			}
		}
	}

	private void drain() {
		try {
			for (int i = 0; i < MAX_BATCH; i++) {
				var envelope = mailbox.poll();
				if (envelope == null) {
					break;
				}
				envelope.run();
			}
		} finally {
			draining.set(false);
		}

		/*
		 * Yield the worker to other rooms between batches.
		 */
		if (!mailbox.isEmpty()) {
			scheduleDrain();
		}
	}

	private class Envelope<T> {
		private final Callable<T> task;
		private final BiConsumer<? super T, ? super Throwable> reply;
		private final CompletableFuture<T> future = new CompletableFuture<>();

		Envelope(Callable<T> task, BiConsumer<? super T, ? super Throwable> reply) {
			this.task = task;
			this.reply = reply;
		}

		void run() {
			T result = null;
			Throwable error = null;
			try {
				result = task.call();
			} catch (Exception e) {
				error = e;
			}

			reply(result, error);

			if (error == null) {
				future.complete(result);
			} else {
				future.completeExceptionally(error);
			}
		}

		void abandon(Throwable error) {
			reply(null, error);
			future.completeExceptionally(error);
		}

		private void reply(T result, Throwable error) {
			if (reply == null) {
				return;
			}

			try {
				reply.accept(result, error);
			} catch (RuntimeException e) {
				logger.atError().setCause(e).log(() -> "[room=" + roomId + "]: Reply callback failed.");
			}
		}
	}
}
