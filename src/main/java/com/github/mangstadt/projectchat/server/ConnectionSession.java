package com.github.mangstadt.projectchat.server;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.mangstadt.projectchat.AuthenticationFailedException;
import com.github.mangstadt.projectchat.AuthorizationDeniedException;
import com.github.mangstadt.projectchat.ChatOperationException;
import com.github.mangstadt.projectchat.ErrorCode;
import com.github.mangstadt.projectchat.Identity;
import com.github.mangstadt.projectchat.NotInRoomException;
import com.github.mangstadt.projectchat.protocol.ClientFrame;
import com.github.mangstadt.projectchat.protocol.CloseCodes;
import com.github.mangstadt.projectchat.protocol.Frames;
import com.github.mangstadt.projectchat.protocol.MalformedFrameException;

/**
 * <p>
 * The server side of one client connection. Authenticates the client, keeps
 * track of the one room it is in, and turns wire frames into room operations
 * and room results back into wire frames.
 * </p>
 * <p>
 * Inbound frames are handled strictly in the order they arrive: each one is
 * chained onto the future of the previous one. Transport threads never wait
 * for a room. This class is thread-safe.
 * </p>
 */
public class ConnectionSession {
	private static final Logger logger = LoggerFactory.getLogger(ConnectionSession.class);

	private final Connection connection;
	private final Outbox outbox;
	private final Authenticator authenticator;
	private final RoomRegistry registry;

	private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);
	private volatile Identity identity;

	/**
	 * The lease on the current room. Only changed by the operation chain.
	 */
	private volatile RoomHandle room;

	private final Object chainLock = new Object();
	private CompletableFuture<Void> pending = CompletableFuture.completedFuture(null);

	/**
	 * @param connection the transport channel
	 * @param outbox the outbound buffer of the transport channel
	 * @param authenticator validates the client's credential
	 * @param registry the rooms
	 */
	public ConnectionSession(Connection connection, Outbox outbox, Authenticator authenticator, RoomRegistry registry) {
		this.connection = connection;
		this.outbox = outbox;
		this.authenticator = authenticator;
		this.registry = registry;
	}

	/**
	 * Called when the transport channel opens.
	 * @param handshakeToken the credential sent with the handshake, or null
	 * if there was none (the client must then send an "auth" frame)
	 */
	public void open(String handshakeToken) {
		logger.atDebug().log(() -> "[" + connection.describe() + "]: Connection opened.");
		if (handshakeToken != null) {
			chain(() -> {
				authenticate(null, handshakeToken);
				return done();
			});
		}
	}

	/**
	 * Called for each text frame the client sends.
	 * @param text the frame
	 */
	public void onFrame(String text) {
		ClientFrame frame;
		try {
			frame = Frames.parseClientFrame(text);
		} catch (MalformedFrameException e) {
			logger.atWarn().log(() -> "[" + describe() + "]: Ignoring malformed frame: " + e.getMessage());
			var ref = e.getRef();
			if (ref != null) {
				chain(() -> {
					deliver(Frames.ackFailure(ref, ErrorCode.BAD_REQUEST, e.getMessage()));
					return done();
				});
			}
			return;
		}

		chain(() -> handle(frame));
	}

	/**
	 * Called when the transport channel closes, gracefully or not. Leaves the
	 * current room. Calling this more than once does nothing.
	 */
	public void close() {
		var previous = state.getAndSet(SessionState.CLOSED);
		if (previous == SessionState.CLOSED) {
			return;
		}

		logger.atDebug().log(() -> "[" + describe() + "]: Connection closed.");
		chain(this::leaveCurrentRoom);
		outbox.close();
	}

	/**
	 * Hands a frame to the client's outbound buffer. Never blocks.
	 * @param frame the frame
	 */
	public void deliver(String frame) {
		outbox.offer(frame);
	}

	/**
	 * Gets the authenticated identity.
	 * @return the identity or null if not authenticated yet
	 */
	public Identity getIdentity() {
		return identity;
	}

	public SessionState getState() {
		return state.get();
	}

	/**
	 * Gets the room the session is in.
	 * @return the room ID or null if not in a room
	 */
	public String getRoomId() {
		var handle = room;
		return (handle == null) ? null : handle.roomId();
	}

	/**
	 * Gets a future that completes once every frame received so far has been
	 * handled.
	 * @return the future
	 */
	public CompletableFuture<Void> idle() {
		synchronized (chainLock) {
			return pending;
		}
	}

	private void chain(Operation operation) {
		synchronized (chainLock) {
			pending = pending.thenCompose(v -> {
				try {
					return operation.run().exceptionally(this::logUnhandled);
				} catch (RuntimeException e) {
					logUnhandled(e);
					return done();
				}
			});
		}
	}

	private Void logUnhandled(Throwable error) {
		logger.atError().setCause(error).log(() -> "[" + describe() + "]: Unexpected error while handling a frame.");
		return null;
	}

	private CompletableFuture<Void> handle(ClientFrame frame) {
		var current = state.get();
		if (current == SessionState.CLOSED) {
			return done();
		}

		var op = frame.op();
		if (op.isRoomOperation() && current == SessionState.CONNECTING) {
			replyFailure(frame, AuthorizationDeniedException.notAuthenticated());
			return done();
		}

		return switch (op) {
		case AUTH -> {
			if (current != SessionState.CONNECTING) {
				replyFailure(frame, new ChatOperationException(ErrorCode.BAD_REQUEST, "Already authenticated."));
			} else {
				authenticate(frame.ref(), frame.token());
			}
			yield done();
		}
		case JOIN -> join(frame);
		case LEAVE -> leave(frame);
		case SEND -> send(frame);
		case TYPING -> setTyping(frame, true);
		case STOP_TYPING -> setTyping(frame, false);
		};
	}

	private void authenticate(Long ref, String token) {
		try {
			identity = authenticator.authenticate(token);
		} catch (AuthenticationFailedException e) {
			logger.atInfo().log(() -> "[" + connection.describe() + "]: Authentication failed. Closing connection.");

			/*
			 * Written straight to the transport: the outbox is discarded when
			 * the connection closes.
			 */
			if (ref != null) {
				connection.send(Frames.ackFailure(ref, e.getErrorCode(), e.getMessage()));
			}
			connection.close(CloseCodes.AUTHENTICATION_FAILED, "Authentication failed.");
			return;
		}

		transition(SessionState.AUTHENTICATED);
		logger.atInfo().log(() -> "[" + describe() + "]: Authenticated.");
		if (ref != null) {
			deliver(Frames.ackSuccess(ref));
		}
	}

	private CompletableFuture<Void> join(ClientFrame frame) {
		var roomId = frame.roomId();
		var current = room;
		var sameRoom = (current != null && current.roomId().equals(roomId));

		var leaving = (current == null || sameRoom) ? done() : leaveCurrentRoom();
		return leaving.thenCompose(v -> {
			var handle = sameRoom ? current : registry.getOrCreate(roomId);

			//@formatter:off
			return handle.actor().join(this, (snapshot, error) -> {
				if (error == null) {
					room = handle;
					transition(SessionState.IN_ROOM);
					reply(frame, () -> Frames.ackJoined(frame.ref(), snapshot));
				} else {
					if (room == handle) {
						room = null;
					}
					handle.release();

					//a session that never joined a room stays AUTHENTICATED
					var next = (state.get() == SessionState.AUTHENTICATED) ? SessionState.AUTHENTICATED : SessionState.IDLE;
					transition(next);
					replyFailure(frame, error);
				}
			})
			.handle((snapshot, error) -> null);
			//@formatter:on
		});
	}

	private CompletableFuture<Void> leave(ClientFrame frame) {
		return leaveCurrentRoom().thenRun(() -> reply(frame, () -> Frames.ackSuccess(frame.ref())));
	}

	private CompletableFuture<Void> leaveCurrentRoom() {
		var handle = room;
		if (handle == null) {
			return done();
		}

		//@formatter:off
		return handle.actor().leave(this)
			.handle((wasMember, error) -> {
				if (error != null) {
					logger.atDebug().setCause(error).log(() -> "[" + describe() + "]: Room refused the leave. Releasing it anyway.");
				}
				room = null;
				handle.release();
				transition(SessionState.IDLE);
				return null;
			});
		//@formatter:on
	}

	private CompletableFuture<Void> send(ClientFrame frame) {
		var handle = room;
		if (handle == null || state.get() != SessionState.IN_ROOM) {
			replyFailure(frame, new NotInRoomException());
			return done();
		}

		//@formatter:off
		return handle.actor().sendMessage(this, frame.body(), (receipt, error) -> {
			if (error == null) {
				reply(frame, () -> Frames.ackSent(frame.ref(), receipt));
			} else {
				replyFailure(frame, error);
			}
		})
		.handle((receipt, error) -> null);
		//@formatter:on
	}

	private CompletableFuture<Void> setTyping(ClientFrame frame, boolean typing) {
		var handle = room;
		if (handle == null || state.get() != SessionState.IN_ROOM) {
			replyFailure(frame, new NotInRoomException());
			return done();
		}

		//@formatter:off
		return handle.actor().setTyping(this, typing, (changed, error) -> {
			if (error == null) {
				reply(frame, () -> Frames.ackSuccess(frame.ref()));
			} else {
				logger.atDebug().setCause(error).log(() -> "[" + describe() + "]: Typing update failed.");
				replyFailure(frame, error);
			}
		})
		.handle((changed, error) -> null);
		//@formatter:on
	}

	/**
	 * Moves to a new state, unless the session is closed.
	 */
	private void transition(SessionState next) {
		state.updateAndGet(current -> (current == SessionState.CLOSED) ? current : next);
	}

	private void reply(ClientFrame frame, Supplier<String> ack) {
		if (frame.wantsAck()) {
			deliver(ack.get());
		}
	}

	private void replyFailure(ClientFrame frame, Throwable error) {
		if (error instanceof CompletionException && error.getCause() != null) {
			error = error.getCause();
		}

		ErrorCode code;
		String reason;
		if (error instanceof ChatOperationException e) {
			code = e.getErrorCode();
			reason = e.getMessage();
		} else {
			var cause = error;
			logger.atError().setCause(cause).log(() -> "[" + describe() + "]: \"" + frame.op().value() + "\" operation failed unexpectedly.");
			code = ErrorCode.INTERNAL_ERROR;
			reason = "Internal error.";
		}

		if (frame.wantsAck()) {
			deliver(Frames.ackFailure(frame.ref(), code, reason));
		}
	}

	private static CompletableFuture<Void> done() {
		return CompletableFuture.completedFuture(null);
	}

	/**
	 * Describes the session, for log messages.
	 * @return the description
	 */
	public String describe() {
		var who = identity;
		var roomId = getRoomId();
		return connection.describe() + ((who == null) ? "" : " user=" + who.id()) + ((roomId == null) ? "" : " room=" + roomId);
	}

	@Override
	public String toString() {
		return "ConnectionSession[" + describe() + "]";
	}

	@FunctionalInterface
	private interface Operation {
		CompletableFuture<Void> run();
	}
}
