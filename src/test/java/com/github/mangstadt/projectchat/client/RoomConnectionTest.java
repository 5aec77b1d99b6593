package com.github.mangstadt.projectchat.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.mangstadt.projectchat.ChatMessage;
import com.github.mangstadt.projectchat.ChatOperationException;
import com.github.mangstadt.projectchat.EmptyMessageException;
import com.github.mangstadt.projectchat.ErrorCode;
import com.github.mangstadt.projectchat.Identity;
import com.github.mangstadt.projectchat.MessageReceipt;
import com.github.mangstadt.projectchat.NotConnectedException;
import com.github.mangstadt.projectchat.PresenceEvent;
import com.github.mangstadt.projectchat.RoomSnapshot;
import com.github.mangstadt.projectchat.event.Event;
import com.github.mangstadt.projectchat.event.MessagePostedEvent;
import com.github.mangstadt.projectchat.event.TypingChangedEvent;
import com.github.mangstadt.projectchat.event.UserEnteredEvent;
import com.github.mangstadt.projectchat.event.UserLeftEvent;
import com.github.mangstadt.projectchat.protocol.CloseCodes;
import com.github.mangstadt.projectchat.protocol.Frames;
import com.github.mangstadt.projectchat.util.JsonUtils;
import com.github.mangstadt.projectchat.util.MockWebSocketServer;
import com.github.mangstadt.projectchat.util.Sleeper;

class RoomConnectionTest {
	private static final String URL = "ws://localhost:8765";
	private static final Identity ALICE = Identity.publicView("u1", "Alice");
	private static final Identity BOB = Identity.publicView("u2", "Bob");

	private MockWebSocketServer server;
	private List<ConnectionState> states;

	@BeforeEach
	void before() {
		Sleeper.startUnitTest();
		server = new MockWebSocketServer(URL);
		states = new ArrayList<>();
	}

	@AfterEach
	void after() {
		Sleeper.endUnitTest();
	}

	@Test
	void joins_when_socket_opens() throws Exception {
		var room = connect(ReconnectPolicy.DEFAULT);
		assertEquals(ConnectionState.CONNECTING, room.getState());
		assertEquals("Bearer alice-token", server.getHeaders().get("Authorization"));

		server.open();

		var join = lastSent();
		assertEquals("join", join.get("op").asText());
		assertEquals(1, join.get("ref").asLong());
		assertEquals("P1", join.get("roomId").asText());

		//still not connected until the server acknowledges
		assertEquals(ConnectionState.CONNECTING, room.getState());

		server.send(Frames.ackJoined(1, new RoomSnapshot("P1", List.of(ALICE, BOB), List.of(BOB), 4)));

		assertEquals(ConnectionState.CONNECTED, room.getState());
		assertEquals(List.of(ALICE, BOB), room.getMembers());
		assertEquals(List.of(BOB), room.getTypingUsers());
		assertEquals(4, room.getLastSnapshot().lastSequence());
		assertEquals(List.of(ConnectionState.CONNECTED), states);
	}

	@Test
	void sendMessage() throws Exception {
		var room = joined(ReconnectPolicy.DEFAULT);

		var future = room.sendMessage("hello");

		var frame = lastSent();
		assertEquals("send", frame.get("op").asText());
		assertEquals("hello", frame.get("body").asText());
		var ref = frame.get("ref").asLong();

		assertFalse(future.isDone());
		server.send(Frames.ackSent(ref, new MessageReceipt("m5", 5)));

		assertEquals(new MessageReceipt("m5", 5), future.get());
	}

	@Test
	void sendMessage_refused() throws Exception {
		var room = joined(ReconnectPolicy.DEFAULT);

		var future = room.sendMessage("x".repeat(2000));
		var ref = lastSent().get("ref").asLong();
		server.send(Frames.ackFailure(ref, ErrorCode.MESSAGE_TOO_LONG, "Message exceeds 1000 characters."));

		var e = assertThrows(ExecutionException.class, () -> future.get());
		var cause = assertInstanceOf(ChatOperationException.class, e.getCause());
		assertEquals(ErrorCode.MESSAGE_TOO_LONG, cause.getErrorCode());

		//the connection is still usable
		assertEquals(ConnectionState.CONNECTED, room.getState());
	}

	@Test
	void sendMessage_blank() throws Exception {
		var room = joined(ReconnectPolicy.DEFAULT);
		var sentBefore = server.getSent().size();

		assertThrows(EmptyMessageException.class, () -> room.sendMessage(""));
		assertThrows(EmptyMessageException.class, () -> room.sendMessage("  \n "));
		assertThrows(EmptyMessageException.class, () -> room.sendMessage(null));

		assertEquals(sentBefore, server.getSent().size());
	}

	@Test
	void sendMessage_not_connected() throws Exception {
		var room = connect(ReconnectPolicy.DEFAULT);
		server.open();

		assertThrows(NotConnectedException.class, () -> room.sendMessage("hello"));

		//only the join frame was sent
		assertEquals(1, server.getSent().size());
	}

	@Test
	void typing() throws Exception {
		var room = connect(ReconnectPolicy.DEFAULT);
		server.open();

		//dropped while not connected
		room.typing();
		assertEquals(1, server.getSent().size());

		server.send(Frames.ackJoined(1, new RoomSnapshot("P1", List.of(ALICE), List.of(), 0)));

		room.typing();
		assertEquals("typing", lastSent().get("op").asText());
		assertNull(lastSent().get("ref"));

		room.stopTyping();
		assertEquals("stopTyping", lastSent().get("op").asText());
	}

	@Test
	void events() throws Exception {
		var room = joined(ReconnectPolicy.DEFAULT);

		var all = new ArrayList<Event>();
		var entered = new ArrayList<UserEnteredEvent>();
		var typing = new ArrayList<TypingChangedEvent>();
		var posted = new ArrayList<MessagePostedEvent>();
		var left = new ArrayList<UserLeftEvent>();
		room.addEventListener(all::add);
		room.addEventListener(UserEnteredEvent.class, entered::add);
		room.addEventListener(TypingChangedEvent.class, typing::add);
		room.addEventListener(MessagePostedEvent.class, posted::add);
		room.addEventListener(UserLeftEvent.class, left::add);

		var timestamp = Instant.parse("2024-03-01T12:00:00Z");
		server.send(Frames.presence(new PresenceEvent(BOB, PresenceEvent.Kind.JOINED, timestamp)));
		assertEquals(List.of(ALICE, BOB), room.getMembers());
		assertEquals(1, entered.size());
		assertEquals("u2", entered.get(0).getUserId());
		assertEquals("Bob", entered.get(0).getUsername());
		assertEquals(timestamp, entered.get(0).getTimestamp());

		server.send(Frames.typing(BOB, true));
		assertEquals(List.of(BOB), room.getTypingUsers());
		assertTrue(typing.get(0).isTyping());

		var message = new ChatMessage.Builder().id("m1").roomId("P1").sender(BOB).body("hi").sequence(1).timestamp(timestamp).build();
		server.send(Frames.message(message));
		assertEquals(List.of(message), room.getMessages());
		assertEquals(message, posted.get(0).getMessage());

		//a posted message clears the sender's typing indicator
		assertEquals(List.of(), room.getTypingUsers());

		server.send(Frames.presence(new PresenceEvent(BOB, PresenceEvent.Kind.LEFT, timestamp)));
		assertEquals(List.of(ALICE), room.getMembers());
		assertEquals("u2", left.get(0).getUserId());

		assertEquals(4, all.size());
	}

	@Test
	void bad_frames_ignored() throws Exception {
		var room = joined(ReconnectPolicy.DEFAULT);

		server.send("not JSON");
		server.send("{}");
		server.send("{\"event\":\"unknown\"}");
		server.send("{\"event\":\"presence\",\"kind\":\"joined\"}");
		server.send("{\"event\":\"ack\",\"ref\":999,\"success\":true}");

		assertEquals(ConnectionState.CONNECTED, room.getState());
		assertEquals(List.of(ALICE), room.getMembers());
	}

	@Test
	void listener_exception_does_not_break_connection() throws Exception {
		var room = joined(ReconnectPolicy.DEFAULT);
		room.addEventListener(event -> {
			throw new RuntimeException("boom");
		});

		server.send(Frames.typing(BOB, true));
		assertEquals(List.of(BOB), room.getTypingUsers());
	}

	@Test
	void reconnects_and_rejoins() throws Exception {
		var room = joined(new ReconnectPolicy(Duration.ofSeconds(1), 3));

		var message = new ChatMessage.Builder().id("m1").roomId("P1").sender(BOB).body("hi").sequence(1).timestamp(Instant.now()).build();
		server.send(Frames.message(message));

		server.dropConnection();

		assertEquals(ConnectionState.RECONNECTING, room.getState());
		assertEquals(2, server.getConnectionCount());
		assertEquals(1000, Sleeper.getTimeSlept());
		assertThrows(NotConnectedException.class, () -> room.sendMessage("lost"));

		server.open();
		var join = lastSent();
		assertEquals("join", join.get("op").asText());
		var ref = join.get("ref").asLong();

		//the member list is replaced with what the server sends
		server.send(Frames.ackJoined(ref, new RoomSnapshot("P1", List.of(BOB, ALICE), List.of(), 1)));

		assertEquals(ConnectionState.CONNECTED, room.getState());
		assertEquals(List.of(BOB, ALICE), room.getMembers());
		assertEquals(List.of(message), room.getMessages());
		assertEquals(List.of(ConnectionState.CONNECTED, ConnectionState.RECONNECTING, ConnectionState.CONNECTED), states);
	}

	@Test
	void reconnects_when_server_closes() throws Exception {
		var room = joined(new ReconnectPolicy(Duration.ofSeconds(1), 3));
		var socket = server.getSocket();

		server.close(CloseCodes.GOING_AWAY, "Server shutting down.");

		verify(socket).close(eq(CloseCodes.NORMAL), eq(null));
		assertEquals(ConnectionState.RECONNECTING, room.getState());
		assertEquals(2, server.getConnectionCount());
	}

	@Test
	void pending_ack_fails_when_connection_drops() throws Exception {
		var room = joined(new ReconnectPolicy(Duration.ofSeconds(1), 3));

		var future = room.sendMessage("hello");
		server.dropConnection();

		var e = assertThrows(ExecutionException.class, () -> future.get());
		assertInstanceOf(NotConnectedException.class, e.getCause());
	}

	@Test
	void gives_up_after_max_attempts() throws Exception {
		var room = connect(new ReconnectPolicy(Duration.ofMillis(500), 2));

		server.dropConnection();
		assertEquals(ConnectionState.RECONNECTING, room.getState());
		server.dropConnection();
		assertEquals(ConnectionState.RECONNECTING, room.getState());
		server.dropConnection();

		assertEquals(ConnectionState.DISCONNECTED, room.getState());
		assertEquals(3, server.getConnectionCount());
		assertEquals(1000, Sleeper.getTimeSlept());
		assertEquals(List.of(ConnectionState.RECONNECTING, ConnectionState.RECONNECTING, ConnectionState.DISCONNECTED), states);
	}

	@Test
	void attempts_reset_after_successful_join() throws Exception {
		var room = connect(new ReconnectPolicy(Duration.ofMillis(500), 1));

		server.dropConnection();
		server.open();
		server.send(Frames.ackJoined(lastSent().get("ref").asLong(), new RoomSnapshot("P1", List.of(ALICE), List.of(), 0)));
		assertEquals(ConnectionState.CONNECTED, room.getState());

		server.dropConnection();
		assertEquals(ConnectionState.RECONNECTING, room.getState());
		assertEquals(3, server.getConnectionCount());
	}

	@Test
	void no_retry_when_credential_rejected_by_close_code() throws Exception {
		var room = joined(ReconnectPolicy.DEFAULT);

		server.close(CloseCodes.AUTHENTICATION_FAILED, "Authentication failed.");

		assertEquals(ConnectionState.DISCONNECTED, room.getState());
		assertEquals(1, server.getConnectionCount());
		assertEquals(0, Sleeper.getTimeSlept());
	}

	@Test
	void no_retry_when_credential_rejected_during_handshake() throws Exception {
		var room = connect(ReconnectPolicy.DEFAULT);

		server.rejectHandshake(401);

		assertEquals(ConnectionState.DISCONNECTED, room.getState());
		assertEquals(1, server.getConnectionCount());
	}

	@Test
	void no_retry_when_not_a_member() throws Exception {
		var room = connect(ReconnectPolicy.DEFAULT);
		server.open();

		server.send(Frames.ackFailure(1, ErrorCode.AUTHORIZATION_DENIED, "Not a member of project P1."));

		assertEquals(ConnectionState.DISCONNECTED, room.getState());
		assertEquals(1, server.getConnectionCount());
		assertThrows(NotConnectedException.class, () -> room.sendMessage("hello"));
	}

	@Test
	void other_join_failure_reconnects() throws Exception {
		var room = connect(ReconnectPolicy.DEFAULT);
		server.open();

		server.send(Frames.ackFailure(1, ErrorCode.INTERNAL_ERROR, "Internal error."));

		assertEquals(ConnectionState.RECONNECTING, room.getState());
		assertEquals(2, server.getConnectionCount());
	}

	@Test
	void leave() throws Exception {
		var room = joined(ReconnectPolicy.DEFAULT);
		var socket = server.getSocket();

		room.leave();

		assertEquals("leave", lastSent().get("op").asText());
		verify(socket).close(eq(CloseCodes.NORMAL), anyString());
		assertEquals(ConnectionState.CLOSED, room.getState());
		assertThrows(NotConnectedException.class, () -> room.sendMessage("hello"));

		//calling it again does nothing
		room.leave();
		assertEquals(List.of(ConnectionState.CONNECTED, ConnectionState.CLOSED), states);

		//late callbacks from the closed socket are ignored
		server.dropConnection();
		assertEquals(ConnectionState.CLOSED, room.getState());
		assertEquals(1, server.getConnectionCount());
	}

	private RoomConnection connect(ReconnectPolicy policy) {
		var room = new RoomConnection("P1", URL, "alice-token", server.getClient(), policy, null);
		room.addStateListener(states::add);
		room.connect();
		return room;
	}

	private RoomConnection joined(ReconnectPolicy policy) {
		var room = connect(policy);
		server.open();
		server.send(Frames.ackJoined(1, new RoomSnapshot("P1", List.of(ALICE), List.of(), 0)));
		assertEquals(ConnectionState.CONNECTED, room.getState());
		return room;
	}

	private JsonNode lastSent() throws Exception {
		return JsonUtils.parse(server.getLastSent());
	}
}
