package com.github.mangstadt.projectchat.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.mangstadt.projectchat.Identity;
import com.github.mangstadt.projectchat.protocol.CloseCodes;
import com.github.mangstadt.projectchat.protocol.Frames;
import com.github.mangstadt.projectchat.util.JsonUtils;

class ConnectionSessionTest {
	private ScheduledExecutorService timers;
	private ScheduledExecutorService delivery;
	private ProjectDirectory directory;
	private InMemoryHistoryStore historyStore;
	private RoomRegistry registry;

	@BeforeEach
	void before() {
		timers = Executors.newSingleThreadScheduledExecutor();
		delivery = Executors.newSingleThreadScheduledExecutor();

		directory = new ProjectDirectory();
		directory.addUser("alice-token", new Identity("u1", "Alice", "alice@example.com"));
		directory.addUser("bob-token", new Identity("u2", "Bob", "bob@example.com"));
		directory.addUser("mallory-token", new Identity("u3", "Mallory", "mallory@example.com"));
		directory.addProject("P1", "u1", List.of("u2"));
		directory.addProject("P2", "u1", List.of());

		historyStore = new InMemoryHistoryStore(100);

		//mailboxes are drained on the calling thread
		var services = new RoomServices(directory, historyStore, Clock.systemUTC(), Runnable::run, timers, Duration.ofMinutes(1), 1000);
		registry = new RoomRegistry(services);
	}

	@AfterEach
	void after() {
		registry.close();
		timers.shutdownNow();
		delivery.shutdownNow();
	}

	@Test
	void handshake_token() throws Exception {
		var alice = connect("alice", "alice-token");

		assertEquals(SessionState.AUTHENTICATED, alice.session.getState());
		assertEquals("u1", alice.session.getIdentity().id());
		assertNull(alice.connection.getCloseCode());
	}

	@Test
	void handshake_token_rejected() throws Exception {
		var client = connect("client", "wrong");

		assertEquals(CloseCodes.AUTHENTICATION_FAILED, client.connection.getCloseCode());
		assertNull(client.session.getIdentity());
		assertEquals(0, registry.size());
	}

	@Test
	void auth_frame() throws Exception {
		var bob = connect("bob", null);
		assertEquals(SessionState.CONNECTING, bob.session.getState());

		bob.send(Frames.auth(1L, "bob-token"));
		assertAck(bob.connection.next("ack"), 1, true);
		assertEquals(SessionState.AUTHENTICATED, bob.session.getState());

		//identity is bound for the connection's lifetime
		bob.send(Frames.auth(2L, "alice-token"));
		assertError(bob.connection.next("ack"), 2, "BAD_REQUEST");
		assertEquals("u2", bob.session.getIdentity().id());
	}

	@Test
	void auth_frame_rejected() throws Exception {
		var client = connect("client", null);

		client.send(Frames.auth(1L, "wrong"));
		assertError(client.connection.next("ack"), 1, "AUTHENTICATION_FAILED");
		assertEquals(CloseCodes.AUTHENTICATION_FAILED, client.connection.getCloseCode());
	}

	@Test
	void room_operation_before_authenticating() throws Exception {
		var client = connect("client", null);

		client.send(Frames.join(1L, "P1"));
		assertError(client.connection.next("ack"), 1, "AUTHORIZATION_DENIED");
		client.send(Frames.send(2L, "hi"));
		assertError(client.connection.next("ack"), 2, "AUTHORIZATION_DENIED");

		assertEquals(0, registry.size());
		assertEquals(SessionState.CONNECTING, client.session.getState());
		assertNull(client.connection.getCloseCode());
	}

	@Test
	void send_not_in_room() throws Exception {
		var alice = connect("alice", "alice-token");

		alice.send(Frames.send(1L, "hi"));
		assertError(alice.connection.next("ack"), 1, "NOT_IN_ROOM");

		alice.send("{\"op\":\"typing\",\"ref\":2}");
		assertError(alice.connection.next("ack"), 2, "NOT_IN_ROOM");

		//no ref, no ack
		alice.send(Frames.typing());
		assertNull(alice.connection.poll(100));

		assertEquals(0, registry.size());
	}

	@Test
	void join_not_a_member() throws Exception {
		var mallory = connect("mallory", "mallory-token");

		mallory.send(Frames.join(1L, "P1"));
		assertError(mallory.connection.next("ack"), 1, "AUTHORIZATION_DENIED");

		assertEquals(SessionState.AUTHENTICATED, mallory.session.getState());
		assertNull(mallory.session.getRoomId());
		assertEquals(0, registry.size());
		assertNull(mallory.connection.getCloseCode());
	}

	@Test
	void alice_and_bob() throws Exception {
		var alice = connect("alice", "alice-token");
		var bob = connect("bob", "bob-token");

		alice.send(Frames.join(1L, "P1"));
		var ack = alice.connection.next("ack");
		assertAck(ack, 1, true);
		assertEquals("P1", ack.get("roomId").asText());
		assertEquals(0, ack.get("lastSequence").asLong());
		assertEquals(List.of("u1"), ids(ack.get("members")));
		assertEquals(SessionState.IN_ROOM, alice.session.getState());

		bob.send(Frames.join(1L, "P1"));
		ack = bob.connection.next("ack");
		assertAck(ack, 1, true);
		assertEquals(List.of("u1", "u2"), ids(ack.get("members")));

		var presence = alice.connection.next("presence");
		assertEquals("joined", presence.get("kind").asText());
		assertEquals("u2", presence.get("user").get("id").asText());

		alice.send(Frames.send(2L, "hello"));

		var message = alice.connection.next("message").get("message");
		assertEquals("hello", message.get("body").asText());
		assertEquals(1, message.get("sequence").asLong());

		ack = alice.connection.next("ack");
		assertAck(ack, 2, true);
		assertEquals(1, ack.get("sequence").asLong());
		assertEquals(message.get("id").asText(), ack.get("messageId").asText());

		message = bob.connection.next("message").get("message");
		assertEquals("hello", message.get("body").asText());
		assertEquals("u1", message.get("senderId").asText());
		assertEquals(1, message.get("sequence").asLong());

		//exactly once
		assertNull(alice.connection.poll(100));
		assertNull(bob.connection.poll(100));

		assertEquals(1, historyStore.latest("P1", 10).size());
	}

	@Test
	void empty_message() throws Exception {
		var alice = joined("alice", "alice-token", "P1");
		var bob = joined("bob", "bob-token", "P1");
		alice.connection.next("presence");

		alice.send(Frames.send(5L, "   "));
		assertError(alice.connection.next("ack"), 5, "EMPTY_MESSAGE");

		alice.send(Frames.send(6L, "hi"));
		var message = bob.connection.next("message").get("message");
		assertEquals("hi", message.get("body").asText());
		assertEquals(1, message.get("sequence").asLong());
	}

	@Test
	void missing_body() throws Exception {
		var alice = joined("alice", "alice-token", "P1");

		alice.send("{\"op\":\"send\",\"ref\":5}");
		assertError(alice.connection.next("ack"), 5, "EMPTY_MESSAGE");
	}

	@Test
	void message_too_long() throws Exception {
		var alice = joined("alice", "alice-token", "P1");

		alice.send(Frames.send(5L, "x".repeat(1001)));
		assertError(alice.connection.next("ack"), 5, "MESSAGE_TOO_LONG");
	}

	@Test
	void typing() throws Exception {
		var alice = joined("alice", "alice-token", "P1");
		var bob = joined("bob", "bob-token", "P1");
		alice.connection.next("presence");

		alice.send(Frames.typing());
		var typing = bob.connection.next("typing");
		assertEquals("u1", typing.get("user").get("id").asText());
		assertTrue(typing.get("typing").asBoolean());

		alice.send(Frames.stopTyping());
		typing = bob.connection.next("typing");
		assertFalse(typing.get("typing").asBoolean());

		assertNull(alice.connection.poll(100));
	}

	@Test
	void abrupt_disconnect() throws Exception {
		var alice = joined("alice", "alice-token", "P1");
		var bob = joined("bob", "bob-token", "P1");
		alice.connection.next("presence");

		bob.session.close();
		bob.session.idle().get(2, TimeUnit.SECONDS);

		var presence = alice.connection.next("presence");
		assertEquals("left", presence.get("kind").asText());
		assertEquals("u2", presence.get("user").get("id").asText());
		assertEquals(SessionState.CLOSED, bob.session.getState());
		assertEquals(1, registry.size());

		//closing twice is a no-op
		bob.session.close();

		alice.session.close();
		alice.session.idle().get(2, TimeUnit.SECONDS);
		assertEquals(0, registry.size());
	}

	@Test
	void frames_after_close_are_ignored() throws Exception {
		var alice = joined("alice", "alice-token", "P1");
		alice.session.close();

		alice.send(Frames.join(9L, "P1"));
		alice.session.idle().get(2, TimeUnit.SECONDS);
		assertEquals(0, registry.size());
	}

	@Test
	void join_same_room_twice() throws Exception {
		var alice = joined("alice", "alice-token", "P1");
		var bob = joined("bob", "bob-token", "P1");
		alice.connection.next("presence");

		bob.send(Frames.join(2L, "P1"));
		var ack = bob.connection.next("ack");
		assertAck(ack, 2, true);
		assertEquals(List.of("u1", "u2"), ids(ack.get("members")));

		assertNull(alice.connection.poll(100));

		bob.session.close();
		bob.session.idle().get(2, TimeUnit.SECONDS);
		alice.session.close();
		alice.session.idle().get(2, TimeUnit.SECONDS);
		assertEquals(0, registry.size());
	}

	@Test
	void join_other_room() throws Exception {
		var alice = joined("alice", "alice-token", "P1");
		var bob = joined("bob", "bob-token", "P1");
		alice.connection.next("presence");

		alice.send(Frames.join(2L, "P2"));
		var ack = alice.connection.next("ack");
		assertAck(ack, 2, true);
		assertEquals("P2", ack.get("roomId").asText());
		assertEquals("P2", alice.session.getRoomId());

		var presence = bob.connection.next("presence");
		assertEquals("left", presence.get("kind").asText());
		assertEquals(2, registry.size());

		//messages in P1 no longer reach alice
		bob.send(Frames.send(3L, "anyone?"));
		bob.connection.next("message");
		assertNull(alice.connection.poll(100));
	}

	@Test
	void refused_join_leaves_session_idle() throws Exception {
		var bob = joined("bob", "bob-token", "P1");

		bob.send(Frames.join(2L, "P2"));
		assertError(bob.connection.next("ack"), 2, "AUTHORIZATION_DENIED");

		assertEquals(SessionState.IDLE, bob.session.getState());
		assertNull(bob.session.getRoomId());
		assertEquals(0, registry.size());
	}

	@Test
	void leave() throws Exception {
		var alice = joined("alice", "alice-token", "P1");

		alice.send(Frames.leave(2L));
		assertAck(alice.connection.next("ack"), 2, true);
		assertEquals(SessionState.IDLE, alice.session.getState());
		assertEquals(0, registry.size());

		//not in a room: still succeeds
		alice.send(Frames.leave(3L));
		assertAck(alice.connection.next("ack"), 3, true);

		alice.send(Frames.send(4L, "hi"));
		assertError(alice.connection.next("ack"), 4, "NOT_IN_ROOM");
	}

	@Test
	void malformed_frames() throws Exception {
		var alice = connect("alice", "alice-token");

		alice.send("not JSON");
		alice.send("[1, 2, 3]");
		alice.send("{\"op\":\"dance\",\"ref\":7}");
		assertError(alice.connection.next("ack"), 7, "BAD_REQUEST");

		alice.send("{\"op\":\"join\",\"ref\":8}");
		assertError(alice.connection.next("ack"), 8, "BAD_REQUEST");

		assertNull(alice.connection.getCloseCode());
		assertEquals(SessionState.AUTHENTICATED, alice.session.getState());
	}

	private Client connect(String name, String token) throws Exception {
		var connection = new RecordingConnection(name);
		var session = new ConnectionSession(connection, new Outbox(connection, 100, delivery), directory, registry);
		session.open(token);
		session.idle().get(2, TimeUnit.SECONDS);
		return new Client(connection, session);
	}

	private Client joined(String name, String token, String roomId) throws Exception {
		var client = connect(name, token);
		client.send(Frames.join(1L, roomId));
		assertAck(client.connection.next("ack"), 1, true);
		return client;
	}

	private static void assertAck(JsonNode ack, long ref, boolean success) {
		assertEquals(ref, ack.get("ref").asLong());
		assertEquals(success, ack.get("success").asBoolean(), () -> "Unexpected ack: " + JsonUtils.prettyPrint(ack));
	}

	private static void assertError(JsonNode ack, long ref, String error) {
		assertAck(ack, ref, false);
		assertEquals(error, ack.get("error").asText());
	}

	private static List<String> ids(JsonNode users) {
		return JsonUtils.streamArray(users).map(user -> user.get("id").asText()).toList();
	}

	private record Client(RecordingConnection connection, ConnectionSession session) {
		void send(String frame) throws Exception {
			session.onFrame(frame);
			session.idle().get(2, TimeUnit.SECONDS);
		}
	}
}
