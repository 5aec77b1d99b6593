package com.github.mangstadt.projectchat.protocol;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.mangstadt.projectchat.ChatMessage;
import com.github.mangstadt.projectchat.ErrorCode;
import com.github.mangstadt.projectchat.Identity;
import com.github.mangstadt.projectchat.MessageReceipt;
import com.github.mangstadt.projectchat.PresenceEvent;
import com.github.mangstadt.projectchat.RoomSnapshot;
import com.github.mangstadt.projectchat.util.JsonUtils;

/**
 * Encodes and decodes the JSON text frames exchanged over the chat web
 * socket.
 */
public final class Frames {
	/*
	 * Client to server.
	 */

	public static String auth(Long ref, String token) {
		var node = op(ClientOp.AUTH, ref);
		node.put("token", token);
		return JsonUtils.toString(node);
	}

	public static String join(Long ref, String roomId) {
		var node = op(ClientOp.JOIN, ref);
		node.put("roomId", roomId);
		return JsonUtils.toString(node);
	}

	public static String leave(Long ref) {
		return JsonUtils.toString(op(ClientOp.LEAVE, ref));
	}

	public static String send(Long ref, String body) {
		var node = op(ClientOp.SEND, ref);
		node.put("body", body);
		return JsonUtils.toString(node);
	}

	public static String typing() {
		return JsonUtils.toString(op(ClientOp.TYPING, null));
	}

	public static String stopTyping() {
		return JsonUtils.toString(op(ClientOp.STOP_TYPING, null));
	}

	private static ObjectNode op(ClientOp op, Long ref) {
		var node = JsonUtils.newObject();
		node.put("op", op.value());
		if (ref != null) {
			node.put("ref", ref);
		}
		return node;
	}

	/**
	 * Parses a client-to-server frame.
	 * @param json the frame text
	 * @return the parsed frame
	 * @throws MalformedFrameException if the frame is not a JSON object, has
	 * an unknown "op", or is missing a field that its "op" requires
	 */
	public static ClientFrame parseClientFrame(String json) throws MalformedFrameException {
		JsonNode node;
		try {
			node = JsonUtils.parse(json);
		} catch (JsonProcessingException e) {
			throw new MalformedFrameException("Frame is not valid JSON.", e);
		}

		if (node == null || !node.isObject()) {
			throw new MalformedFrameException("Frame is not a JSON object.", (Long) null);
		}

		var refNode = node.get("ref");
		var ref = (refNode != null && refNode.canConvertToLong()) ? refNode.asLong() : null;

		var opValue = JsonUtils.text(node, "op");
		var op = (opValue == null) ? null : ClientOp.get(opValue);
		if (op == null) {
			throw new MalformedFrameException("Unknown \"op\": " + opValue, ref);
		}

		var roomId = JsonUtils.text(node, "roomId");
		var body = JsonUtils.text(node, "body");
		var token = JsonUtils.text(node, "token");

		switch (op) {
		case AUTH:
			if (token == null) {
				throw new MalformedFrameException("\"auth\" requires a \"token\".", ref);
			}
			break;
		case JOIN:
			if (roomId == null || roomId.isBlank()) {
				throw new MalformedFrameException("\"join\" requires a \"roomId\".", ref);
			}
			break;
		case SEND:
			/*
			 * A missing body is treated like an empty one so that the client
			 * gets an EMPTY_MESSAGE error.
			 */
			if (body == null) {
				body = "";
			}
			break;
		default:
			break;
		}

		return new ClientFrame(op, ref, roomId, body, token);
	}

	/*
	 * Server to client.
	 */

	public static String ackSuccess(long ref) {
		return JsonUtils.toString(ack(ref, true));
	}

	public static String ackJoined(long ref, RoomSnapshot snapshot) {
		var node = ack(ref, true);
		node.put("roomId", snapshot.roomId());
		node.put("lastSequence", snapshot.lastSequence());

		var members = node.putArray("members");
		snapshot.members().forEach(member -> members.add(identity(member)));

		var typing = node.putArray("typing");
		snapshot.typing().forEach(member -> typing.add(identity(member)));

		return JsonUtils.toString(node);
	}

	public static String ackSent(long ref, MessageReceipt receipt) {
		var node = ack(ref, true);
		node.put("messageId", receipt.messageId());
		node.put("sequence", receipt.sequence());
		return JsonUtils.toString(node);
	}

	public static String ackFailure(long ref, ErrorCode error, String reason) {
		var node = ack(ref, false);
		node.put("error", error.name());
		node.put("reason", reason);
		return JsonUtils.toString(node);
	}

	private static ObjectNode ack(long ref, boolean success) {
		var node = event(ServerEventType.ACK);
		node.put("ref", ref);
		node.put("success", success);
		return node;
	}

	public static String message(ChatMessage message) {
		var node = event(ServerEventType.MESSAGE);
		node.set("message", messageNode(message));
		return JsonUtils.toString(node);
	}

	public static String presence(PresenceEvent event) {
		var node = event(ServerEventType.PRESENCE);
		node.put("kind", event.kind().wireValue());
		node.set("user", identity(event.identity()));
		node.put("timestamp", event.timestamp().toString());
		return JsonUtils.toString(node);
	}

	public static String typing(Identity identity, boolean typing) {
		var node = event(ServerEventType.TYPING);
		node.set("user", identity(identity));
		node.put("typing", typing);
		return JsonUtils.toString(node);
	}

	/**
	 * Encodes the body of a history endpoint response.
	 * @param messages the messages, oldest first
	 * @return the JSON
	 */
	public static String history(List<ChatMessage> messages) {
		var node = JsonUtils.newObject();
		var array = node.putArray("messages");
		messages.forEach(message -> array.add(messageNode(message)));
		return JsonUtils.toString(node);
	}

	private static ObjectNode event(ServerEventType type) {
		var node = JsonUtils.newObject();
		node.put("event", type.value());
		return node;
	}

	private static ObjectNode messageNode(ChatMessage message) {
		var node = JsonUtils.newObject();
		node.put("id", message.id());
		node.put("roomId", message.roomId());
		node.put("senderId", message.senderId());
		node.put("senderName", message.senderName());
		node.put("body", message.body());
		node.put("sequence", message.sequence());
		node.put("timestamp", message.timestamp().toString());
		return node;
	}

	/**
	 * Only the fields that other members are allowed to see.
	 */
	private static ObjectNode identity(Identity identity) {
		var node = JsonUtils.newObject();
		node.put("id", identity.id());
		node.put("name", identity.displayName());
		return node;
	}

	/**
	 * Determines the type of a server-to-client frame.
	 * @param node the parsed frame
	 * @return the type or null if not recognized
	 */
	public static ServerEventType eventType(JsonNode node) {
		var value = JsonUtils.text(node, "event");
		return (value == null) ? null : ServerEventType.get(value);
	}

	/**
	 * Extracts a chat message from a "message" object.
	 * @param node the "message" object
	 * @return the chat message
	 */
	public static ChatMessage extractChatMessage(JsonNode node) {
		//@formatter:off
		return new ChatMessage.Builder()
			.id(JsonUtils.text(node, "id"))
			.roomId(JsonUtils.text(node, "roomId"))
			.senderId(JsonUtils.text(node, "senderId"))
			.senderName(JsonUtils.text(node, "senderName"))
			.body(JsonUtils.text(node, "body"))
			.sequence(node.path("sequence").asLong())
			.timestamp(JsonUtils.instant(node, "timestamp"))
		.build();
		//@formatter:on
	}

	/**
	 * Extracts the public view of an identity from a "user" object.
	 * @param node the "user" object
	 * @return the identity or null if the node is missing or has no ID
	 */
	public static Identity extractIdentity(JsonNode node) {
		if (node == null) {
			return null;
		}

		var id = JsonUtils.text(node, "id");
		if (id == null) {
			return null;
		}

		return Identity.publicView(id, JsonUtils.text(node, "name"));
	}

	/**
	 * Extracts the room snapshot from a successful "join" acknowledgment.
	 * @param ack the acknowledgment
	 * @return the snapshot
	 */
	public static RoomSnapshot extractSnapshot(JsonNode ack) {
		//@formatter:off
		var members = JsonUtils.streamArray(ack.get("members"))
			.map(Frames::extractIdentity)
			.filter(identity -> identity != null)
		.toList();

		var typing = JsonUtils.streamArray(ack.get("typing"))
			.map(Frames::extractIdentity)
			.filter(identity -> identity != null)
		.toList();
		//@formatter:on

		return new RoomSnapshot(JsonUtils.text(ack, "roomId"), members, typing, ack.path("lastSequence").asLong());
	}

	private Frames() {
		//hide constructor
	}
}
