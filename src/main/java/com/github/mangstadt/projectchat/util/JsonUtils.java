package com.github.mangstadt.projectchat.util;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.PrettyPrinter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON utility methods.
 */
public final class JsonUtils {
	private static final ObjectMapper mapper = new ObjectMapper();

	/**
	 * Creates a new object node that's not attached to anything.
	 * @return the object node
	 */
	public static ObjectNode newObject() {
		return mapper.createObjectNode();
	}

	/**
	 * Parses JSON from a string.
	 * @param string the string
	 * @return the parsed JSON
	 * @throws JsonProcessingException if there's a problem parsing the JSON
	 */
	public static JsonNode parse(String string) throws JsonProcessingException {
		return mapper.readTree(string);
	}

	/**
	 * Streams the elements of an array node.
	 * @param array the array node
	 * @return the elements (empty if the node is not an array)
	 */
	public static Stream<JsonNode> streamArray(JsonNode array) {
		if (array == null || !array.isArray()) {
			return Stream.empty();
		}
		return StreamSupport.stream(array.spliterator(), false);
	}

	/**
	 * Gets the text value of a field.
	 * @param node the object node
	 * @param field the field name
	 * @return the text value or null if the field is missing or null
	 */
	public static String text(JsonNode node, String field) {
		var value = node.get(field);
		return (value == null || value.isNull()) ? null : value.asText();
	}

	/**
	 * Gets the value of a field as an ISO-8601 instant.
	 * @param node the object node
	 * @param field the field name
	 * @return the instant or null if the field is missing or not a valid
	 * timestamp
	 */
	public static Instant instant(JsonNode node, String field) {
		var text = text(node, field);
		if (text == null) {
			return null;
		}

		try {
			return Instant.parse(text);
		} catch (DateTimeParseException e) {
			return null;
		}
	}

	/**
	 * Pretty prints the given JSON node.
	 * @param node the JSON node
	 * @return the pretty-printed JSON
	 */
	public static String prettyPrint(JsonNode node) {
		return toString(node, new DefaultPrettyPrinter());
	}

	/**
	 * Converts the given JSON node to a string.
	 * @param node the JSON node
	 * @return the JSON string
	 */
	public static String toString(JsonNode node) {
		return toString(node, null);
	}

	private static String toString(JsonNode node, PrettyPrinter pp) {
		ObjectWriter writer = mapper.writer(pp);
		try {
			return writer.writeValueAsString(node);
		} catch (JsonProcessingException e) {
			//should never be thrown
			throw new RuntimeException(e);
		}
	}

	private JsonUtils() {
		//hide constructor
	}
}
