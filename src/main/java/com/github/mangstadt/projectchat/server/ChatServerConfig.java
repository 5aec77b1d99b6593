package com.github.mangstadt.projectchat.server;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * Settings for the chat server. Use its {@link Builder} class or
 * {@link #load} to construct instances.
 * @param host the interface the web socket server binds to
 * @param port the web socket port
 * @param historyPort the port of the scrollback endpoint, or 0 to not start
 * it
 * @param typingTimeout how long a typing indicator lasts without a refresh
 * @param outboxCapacity how many frames may be waiting to be written to one
 * client before that client is disconnected
 * @param maxMessageLength the maximum length of a message body
 * @param historyCapacityPerRoom how many messages the in-memory history keeps
 * per room
 * @param roomWorkerThreads how many threads process room operations
 * @param directoryFile the JSON file holding users and projects
 */
public record ChatServerConfig(String host, int port, int historyPort, Duration typingTimeout, int outboxCapacity, int maxMessageLength, int historyCapacityPerRoom, int roomWorkerThreads, Path directoryFile) {
	private static final String DEFAULTS_RESOURCE = "projectchat-defaults.properties";

	/**
	 * Gets the default settings.
	 * @return the defaults
	 */
	public static ChatServerConfig defaults() {
		return new Builder().build();
	}

	/**
	 * Loads settings from a properties file. Settings that are missing from
	 * the file keep their default values.
	 * @param file the properties file
	 * @return the settings
	 * @throws IOException if the file can't be read
	 * @throws IllegalArgumentException if a value is not valid
	 */
	public static ChatServerConfig load(Path file) throws IOException {
		var properties = new Properties();
		try (var in = Files.newInputStream(file)) {
			properties.load(in);
		}

		var builder = new Builder();
		builder.apply(properties);

		/*
		 * A relative directory file is resolved against the config file's
		 * folder.
		 */
		var directory = properties.getProperty("directory.file");
		if (directory != null) {
			var path = Path.of(directory.trim());
			if (!path.isAbsolute() && file.getParent() != null) {
				path = file.getParent().resolve(path);
			}
			builder.directoryFile(path);
		}

		return builder.build();
	}

	/**
	 * Used for constructing {@link ChatServerConfig} instances. The builder
	 * starts out with the values from the "projectchat-defaults.properties"
	 * classpath resource.
	 */
	public static class Builder {
		private String host;
		private int port;
		private int historyPort;
		private Duration typingTimeout;
		private int outboxCapacity;
		private int maxMessageLength;
		private int historyCapacityPerRoom;
		private int roomWorkerThreads;
		private Path directoryFile;

		/**
		 * Creates a builder initialized with the default settings.
		 */
		public Builder() {
			var defaults = new Properties();
			try (InputStream in = ChatServerConfig.class.getResourceAsStream("/" + DEFAULTS_RESOURCE)) {
				if (in == null) {
					throw new IllegalStateException("Classpath resource not found: " + DEFAULTS_RESOURCE);
				}
				defaults.load(in);
			} catch (IOException e) {
				throw new UncheckedIOException(e);
			}

			apply(defaults);
		}

		private void apply(Properties properties) {
			host = properties.getProperty("host", host);
			port = intValue(properties, "port", port);
			historyPort = intValue(properties, "history.port", historyPort);
			outboxCapacity = intValue(properties, "outbox.capacity", outboxCapacity);
			maxMessageLength = intValue(properties, "message.max.length", maxMessageLength);
			historyCapacityPerRoom = intValue(properties, "history.capacity.per.room", historyCapacityPerRoom);
			roomWorkerThreads = intValue(properties, "room.worker.threads", roomWorkerThreads);

			var typingMs = properties.getProperty("typing.timeout.ms");
			if (typingMs != null) {
				typingTimeout = Duration.ofMillis(parseInt("typing.timeout.ms", typingMs));
			}
		}

		private static int intValue(Properties properties, String key, int defaultValue) {
			var value = properties.getProperty(key);
			return (value == null) ? defaultValue : parseInt(key, value);
		}

		private static int parseInt(String key, String value) {
			try {
				return Integer.parseInt(value.trim());
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Setting \"" + key + "\" must be an integer: " + value, e);
			}
		}

		public Builder host(String host) {
			this.host = host;
			return this;
		}

		public Builder port(int port) {
			this.port = port;
			return this;
		}

		public Builder historyPort(int historyPort) {
			this.historyPort = historyPort;
			return this;
		}

		public Builder typingTimeout(Duration typingTimeout) {
			this.typingTimeout = typingTimeout;
			return this;
		}

		public Builder outboxCapacity(int outboxCapacity) {
			this.outboxCapacity = outboxCapacity;
			return this;
		}

		public Builder maxMessageLength(int maxMessageLength) {
			this.maxMessageLength = maxMessageLength;
			return this;
		}

		public Builder historyCapacityPerRoom(int historyCapacityPerRoom) {
			this.historyCapacityPerRoom = historyCapacityPerRoom;
			return this;
		}

		public Builder roomWorkerThreads(int roomWorkerThreads) {
			this.roomWorkerThreads = roomWorkerThreads;
			return this;
		}

		public Builder directoryFile(Path directoryFile) {
			this.directoryFile = directoryFile;
			return this;
		}

		/**
		 * Builds the settings.
		 * @return the built object
		 * @throws IllegalArgumentException if a value is out of range
		 */
		public ChatServerConfig build() {
			if (port < 0 || historyPort < 0) {
				throw new IllegalArgumentException("Ports cannot be negative.");
			}
			if (outboxCapacity < 1 || maxMessageLength < 1 || historyCapacityPerRoom < 1 || roomWorkerThreads < 1) {
				throw new IllegalArgumentException("Capacities, lengths and thread counts must be positive.");
			}
			if (typingTimeout == null || typingTimeout.isNegative() || typingTimeout.isZero()) {
				throw new IllegalArgumentException("Typing timeout must be positive.");
			}

			return new ChatServerConfig(host, port, historyPort, typingTimeout, outboxCapacity, maxMessageLength, historyCapacityPerRoom, roomWorkerThreads, directoryFile);
		}
	}
}
