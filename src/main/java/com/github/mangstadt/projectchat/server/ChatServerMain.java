package com.github.mangstadt.projectchat.server;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the chat server and the history endpoint.
 * 
 * <pre>
 * java com.github.mangstadt.projectchat.server.ChatServerMain [server.properties]
 * </pre>
 */
public class ChatServerMain implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(ChatServerMain.class);

	private final ExecutorService workers;
	private final ScheduledExecutorService timers;
	private final ScheduledExecutorService delivery;
	private final RoomRegistry registry;
	private final ChatServer chatServer;
	private final HistoryHttpServer historyServer;

	public static void main(String[] args) throws Exception {
		var config = (args.length > 0) ? ChatServerConfig.load(Path.of(args[0])) : ChatServerConfig.defaults();
		if (config.directoryFile() == null) {
			logger.atError().log("No project directory configured. Set \"directory.file\" in the server properties.");
			System.exit(1);
			return;
		}

		var directory = ProjectDirectory.load(config.directoryFile());
		var main = new ChatServerMain(config, directory);
		Runtime.getRuntime().addShutdownHook(new Thread(main::close, "shutdown"));
		main.start();
	}

	/**
	 * Wires the server together. Nothing is started until {@link #start} is
	 * called.
	 * @param config the settings
	 * @param directory authenticates users and answers membership questions
	 * @throws IOException if the history endpoint's port can't be bound
	 */
	public ChatServerMain(ChatServerConfig config, ProjectDirectory directory) throws IOException {
		workers = Executors.newFixedThreadPool(config.roomWorkerThreads(), namedThreads("room-worker"));
		timers = Executors.newSingleThreadScheduledExecutor(namedThreads("typing-timer"));
		delivery = Executors.newScheduledThreadPool(2, namedThreads("delivery"));

		var historyStore = new InMemoryHistoryStore(config.historyCapacityPerRoom());
		var services = new RoomServices(directory, historyStore, Clock.systemUTC(), workers, timers, config.typingTimeout(), config.maxMessageLength());
		registry = new RoomRegistry(services);

		chatServer = new ChatServer(new InetSocketAddress(config.host(), config.port()), directory, registry, config.outboxCapacity(), delivery);
		historyServer = (config.historyPort() == 0) ? null : new HistoryHttpServer(new InetSocketAddress(config.host(), config.historyPort()), directory, directory, historyStore);
	}

	/**
	 * Starts the servers and waits for the chat server to start listening.
	 * @throws IOException if the chat server doesn't start listening in time
	 */
	public void start() throws IOException {
		chatServer.start();
		try {
			if (!chatServer.awaitStart(10, TimeUnit.SECONDS)) {
				throw new IOException("Chat server did not start listening on " + chatServer.getAddress() + ".");
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new InterruptedIOException("Interrupted while waiting for the chat server to start.");
		}

		if (historyServer != null) {
			historyServer.start();
		}
	}

	/**
	 * Gets the port the chat server is listening on.
	 * @return the port
	 */
	public int getPort() {
		return chatServer.getPort();
	}

	/**
	 * Gets the port of the history endpoint.
	 * @return the port or 0 if the endpoint is disabled
	 */
	public int getHistoryPort() {
		return (historyServer == null) ? 0 : historyServer.getPort();
	}

	/**
	 * Closes every client connection (code 1001) and stops the servers.
	 */
	@Override
	public void close() {
		logger.atInfo().log("Shutting down.");

		try {
			chatServer.stop(1000);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}

		if (historyServer != null) {
			historyServer.close();
		}

		registry.close();
		workers.shutdown();
		timers.shutdownNow();
		delivery.shutdownNow();

		try {
			if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
				logger.atWarn().log("Room workers did not finish in time.");
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	private static ThreadFactory namedThreads(String prefix) {
		var count = new AtomicInteger();
		return runnable -> {
			var thread = new Thread(runnable, prefix + "-" + count.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}
}
