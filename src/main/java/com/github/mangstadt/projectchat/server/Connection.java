package com.github.mangstadt.projectchat.server;

/**
 * The server's end of one client transport channel.
 */
public interface Connection {
	/**
	 * Queues a text frame for sending. Must not block.
	 * @param frame the frame
	 */
	void send(String frame);

	/**
	 * Determines whether frames handed to {@link #send} are still waiting to
	 * be written to the network.
	 * @return true if the transport has unwritten data
	 */
	boolean hasBufferedData();

	/**
	 * Closes the channel.
	 * @param code the close code
	 * @param reason the close reason
	 */
	void close(int code, String reason);

	/**
	 * Describes the remote end, for log messages.
	 * @return the description
	 */
	String describe();
}
