package com.github.mangstadt.projectchat.protocol;

/**
 * A parsed client-to-server frame.
 * @param op the operation
 * @param ref the correlation number echoed back in the acknowledgment, or
 * null if the client does not want an acknowledgment
 * @param roomId the room ID ("join" only)
 * @param body the message body ("send" only)
 * @param token the bearer credential ("auth" only)
 */
public record ClientFrame(ClientOp op, Long ref, String roomId, String body, String token) {
	/**
	 * Determines whether the client asked for an acknowledgment.
	 * @return true if an acknowledgment is expected
	 */
	public boolean wantsAck() {
		return ref != null;
	}
}
