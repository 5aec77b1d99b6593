package com.github.mangstadt.projectchat;

/**
 * Thrown when a chat operation is refused. The {@link ErrorCode} is what gets
 * sent back to the client in the failed acknowledgment.
 */
@SuppressWarnings("serial")
public class ChatOperationException extends RuntimeException {
	private final ErrorCode errorCode;

	public ChatOperationException(ErrorCode errorCode, String message) {
		super(message);
		this.errorCode = errorCode;
	}

	/**
	 * Gets the error code.
	 * @return the error code
	 */
	public ErrorCode getErrorCode() {
		return errorCode;
	}
}
