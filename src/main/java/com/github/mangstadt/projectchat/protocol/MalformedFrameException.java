package com.github.mangstadt.projectchat.protocol;

/**
 * Thrown when a frame cannot be parsed.
 */
@SuppressWarnings("serial")
public class MalformedFrameException extends Exception {
	private final Long ref;

	public MalformedFrameException(String message, Long ref) {
		super(message);
		this.ref = ref;
	}

	public MalformedFrameException(String message, Throwable cause) {
		super(message, cause);
		ref = null;
	}

	/**
	 * Gets the correlation number of the frame, if it could be read.
	 * @return the ref or null
	 */
	public Long getRef() {
		return ref;
	}
}
