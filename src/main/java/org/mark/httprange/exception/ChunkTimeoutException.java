package org.mark.httprange.exception;

import java.time.Duration;

/**
 * 	单次范围读取超过了规定的时限。
 */
public class ChunkTimeoutException extends HttpRangeException {

	private static final long serialVersionUID = 1L;
	
	private final long offset;
	private final Duration timeout;
	
	public ChunkTimeoutException(long offset, Duration timeout, Throwable cause) {
		super("range read at offset " + offset + " timed out after " + timeout.toMillis() + "ms", cause);
		this.offset = offset;
		this.timeout = timeout;
	}
	
	public long getOffset() {
		return this.offset;
	}
	
	public Duration getTimeout() {
		return this.timeout;
	}
}
