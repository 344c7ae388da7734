package org.mark.httprange.exception;

/**
 * 	长度不匹配：响应的 Content-Length 与 Content-Range 不符，或分片实际读到的字节数与期望不符。
 */
public class LengthMismatchException extends HttpRangeException {

	private static final long serialVersionUID = 1L;
	
	private final long expected;
	private final long actual;
	
	public LengthMismatchException(String message, long expected, long actual) {
		super(message + "，期望: " + expected + " 实际: " + actual);
		this.expected = expected;
		this.actual = actual;
	}
	
	public long getExpected() {
		return this.expected;
	}
	
	public long getActual() {
		return this.actual;
	}
}
