package org.mark.httprange.exception;

/**
 * 	下载完成后的sha256校验失败。
 */
public class ChecksumMismatchException extends HttpRangeException {

	private static final long serialVersionUID = 1L;
	
	private final String expected;
	private final String actual;
	
	public ChecksumMismatchException(String expected, String actual) {
		super("sha256 checksum not equal with " + expected + ", actual " + actual);
		this.expected = expected;
		this.actual = actual;
	}
	
	public String getExpected() {
		return this.expected;
	}
	
	public String getActual() {
		return this.actual;
	}
}
