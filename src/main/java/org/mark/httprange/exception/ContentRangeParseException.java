package org.mark.httprange.exception;

/**
 * 	Content-Range 头格式错误。
 */
public class ContentRangeParseException extends HttpRangeException {

	private static final long serialVersionUID = 1L;
	
	private final String value;
	
	public ContentRangeParseException(String value) {
		super("content-range parse error: " + value);
		this.value = value;
	}
	
	public ContentRangeParseException(String value, Throwable cause) {
		super("content-range parse error: " + value, cause);
		this.value = value;
	}
	
	public String getValue() {
		return this.value;
	}
}
