package org.mark.httprange;

/**
 * 	范围读取用到的HTTP头。
 */
public final class HttpHeaders {
	
	public static final String RANGE = "Range";
	public static final String CONTENT_LENGTH = "Content-Length";
	public static final String CONTENT_RANGE = "Content-Range";
	public static final String CONTENT_DISPOSITION = "Content-Disposition";
	public static final String CONTENT_TYPE = "Content-Type";
	public static final String LAST_MODIFIED = "Last-Modified";
	public static final String ETAG = "ETag";
	public static final String USER_AGENT = "User-Agent";
	
	public static String range(long first, long last) {
		return "bytes=" + first + "-" + last;
	}
	
	private HttpHeaders() {
		
	}
}
