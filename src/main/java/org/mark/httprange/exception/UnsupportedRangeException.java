package org.mark.httprange.exception;

/**
 * 	服务器没有按206返回，说明该资源不支持Range请求。
 */
public class UnsupportedRangeException extends HttpRangeException {

	private static final long serialVersionUID = 1L;
	
	private final int statusCode;
	
	public UnsupportedRangeException(int statusCode) {
		super("server does not support range requests, HTTP状态码: " + statusCode + ", expect 206");
		this.statusCode = statusCode;
	}
	
	public int getStatusCode() {
		return this.statusCode;
	}
}
