package org.mark.httprange.exception;

/**
 * 	请求执行失败或响应体读取中断。
 */
public class TransportException extends HttpRangeException {

	private static final long serialVersionUID = 1L;
	
	public TransportException(String message) {
		super(message);
	}
	
	public TransportException(String message, Throwable cause) {
		super(message, cause);
	}
}
