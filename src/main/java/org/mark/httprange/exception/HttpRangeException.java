package org.mark.httprange.exception;

import java.io.IOException;

/**
 * 	所有范围读取、分片下载相关异常的基类。
 */
public class HttpRangeException extends IOException {

	/**
	 * 
	 */
	private static final long serialVersionUID = 1L;
	
	
	public HttpRangeException(String message) {
		super(message);
	}
	
	public HttpRangeException(String message, Throwable cause) {
		super(message, cause);
	}
}
