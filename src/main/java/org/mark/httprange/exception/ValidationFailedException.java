package org.mark.httprange.exception;

/**
 * 	远程文件在读取过程中发生了变化（大小、Last-Modified 或 ETag 不一致）。
 */
public class ValidationFailedException extends HttpRangeException {

	private static final long serialVersionUID = 1L;
	
	public ValidationFailedException(String message) {
		super(message);
	}
}
