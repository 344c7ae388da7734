package org.mark.httprange.exception;




/**
 * 	请求方式错误的异常。范围读取只接受GET请求作为原型。
 */
public class RequestMethodException extends HttpRangeException {

	/**
	 * 
	 */
	private static final long serialVersionUID = 1L;
	
	private final String method;
	
	
	public RequestMethodException(String method) {
		super("invalid HTTP method, must be GET: " + method);
		this.method = method;
	}
	
	public String getMethod() {
		return this.method;
	}
}
