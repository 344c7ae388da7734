package org.mark.httprange.exception;

/**
 * 	服务器返回的范围与请求的范围不一致。
 */
public class RangeMismatchException extends HttpRangeException {

	private static final long serialVersionUID = 1L;
	
	private final long requestFirst;
	private final long requestLast;
	private final long responseFirst;
	private final long responseLast;
	
	public RangeMismatchException(long requestFirst, long requestLast, long responseFirst, long responseLast) {
		super("received different range than requested (req=" + requestFirst + "-" + requestLast
				+ ", resp=" + responseFirst + "-" + responseLast + ")");
		this.requestFirst = requestFirst;
		this.requestLast = requestLast;
		this.responseFirst = responseFirst;
		this.responseLast = responseLast;
	}
	
	public long getRequestFirst() {
		return this.requestFirst;
	}
	
	public long getRequestLast() {
		return this.requestLast;
	}
	
	public long getResponseFirst() {
		return this.responseFirst;
	}
	
	public long getResponseLast() {
		return this.responseLast;
	}
}
