package org.mark.httprange;

/**
 * 	一次范围读取的结果。endOfResource为true表示已经读到资源末尾，这不是错误。
 */
public final class ReadResult {
	
	private static final ReadResult EMPTY = new ReadResult(0, false);
	private static final ReadResult EMPTY_END = new ReadResult(0, true);
	
	private final int bytesRead;
	private final boolean endOfResource;
	
	public ReadResult(int bytesRead, boolean endOfResource) {
		if (bytesRead < 0) {
			throw new IllegalArgumentException("bytesRead must be >= 0");
		}
		this.bytesRead = bytesRead;
		this.endOfResource = endOfResource;
	}
	
	static ReadResult empty() {
		return EMPTY;
	}
	
	static ReadResult endOfResource() {
		return EMPTY_END;
	}
	
	public int getBytesRead() {
		return this.bytesRead;
	}
	
	public boolean isEndOfResource() {
		return this.endOfResource;
	}
	
	@Override
	public String toString() {
		return "ReadResult{bytesRead=" + this.bytesRead + ", endOfResource=" + this.endOfResource + "}";
	}
}
