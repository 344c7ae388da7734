package org.mark.httprange;

import org.mark.httprange.exception.ContentRangeParseException;

/**
 * 	解析HTTP头 Content-Range，支持以下三种格式：
 * 	<pre>
 * 	Content-Range: bytes 42-1233/1234
 * 	Content-Range: bytes 42-1233/*
 * 	Content-Range: bytes *&#47;1234
 * 	</pre>
 * 	未知的部分用 -1 表示。三部分都未知时视为格式错误。
 */
public final class ContentRangeParser {
	
	private static final String UNIT = "bytes";
	private static final String UNKNOWN = "*";
	
	/**
	 * 	解析结果。
	 */
	public static final class ContentRange {
		private final long first;
		private final long last;
		private final long length;
		
		private ContentRange(long first, long last, long length) {
			this.first = first;
			this.last = last;
			this.length = length;
		}
		
		public long getFirst() {
			return this.first;
		}
		
		public long getLast() {
			return this.last;
		}
		
		/**
		 * 	资源总长度，-1表示未知
		 * @return
		 */
		public long getLength() {
			return this.length;
		}
		
		@Override
		public String toString() {
			return "ContentRange{" + this.first + "-" + this.last + "/" + this.length + "}";
		}
	}
	
	/**
	 * 	解析 Content-Range 的值
	 * @param value
	 * @return
	 * @throws ContentRangeParseException
	 */
	public static ContentRange parse(String value) throws ContentRangeParseException {
		if (value == null) {
			throw new ContentRangeParseException(null);
		}
		long first = -1;
		long last = -1;
		long length = -1;
		
		// split的limit为-1，保留末尾的空串，多余的token不能被静默丢掉
		String[] tokens = value.split(" ", -1);
		if (tokens.length != 2 || !UNIT.equals(tokens[0])) {
			throw new ContentRangeParseException(value);
		}
		tokens = tokens[1].split("/", -1);
		if (tokens.length != 2) {
			throw new ContentRangeParseException(value);
		}
		if (!UNKNOWN.equals(tokens[1])) {
			length = parseNumber(tokens[1], value);
		}
		if (!UNKNOWN.equals(tokens[0])) {
			String[] bounds = tokens[0].split("-", -1);
			if (bounds.length != 2) {
				throw new ContentRangeParseException(value);
			}
			first = parseNumber(bounds[0], value);
			last = parseNumber(bounds[1], value);
		}
		if (first == -1 && last == -1 && length == -1) {
			throw new ContentRangeParseException(value);
		}
		return new ContentRange(first, last, length);
	}
	
	private static long parseNumber(String s, String value) throws ContentRangeParseException {
		long v;
		try {
			v = Long.parseLong(s);
		} catch (NumberFormatException e) {
			throw new ContentRangeParseException(value, e);
		}
		if (v < 0) {
			throw new ContentRangeParseException(value);
		}
		return v;
	}
	
	private ContentRangeParser() {
		
	}
}
