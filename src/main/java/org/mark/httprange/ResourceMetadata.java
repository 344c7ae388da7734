package org.mark.httprange;

import java.net.http.HttpResponse;
import java.util.Objects;

import org.mark.httprange.ContentRangeParser.ContentRange;
import org.mark.httprange.exception.ContentRangeParseException;

/**
 * 	远程资源的元数据快照。创建后不可变。
 * 	start/end 只有在206响应中才有意义；size为-1表示服务器没有给出可用的长度。
 */
public final class ResourceMetadata {
	
	private final long start;
	private final long end;
	private final long size;
	private final String lastModified;
	private final String etag;
	private final String contentType;
	
	public ResourceMetadata(long start, long end, long size, String lastModified, String etag, String contentType) {
		this.start = start;
		this.end = end;
		this.size = size;
		this.lastModified = lastModified == null ? "" : lastModified;
		this.etag = etag == null ? "" : etag;
		this.contentType = contentType == null ? "" : contentType;
	}
	
	/**
	 * 	从响应头中提取元数据。
	 * @param response
	 * @return
	 * @throws ContentRangeParseException
	 */
	public static ResourceMetadata from(HttpResponse<?> response) throws ContentRangeParseException {
		long start = -1;
		long end = -1;
		long size = -1;
		String lastModified = firstHeaderValue(response, HttpHeaders.LAST_MODIFIED);
		String etag = firstHeaderValue(response, HttpHeaders.ETAG);
		String contentType = firstHeaderValue(response, HttpHeaders.CONTENT_TYPE);
		
		switch (response.statusCode()) {
		case 200:
			size = contentLength(response);
			break;
		case 206:
			String contentRange = firstHeaderValue(response, HttpHeaders.CONTENT_RANGE);
			if (!contentRange.isEmpty()) {
				ContentRange range = ContentRangeParser.parse(contentRange);
				start = range.getFirst();
				end = range.getLast();
				size = range.getLength();
			}
			break;
		default:
			break;
		}
		return new ResourceMetadata(start, end, size, lastModified, etag, contentType);
	}
	
	/**
	 * 	Content-Length，缺失或无法解析时返回-1
	 * @param response
	 * @return
	 */
	public static long contentLength(HttpResponse<?> response) {
		String value = firstHeaderValue(response, HttpHeaders.CONTENT_LENGTH);
		if (value.isEmpty()) {
			return -1;
		}
		try {
			return Long.parseLong(value.trim());
		} catch (NumberFormatException e) {
			return -1;
		}
	}
	
	private static String firstHeaderValue(HttpResponse<?> response, String name) {
		return response.headers().firstValue(name).orElse("");
	}
	
	/**
	 * 	判断是不是同一个资源：大小、Last-Modified、ETag 都要一致。
	 * @param other
	 * @return
	 */
	public boolean isSameResource(ResourceMetadata other) {
		return this.size == other.size
				&& this.lastModified.equals(other.lastModified)
				&& this.etag.equals(other.etag);
	}
	
	public long getStart() {
		return this.start;
	}
	
	public long getEnd() {
		return this.end;
	}
	
	public long getSize() {
		return this.size;
	}
	
	public String getLastModified() {
		return this.lastModified;
	}
	
	public String getEtag() {
		return this.etag;
	}
	
	public String getContentType() {
		return this.contentType;
	}
	
	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ResourceMetadata that = (ResourceMetadata) o;
		return this.start == that.start
				&& this.end == that.end
				&& this.size == that.size
				&& this.lastModified.equals(that.lastModified)
				&& this.etag.equals(that.etag)
				&& this.contentType.equals(that.contentType);
	}
	
	@Override
	public int hashCode() {
		return Objects.hash(this.start, this.end, this.size, this.lastModified, this.etag, this.contentType);
	}
	
	@Override
	public String toString() {
		return "ResourceMetadata{" +
				"range=" + this.start + "-" + this.end +
				", size=" + this.size +
				", lastModified='" + this.lastModified + '\'' +
				", etag='" + this.etag + '\'' +
				", contentType='" + this.contentType + '\'' +
				'}';
	}
}
