package org.mark.httprange;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.io.InputStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 	内存中的远程资源，按 Range 头返回206。可以通过 {@link Responder} 替换某些请求的响应，模拟异常的服务器。
 */
public final class FakeResource implements RequestExecutor {

	public static final URI RESOURCE_URI = URI.create("http://fake.test/file.bin");
	public static final String LAST_MODIFIED = "Wed, 21 Oct 2015 07:28:00 GMT";

	/**
	 * 	返回null表示按正常流程响应
	 */
	@FunctionalInterface
	public interface Responder {
		HttpResponse<InputStream> respond(HttpRequest request, long first, long last) throws IOException, InterruptedException;
	}

	private final byte[] content;
	private volatile String etag = "\"v1\"";
	private volatile Responder responder;
	private final AtomicInteger requests = new AtomicInteger();
	private final List<String> ranges = new CopyOnWriteArrayList<>();

	public FakeResource(byte[] content) {
		this.content = content;
	}

	public static byte[] generateData(int size) {
		byte[] data = new byte[size];
		for (int i = 0; i < size; i++) {
			data[i] = (byte) (i * 31 + 7);
		}
		return data;
	}

	public static HttpRequest get() {
		return HttpRequest.newBuilder(RESOURCE_URI).GET().build();
	}

	public FakeResource setEtag(String etag) {
		this.etag = etag;
		return this;
	}

	public FakeResource setResponder(Responder responder) {
		this.responder = responder;
		return this;
	}

	public int getRequests() {
		return this.requests.get();
	}

	public List<String> getRanges() {
		return this.ranges;
	}

	public byte[] getContent() {
		return this.content;
	}

	@Override
	public HttpResponse<InputStream> execute(HttpRequest request) throws IOException, InterruptedException {
		this.requests.incrementAndGet();
		String range = request.headers().firstValue("Range").orElse(null);
		if (range == null) {
			return new FakeResponse(request, 200, this.headers(this.content.length), this.content);
		}
		this.ranges.add(range);
		String[] bounds = range.substring("bytes=".length()).split("-");
		long first = Long.parseLong(bounds[0]);
		long last = Long.parseLong(bounds[1]);
		Responder r = this.responder;
		if (r != null) {
			HttpResponse<InputStream> custom = r.respond(request, first, last);
			if (custom != null) {
				return custom;
			}
		}
		return this.partial(request, first, last);
	}

	/**
	 * 	正常的206响应
	 */
	public HttpResponse<InputStream> partial(HttpRequest request, long first, long last) {
		last = Math.min(last, this.content.length - 1);
		int len = (int) (last - first + 1);
		Map<String, String> headers = this.headers(len);
		headers.put("Content-Range", "bytes " + first + "-" + last + "/" + this.content.length);
		return new FakeResponse(request, 206, headers,
				Arrays.copyOfRange(this.content, (int) first, (int) first + len));
	}

	public Map<String, String> headers(long contentLength) {
		Map<String, String> headers = new LinkedHashMap<>();
		headers.put("Content-Length", String.valueOf(contentLength));
		headers.put("Content-Type", "application/octet-stream");
		headers.put("Last-Modified", LAST_MODIFIED);
		headers.put("ETag", this.etag);
		return headers;
	}
}
