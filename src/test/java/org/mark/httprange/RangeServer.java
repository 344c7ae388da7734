package org.mark.httprange;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

/**
 * 	本地的HTTP服务器，支持 Range 请求。
 */
public final class RangeServer implements AutoCloseable {

	private final byte[] content;
	private final HttpServer server;
	private final ExecutorService pool = Executors.newFixedThreadPool(8);
	private final AtomicInteger rangeRequests = new AtomicInteger();
	private volatile boolean honorRange = true;
	private volatile int changeEtagAfter = -1;

	public RangeServer(byte[] content) throws IOException {
		this.content = content;
		this.server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
		this.server.createContext("/file.bin", this::handle);
		this.server.setExecutor(this.pool);
		this.server.start();
	}

	public URI uri() {
		return URI.create("http://localhost:" + this.server.getAddress().getPort() + "/file.bin");
	}

	public static HttpClientExecutor newExecutor() {
		return new HttpClientExecutor(HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build());
	}

	/**
	 * 	关闭后服务器忽略 Range 头，总是返回200和完整内容
	 */
	public RangeServer setHonorRange(boolean honorRange) {
		this.honorRange = honorRange;
		return this;
	}

	/**
	 * 	处理完n个范围请求之后更换ETag，模拟下载中途文件被替换
	 */
	public RangeServer changeEtagAfter(int n) {
		this.changeEtagAfter = n;
		return this;
	}

	public int getRangeRequests() {
		return this.rangeRequests.get();
	}

	private void handle(HttpExchange exchange) throws IOException {
		Headers resp = exchange.getResponseHeaders();
		resp.add("Accept-Ranges", "bytes");
		resp.add("Content-Type", "application/octet-stream");
		resp.add("Last-Modified", FakeResource.LAST_MODIFIED);

		String range = exchange.getRequestHeaders().getFirst("Range");
		if (!this.honorRange || range == null || !range.startsWith("bytes=")) {
			resp.add("ETag", "\"v1\"");
			exchange.sendResponseHeaders(200, this.content.length);
			try (OutputStream os = exchange.getResponseBody()) {
				os.write(this.content);
			}
			return;
		}

		int n = this.rangeRequests.incrementAndGet();
		boolean changed = this.changeEtagAfter >= 0 && n > this.changeEtagAfter;
		resp.add("ETag", changed ? "\"v2\"" : "\"v1\"");

		String[] parts = range.substring("bytes=".length()).trim().split("-", 2);
		long start = Long.parseLong(parts[0]);
		long end = Math.min(Long.parseLong(parts[1]), this.content.length - 1L);
		if (start >= this.content.length || end < start) {
			resp.add("Content-Range", "bytes */" + this.content.length);
			exchange.sendResponseHeaders(416, -1);
			exchange.close();
			return;
		}
		int len = (int) (end - start + 1);
		resp.add("Content-Range", "bytes " + start + "-" + end + "/" + this.content.length);
		exchange.sendResponseHeaders(206, len);
		try (OutputStream os = exchange.getResponseBody()) {
			os.write(this.content, (int) start, len);
		}
	}

	@Override
	public void close() {
		this.server.stop(0);
		this.pool.shutdownNow();
	}
}
