package org.mark.httprange;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;

import org.mark.httprange.exception.ChunkTimeoutException;
import org.mark.httprange.exception.LengthMismatchException;
import org.mark.httprange.exception.RangeMismatchException;
import org.mark.httprange.exception.RequestMethodException;
import org.mark.httprange.exception.TransportException;
import org.mark.httprange.exception.UnsupportedRangeException;
import org.mark.httprange.exception.ValidationFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 	通过HTTP Range请求随机读取远程资源。
 * 	<p>
 * 	构造时先发一个 {@code Range: bytes=0-0} 的探测请求，确认服务器支持范围请求并记下资源的元数据。
 * 	之后每一次读取都会把响应的大小、Last-Modified、ETag 和探测时的快照比较，
 * 	不一致就说明远程文件在读取过程中被替换了，抛出 {@link ValidationFailedException}。
 * 	<p>
 * 	可以被多个线程同时使用：每次读取都从原型请求复制出自己的请求，没有可变的共享状态。
 */
public class RangeReader {

	private static final Logger logger = LoggerFactory.getLogger(RangeReader.class);

	private static final String GET = "GET";

	private final RequestExecutor executor;
	private final HttpRequest prototype;
	private final ResourceMetadata metadata;

	/**
	 * 	派生读取器的单次读取时限，为null表示不限
	 */
	private final Duration timeout;
	private final ScheduledExecutorService watchdog;

	/**
	 * 	创建读取器并立即发送探测请求。
	 * 	注意不要把原型的方法改成HEAD，有些签名URL只对GET有效。
	 * @param executor
	 * @param prototype 请求原型，必须是GET，使用时会被复制
	 * @throws IOException
	 * @throws InterruptedException
	 */
	public RangeReader(RequestExecutor executor, HttpRequest prototype) throws IOException, InterruptedException {
		this.executor = Objects.requireNonNull(executor, "executor");
		this.prototype = Objects.requireNonNull(prototype, "prototype");
		if (!GET.equalsIgnoreCase(prototype.method())) {
			throw new RequestMethodException(prototype.method());
		}
		this.timeout = null;
		this.watchdog = null;
		this.metadata = this.probe();
	}

	private RangeReader(RangeReader parent, Duration timeout, ScheduledExecutorService watchdog) {
		this.executor = parent.executor;
		this.prototype = parent.prototype;
		this.metadata = parent.metadata;
		this.timeout = timeout;
		this.watchdog = watchdog;
	}

	/**
	 * 	派生一个带时限的读取器，复用已缓存的元数据，不会重新探测。
	 * 	只设置请求本身的超时，响应体读取不受限。
	 * @param timeout
	 * @return
	 */
	public RangeReader withTimeout(Duration timeout) {
		return new RangeReader(this, checkTimeout(timeout), null);
	}

	/**
	 * 	派生一个带时限的读取器。每次读取都在watchdog上登记一个到期任务，
	 * 	到期后中断读取线程并关闭响应体，读取以 {@link ChunkTimeoutException} 结束。
	 * @param timeout
	 * @param watchdog
	 * @return
	 */
	public RangeReader withTimeout(Duration timeout, ScheduledExecutorService watchdog) {
		return new RangeReader(this, checkTimeout(timeout), Objects.requireNonNull(watchdog, "watchdog"));
	}

	private static Duration checkTimeout(Duration timeout) {
		Objects.requireNonNull(timeout, "timeout");
		if (timeout.isNegative() || timeout.isZero()) {
			throw new IllegalArgumentException("timeout must be > 0");
		}
		return timeout;
	}

	/**
	 * 	资源大小，-1表示服务器没有给出
	 * @return
	 */
	public long size() {
		return this.metadata.getSize();
	}

	public ResourceMetadata getMetadata() {
		return this.metadata;
	}

	public String getContentType() {
		return this.metadata.getContentType();
	}

	public String getLastModified() {
		return this.metadata.getLastModified();
	}

	public String getEtag() {
		return this.metadata.getEtag();
	}

	public HttpRequest getPrototype() {
		return this.prototype;
	}

	public Duration getTimeout() {
		return this.timeout;
	}

	/**
	 * 	发送1字节的范围请求，确认服务器支持并记录元数据
	 * @return
	 * @throws IOException
	 * @throws InterruptedException
	 */
	private ResourceMetadata probe() throws IOException, InterruptedException {
		HttpRequest request = this.newRangeRequest(0, 0);
		HttpResponse<InputStream> response = this.send(request, 0);
		try (InputStream body = bodyOf(response)) {
			if (response.statusCode() != 206) {
				throw new UnsupportedRangeException(response.statusCode());
			}
			ResourceMetadata meta = ResourceMetadata.from(response);
			try {
				body.transferTo(OutputStream.nullOutputStream());
			} catch (IOException e) {
				throw new TransportException("读取探测响应失败: " + e.getMessage(), e);
			}
			logger.info("范围请求探测成功: {} size={} etag={}", request.uri(), meta.getSize(), meta.getEtag());
			return meta;
		}
	}

	/**
	 * 	从position开始读取，填满整个数组
	 * @param b
	 * @param position
	 * @return
	 * @throws IOException
	 * @throws InterruptedException
	 */
	public ReadResult readAt(byte[] b, long position) throws IOException, InterruptedException {
		return this.readAt(b, 0, b.length, position);
	}

	/**
	 * 	从远程资源的position处读取len个字节，写入b[off, off+len)。
	 * 	<p>
	 * 	如果请求的范围超出了资源末尾，会先把范围截到最后一个字节（有些服务器对越界请求直接返回416），
	 * 	读满后在结果里标记 endOfResource。position已经在末尾之后时不发请求，直接返回0字节和末尾标记。
	 * @param b
	 * @param off
	 * @param len
	 * @param position
	 * @return
	 * @throws IOException
	 * @throws InterruptedException
	 */
	public ReadResult readAt(byte[] b, int off, int len, long position) throws IOException, InterruptedException {
		Objects.checkFromIndexSize(off, len, b.length);
		if (position < 0) {
			throw new IllegalArgumentException("position must be >= 0: " + position);
		}
		if (len == 0) {
			return ReadResult.empty();
		}
		if (position > Long.MAX_VALUE - len + 1) {
			throw new IllegalArgumentException("range overflow: position " + position + ", length " + len);
		}
		long reqFirst = position;
		long reqLast = position + len - 1;
		boolean clamped = false;
		long size = this.metadata.getSize();
		if (size != -1 && reqLast > size - 1) {
			reqLast = size - 1;
			clamped = true;
			if (reqLast < reqFirst) {
				return ReadResult.endOfResource();
			}
		}
		int expected = (int) (reqLast - reqFirst + 1);
		HttpRequest request = this.newRangeRequest(reqFirst, reqLast);

		ReadDeadline deadline = this.watchdog == null ? null : ReadDeadline.arm(this.watchdog, this.timeout);
		try {
			return this.exchange(request, b, off, expected, reqFirst, reqLast, clamped, deadline);
		} catch (ChunkTimeoutException e) {
			throw e;
		} catch (InterruptedException | IOException e) {
			if (deadline != null && deadline.isExpired()) {
				throw new ChunkTimeoutException(position, this.timeout, e);
			}
			throw e;
		} finally {
			if (deadline != null) {
				deadline.close();
			}
		}
	}

	private ReadResult exchange(HttpRequest request, byte[] b, int off, int expected, long reqFirst, long reqLast,
			boolean clamped, ReadDeadline deadline) throws IOException, InterruptedException {
		HttpResponse<InputStream> response = this.send(request, reqFirst);
		InputStream body = bodyOf(response);
		if (deadline != null) {
			deadline.attach(body);
		}
		try (body) {
			if (response.statusCode() != 206) {
				throw new UnsupportedRangeException(response.statusCode());
			}
			ResourceMetadata meta = ResourceMetadata.from(response);
			if (!this.metadata.isSameResource(meta)) {
				throw new ValidationFailedException("validation failed, 远程文件已更改: " + this.metadata + " -> " + meta);
			}
			if (meta.getStart() != reqFirst || meta.getEnd() > reqLast) {
				throw new RangeMismatchException(reqFirst, reqLast, meta.getStart(), meta.getEnd());
			}
			long declared = meta.getEnd() - meta.getStart() + 1;
			long contentLength = ResourceMetadata.contentLength(response);
			if (contentLength != declared) {
				throw new LengthMismatchException("content-length mismatch in http response", declared, contentLength);
			}

			int n = readFully(body, b, off, expected);
			if (n < expected) {
				// 服务器给的范围比请求的短，只要和声明的长度一致就当作读到了末尾
				if (n != contentLength) {
					throw new TransportException("响应体被截断，期望: " + contentLength + " 实际: " + n);
				}
				return new ReadResult(n, true);
			}
			return new ReadResult(n, clamped);
		}
	}

	private static int readFully(InputStream in, byte[] b, int off, int len) throws TransportException {
		int n = 0;
		try {
			while (n < len) {
				int read = in.read(b, off + n, len - n);
				if (read == -1) {
					break;
				}
				n += read;
			}
		} catch (IOException e) {
			throw new TransportException("读取响应体失败: " + e.getMessage(), e);
		}
		return n;
	}

	private HttpResponse<InputStream> send(HttpRequest request, long offset) throws IOException, InterruptedException {
		HttpResponse<InputStream> response;
		try {
			response = this.executor.execute(request);
		} catch (HttpTimeoutException e) {
			Duration effective = this.timeout != null ? this.timeout : request.timeout().orElse(Duration.ZERO);
			throw new ChunkTimeoutException(offset, effective, e);
		} catch (IOException e) {
			throw new TransportException("http request error: " + e.getMessage(), e);
		}
		if (response == null) {
			throw new TransportException("http request error: no response for " + request.uri());
		}
		return response;
	}

	private HttpRequest newRangeRequest(long first, long last) {
		HttpRequest.Builder builder = HttpRequest.newBuilder(this.prototype, (name, value) -> true)
				.setHeader(HttpHeaders.RANGE, HttpHeaders.range(first, last));
		if (this.timeout != null) {
			builder.timeout(this.timeout);
		}
		return builder.build();
	}

	private static InputStream bodyOf(HttpResponse<InputStream> response) {
		InputStream body = response.body();
		return body != null ? body : InputStream.nullInputStream();
	}
}
