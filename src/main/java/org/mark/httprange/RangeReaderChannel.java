package org.mark.httprange;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.NonWritableChannelException;
import java.nio.channels.SeekableByteChannel;
import java.util.Objects;

/**
 * 	把 {@link RangeReader} 包装成只读的 {@link SeekableByteChannel}，
 * 	可以交给需要随机访问通道的API，比如直接读取远程zip的目录而不用下载整个文件。
 * 	<p>
 * 	每次read都会发一个范围请求，调用方最好自己做缓冲。非线程安全。
 */
public class RangeReaderChannel implements SeekableByteChannel {

	private static final int MAX_READ = 1024 * 1024;

	private final RangeReader reader;
	private long position;
	private boolean open = true;

	public RangeReaderChannel(RangeReader reader) {
		this.reader = Objects.requireNonNull(reader, "reader");
		if (reader.size() < 0) {
			throw new IllegalArgumentException("resource size is unknown");
		}
	}

	@Override
	public int read(ByteBuffer dst) throws IOException {
		this.ensureOpen();
		if (!dst.hasRemaining()) {
			return 0;
		}
		if (this.position >= this.reader.size()) {
			return -1;
		}
		int len = (int) Math.min(Math.min(dst.remaining(), MAX_READ), this.reader.size() - this.position);
		ReadResult result;
		if (dst.hasArray()) {
			result = this.readAt(dst.array(), dst.arrayOffset() + dst.position(), len);
			dst.position(dst.position() + result.getBytesRead());
		} else {
			byte[] buffer = new byte[len];
			result = this.readAt(buffer, 0, len);
			dst.put(buffer, 0, result.getBytesRead());
		}
		this.position += result.getBytesRead();
		return result.getBytesRead();
	}

	private ReadResult readAt(byte[] b, int off, int len) throws IOException {
		try {
			return this.reader.readAt(b, off, len, this.position);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			InterruptedIOException ie = new InterruptedIOException("range read interrupted");
			ie.initCause(e);
			throw ie;
		}
	}

	@Override
	public int write(ByteBuffer src) {
		throw new NonWritableChannelException();
	}

	@Override
	public long position() throws IOException {
		this.ensureOpen();
		return this.position;
	}

	@Override
	public SeekableByteChannel position(long newPosition) throws IOException {
		this.ensureOpen();
		if (newPosition < 0) {
			throw new IllegalArgumentException("position must be >= 0");
		}
		this.position = newPosition;
		return this;
	}

	@Override
	public long size() throws IOException {
		this.ensureOpen();
		return this.reader.size();
	}

	@Override
	public SeekableByteChannel truncate(long size) {
		throw new NonWritableChannelException();
	}

	@Override
	public boolean isOpen() {
		return this.open;
	}

	@Override
	public void close() {
		this.open = false;
	}

	private void ensureOpen() throws ClosedChannelException {
		if (!this.open) {
			throw new ClosedChannelException();
		}
	}
}
