package org.mark.httprange.download;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

import org.mark.httprange.download.struct.ChunkResult;

/**
 * 	文件模式下唯一的写文件线程。按结果自带的偏移写入，写满 totalSize 字节即结束。
 * 	所有写操作都在这里串行执行，文件句柄只归它所有。
 */
final class ChunkWriter implements Callable<Long> {
	
	static final long POLL_MILLIS = 100;
	
	private final FileChannel channel;
	private final BlockingQueue<ChunkResult> results;
	private final long totalSize;
	private final DownloadScope scope;
	
	ChunkWriter(FileChannel channel, BlockingQueue<ChunkResult> results, long totalSize, DownloadScope scope) {
		this.channel = Objects.requireNonNull(channel, "channel");
		this.results = Objects.requireNonNull(results, "results");
		this.totalSize = totalSize;
		this.scope = Objects.requireNonNull(scope, "scope");
	}
	
	/**
	 * 	@return 实际写入的字节数，被取消时可能小于totalSize
	 */
	@Override
	public Long call() throws IOException, InterruptedException {
		long totalWrite = 0;
		while (totalWrite < this.totalSize) {
			if (this.scope.isCancelled()) {
				return totalWrite;
			}
			ChunkResult chunk = this.results.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
			if (chunk == null) {
				continue;
			}
			this.write(chunk);
			totalWrite += chunk.getContent().length;
		}
		return totalWrite;
	}
	
	private void write(ChunkResult chunk) throws IOException {
		ByteBuffer buffer = ByteBuffer.wrap(chunk.getContent());
		long position = chunk.getOffset();
		while (buffer.hasRemaining()) {
			position += this.channel.write(buffer, position);
		}
	}
}
