package org.mark.httprange.download.struct;

import java.util.Objects;

/**
 * 	下载线程交给写文件线程的结果，到达顺序不保证按偏移递增。
 */
public final class ChunkResult {
	private final long offset;
	private final byte[] content;

	public ChunkResult(long offset, byte[] content) {
		this.offset = offset;
		this.content = Objects.requireNonNull(content, "content");
	}

	public long getOffset() {
		return this.offset;
	}

	public byte[] getContent() {
		return this.content;
	}
}
