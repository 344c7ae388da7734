package org.mark.httprange.download.struct;

import java.util.Objects;

/**
 * 	内存模式的分片：直接指向目标缓冲区中属于自己的那一段，读完即是最终结果，不需要合并。
 */
public final class MemoryChunk {
	private final long offset;
	private final byte[] buffer;
	private final int bufferOffset;
	private final int length;

	public MemoryChunk(long offset, byte[] buffer, int bufferOffset, int length) {
		this.buffer = Objects.requireNonNull(buffer, "buffer");
		Objects.checkFromIndexSize(bufferOffset, length, buffer.length);
		if (offset < 0 || length < 1) {
			throw new IllegalArgumentException("invalid chunk: offset=" + offset + " length=" + length);
		}
		this.offset = offset;
		this.bufferOffset = bufferOffset;
		this.length = length;
	}

	/**
	 * 	在远程资源中的偏移
	 * @return
	 */
	public long getOffset() {
		return this.offset;
	}

	public byte[] getBuffer() {
		return this.buffer;
	}

	public int getBufferOffset() {
		return this.bufferOffset;
	}

	public int getLength() {
		return this.length;
	}

	@Override
	public String toString() {
		return "MemoryChunk{offset=" + this.offset + ", length=" + this.length + "}";
	}
}
