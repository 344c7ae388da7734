package org.mark.httprange.download.struct;

/**
 * 	文件模式的分片，只有偏移和大小，缓冲区由下载线程自己分配。
 */
public final class FileChunk {
	private final long offset;
	private final long size;

	public FileChunk(long offset, long size) {
		if (offset < 0 || size < 1) {
			throw new IllegalArgumentException("invalid chunk: offset=" + offset + " size=" + size);
		}
		this.offset = offset;
		this.size = size;
	}

	public long getOffset() {
		return this.offset;
	}

	public long getSize() {
		return this.size;
	}

	public long getEndInclusive() {
		return this.offset + this.size - 1;
	}

	@Override
	public String toString() {
		return "FileChunk{offset=" + this.offset + ", size=" + this.size + "}";
	}
}
