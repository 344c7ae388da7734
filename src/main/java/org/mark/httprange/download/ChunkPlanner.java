package org.mark.httprange.download;

import java.util.ArrayList;
import java.util.List;

import org.mark.httprange.download.struct.FileChunk;
import org.mark.httprange.download.struct.MemoryChunk;

/**
 * 	按固定大小切分资源。先切出 size/chunkSize 个整块，不能整除时最后再补一个较短的块，
 * 	所有分片正好覆盖 [0, size)，不重叠也没有空隙。
 */
public final class ChunkPlanner {
	
	public static final int DEFAULT_CHUNK_SIZE = 64 * 1024;
	
	/**
	 * 	内存模式：每个分片都是目标缓冲区上的一个窗口
	 * @param buffer
	 * @param chunkSize
	 * @return
	 */
	public static List<MemoryChunk> planMemory(byte[] buffer, int chunkSize) {
		checkChunkSize(chunkSize);
		int totalSize = buffer.length;
		int taskCount = totalSize / chunkSize;
		List<MemoryChunk> result = new ArrayList<>(taskCount + 1);
		int offset = 0;
		for (int i = 0; i < taskCount; i++) {
			result.add(new MemoryChunk(offset, buffer, offset, chunkSize));
			offset += chunkSize;
		}
		if (offset < totalSize) {
			result.add(new MemoryChunk(offset, buffer, offset, totalSize - offset));
		}
		return result;
	}
	
	/**
	 * 	文件模式：只记录偏移和大小
	 * @param totalSize
	 * @param chunkSize
	 * @return
	 */
	public static List<FileChunk> planFile(long totalSize, long chunkSize) {
		checkChunkSize(chunkSize);
		if (totalSize < 0) {
			throw new IllegalArgumentException("totalSize must be >= 0");
		}
		long taskCount = totalSize / chunkSize;
		if (taskCount + 1 > Integer.MAX_VALUE) {
			throw new IllegalArgumentException("too many chunks: " + taskCount);
		}
		List<FileChunk> result = new ArrayList<>((int) taskCount + 1);
		long offset = 0;
		for (long i = 0; i < taskCount; i++) {
			result.add(new FileChunk(offset, chunkSize));
			offset += chunkSize;
		}
		if (offset < totalSize) {
			result.add(new FileChunk(offset, totalSize - offset));
		}
		return result;
	}
	
	private static void checkChunkSize(long chunkSize) {
		if (chunkSize < 1) {
			throw new IllegalArgumentException("chunkSize must be >= 1");
		}
	}
	
	private ChunkPlanner() {
		
	}
}
