package org.mark.httprange.download;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.mark.httprange.download.struct.FileChunk;
import org.mark.httprange.download.struct.MemoryChunk;

public class ChunkPlannerTest {

	@Test
	void plansExampleResource() {
		List<FileChunk> chunks = ChunkPlanner.planFile(200_000, ChunkPlanner.DEFAULT_CHUNK_SIZE);

		assertEquals(4, chunks.size());
		assertEquals(65536, chunks.get(0).getSize());
		assertEquals(65536, chunks.get(1).getSize());
		assertEquals(65536, chunks.get(2).getSize());
		assertEquals(3392, chunks.get(3).getSize());
		assertEquals(196608, chunks.get(3).getOffset());
		assertEquals(199_999, chunks.get(3).getEndInclusive());
	}

	@Test
	void fileChunksPartitionTheResource() {
		long[] sizes = { 0, 1, 2, 63, 64, 65, 127, 128, 1000, 4096, 65535, 65536, 65537, 200_000, 1_000_003 };
		long[] chunkSizes = { 1, 3, 64, 1000, 4096, 65536 };
		for (long total : sizes) {
			for (long chunkSize : chunkSizes) {
				if (total / chunkSize > 100_000) {
					continue;
				}
				List<FileChunk> chunks = ChunkPlanner.planFile(total, chunkSize);
				long expectedOffset = 0;
				for (FileChunk chunk : chunks) {
					// 按顺序首尾相接，就说明没有空隙也没有重叠
					assertEquals(expectedOffset, chunk.getOffset(), "T=" + total + " C=" + chunkSize);
					assertTrue(chunk.getSize() >= 1 && chunk.getSize() <= chunkSize);
					expectedOffset += chunk.getSize();
				}
				assertEquals(total, expectedOffset, "T=" + total + " C=" + chunkSize);
				assertEquals((total + chunkSize - 1) / chunkSize, chunks.size());
			}
		}
	}

	@Test
	void memoryChunksAreWindowsIntoTheBuffer() {
		int[] sizes = { 0, 1, 100, 4095, 4096, 4097, 200_000 };
		int[] chunkSizes = { 1, 7, 4096, 65536 };
		for (int total : sizes) {
			for (int chunkSize : chunkSizes) {
				byte[] buffer = new byte[total];
				List<MemoryChunk> chunks = ChunkPlanner.planMemory(buffer, chunkSize);
				int expectedOffset = 0;
				for (MemoryChunk chunk : chunks) {
					assertSame(buffer, chunk.getBuffer());
					assertEquals(expectedOffset, chunk.getOffset());
					assertEquals(expectedOffset, chunk.getBufferOffset());
					assertTrue(chunk.getLength() >= 1 && chunk.getLength() <= chunkSize);
					expectedOffset += chunk.getLength();
				}
				assertEquals(total, expectedOffset);
			}
		}
	}

	@Test
	void rejectsInvalidArguments() {
		assertThrows(IllegalArgumentException.class, () -> ChunkPlanner.planFile(10, 0));
		assertThrows(IllegalArgumentException.class, () -> ChunkPlanner.planFile(-1, 10));
		assertThrows(IllegalArgumentException.class, () -> ChunkPlanner.planMemory(new byte[10], 0));
	}
}
