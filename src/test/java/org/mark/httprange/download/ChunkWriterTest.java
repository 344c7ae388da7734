package org.mark.httprange.download;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.channels.ClosedChannelException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mark.httprange.download.struct.ChunkResult;

public class ChunkWriterTest {

	@TempDir
	Path dir;

	private FileChannel open(Path file) throws Exception {
		return FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
	}

	@Test
	void writesChunksAtTheirOffsets() throws Exception {
		Path file = dir.resolve("out.bin");
		BlockingQueue<ChunkResult> results = new ArrayBlockingQueue<>(4);
		results.add(new ChunkResult(4, new byte[] { 5, 6 }));
		results.add(new ChunkResult(0, new byte[] { 1, 2, 3, 4 }));

		try (FileChannel channel = open(file)) {
			long written = new ChunkWriter(channel, results, 6, new DownloadScope()).call();
			assertEquals(6, written);
		}
		assertArrayEquals(new byte[] { 1, 2, 3, 4, 5, 6 }, Files.readAllBytes(file));
	}

	@Test
	void writeErrorIsThrown() throws Exception {
		BlockingQueue<ChunkResult> results = new ArrayBlockingQueue<>(1);
		results.add(new ChunkResult(0, new byte[] { 1 }));
		FileChannel channel = open(dir.resolve("closed.bin"));
		channel.close();

		ChunkWriter writer = new ChunkWriter(channel, results, 1, new DownloadScope());

		assertThrows(ClosedChannelException.class, writer::call);
	}

	@Test
	void cancelledScopeStopsWaiting() throws Exception {
		DownloadScope scope = new DownloadScope();
		scope.cancel();

		try (FileChannel channel = open(dir.resolve("cancelled.bin"))) {
			long written = new ChunkWriter(channel, new ArrayBlockingQueue<>(1), 100, scope).call();
			assertEquals(0, written);
		}
	}
}
