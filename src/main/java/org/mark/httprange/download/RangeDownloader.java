package org.mark.httprange.download;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.mark.httprange.HttpHeaders;
import org.mark.httprange.RangeReader;
import org.mark.httprange.ReadResult;
import org.mark.httprange.RequestExecutor;
import org.mark.httprange.download.struct.ChunkResult;
import org.mark.httprange.download.struct.DownloadProgress;
import org.mark.httprange.download.struct.DownloadState;
import org.mark.httprange.download.struct.FileChunk;
import org.mark.httprange.download.struct.MemoryChunk;
import org.mark.httprange.exception.LengthMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 	基于范围请求的并行分片下载。
 * 	<p>
 * 	先用 {@link RangeReader} 探测资源大小，再按固定大小切成分片，由固定数量的线程并发下载。
 * 	任何一个分片失败都会取消整个下载，其它线程在拿下一个分片前退出，最终只抛出第一个错误。
 * 	失败不会重试，也不会返回部分结果。
 * 	<p>
 * 	两种输出：下载到内存（分片直接写进目标数组的对应位置，不需要合并），
 * 	或者下载到文件（所有写操作交给单独的写线程串行完成）。
 * 	<p>
 * 	一个实例同一时间只能执行一个下载。
 */
public class RangeDownloader {

	private static final Logger logger = LoggerFactory.getLogger(RangeDownloader.class);

	/**
	 * 	Java数组的长度上限
	 */
	private static final long MAX_BUFFER_SIZE = Integer.MAX_VALUE - 8;

	private final RequestExecutor executor;
	private final DownloadConfig config;

	private final AtomicBoolean running = new AtomicBoolean(false);
	private final AtomicLong downloadedBytes = new AtomicLong(0);
	private final AtomicInteger chunksTotal = new AtomicInteger(0);
	private final AtomicInteger chunksCompleted = new AtomicInteger(0);
	private volatile DownloadState state = DownloadState.IDLE;
	private volatile URI sourceUri;
	private volatile Path targetFile;
	private volatile long totalBytes = -1;
	private volatile long startedAtNanos;
	private volatile long finishedAtNanos;
	private volatile String errorMessage;
	private volatile DownloadScope activeScope;
	private volatile ExecutorService activePool;

	public RangeDownloader(RequestExecutor executor) {
		this(executor, DownloadConfig.defaults());
	}

	public RangeDownloader(RequestExecutor executor, DownloadConfig config) {
		this.executor = Objects.requireNonNull(executor, "executor");
		this.config = Objects.requireNonNull(config, "config");
	}

	public DownloadConfig getConfig() {
		return this.config;
	}

	public DownloadState getState() {
		return this.state;
	}

	public DownloadProgress getProgress() {
		return new DownloadProgress(
				this.state,
				this.sourceUri,
				this.targetFile,
				this.totalBytes,
				this.downloadedBytes.get(),
				this.chunksTotal.get(),
				this.chunksCompleted.get(),
				this.elapsedMillis(),
				this.errorMessage);
	}

	private long elapsedMillis() {
		long start = this.startedAtNanos;
		if (start == 0) {
			return 0;
		}
		long end = this.finishedAtNanos != 0 ? this.finishedAtNanos : System.nanoTime();
		return (end - start) / 1_000_000L;
	}

	/**
	 * 	下载整个资源到内存
	 * @param uri
	 * @return
	 * @throws IOException
	 * @throws InterruptedException
	 */
	public byte[] download(URI uri) throws IOException, InterruptedException {
		return this.download(this.newPrototype(uri));
	}

	/**
	 * 	用自定义的请求原型下载到内存，原型必须是GET
	 * @param prototype
	 * @return
	 * @throws IOException
	 * @throws InterruptedException
	 */
	public byte[] download(HttpRequest prototype) throws IOException, InterruptedException {
		Objects.requireNonNull(prototype, "prototype");
		return this.track(prototype.uri(), null, () -> this.downloadToBuffer(prototype));
	}

	/**
	 * 	下载到内存并校验sha256。摘要格式错误会在下载前抛出 IllegalArgumentException。
	 * @param uri
	 * @param sha256Hex
	 * @return
	 * @throws IOException
	 * @throws InterruptedException
	 */
	public byte[] downloadWithChecksum(URI uri, String sha256Hex) throws IOException, InterruptedException {
		ChecksumVerifier.parseSha256(sha256Hex);
		HttpRequest prototype = this.newPrototype(uri);
		return this.track(uri, null, () -> {
			byte[] content = this.downloadToBuffer(prototype);
			this.state = DownloadState.VERIFYING;
			ChecksumVerifier.verify(content, sha256Hex);
			return content;
		});
	}

	/**
	 * 	下载到文件
	 * @param uri
	 * @param file
	 * @throws IOException
	 * @throws InterruptedException
	 */
	public void downloadToFile(URI uri, Path file) throws IOException, InterruptedException {
		this.downloadToFile(this.newPrototype(uri), file);
	}

	public void downloadToFile(HttpRequest prototype, Path file) throws IOException, InterruptedException {
		Objects.requireNonNull(prototype, "prototype");
		Objects.requireNonNull(file, "file");
		this.track(prototype.uri(), file, () -> {
			this.downloadToPath(prototype, file);
			return null;
		});
	}

	/**
	 * 	停止当前的下载，下载方法会抛出 InterruptedException。
	 */
	public void requestStop() {
		DownloadScope scope = this.activeScope;
		if (scope != null && scope.fail(new InterruptedException("下载已停止"))) {
			logger.info("收到停止请求: {}", this.sourceUri);
		}
		ExecutorService pool = this.activePool;
		if (pool != null) {
			pool.shutdownNow();
		}
	}

	private HttpRequest newPrototype(URI uri) {
		Objects.requireNonNull(uri, "uri");
		return HttpRequest.newBuilder()
				.uri(uri)
				.header(HttpHeaders.USER_AGENT, this.config.getUserAgent())
				.GET()
				.build();
	}

	/**
	 * 	记录下载的状态变化，和具体的输出方式无关
	 */
	private <T> T track(URI uri, Path file, DownloadAction<T> action) throws IOException, InterruptedException {
		if (!this.running.compareAndSet(false, true)) {
			throw new IllegalStateException("another download is running: " + this.sourceUri);
		}
		this.resetProgress(uri, file);
		this.startedAtNanos = System.nanoTime();

		try {
			this.state = DownloadState.PREPARING;
			T result = action.run();
			this.state = DownloadState.COMPLETED;
			logger.info("下载完成: {} {} 字节，耗时 {}ms", uri, this.downloadedBytes.get(),
					this.elapsedMillis());
			return result;
		} catch (InterruptedException e) {
			this.state = DownloadState.IDLE;
			this.errorMessage = e.getMessage();
			throw e;
		} catch (IOException | RuntimeException e) {
			this.state = DownloadState.FAILED;
			this.errorMessage = e.getMessage();
			logger.warn("下载失败: {} {}", uri, e.toString());
			throw e;
		} finally {
			this.finishedAtNanos = System.nanoTime();
			this.activeScope = null;
			this.activePool = null;
			this.running.set(false);
		}
	}

	private void resetProgress(URI uri, Path file) {
		this.sourceUri = uri;
		this.targetFile = file;
		this.totalBytes = -1;
		this.downloadedBytes.set(0);
		this.chunksTotal.set(0);
		this.chunksCompleted.set(0);
		this.finishedAtNanos = 0;
		this.errorMessage = null;
		this.activeScope = new DownloadScope();
		this.state = DownloadState.IDLE;
	}

	private RangeReader prepare(HttpRequest prototype) throws IOException, InterruptedException {
		this.checkStop();
		RangeReader reader = new RangeReader(this.executor, prototype);
		this.totalBytes = reader.size();
		return reader;
	}

	private byte[] downloadToBuffer(HttpRequest prototype) throws IOException, InterruptedException {
		RangeReader reader = this.prepare(prototype);
		long totalSize = reader.size();
		if (totalSize < 0) {
			throw new IOException("无法获取文件大小: " + prototype.uri());
		}
		if (totalSize > MAX_BUFFER_SIZE) {
			throw new IOException("文件太大，无法下载到内存: " + totalSize + " 字节");
		}

		byte[] buffer = new byte[(int) totalSize];
		List<MemoryChunk> chunks = ChunkPlanner.planMemory(buffer, this.config.getChunkSize());
		this.chunksTotal.set(chunks.size());
		this.state = DownloadState.DOWNLOADING;
		logger.info("开始下载到内存: {} {} 字节，{} 个分片", prototype.uri(), totalSize, chunks.size());

		this.runChunks(reader, chunks, (chunkReader, chunk) -> {
			this.readChunk(chunkReader, chunk.getBuffer(), chunk.getBufferOffset(), chunk.getLength(), chunk.getOffset());
			return true;
		}, null);
		return buffer;
	}

	private void downloadToPath(HttpRequest prototype, Path file) throws IOException, InterruptedException {
		RangeReader reader = this.prepare(prototype);
		long totalSize = reader.size();
		if (totalSize < 0) {
			throw new IOException("无法获取文件大小: " + prototype.uri());
		}

		List<FileChunk> chunks = ChunkPlanner.planFile(totalSize, this.config.getChunkSize());
		this.chunksTotal.set(chunks.size());
		ensureParentDirectory(file);

		boolean completed = false;
		try (FileChannel channel = FileChannel.open(file,
				StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
			this.state = DownloadState.DOWNLOADING;
			logger.info("开始下载到文件: {} -> {} {} 字节，{} 个分片", prototype.uri(), file, totalSize, chunks.size());

			BlockingQueue<ChunkResult> results = new ArrayBlockingQueue<>(this.config.getConcurrency());
			DownloadScope scope = this.activeScope;
			Callable<Long> writer = this.newChunkWriter(channel, results, totalSize, scope);

			this.runChunks(reader, chunks, (chunkReader, chunk) -> {
				byte[] content = new byte[(int) chunk.getSize()];
				this.readChunk(chunkReader, content, 0, content.length, chunk.getOffset());
				return handOff(results, new ChunkResult(chunk.getOffset(), content), scope);
			}, writer);
			completed = true;
		} finally {
			if (!completed) {
				this.deletePartialFile(file);
			}
		}
	}

	/**
	 * 	文件模式的写任务，写入失败同样会取消所有分片
	 */
	Callable<Long> newChunkWriter(FileChannel channel, BlockingQueue<ChunkResult> results, long totalSize,
			DownloadScope scope) {
		return new ChunkWriter(channel, results, totalSize, scope);
	}

	/**
	 * 	把结果交给写线程，队列满时等待，期间被取消就放弃
	 * @return 是否继续下载下一个分片
	 */
	private static boolean handOff(BlockingQueue<ChunkResult> results, ChunkResult result, DownloadScope scope)
			throws InterruptedException {
		while (!results.offer(result, ChunkWriter.POLL_MILLIS, TimeUnit.MILLISECONDS)) {
			if (scope.isCancelled()) {
				return false;
			}
		}
		return true;
	}

	/**
	 * 	下载一个分片。每个分片用一个带时限的派生读取器，复用探测时的元数据。
	 */
	private void readChunk(RangeReader chunkReader, byte[] b, int off, int len, long offset)
			throws IOException, InterruptedException {
		ReadResult result = chunkReader.readAt(b, off, len, offset);
		if (result.getBytesRead() != len) {
			throw new LengthMismatchException("download size not equal with expect size, for chunk(offset "
					+ offset + " size " + len + ")", len, result.getBytesRead());
		}
		this.downloadedBytes.addAndGet(len);
		this.chunksCompleted.incrementAndGet();
	}

	/**
	 * 	用固定数量的线程消费预先填满的分片队列，writer不为null时额外占用一个线程。
	 */
	private <C> void runChunks(RangeReader reader, List<C> chunks, ChunkHandler<C> handler, Callable<Long> writer)
			throws IOException, InterruptedException {
		DownloadScope scope = this.activeScope;
		if (chunks.isEmpty()) {
			return;
		}
		Queue<C> queue = new ConcurrentLinkedQueue<>(chunks);
		int workerCount = Math.min(this.config.getConcurrency(), chunks.size());

		ExecutorService pool = Executors.newFixedThreadPool(writer == null ? workerCount : workerCount + 1);
		ScheduledThreadPoolExecutor watchdog = new ScheduledThreadPoolExecutor(1);
		watchdog.setRemoveOnCancelPolicy(true);
		RangeReader chunkReader = reader.withTimeout(this.config.getChunkTimeout(), watchdog);
		try {
			this.checkStop();
			List<Future<?>> futures = new ArrayList<>();
			for (int i = 0; i < workerCount; i++) {
				futures.add(pool.submit(guard(scope, () -> {
					while (!scope.isCancelled()) {
						C chunk = queue.poll();
						if (chunk == null) {
							return null;
						}
						if (!handler.handle(chunkReader, chunk)) {
							return null;
						}
					}
					return null;
				})));
			}
			if (writer != null) {
				futures.add(pool.submit(guard(scope, writer)));
			}
			// 全部提交后才公开给 requestStop，之前收到的停止请求在这里补上
			this.activePool = pool;
			if (scope.getFirstError() instanceof InterruptedException) {
				pool.shutdownNow();
			}

			for (Future<?> f : futures) {
				try {
					f.get();
				} catch (ExecutionException e) {
					scope.fail(e.getCause());
				} catch (InterruptedException e) {
					scope.fail(e);
					throw e;
				}
			}
		} finally {
			pool.shutdownNow();
			watchdog.shutdownNow();
			this.activePool = null;
		}
		scope.throwIfFailed();
	}

	/**
	 * 	任务出错时记录到scope并取消其它任务；scope已取消后的错误只记日志。
	 */
	private static <T> Callable<T> guard(DownloadScope scope, Callable<T> task) {
		return () -> {
			try {
				return task.call();
			} catch (Throwable e) {
				if (scope.fail(e)) {
					logger.info("分片下载失败，取消其余任务: {}", e.toString());
				} else {
					logger.debug("取消后的错误: {}", e.toString());
				}
				return null;
			}
		};
	}

	private void deletePartialFile(Path file) {
		try {
			if (Files.deleteIfExists(file)) {
				logger.info("已删除未完成的文件: {}", file);
			}
		} catch (IOException e) {
			logger.warn("删除未完成的文件失败: {}", file, e);
		}
	}

	private void checkStop() throws InterruptedException {
		DownloadScope scope = this.activeScope;
		if ((scope != null && scope.getFirstError() instanceof InterruptedException) || Thread.currentThread().isInterrupted()) {
			throw new InterruptedException("下载已停止");
		}
	}

	private static void ensureParentDirectory(Path targetFile) throws IOException {
		Path parent = targetFile.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
	}

	@FunctionalInterface
	private interface DownloadAction<T> {
		T run() throws IOException, InterruptedException;
	}

	/**
	 * 	处理一个分片，返回false表示已取消、不要再拿下一个分片
	 */
	@FunctionalInterface
	private interface ChunkHandler<C> {
		boolean handle(RangeReader chunkReader, C chunk) throws IOException, InterruptedException;
	}
}
