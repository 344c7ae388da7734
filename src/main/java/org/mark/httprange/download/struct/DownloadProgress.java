package org.mark.httprange.download.struct;

import java.net.URI;
import java.nio.file.Path;

/**
 * 	某一时刻的下载快照，由 RangeDownloader.getProgress() 生成，生成后不再变化。
 * 	<p>
 * 	分片按固定大小切分，只有最后一个分片可能较短，所以已完成的分片数和已下载的字节数同步增长。
 */
public final class DownloadProgress {
	private final DownloadState state;
	private final URI sourceUri;
	private final Path targetFile;
	private final long totalBytes;
	private final long downloadedBytes;
	private final int chunksTotal;
	private final int chunksCompleted;
	private final long elapsedMillis;
	private final String errorMessage;

	public DownloadProgress(
			DownloadState state,
			URI sourceUri,
			Path targetFile,
			long totalBytes,
			long downloadedBytes,
			int chunksTotal,
			int chunksCompleted,
			long elapsedMillis,
			String errorMessage) {
		this.state = state;
		this.sourceUri = sourceUri;
		this.targetFile = targetFile;
		this.totalBytes = totalBytes;
		this.downloadedBytes = downloadedBytes;
		this.chunksTotal = chunksTotal;
		this.chunksCompleted = chunksCompleted;
		this.elapsedMillis = Math.max(0, elapsedMillis);
		this.errorMessage = errorMessage;
	}

	public DownloadState getState() {
		return state;
	}

	public URI getSourceUri() {
		return sourceUri;
	}

	/**
	 * 	内存模式下为null
	 * @return
	 */
	public Path getTargetFile() {
		return targetFile;
	}

	/**
	 * 	探测前为-1
	 * @return
	 */
	public long getTotalBytes() {
		return totalBytes;
	}

	public long getDownloadedBytes() {
		return downloadedBytes;
	}

	public int getChunksTotal() {
		return chunksTotal;
	}

	public int getChunksCompleted() {
		return chunksCompleted;
	}

	public int getChunksRemaining() {
		return Math.max(0, chunksTotal - chunksCompleted);
	}

	public long getElapsedMillis() {
		return elapsedMillis;
	}

	public String getErrorMessage() {
		return errorMessage;
	}

	/**
	 * 	空资源没有分片，完成后记为1
	 */
	public double getProgressRatio() {
		if (totalBytes == 0 || chunksTotal == 0) {
			return state == DownloadState.COMPLETED ? 1.0 : 0.0;
		}
		if (totalBytes < 0) {
			return (double) chunksCompleted / chunksTotal;
		}
		return Math.min(1.0, (double) downloadedBytes / totalBytes);
	}

	public long getSpeedBytesPerSecond() {
		if (elapsedMillis == 0) {
			return 0;
		}
		return downloadedBytes * 1000L / elapsedMillis;
	}

	@Override
	public String toString() {
		return "DownloadProgress{" +
				"state=" + state +
				", source=" + sourceUri +
				", bytes=" + downloadedBytes + "/" + totalBytes +
				", chunks=" + chunksCompleted + "/" + chunksTotal +
				", elapsed=" + elapsedMillis + "ms" +
				'}';
	}
}
