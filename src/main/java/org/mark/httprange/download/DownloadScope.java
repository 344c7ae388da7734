package org.mark.httprange.download;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 	一次下载的取消范围。第一个失败的任务记录错误并取消整个范围，
 * 	其它任务在拿下一个分片之前检查取消标记，安静地退出，不再报告额外的错误。
 */
public final class DownloadScope {
	
	private final AtomicReference<Throwable> firstError = new AtomicReference<>();
	private final AtomicBoolean cancelled = new AtomicBoolean(false);
	
	/**
	 * 	记录失败并取消。
	 * @param error
	 * @return 是否是第一个错误
	 */
	public boolean fail(Throwable error) {
		boolean first = this.firstError.compareAndSet(null, error);
		this.cancel();
		return first;
	}
	
	public void cancel() {
		this.cancelled.set(true);
	}
	
	public boolean isCancelled() {
		return this.cancelled.get();
	}
	
	public Throwable getFirstError() {
		return this.firstError.get();
	}
	
	/**
	 * 	如果有错误，按原来的类型抛出第一个错误
	 * @throws IOException
	 * @throws InterruptedException
	 */
	public void throwIfFailed() throws IOException, InterruptedException {
		Throwable cause = this.firstError.get();
		if (cause == null) {
			return;
		}
		if (cause instanceof InterruptedException ie) {
			throw ie;
		}
		if (cause instanceof IOException io) {
			throw io;
		}
		if (cause instanceof RuntimeException re) {
			throw re;
		}
		if (cause instanceof Error err) {
			throw err;
		}
		throw new IOException(cause);
	}
}
