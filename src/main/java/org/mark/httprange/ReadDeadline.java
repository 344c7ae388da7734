package org.mark.httprange;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 	单次读取的时限。到期后中断读取线程并关闭响应体，让阻塞在请求或读流上的线程尽快退出。
 */
final class ReadDeadline implements AutoCloseable {
	
	private static final Logger logger = LoggerFactory.getLogger(ReadDeadline.class);
	
	private final Thread owner;
	private final AtomicBoolean expired = new AtomicBoolean(false);
	private final AtomicBoolean closed = new AtomicBoolean(false);
	private volatile InputStream body;
	private final ScheduledFuture<?> future;
	
	private ReadDeadline(ScheduledExecutorService watchdog, Duration timeout) {
		this.owner = Thread.currentThread();
		this.future = watchdog.schedule(this::expire, timeout.toNanos(), TimeUnit.NANOSECONDS);
	}
	
	static ReadDeadline arm(ScheduledExecutorService watchdog, Duration timeout) {
		return new ReadDeadline(watchdog, timeout);
	}
	
	/**
	 * 	登记当前读取的响应体，到期时一并关闭
	 * @param body
	 */
	void attach(InputStream body) {
		this.body = body;
		if (this.expired.get()) {
			closeBody(body);
		}
	}
	
	boolean isExpired() {
		return this.expired.get();
	}
	
	private synchronized void expire() {
		if (this.closed.get()) {
			return;
		}
		this.expired.set(true);
		this.owner.interrupt();
		InputStream in = this.body;
		if (in != null) {
			closeBody(in);
		}
	}
	
	private static void closeBody(InputStream in) {
		try {
			in.close();
		} catch (IOException e) {
			logger.debug("关闭超时的响应体失败", e);
		}
	}
	
	@Override
	public synchronized void close() {
		this.closed.set(true);
		this.future.cancel(false);
		if (this.expired.get()) {
			// 到期时投递的中断不能带出本次读取
			Thread.interrupted();
		}
	}
}
