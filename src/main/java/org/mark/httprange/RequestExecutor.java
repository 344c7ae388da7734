package org.mark.httprange;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * 	执行一个完整的GET请求并返回响应。可以是连接池客户端、测试桩或者带统计的代理。
 * 	实现必须可以被多个线程同时调用。
 */
@FunctionalInterface
public interface RequestExecutor {
	
	/**
	 * 	执行请求。调用方负责关闭响应体。
	 * @param request
	 * @return
	 * @throws IOException
	 * @throws InterruptedException
	 */
	HttpResponse<InputStream> execute(HttpRequest request) throws IOException, InterruptedException;
}
