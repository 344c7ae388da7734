package org.mark.httprange;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.util.Objects;

/**
 * 	基于JDK HttpClient的默认实现，重定向交给HttpClient处理。
 */
public class HttpClientExecutor implements RequestExecutor {
	
	private final HttpClient httpClient;
	
	public HttpClientExecutor() {
		this(HttpClient.newBuilder()
				.followRedirects(HttpClient.Redirect.NORMAL)
				.connectTimeout(Duration.ofSeconds(30))
				.build());
	}
	
	public HttpClientExecutor(HttpClient httpClient) {
		this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
	}
	
	public HttpClient getHttpClient() {
		return this.httpClient;
	}
	
	@Override
	public HttpResponse<InputStream> execute(HttpRequest request) throws IOException, InterruptedException {
		return this.httpClient.send(request, BodyHandlers.ofInputStream());
	}
}
