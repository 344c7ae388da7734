package org.mark.httprange;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import javax.net.ssl.SSLSession;

/**
 * 	测试用的响应，头和响应体都由测试直接指定。
 */
public final class FakeResponse implements HttpResponse<InputStream> {

	private final HttpRequest request;
	private final int statusCode;
	private final java.net.http.HttpHeaders headers;
	private final InputStream body;

	public FakeResponse(HttpRequest request, int statusCode, Map<String, String> headers, InputStream body) {
		this.request = request;
		this.statusCode = statusCode;
		Map<String, List<String>> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		headers.forEach((k, v) -> map.put(k, List.of(v)));
		this.headers = java.net.http.HttpHeaders.of(map, (k, v) -> true);
		this.body = body;
	}

	public FakeResponse(HttpRequest request, int statusCode, Map<String, String> headers, byte[] body) {
		this(request, statusCode, headers, new ByteArrayInputStream(body));
	}

	@Override
	public int statusCode() {
		return this.statusCode;
	}

	@Override
	public HttpRequest request() {
		return this.request;
	}

	@Override
	public Optional<HttpResponse<InputStream>> previousResponse() {
		return Optional.empty();
	}

	@Override
	public java.net.http.HttpHeaders headers() {
		return this.headers;
	}

	@Override
	public InputStream body() {
		return this.body;
	}

	@Override
	public Optional<SSLSession> sslSession() {
		return Optional.empty();
	}

	@Override
	public URI uri() {
		return this.request.uri();
	}

	@Override
	public HttpClient.Version version() {
		return HttpClient.Version.HTTP_1_1;
	}
}
