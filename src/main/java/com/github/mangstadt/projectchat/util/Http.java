package com.github.mangstadt.projectchat.util;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

import org.apache.http.HttpEntity;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.ContentType;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Helper class for sending HTTP requests.
 */
public class Http implements Closeable {
	private static final Logger logger = LoggerFactory.getLogger(Http.class);

	protected final CloseableHttpClient client;

	/**
	 * @param client the HTTP client object to wrap
	 */
	public Http(CloseableHttpClient client) {
		this.client = Objects.requireNonNull(client);
	}

	/**
	 * Sends an HTTP GET request.
	 * @param uri the URI
	 * @return the response
	 * @throws IOException if there's a problem sending the request
	 */
	public Response get(String uri) throws IOException {
		return get(uri, Map.of(), null);
	}

	/**
	 * Sends an HTTP GET request, retrying the request if it was rate limited.
	 * @param uri the URI
	 * @param headers the request headers
	 * @param rateLimitHandler defines how to handle rate-limited requests, or
	 * null to not retry
	 * @return the response
	 * @throws IOException if there's a problem sending the request
	 */
	public Response get(String uri, Map<String, String> headers, RateLimitHandler rateLimitHandler) throws IOException {
		var request = new HttpGet(uri);
		headers.forEach(request::addHeader);

		logger.atDebug().log(() -> "Sending request [method=GET; URI=" + uri + "]...");

		return send(request, rateLimitHandler);
	}

	/**
	 * Sends an HTTP request.
	 * @param request the request to send
	 * @return the response
	 * @throws IOException if there was a problem sending the request
	 */
	private Response send(HttpUriRequest request) throws IOException {
		try (CloseableHttpResponse response = client.execute(request)) {
			int statusCode = response.getStatusLine().getStatusCode();

			HttpEntity entity = response.getEntity();
			ContentType contentType;
			byte[] body;
			if (entity == null) {
				contentType = null;
				body = null;
			} else {
				contentType = ContentType.getOrDefault(entity);
				body = EntityUtils.toByteArray(entity);
			}

			var retryAfter = response.getFirstHeader("Retry-After");
			return new Response(statusCode, body, contentType, (retryAfter == null) ? null : retryAfter.getValue());
		}
	}

	/**
	 * Sends an HTTP request, retrying the request if it was rate limited.
	 * @param request the request to send
	 * @param rateLimitHandler defines how to handle rate-limited requests
	 * @return the response
	 * @throws IOException if there was a problem sending the request
	 */
	public Response send(HttpUriRequest request, RateLimitHandler rateLimitHandler) throws IOException {
		if (rateLimitHandler == null) {
			return send(request);
		}

		int attempts = 0;
		while (true) {
			attempts++;
			Response response = send(request);
			if (!rateLimitHandler.isRateLimited(response)) {
				return response;
			}

			if (attempts >= rateLimitHandler.getMaxAttempts()) {
				break;
			}

			Duration sleep = rateLimitHandler.getWaitTime(response);
			logger.atInfo().log(() -> "Sleeping for " + sleep.toMillis() + "ms before resending the request...");
			Sleeper.sleep(sleep);
		}

		throw new IOException("Request was not accepted after " + attempts + " attempts [request-method=" + request.getMethod() + "; request-URI=" + request.getURI() + "].");
	}

	@Override
	public void close() throws IOException {
		client.close();
	}

	/**
	 * Represents an HTTP response.
	 */
	public static class Response {
		private final int statusCode;
		private final byte[] body;
		private String bodyStr;
		private final ContentType contentType;
		private final String retryAfter;

		/**
		 * @param statusCode the status code (e.g. 200)
		 * @param body the response body
		 * @param contentType the content type of the body
		 * @param retryAfter the value of the "Retry-After" header or null
		 */
		public Response(int statusCode, byte[] body, ContentType contentType, String retryAfter) {
			this.statusCode = statusCode;
			this.body = body;
			this.contentType = contentType;
			this.retryAfter = retryAfter;
		}

		/**
		 * Gets the status code.
		 * @return the status code (e.g. 200)
		 */
		public int getStatusCode() {
			return statusCode;
		}

		/**
		 * Gets the value of the "Retry-After" header.
		 * @return the header value or null if not present
		 */
		public String getRetryAfter() {
			return retryAfter;
		}

		/**
		 * Gets the response body.
		 * @return the response body or null if there is no body
		 */
		public String getBody() {
			if (body == null) {
				return null;
			}

			if (bodyStr == null) {
				var charset = (contentType == null) ? null : contentType.getCharset();
				bodyStr = new String(body, (charset == null) ? StandardCharsets.UTF_8 : charset);
			}

			return bodyStr;
		}

		/**
		 * Parses the response body as JSON.
		 * @return the parsed JSON or null if there is no response body
		 * @throws JsonProcessingException if the body could not be parsed as
		 * JSON
		 */
		public JsonNode getBodyAsJson() throws JsonProcessingException {
			String bodyStr = getBody();
			return (bodyStr == null) ? null : JsonUtils.parse(bodyStr);
		}
	}

	/**
	 * Defines behavior for handling rate-limited requests.
	 */
	public interface RateLimitHandler {
		/**
		 * The maximum number of times to try sending the request before giving
		 * up.
		 * @return the max attempts
		 */
		int getMaxAttempts();

		/**
		 * Determines if the request was rate-limited.
		 * @param response the rate-limited request's response
		 * @return true if the request was rate limited, false if not
		 */
		boolean isRateLimited(Response response);

		/**
		 * Gets the amount of time to sleep before retrying the request.
		 * @param response the rate-limited request's response
		 * @return the amount of time to sleep before retrying the request
		 */
		Duration getWaitTime(Response response);
	}
}
