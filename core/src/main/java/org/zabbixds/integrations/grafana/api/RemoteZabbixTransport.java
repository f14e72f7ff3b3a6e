package org.zabbixds.integrations.grafana.api;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.concurrent.atomic.AtomicInteger;

import javax.net.ssl.SSLContext;

import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.cookie.BasicCookieStore;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.ssl.NoopHostnameVerifier;
import org.apache.hc.client5.http.ssl.SSLConnectionSocketFactoryBuilder;
import org.apache.hc.client5.http.ssl.TrustAllStrategy;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.ssl.SSLContexts;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonParseException;

public class RemoteZabbixTransport implements ZabbixTransport, Closeable
{
	private static final Logger logger = LoggerFactory.getLogger(RemoteZabbixTransport.class);

	public static final int DEFAULT_TIMEOUT = 30000;
	public static final int MIN_TIMEOUT = 5000;

	private static final int MAX_LOGGED_BODY = 1000;

	private final String url;
	private final String basicAuth;
	private final CloseableHttpClient httpClient;
	private final AtomicInteger requestId;
	private final Gson gson;

	private static class HttpResult
	{
		private final int status;
		private final String body;

		private HttpResult(int status, String body)
		{
			this.status = status;
			this.body = body;
		}
	}

	private RemoteZabbixTransport(String url, String basicAuth, CloseableHttpClient httpClient)
	{
		this.url = url;
		this.basicAuth = basicAuth;
		this.httpClient = httpClient;
		this.requestId = new AtomicInteger();
		this.gson = new Gson();
	}

	@Override
	public String getUrl()
	{
		return url;
	}

	@Override
	public JsonElement send(String method, Object params, String auth)
	{
		ApiRequest apiRequest = ApiRequest.of(method, params, auth, requestId.incrementAndGet());
		String json = gson.toJson(apiRequest);

		HttpPost post = new HttpPost(url);
		post.setEntity(new StringEntity(json, ContentType.APPLICATION_JSON));

		if (!Strings.isNullOrEmpty(basicAuth))
		{
			post.setHeader(HttpHeaders.AUTHORIZATION, basicAuth);
		}

		logger.debug("Zabbix request {} to {}", method, url);

		HttpResult httpResult;

		try
		{
			httpResult = httpClient.execute(post, response ->
			{
				HttpEntity entity = response.getEntity();
				String body = (entity != null) ? EntityUtils.toString(entity, StandardCharsets.UTF_8) : null;

				return new HttpResult(response.getCode(), body);
			});
		}
		catch (IOException e)
		{
			throw new ZabbixNetworkException(url, "Error calling " + method + ": " + e.getMessage(), e);
		}

		if ((httpResult.status < 200) || (httpResult.status >= 300))
		{
			throw new ZabbixNetworkException(url, "Invalid status code " + httpResult.status + " for " + method);
		}

		if (logger.isDebugEnabled())
		{
			String body = Strings.nullToEmpty(httpResult.body);
			logger.debug("Zabbix response {}: {}", method, body.substring(0, Math.min(MAX_LOGGED_BODY, body.length())));
		}

		return parseResponse(method, httpResult.body);
	}

	private JsonElement parseResponse(String method, String body)
	{
		ApiResponse response;

		try
		{
			response = gson.fromJson(body, ApiResponse.class);
		}
		catch (JsonParseException e)
		{
			throw new ZabbixNetworkException(url, "Could not parse response for " + method, e);
		}

		if (response == null)
		{
			throw new ZabbixNetworkException(url, "Empty response for " + method);
		}

		if (response.error != null)
		{
			throw new ZabbixApiException(response.error.code, response.error.message, response.error.data);
		}

		if (response.result == null)
		{
			return JsonNull.INSTANCE;
		}

		return response.result;
	}

	@Override
	public void close() throws IOException
	{
		httpClient.close();
	}

	public static Builder newBuilder()
	{
		return new Builder();
	}

	public static class Builder
	{
		private String url;
		private String basicAuth;
		private boolean withCredentials;
		private boolean tlsSkipVerify;
		private int timeout = DEFAULT_TIMEOUT;

		private Builder()
		{
		}

		public Builder setUrl(String url)
		{
			this.url = url;
			return this;
		}

		/**
		 * The full value of the Authorization header, e.g. "Basic dXNlcjpwYXNz".
		 */
		public Builder setBasicAuth(String basicAuth)
		{
			this.basicAuth = basicAuth;
			return this;
		}

		public Builder setWithCredentials(boolean withCredentials)
		{
			this.withCredentials = withCredentials;
			return this;
		}

		public Builder setTlsSkipVerify(boolean tlsSkipVerify)
		{
			this.tlsSkipVerify = tlsSkipVerify;
			return this;
		}

		public Builder setTimeout(int timeout)
		{
			this.timeout = Math.max(MIN_TIMEOUT, timeout);
			return this;
		}

		public RemoteZabbixTransport build()
		{
			if (Strings.isNullOrEmpty(url))
			{
				throw new IllegalArgumentException("url");
			}

			Timeout clientTimeout = Timeout.ofMilliseconds(timeout);

			PoolingHttpClientConnectionManagerBuilder connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
					.setDefaultConnectionConfig(ConnectionConfig.custom()
							.setConnectTimeout(clientTimeout)
							.setSocketTimeout(clientTimeout)
							.build());

			if (tlsSkipVerify)
			{
				connectionManager.setSSLSocketFactory(SSLConnectionSocketFactoryBuilder.create()
						.setSslContext(trustAllContext())
						.setHostnameVerifier(NoopHostnameVerifier.INSTANCE)
						.build());
			}

			HttpClientBuilder clientBuilder = HttpClients.custom()
					.setConnectionManager(connectionManager.build())
					.setDefaultRequestConfig(RequestConfig.custom()
							.setConnectionRequestTimeout(clientTimeout)
							.setResponseTimeout(clientTimeout)
							.build());

			// cookies set by the endpoint are only replayed when credentials are forwarded
			if (withCredentials)
			{
				clientBuilder.setDefaultCookieStore(new BasicCookieStore());
			}
			else
			{
				clientBuilder.disableCookieManagement();
			}

			return new RemoteZabbixTransport(url, basicAuth, clientBuilder.build());
		}

		private static SSLContext trustAllContext()
		{
			try
			{
				return SSLContexts.custom()
						.loadTrustMaterial(null, TrustAllStrategy.INSTANCE)
						.build();
			}
			catch (GeneralSecurityException e)
			{
				throw new IllegalStateException("Could not create trust-all SSL context", e);
			}
		}
	}
}
