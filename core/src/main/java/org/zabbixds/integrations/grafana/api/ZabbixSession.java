package org.zabbixds.integrations.grafana.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Objects;
import com.google.gson.JsonElement;
import org.zabbixds.integrations.grafana.output.ConnectionTestResult;

/**
 * Owns the auth token of one Zabbix endpoint. Every call goes through {@link #request(String, Object)},
 * which logs in on demand and renews the token when the endpoint reports the session as gone.
 */
public class ZabbixSession implements ZabbixApiClient
{
	private static final Logger logger = LoggerFactory.getLogger(ZabbixSession.class);

	public static final int MAX_AUTH_ATTEMPTS = 3;

	public static final String LOGIN_METHOD = "user.login";
	public static final String VERSION_METHOD = "apiinfo.version";

	public static final String AUTH_FAILED_TITLE = "Authentication failed";

	private final ZabbixTransport transport;
	private final String username;
	private final String password;

	private final Object authLock = new Object();
	private volatile String authToken;

	public ZabbixSession(ZabbixTransport transport, String username, String password)
	{
		this.transport = transport;
		this.username = username;
		this.password = password;
	}

	@Override
	public String getHostname()
	{
		return transport.getUrl();
	}

	public String getAuthToken()
	{
		return authToken;
	}

	@Override
	public JsonElement request(String method, Object params)
	{
		String staleToken = null;
		ZabbixApiException lastError = null;

		for (int attempt = 0; attempt < MAX_AUTH_ATTEMPTS; attempt++)
		{
			String token = acquireToken(staleToken);

			try
			{
				return transport.send(method, params, token);
			}
			catch (ZabbixApiException e)
			{
				if (!e.isNotAuthorized())
				{
					throw e;
				}

				logger.warn("Session for {} rejected on {} (attempt {}): {}", 
						transport.getUrl(), method, attempt + 1, e.getMessage());

				staleToken = token;
				lastError = e;
			}
		}

		throw lastError;
	}

	/**
	 * Returns the held token unless it is the one that was just rejected. Callers racing on the
	 * same stale token wait on the lock and pick up the token the first of them obtained.
	 */
	private String acquireToken(String staleToken)
	{
		String current = authToken;

		if ((current != null) && (!Objects.equal(current, staleToken)))
		{
			return current;
		}

		synchronized (authLock)
		{
			current = authToken;

			if ((current != null) && (!Objects.equal(current, staleToken)))
			{
				return current;
			}

			authToken = null;
			authToken = doLogin();

			return authToken;
		}
	}

	/**
	 * Performs user.login and keeps the returned token. Not subject to the re-login retry.
	 */
	public String login()
	{
		synchronized (authLock)
		{
			authToken = doLogin();
			return authToken;
		}
	}

	private String doLogin()
	{
		Map<String, Object> params = new LinkedHashMap<String, Object>();

		params.put("user", username);
		params.put("password", password);

		JsonElement result = transport.send(LOGIN_METHOD, params, null);

		if ((result == null) || (!result.isJsonPrimitive()))
		{
			throw new IllegalStateException("Unexpected login result from " + transport.getUrl() + ": " + result);
		}

		logger.debug("Logged in to {} as {}", transport.getUrl(), username);

		return result.getAsString();
	}

	public String getVersion()
	{
		JsonElement result = transport.send(VERSION_METHOD, Collections.emptyList(), null);

		if ((result == null) || (!result.isJsonPrimitive()))
		{
			throw new IllegalStateException("Unexpected version result from " + transport.getUrl() + ": " + result);
		}

		return result.getAsString();
	}

	public ConnectionTestResult testConnection()
	{
		String version;

		try
		{
			version = getVersion();
		}
		catch (ZabbixApiException e)
		{
			logger.warn("Version request to {} failed: {}", transport.getUrl(), e.getMessage());
			return ConnectionTestResult.authFailed(e.getErrorMessage(), e.getData());
		}
		catch (ZabbixNetworkException | IllegalStateException e)
		{
			// a reply that is not a version string is not a Zabbix API
			logger.warn("Could not connect to {}", transport.getUrl(), e);
			return ConnectionTestResult.unreachable();
		}

		try
		{
			login();

			return ConnectionTestResult.success(version);
		}
		catch (ZabbixApiException e)
		{
			logger.warn("Authentication against {} failed: {}", transport.getUrl(), e.getMessage());
			return ConnectionTestResult.authFailed(e.getErrorMessage(), e.getData());
		}
		catch (IllegalStateException e)
		{
			logger.warn("Authentication against {} failed", transport.getUrl(), e);
			return ConnectionTestResult.authFailed(AUTH_FAILED_TITLE, e.getMessage());
		}
		catch (ZabbixNetworkException e)
		{
			logger.warn("Could not connect to {}", transport.getUrl(), e);
			return ConnectionTestResult.unreachable();
		}
	}
}
