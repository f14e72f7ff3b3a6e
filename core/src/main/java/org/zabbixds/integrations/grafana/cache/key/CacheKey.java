package org.zabbixds.integrations.grafana.cache.key;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.gson.JsonElement;
import org.zabbixds.integrations.grafana.api.ZabbixApiClient;

public abstract class CacheKey
{
	private static final Logger logger = LoggerFactory.getLogger(CacheKey.class);
	private static boolean PRINT_DURATIONS = true;

	protected final ZabbixApiClient apiClient;

	protected CacheKey(ZabbixApiClient apiClient)
	{
		this.apiClient = apiClient;
	}

	public ZabbixApiClient getApiClient()
	{
		return apiClient;
	}

	protected boolean printDuration()
	{
		return PRINT_DURATIONS;
	}

	@Override
	public boolean equals(Object o)
	{
		if (o == this)
		{
			return true;
		}

		if (!(o instanceof CacheKey))
		{
			return false;
		}

		CacheKey other = (CacheKey)o;

		return ((Objects.equal(apiClient.getHostname(), other.apiClient.getHostname())) &&
				(Objects.equal(getRequestId(), other.getRequestId())));
	}

	@Override
	public int hashCode()
	{
		return Strings.nullToEmpty(apiClient.getHostname()).hashCode() ^ getRequestId().hashCode();
	}

	/**
	 * Runs the remote request behind this key. Domain exceptions reach the caller unchanged so that
	 * auth and capability errors keep their type.
	 */
	public JsonElement load()
	{
		long t1 = System.currentTimeMillis();

		try
		{
			JsonElement result = internalLoad();

			long t2 = System.currentTimeMillis();

			if (printDuration())
			{
				double sec = (double) (t2 - t1) / 1000;
				logger.info(sec + " sec: " + toString());
			}

			return result;
		}
		catch (RuntimeException e)
		{
			long t2 = System.currentTimeMillis();

			logger.warn("Error executing after " + ((double) (t2 - t1) / 1000) + " sec: " + toString() + ": " + e.getMessage());

			throw e;
		}
	}

	protected abstract String getRequestId();
	protected abstract JsonElement internalLoad();
}
