package org.zabbixds.integrations.grafana.cache.key;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import org.zabbixds.integrations.grafana.api.ZabbixApiClient;

/**
 * Keys a remote read by its method and the exact serialized params.
 */
public class CacheGetKey extends CacheKey
{
	private static final Gson gson = new Gson();

	protected final String method;
	protected final Object params;
	protected final String requestId;

	public CacheGetKey(ZabbixApiClient apiClient, String method, Object params)
	{
		super(apiClient);

		this.method = method;
		this.params = params;
		this.requestId = method + " " + gson.toJson(params);
	}

	public String getMethod()
	{
		return method;
	}

	@Override
	protected String getRequestId()
	{
		return requestId;
	}

	@Override
	protected JsonElement internalLoad()
	{
		return apiClient.request(method, params);
	}

	@Override
	public String toString()
	{
		return requestId;
	}
}
