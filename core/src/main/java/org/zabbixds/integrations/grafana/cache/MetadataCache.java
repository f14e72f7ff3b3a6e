package org.zabbixds.integrations.grafana.cache;

import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Throwables;
import com.google.common.base.Ticker;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.reflect.TypeToken;
import org.zabbixds.integrations.grafana.api.ZabbixApiClient;
import org.zabbixds.integrations.grafana.api.ZabbixApiException;
import org.zabbixds.integrations.grafana.api.data.Application;
import org.zabbixds.integrations.grafana.api.data.Group;
import org.zabbixds.integrations.grafana.api.data.Host;
import org.zabbixds.integrations.grafana.api.data.Item;
import org.zabbixds.integrations.grafana.api.data.ItemKind;
import org.zabbixds.integrations.grafana.api.data.ItService;
import org.zabbixds.integrations.grafana.cache.key.CacheGetKey;
import org.zabbixds.integrations.grafana.cache.key.CacheKey;

/**
 * TTL cache in front of the metadata reads of one endpoint. Concurrent misses on the same key wait
 * for a single load.
 */
public class MetadataCache
{
	private static final Logger logger = LoggerFactory.getLogger(MetadataCache.class);

	private static final int CACHE_SIZE = 1000;

	public static final String APPLICATION_API = "application";

	private static final Type GROUPS_TYPE = new TypeToken<List<Group>>() {}.getType();
	private static final Type HOSTS_TYPE = new TypeToken<List<Host>>() {}.getType();
	private static final Type APPLICATIONS_TYPE = new TypeToken<List<Application>>() {}.getType();
	private static final Type ITEMS_TYPE = new TypeToken<List<Item>>() {}.getType();
	private static final Type SERVICES_TYPE = new TypeToken<List<ItService>>() {}.getType();

	private final ZabbixApiClient apiClient;
	private final LoadingCache<CacheKey, JsonElement> queryCache;
	private final Gson gson;

	private volatile boolean applicationsSupported;

	public MetadataCache(ZabbixApiClient apiClient, long ttlMillis)
	{
		this(apiClient, ttlMillis, Ticker.systemTicker());
	}

	public MetadataCache(ZabbixApiClient apiClient, long ttlMillis, Ticker ticker)
	{
		this.apiClient = apiClient;
		this.gson = new Gson();
		this.applicationsSupported = true;

		this.queryCache = CacheBuilder.newBuilder()
				.maximumSize(CACHE_SIZE)
				.expireAfterWrite(ttlMillis, TimeUnit.MILLISECONDS)
				.ticker(ticker)
				.build(new CacheLoader<CacheKey, JsonElement>()
				{
					@Override
					public JsonElement load(CacheKey key)
					{
						return key.load();
					}
				});
	}

	public ZabbixApiClient getApiClient()
	{
		return apiClient;
	}

	public boolean isApplicationsSupported()
	{
		return applicationsSupported;
	}

	public void invalidateAll()
	{
		queryCache.invalidateAll();
	}

	public JsonElement cachedRequest(String method, Object params)
	{
		CacheKey key = new CacheGetKey(apiClient, method, params);

		try
		{
			return queryCache.get(key);
		}
		catch (UncheckedExecutionException e)
		{
			Throwables.throwIfUnchecked(e.getCause());
			throw new IllegalStateException(e.getCause());
		}
		catch (ExecutionException e)
		{
			Throwables.throwIfUnchecked(e.getCause());
			throw new IllegalStateException(e.getCause());
		}
	}

	public List<Group> getAllGroups()
	{
		Map<String, Object> params = new LinkedHashMap<String, Object>();

		params.put("output", Arrays.asList("name"));
		params.put("sortfield", "name");
		params.put("real_hosts", true);

		return toList(cachedRequest("hostgroup.get", params), GROUPS_TYPE);
	}

	public List<Host> getAllHosts(Collection<String> groupIds)
	{
		Map<String, Object> params = new LinkedHashMap<String, Object>();

		params.put("output", Arrays.asList("name", "host"));
		params.put("sortfield", "name");

		if (groupIds != null)
		{
			params.put("groupids", groupIds);
		}

		return toList(cachedRequest("host.get", params), HOSTS_TYPE);
	}

	/**
	 * Returns an empty list once the endpoint has reported that it has no application API.
	 */
	public List<Application> getAllApplications(Collection<String> hostIds)
	{
		if (!applicationsSupported)
		{
			return Collections.emptyList();
		}

		Map<String, Object> params = new LinkedHashMap<String, Object>();

		params.put("output", "extend");
		params.put("hostids", hostIds);

		try
		{
			return toList(cachedRequest("application.get", params), APPLICATIONS_TYPE);
		}
		catch (ZabbixApiException e)
		{
			if (!e.isMethodNotFound(APPLICATION_API))
			{
				throw e;
			}

			logger.warn("{} has no application API, continuing without applications: {}",
					apiClient.getHostname(), e.getMessage());

			applicationsSupported = false;

			return Collections.emptyList();
		}
	}

	/**
	 * Items scoped to either host-ids or application-ids. Exactly one of them is expected to be set.
	 */
	public List<Item> getAllItems(Collection<String> hostIds, Collection<String> appIds, ItemKind itemKind)
	{
		Map<String, Object> params = new LinkedHashMap<String, Object>();

		params.put("output", Arrays.asList("itemid", "name", "key_", "value_type", "hostid", "status", "state"));
		params.put("sortfield", "name");
		params.put("webitems", true);
		params.put("selectHosts", Arrays.asList("hostid", "name"));

		if (appIds != null)
		{
			params.put("applicationids", appIds);
		}
		else
		{
			params.put("hostids", hostIds);
		}

		if ((itemKind != null) && (itemKind != ItemKind.ALL))
		{
			Map<String, Object> filter = new LinkedHashMap<String, Object>();
			filter.put("value_type", itemKind.getValueTypes());
			params.put("filter", filter);
		}

		return toList(cachedRequest("item.get", params), ITEMS_TYPE);
	}

	public List<ItService> getItServices()
	{
		Map<String, Object> params = new LinkedHashMap<String, Object>();

		params.put("output", "extend");

		return toList(cachedRequest("service.get", params), SERVICES_TYPE);
	}

	private <T> List<T> toList(JsonElement result, Type type)
	{
		List<T> list = gson.fromJson(result, type);

		if (list == null)
		{
			return Collections.emptyList();
		}

		return list;
	}
}
