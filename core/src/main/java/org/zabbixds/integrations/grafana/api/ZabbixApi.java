package org.zabbixds.integrations.grafana.api;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.reflect.TypeToken;
import org.zabbixds.integrations.grafana.api.data.Event;
import org.zabbixds.integrations.grafana.api.data.HistoryPoint;
import org.zabbixds.integrations.grafana.api.data.Item;
import org.zabbixds.integrations.grafana.api.data.ServiceSla;
import org.zabbixds.integrations.grafana.api.data.TrendPoint;
import org.zabbixds.integrations.grafana.api.data.Trigger;

/**
 * Typed, uncached reads of time dependent data. Times are epoch seconds.
 */
public class ZabbixApi
{
	private static final Type HISTORY_TYPE = new TypeToken<List<HistoryPoint>>() {}.getType();
	private static final Type TRENDS_TYPE = new TypeToken<List<TrendPoint>>() {}.getType();
	private static final Type TRIGGERS_TYPE = new TypeToken<List<Trigger>>() {}.getType();
	private static final Type EVENTS_TYPE = new TypeToken<List<Event>>() {}.getType();
	private static final Type SLA_TYPE = new TypeToken<Map<String, ServiceSla>>() {}.getType();

	private final ZabbixApiClient apiClient;
	private final Gson gson;

	public ZabbixApi(ZabbixApiClient apiClient)
	{
		this.apiClient = apiClient;
		this.gson = new Gson();
	}

	public ZabbixApiClient getApiClient()
	{
		return apiClient;
	}

	/**
	 * history.get is scoped to a single value type, so items are fetched in one call per type.
	 */
	public List<HistoryPoint> getHistory(Collection<Item> items, long timeFrom, long timeTill)
	{
		Map<Integer, List<String>> itemIdsByType = new TreeMap<Integer, List<String>>();

		for (Item item : items)
		{
			List<String> itemIds = itemIdsByType.get(item.valueType);

			if (itemIds == null)
			{
				itemIds = new ArrayList<String>();
				itemIdsByType.put(item.valueType, itemIds);
			}

			itemIds.add(item.itemId);
		}

		List<HistoryPoint> result = new ArrayList<HistoryPoint>();

		for (Map.Entry<Integer, List<String>> entry : itemIdsByType.entrySet())
		{
			Map<String, Object> params = new LinkedHashMap<String, Object>();

			params.put("output", "extend");
			params.put("history", entry.getKey());
			params.put("itemids", entry.getValue());
			params.put("sortfield", "clock");
			params.put("sortorder", "ASC");
			params.put("time_from", timeFrom);
			params.put("time_till", timeTill);

			List<HistoryPoint> points = toList(apiClient.request("history.get", params), HISTORY_TYPE);
			result.addAll(points);
		}

		return result;
	}

	public List<TrendPoint> getTrends(Collection<Item> items, long timeFrom, long timeTill)
	{
		List<String> itemIds = new ArrayList<String>();

		for (Item item : items)
		{
			itemIds.add(item.itemId);
		}

		Map<String, Object> params = new LinkedHashMap<String, Object>();

		params.put("output", Arrays.asList("itemid", "clock", "value_min", "value_avg", "value_max", "num"));
		params.put("itemids", itemIds);
		params.put("time_from", timeFrom);
		params.put("time_till", timeTill);

		return toList(apiClient.request("trend.get", params), TRENDS_TYPE);
	}

	public ServiceSla getSla(String serviceId, long timeFrom, long timeTill)
	{
		Map<String, Object> interval = new LinkedHashMap<String, Object>();

		interval.put("from", timeFrom);
		interval.put("to", timeTill);

		Map<String, Object> params = new LinkedHashMap<String, Object>();

		params.put("serviceids", Collections.singletonList(serviceId));
		params.put("intervals", Collections.singletonList(interval));

		JsonElement result = apiClient.request("service.getsla", params);

		if ((result == null) || (!result.isJsonObject()))
		{
			return null;
		}

		Map<String, ServiceSla> slaByService = gson.fromJson(result, SLA_TYPE);

		return slaByService.get(serviceId);
	}

	/**
	 * @param applicationIds null when triggers should not be scoped by application
	 */
	public List<Trigger> getTriggers(Collection<String> hostIds, Collection<String> applicationIds)
	{
		Map<String, Object> params = new LinkedHashMap<String, Object>();

		params.put("output", Arrays.asList("triggerid", "description", "priority"));
		params.put("hostids", hostIds);

		if (applicationIds != null)
		{
			params.put("applicationids", applicationIds);
		}

		params.put("expandDescription", true);
		params.put("selectHosts", Arrays.asList("name"));

		return toList(apiClient.request("trigger.get", params), TRIGGERS_TYPE);
	}

	public List<Event> getEvents(Collection<String> objectIds, long timeFrom, long timeTill, boolean showOkEvents)
	{
		Map<String, Object> params = new LinkedHashMap<String, Object>();

		params.put("output", "extend");
		params.put("time_from", timeFrom);
		params.put("time_till", timeTill);
		params.put("objectids", objectIds);
		params.put("select_acknowledges", "extend");
		params.put("selectHosts", "extend");

		if (!showOkEvents)
		{
			params.put("value", 1);
		}

		return toList(apiClient.request("event.get", params), EVENTS_TYPE);
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
