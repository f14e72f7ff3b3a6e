package org.zabbixds.integrations.grafana.api;

import com.google.gson.JsonElement;

/**
 * An authenticated view of a single Zabbix endpoint. Implementations take care of
 * acquiring and renewing the session token; callers only name the method and its params.
 */
public interface ZabbixApiClient {
	
	public String getHostname();
	
	public JsonElement request(String method, Object params);
}
