package org.zabbixds.integrations.grafana.api;

import com.google.gson.JsonElement;

/**
 * Performs a single JSON-RPC call. A null auth token means the call is sent without
 * the "auth" member, as required by user.login and apiinfo.version.
 */
public interface ZabbixTransport {
	
	public String getUrl();
	
	public JsonElement send(String method, Object params, String auth);
}
