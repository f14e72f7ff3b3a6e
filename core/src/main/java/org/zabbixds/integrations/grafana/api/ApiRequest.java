package org.zabbixds.integrations.grafana.api;

public class ApiRequest {
	
	public static final String JSON_RPC_VERSION = "2.0";
	
	public String jsonrpc;
	public String method;
	public Object params;
	public int id;
	
	// left null for unauthenticated calls so it is dropped from the body
	public String auth;
	
	public static ApiRequest of(String method, Object params, String auth, int id) {
		
		ApiRequest result = new ApiRequest();
		
		result.jsonrpc = JSON_RPC_VERSION;
		result.method = method;
		result.params = params;
		result.id = id;
		result.auth = auth;
		
		return result;
	}
}
