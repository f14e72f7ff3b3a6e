package org.zabbixds.integrations.grafana.api;

import com.google.gson.JsonElement;

public class ApiResponse {
	
	public static class ApiError {
		public int code;
		public String message;
		public String data;
	}
	
	public String jsonrpc;
	public JsonElement result;
	public ApiError error;
	public int id;
}
