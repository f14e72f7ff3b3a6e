package org.zabbixds.integrations.grafana.output;

public class ConnectionTestResult {
	
	public enum ConnectionState {
		SUCCESS,
		AUTH_FAILED,
		UNREACHABLE
	}
	
	public static final String SUCCESS = "success";
	public static final String ERROR = "error";
	
	public transient ConnectionState state;
	
	public String status;
	public String title;
	public String message;
	
	public static ConnectionTestResult success(String version) {
		return of(ConnectionState.SUCCESS, SUCCESS, "Success", "Zabbix API version: " + version);
	}
	
	public static ConnectionTestResult authFailed(String title, String message) {
		return of(ConnectionState.AUTH_FAILED, ERROR, title, message);
	}
	
	public static ConnectionTestResult unreachable() {
		return of(ConnectionState.UNREACHABLE, ERROR, "Connection failed", "Could not connect to given url");
	}
	
	private static ConnectionTestResult of(ConnectionState state, String status, String title, String message) {
		
		ConnectionTestResult result = new ConnectionTestResult();
		
		result.state = state;
		result.status = status;
		result.title = title;
		result.message = message;
		
		return result;
	}
}
