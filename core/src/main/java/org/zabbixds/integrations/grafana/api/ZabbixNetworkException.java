package org.zabbixds.integrations.grafana.api;

/**
 * The endpoint could not be reached, answered with a non 2xx status, timed out
 * or returned a body that is not a JSON-RPC reply. Never retried.
 */
public class ZabbixNetworkException extends RuntimeException {
	
	private static final long serialVersionUID = -2608841264128357734L;
	
	private final String url;
	
	public ZabbixNetworkException(String url, String message) {
		this(url, message, null);
	}
	
	public ZabbixNetworkException(String url, String message, Throwable cause) {
		super(message + " (" + url + ")", cause);
		
		this.url = url;
	}
	
	public String getUrl() {
		return url;
	}
}
