package org.zabbixds.integrations.grafana.api;

import java.util.Arrays;
import java.util.List;

import com.google.common.base.Strings;

/**
 * A well formed JSON-RPC error returned by the Zabbix API.
 */
public class ZabbixApiException extends RuntimeException {
	
	private static final long serialVersionUID = 4571940389721460175L;
	
	private static final List<String> NOT_AUTHORIZED_MESSAGES = Arrays.asList(
		"Session terminated, re-login, please.", "Not authorised.", "Not authorized.");
	
	private static final String METHOD_NOT_FOUND = "Method not found";
	
	private final int code;
	private final String errorMessage;
	private final String data;
	
	public ZabbixApiException(int code, String errorMessage, String data) {
		super(buildMessage(errorMessage, data));
		
		this.code = code;
		this.errorMessage = errorMessage;
		this.data = data;
	}
	
	private static String buildMessage(String errorMessage, String data) {
		
		if (Strings.isNullOrEmpty(data)) {
			return Strings.nullToEmpty(errorMessage);
		}
		
		return Strings.nullToEmpty(errorMessage) + " " + data;
	}
	
	public int getCode() {
		return code;
	}
	
	public String getErrorMessage() {
		return errorMessage;
	}
	
	public String getData() {
		return data;
	}
	
	/**
	 * Zabbix puts the session error either in the message or, on newer versions,
	 * in the data member of an "Invalid params." error.
	 */
	public boolean isNotAuthorized() {
		return (NOT_AUTHORIZED_MESSAGES.contains(errorMessage)) 
			|| (NOT_AUTHORIZED_MESSAGES.contains(data));
	}
	
	/**
	 * True for errors such as: Method not found. Incorrect API "application".
	 */
	public boolean isMethodNotFound(String api) {
		
		String message = getMessage();
		
		if (!message.startsWith(METHOD_NOT_FOUND)) {
			return false;
		}
		
		return message.contains("\"" + api + "\"");
	}
}
