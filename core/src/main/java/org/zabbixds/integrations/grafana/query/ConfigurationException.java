package org.zabbixds.integrations.grafana.query;

/**
 * A target or function definition that cannot be executed as written: an unknown function,
 * a bad function parameter, a malformed regex filter or a bad duration string.
 */
public class ConfigurationException extends RuntimeException {
	
	private static final long serialVersionUID = -2386511913412092650L;
	
	public ConfigurationException(String message) {
		super(message);
	}
	
	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
