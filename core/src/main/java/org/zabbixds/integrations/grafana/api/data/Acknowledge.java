package org.zabbixds.integrations.grafana.api.data;

public class Acknowledge {
	
	/**
	 * Epoch seconds.
	 */
	public long clock;
	
	public String message;
	public String alias;
	public String name;
	public String surname;
}
