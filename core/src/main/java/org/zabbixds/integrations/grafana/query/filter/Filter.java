package org.zabbixds.integrations.grafana.query.filter;

/**
 * A parsed group, host, application or item filter.
 */
public interface Filter {
	
	public boolean matches(String name);
	
	/**
	 * True when the filter accepts every name, so the level needs no narrowing.
	 */
	public boolean matchesAll();
	
	/**
	 * True when the filter may select more than one entity by name.
	 */
	public boolean isPattern();
}
