package org.zabbixds.integrations.grafana.input;

/**
 * Input of an annotation query, turning trigger events of the matching hosts into panel annotations.
 */
public class AnnotationInput {
	
	public String group;
	public String host;
	public String application;
	
	/**
	 * Trigger description filter: exact text or /regex/. Empty for all triggers.
	 */
	public String trigger;
	
	/**
	 * Lowest trigger priority to report, 0 (not classified) to 5 (disaster).
	 */
	public int minSeverity;
	
	public boolean showOkEvents;
	public boolean hideAcknowledged;
	
	/**
	 * Tag every annotation with the names of its hosts.
	 */
	public boolean showHostname;
	
	public TimeRange range;
}
