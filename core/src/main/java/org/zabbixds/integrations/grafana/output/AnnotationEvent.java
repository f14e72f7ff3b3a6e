package org.zabbixds.integrations.grafana.output;

import java.util.List;

public class AnnotationEvent {
	
	public static final String PROBLEM = "Problem";
	public static final String OK = "OK";
	
	/**
	 * Epoch millis.
	 */
	public long time;
	
	public String title;
	public String text;
	public List<String> tags;
}
