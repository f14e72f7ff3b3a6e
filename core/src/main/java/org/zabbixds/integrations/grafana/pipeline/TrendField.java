package org.zabbixds.integrations.grafana.pipeline;

import org.zabbixds.integrations.grafana.query.ConfigurationException;

/**
 * The trend.get column reported for each trend hour.
 */
public enum TrendField {
	
	avg,
	min,
	max,
	count;
	
	public static TrendField forName(String name) {
		
		if (name != null) {
			for (TrendField field : values()) {
				if (field.name().equals(name.trim())) {
					return field;
				}
			}
		}
		
		throw new ConfigurationException("Unknown trend value " + name);
	}
}
