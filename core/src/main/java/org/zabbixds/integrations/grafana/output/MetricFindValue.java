package org.zabbixds.integrations.grafana.output;

public class MetricFindValue {
	
	public String text;
	public boolean expandable;
	
	public MetricFindValue(String text) {
		this.text = text;
		this.expandable = false;
	}
	
	@Override
	public String toString() {
		return text;
	}
}
