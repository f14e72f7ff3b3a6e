package org.zabbixds.integrations.grafana.input;

import com.google.gson.annotations.SerializedName;

/**
 * The figure of a service.getsla interval reported by a service target.
 */
public enum SlaProperty {
	
	@SerializedName("sla")
	SLA("SLA"),
	
	@SerializedName("okTime")
	OK_TIME("OK time"),
	
	@SerializedName("problemTime")
	PROBLEM_TIME("Problem time"),
	
	@SerializedName("downtimeTime")
	DOWNTIME_TIME("Down time");
	
	private final String displayName;
	
	private SlaProperty(String displayName) {
		this.displayName = displayName;
	}
	
	public String getDisplayName() {
		return displayName;
	}
}
