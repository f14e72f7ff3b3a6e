package org.zabbixds.integrations.grafana.input;

import com.google.gson.annotations.SerializedName;

public class MetricFindInput {
	
	/**
	 * A dot delimited lookup, "group.host.application.item" with one to four segments.
	 */
	@SerializedName(value = "query", alternate = { "target" })
	public String query;
}
