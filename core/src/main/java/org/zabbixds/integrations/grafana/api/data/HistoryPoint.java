package org.zabbixds.integrations.grafana.api.data;

import com.google.gson.annotations.SerializedName;

public class HistoryPoint {
	
	@SerializedName("itemid")
	public String itemId;
	
	/**
	 * Epoch seconds.
	 */
	public long clock;
	
	public String value;
	
	public long ns;
}
