package org.zabbixds.integrations.grafana.api.data;

import com.google.gson.annotations.SerializedName;

public class TrendPoint {
	
	@SerializedName("itemid")
	public String itemId;
	
	/**
	 * Epoch seconds, start of the trend hour.
	 */
	public long clock;
	
	@SerializedName("value_min")
	public String valueMin;
	
	@SerializedName("value_avg")
	public String valueAvg;
	
	@SerializedName("value_max")
	public String valueMax;
	
	public String num;
}
