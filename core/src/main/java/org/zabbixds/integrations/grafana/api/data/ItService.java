package org.zabbixds.integrations.grafana.api.data;

import com.google.gson.annotations.SerializedName;

public class ItService {
	
	@SerializedName("serviceid")
	public String serviceId;
	
	public String name;
	
	@Override
	public String toString() {
		return name;
	}
}
