package org.zabbixds.integrations.grafana.api.data;

import com.google.gson.annotations.SerializedName;

public class Application {
	
	@SerializedName("applicationid")
	public String applicationId;
	
	@SerializedName("hostid")
	public String hostId;
	
	public String name;
	
	@Override
	public String toString() {
		return name;
	}
}
