package org.zabbixds.integrations.grafana.api.data;

import com.google.gson.annotations.SerializedName;

public class Group {
	
	@SerializedName("groupid")
	public String groupId;
	
	public String name;
	
	@Override
	public String toString() {
		return name;
	}
}
