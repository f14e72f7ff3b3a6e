package org.zabbixds.integrations.grafana.api.data;

import java.util.List;

import com.google.gson.annotations.SerializedName;

public class Trigger {
	
	@SerializedName("triggerid")
	public String triggerId;
	
	public String description;
	
	public int priority;
	
	public List<Host> hosts;
}
