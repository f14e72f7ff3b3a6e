package org.zabbixds.integrations.grafana.api.data;

import com.google.gson.annotations.SerializedName;

public class Host {
	
	@SerializedName("hostid")
	public String hostId;
	
	/**
	 * Visible name of the host.
	 */
	public String name;
	
	/**
	 * Technical host name.
	 */
	public String host;
	
	@Override
	public String toString() {
		return name;
	}
}
