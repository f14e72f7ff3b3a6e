package org.zabbixds.integrations.grafana.input;

import com.google.gson.annotations.SerializedName;

public enum QueryMode {
	
	@SerializedName("numeric")
	NUMERIC,
	
	@SerializedName("text")
	TEXT,
	
	@SerializedName("service")
	SERVICE
}
