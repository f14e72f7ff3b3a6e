package org.zabbixds.integrations.grafana.api.data;

import java.util.List;

import com.google.gson.annotations.SerializedName;

public class Event {
	
	public static final String PROBLEM_VALUE = "1";
	
	@SerializedName("eventid")
	public String eventId;
	
	@SerializedName("objectid")
	public String objectId;
	
	/**
	 * Epoch seconds.
	 */
	public long clock;
	
	/**
	 * "1" for a problem event, "0" for a recovery.
	 */
	public String value;
	
	public String acknowledged;
	
	public List<Acknowledge> acknowledges;
	
	public List<Host> hosts;
	
	public boolean isProblem() {
		return PROBLEM_VALUE.equals(value);
	}
	
	public boolean isAcknowledged() {
		return ("1".equals(acknowledged)) || ((acknowledges != null) && (!acknowledges.isEmpty()));
	}
}
