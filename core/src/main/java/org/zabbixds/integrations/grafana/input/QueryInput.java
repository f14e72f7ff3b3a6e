package org.zabbixds.integrations.grafana.input;

import java.util.List;

public class QueryInput {
	
	public TimeRange range;
	
	public List<Target> targets;
	
	/**
	 * Upper bound of points per returned series, 0 for no limit.
	 */
	public int maxDataPoints;
	
	/**
	 * Optional bucket size used when series are downsampled.
	 */
	public long intervalMs;
}
