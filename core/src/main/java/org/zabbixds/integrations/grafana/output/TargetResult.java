package org.zabbixds.integrations.grafana.output;

import java.util.Collections;
import java.util.List;

public class TargetResult {
	
	public String refId;
	public List<TimeSeries> series;
	
	/**
	 * Set only when this target failed, other targets of the same query are not affected.
	 */
	public String error;
	
	public static TargetResult of(String refId, List<TimeSeries> series) {
		
		TargetResult result = new TargetResult();
		
		result.refId = refId;
		result.series = series;
		
		return result;
	}
	
	public static TargetResult error(String refId, String error) {
		
		TargetResult result = of(refId, Collections.<TimeSeries>emptyList());
		result.error = error;
		
		return result;
	}
}
