package org.zabbixds.integrations.grafana.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.zabbixds.integrations.grafana.output.DataPoint;
import org.zabbixds.integrations.grafana.output.TimeSeries;

/**
 * Caps the number of points per series by averaging fixed time buckets.
 */
public class Downsampler {
	
	/**
	 * @param intervalMs bucket size, 0 to derive the smallest size that keeps the series within maxPoints
	 */
	public static List<TimeSeries> limit(List<TimeSeries> series, int maxPoints, long intervalMs) {
		
		if (maxPoints <= 0) {
			return series;
		}
		
		List<TimeSeries> result = new ArrayList<TimeSeries>(series.size());
		
		for (TimeSeries timeSeries : series) {
			result.add(limit(timeSeries, maxPoints, intervalMs));
		}
		
		return result;
	}
	
	public static TimeSeries limit(TimeSeries series, int maxPoints, long intervalMs) {
		
		if ((maxPoints <= 0) || (series.size() <= maxPoints)) {
			return series;
		}
		
		long interval = intervalMs;
		
		if (interval <= 0) {
			
			if (maxPoints == 1) {
				return series.withPoints(Collections.singletonList(average(series.datapoints)));
			}
			
			interval = getInterval(series, maxPoints);
		}
		
		return series.withPoints(DataProcessor.groupBy(series.datapoints, interval, AggregationType.avg));
	}
	
	/**
	 * Buckets are aligned to multiples of the interval, so a span of n intervals can touch n + 1 of
	 * them. The span has to stay below maxPoints - 1 intervals.
	 */
	static long getInterval(TimeSeries series, int maxPoints) {
		
		long span = series.datapoints.get(series.size() - 1).time - series.datapoints.get(0).time;
		
		return (span / (maxPoints - 1)) + 1;
	}
	
	private static DataPoint average(List<DataPoint> points) {
		
		List<Double> values = new ArrayList<Double>(points.size());
		
		for (DataPoint point : points) {
			values.add(point.doubleValue());
		}
		
		return new DataPoint(AggregationType.avg.apply(values), points.get(0).time);
	}
}
