package org.zabbixds.integrations.grafana.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import org.zabbixds.integrations.grafana.output.DataPoint;
import org.zabbixds.integrations.grafana.output.TimeSeries;

/**
 * Point list arithmetic behind the metric functions. Inputs are time-ascending and never modified.
 */
public class DataProcessor {
	
	private static final Comparator<DataPoint> TIME_ORDER = new Comparator<DataPoint>() {
		
		@Override
		public int compare(DataPoint o1, DataPoint o2) {
			return Long.compare(o1.time, o2.time);
		}
	};
	
	public static long getBucket(long time, long interval) {
		return Math.floorDiv(time, interval) * interval;
	}
	
	/**
	 * Groups points into buckets starting at floor(t / interval) * interval and reduces each bucket.
	 */
	public static List<DataPoint> groupBy(List<DataPoint> points, long interval, AggregationType aggregation) {
		
		if (interval <= 0) {
			throw new IllegalArgumentException("interval must be positive: " + interval);
		}
		
		Map<Long, List<Double>> buckets = new TreeMap<Long, List<Double>>();
		
		for (DataPoint point : points) {
			
			Long bucket = Long.valueOf(getBucket(point.time, interval));
			List<Double> values = buckets.get(bucket);
			
			if (values == null) {
				values = new ArrayList<Double>();
				buckets.put(bucket, values);
			}
			
			values.add(point.doubleValue());
		}
		
		List<DataPoint> result = new ArrayList<DataPoint>(buckets.size());
		
		for (Map.Entry<Long, List<Double>> entry : buckets.entrySet()) {
			result.add(new DataPoint(aggregation.apply(entry.getValue()), entry.getKey().longValue()));
		}
		
		return result;
	}
	
	/**
	 * Merges the points of all series in time order and groups them, so each bucket is reduced over
	 * every series at once.
	 */
	public static List<DataPoint> aggregateBy(List<TimeSeries> series, long interval, AggregationType aggregation) {
		return groupBy(flatten(series), interval, aggregation);
	}
	
	public static List<DataPoint> flatten(List<TimeSeries> series) {
		
		List<DataPoint> result = new ArrayList<DataPoint>();
		
		for (TimeSeries timeSeries : series) {
			result.addAll(timeSeries.datapoints);
		}
		
		// stable, points sharing a timestamp keep series order
		Collections.sort(result, TIME_ORDER);
		
		return result;
	}
	
	/**
	 * Sums series at the union of their timestamps. A series contributes at a timestamp only inside
	 * its own first..last span, with linear interpolation between its points.
	 */
	public static List<DataPoint> sumSeries(List<TimeSeries> series) {
		
		TreeSet<Long> timestamps = new TreeSet<Long>();
		List<List<DataPoint>> numericSeries = new ArrayList<List<DataPoint>>();
		
		for (TimeSeries timeSeries : series) {
			
			List<DataPoint> numericPoints = nonNull(timeSeries.datapoints);
			
			if (numericPoints.isEmpty()) {
				continue;
			}
			
			numericSeries.add(numericPoints);
			
			for (DataPoint point : numericPoints) {
				timestamps.add(Long.valueOf(point.time));
			}
		}
		
		List<DataPoint> result = new ArrayList<DataPoint>(timestamps.size());
		
		for (Long timestamp : timestamps) {
			
			double sum = 0;
			
			for (List<DataPoint> points : numericSeries) {
				
				Double value = interpolate(points, timestamp.longValue());
				
				if (value != null) {
					sum += value.doubleValue();
				}
			}
			
			result.add(new DataPoint(Double.valueOf(sum), timestamp.longValue()));
		}
		
		return result;
	}
	
	/**
	 * Linear interpolation at time t, or null when t is outside the span of the points.
	 */
	public static Double interpolate(List<DataPoint> points, long t) {
		
		if ((points.isEmpty()) || (t < points.get(0).time) || (t > points.get(points.size() - 1).time)) {
			return null;
		}
		
		int low = 0;
		int high = points.size() - 1;
		
		while (low <= high) {
			
			int mid = (low + high) >>> 1;
			long midTime = points.get(mid).time;
			
			if (midTime < t) {
				low = mid + 1;
			} else if (midTime > t) {
				high = mid - 1;
			} else {
				return points.get(mid).doubleValue();
			}
		}
		
		DataPoint before = points.get(high);
		DataPoint after = points.get(low);
		
		double ratio = (double)(t - before.time) / (after.time - before.time);
		double value = before.doubleValue().doubleValue() 
			+ ratio * (after.doubleValue().doubleValue() - before.doubleValue().doubleValue());
		
		return Double.valueOf(value);
	}
	
	public static List<DataPoint> scale(List<DataPoint> points, double factor) {
		
		List<DataPoint> result = new ArrayList<DataPoint>(points.size());
		
		for (DataPoint point : points) {
			Double value = point.doubleValue();
			result.add(point.withValue(value != null ? Double.valueOf(value.doubleValue() * factor) : null));
		}
		
		return result;
	}
	
	public static List<DataPoint> offset(List<DataPoint> points, double delta) {
		
		List<DataPoint> result = new ArrayList<DataPoint>(points.size());
		
		for (DataPoint point : points) {
			Double value = point.doubleValue();
			result.add(point.withValue(value != null ? Double.valueOf(value.doubleValue() + delta) : null));
		}
		
		return result;
	}
	
	/**
	 * Difference to the previous point. The first point has no predecessor and is dropped.
	 */
	public static List<DataPoint> delta(List<DataPoint> points) {
		
		List<DataPoint> result = new ArrayList<DataPoint>();
		
		for (int i = 1; i < points.size(); i++) {
			
			Double previous = points.get(i - 1).doubleValue();
			Double current = points.get(i).doubleValue();
			
			Double value = null;
			
			if ((previous != null) && (current != null)) {
				value = Double.valueOf(current.doubleValue() - previous.doubleValue());
			}
			
			result.add(points.get(i).withValue(value));
		}
		
		return result;
	}
	
	/**
	 * Per second change. A decrease is treated as a counter reset and gives a gap.
	 */
	public static List<DataPoint> rate(List<DataPoint> points) {
		
		List<DataPoint> result = new ArrayList<DataPoint>();
		
		for (int i = 1; i < points.size(); i++) {
			
			DataPoint previous = points.get(i - 1);
			DataPoint current = points.get(i);
			
			long timeDelta = current.time - previous.time;
			
			if (timeDelta <= 0) {
				continue;
			}
			
			Double value = null;
			
			if ((previous.doubleValue() != null) && (current.doubleValue() != null)) {
				
				double valueDelta = current.doubleValue().doubleValue() - previous.doubleValue().doubleValue();
				
				if (valueDelta >= 0) {
					value = Double.valueOf(valueDelta / (timeDelta / 1000.0));
				}
			}
			
			result.add(current.withValue(value));
		}
		
		return result;
	}
	
	/**
	 * Mean over a window of the current and up to windowSize - 1 preceding points.
	 */
	public static List<DataPoint> movingAverage(List<DataPoint> points, int windowSize) {
		
		List<DataPoint> result = new ArrayList<DataPoint>(points.size());
		
		for (int i = 0; i < points.size(); i++) {
			
			List<Double> window = new ArrayList<Double>(windowSize);
			
			for (int j = Math.max(0, i - windowSize + 1); j <= i; j++) {
				window.add(points.get(j).doubleValue());
			}
			
			result.add(points.get(i).withValue(AggregationType.avg.apply(window)));
		}
		
		return result;
	}
	
	/**
	 * Keeps the count series ranked highest (or lowest) by the aggregation of all their points.
	 * Ties keep the original order.
	 */
	public static List<TimeSeries> rank(List<TimeSeries> series, int count, 
		final AggregationType aggregation, final boolean highest) {
		
		List<TimeSeries> sorted = new ArrayList<TimeSeries>(series);
		
		Collections.sort(sorted, new Comparator<TimeSeries>() {
			
			@Override
			public int compare(TimeSeries o1, TimeSeries o2) {
				
				Double v1 = aggregation.apply(values(o1.datapoints));
				Double v2 = aggregation.apply(values(o2.datapoints));
				
				// series without values rank last either way
				if (v1 == null) {
					return (v2 == null) ? 0 : 1;
				}
				
				if (v2 == null) {
					return -1;
				}
				
				if (highest) {
					return Double.compare(v2.doubleValue(), v1.doubleValue());
				}
				
				return Double.compare(v1.doubleValue(), v2.doubleValue());
			}
		});
		
		return new ArrayList<TimeSeries>(sorted.subList(0, Math.min(count, sorted.size())));
	}
	
	public static List<Double> values(List<DataPoint> points) {
		
		List<Double> result = new ArrayList<Double>(points.size());
		
		for (DataPoint point : points) {
			result.add(point.doubleValue());
		}
		
		return result;
	}
	
	private static List<DataPoint> nonNull(List<DataPoint> points) {
		
		List<DataPoint> result = new ArrayList<DataPoint>(points.size());
		
		for (DataPoint point : points) {
			if (point.doubleValue() != null) {
				result.add(point);
			}
		}
		
		return result;
	}
}
