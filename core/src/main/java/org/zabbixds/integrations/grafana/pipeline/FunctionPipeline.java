package org.zabbixds.integrations.grafana.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.zabbixds.integrations.grafana.input.FunctionCall;
import org.zabbixds.integrations.grafana.input.TimeRange;
import org.zabbixds.integrations.grafana.output.DataPoint;
import org.zabbixds.integrations.grafana.output.TimeSeries;

/**
 * The bound functions of one target, applied by category: time shift on the query window, then
 * transform, filter, aggregate and alias on the fetched series. Within a category functions run in
 * declared order.
 */
public class FunctionPipeline {
	
	private final List<BoundFunction.TimeShift> timeShifts;
	private final List<BoundFunction.Transform> transforms;
	private final List<BoundFunction.Filter> filters;
	private final List<BoundFunction.Aggregate> aggregates;
	private final List<BoundFunction.Alias> aliases;
	
	private TrendField trendField;
	
	private FunctionPipeline() {
		this.timeShifts = new ArrayList<BoundFunction.TimeShift>();
		this.transforms = new ArrayList<BoundFunction.Transform>();
		this.filters = new ArrayList<BoundFunction.Filter>();
		this.aggregates = new ArrayList<BoundFunction.Aggregate>();
		this.aliases = new ArrayList<BoundFunction.Alias>();
	}
	
	public static FunctionPipeline empty() {
		return new FunctionPipeline();
	}
	
	/**
	 * Binds every call up front, so an unknown function or a bad parameter fails before anything
	 * is fetched.
	 */
	public static FunctionPipeline bind(List<FunctionCall> calls) {
		
		FunctionPipeline result = new FunctionPipeline();
		
		if (calls == null) {
			return result;
		}
		
		for (FunctionCall call : calls) {
			result.add(MetricFunction.forName(call.name).bind(call.params));
		}
		
		return result;
	}
	
	public FunctionPipeline add(BoundFunction function) {
		
		switch (function.getCategory()) {
			
			case TIME:
				timeShifts.add((BoundFunction.TimeShift)function);
				break;
				
			case TREND:
				trendField = ((BoundFunction.TrendValue)function).getField();
				break;
				
			case TRANSFORM:
				transforms.add((BoundFunction.Transform)function);
				break;
				
			case FILTER:
				filters.add((BoundFunction.Filter)function);
				break;
				
			case AGGREGATE:
				aggregates.add((BoundFunction.Aggregate)function);
				break;
				
			case ALIAS:
				aliases.add((BoundFunction.Alias)function);
				break;
				
			default:
				throw new IllegalStateException("Unknown category " + function.getCategory());
		}
		
		return this;
	}
	
	/**
	 * Total millis added to the query window by the time functions.
	 */
	public long getTimeOffset() {
		
		long result = 0;
		
		for (BoundFunction.TimeShift timeShift : timeShifts) {
			result += timeShift.getOffset();
		}
		
		return result;
	}
	
	public TimeRange applyTimeFunctions(TimeRange range) {
		return range.shift(getTimeOffset());
	}
	
	/**
	 * The trend column selected by trendValue, avg when none is given.
	 */
	public TrendField getTrendField() {
		
		if (trendField == null) {
			return TrendField.avg;
		}
		
		return trendField;
	}
	
	public List<TimeSeries> apply(List<TimeSeries> series) {
		
		List<TimeSeries> result = applyTransforms(series);
		result = applyFilters(result);
		result = applyAggregates(result);
		result = applyAliases(result);
		
		return unshift(result);
	}
	
	private List<TimeSeries> applyTransforms(List<TimeSeries> series) {
		
		if (transforms.isEmpty()) {
			return series;
		}
		
		List<TimeSeries> result = new ArrayList<TimeSeries>(series.size());
		
		for (TimeSeries timeSeries : series) {
			
			List<DataPoint> points = timeSeries.datapoints;
			
			for (BoundFunction.Transform transform : transforms) {
				points = transform.apply(points);
			}
			
			result.add(timeSeries.withPoints(points));
		}
		
		return result;
	}
	
	private List<TimeSeries> applyFilters(List<TimeSeries> series) {
		
		List<TimeSeries> result = series;
		
		for (BoundFunction.Filter filter : filters) {
			result = filter.apply(result);
		}
		
		return result;
	}
	
	private List<TimeSeries> applyAggregates(List<TimeSeries> series) {
		
		if ((aggregates.isEmpty()) || (series.isEmpty())) {
			return series;
		}
		
		List<TimeSeries> result = series;
		
		for (BoundFunction.Aggregate aggregate : aggregates) {
			result = Collections.singletonList(new TimeSeries(null, aggregate.apply(result)));
		}
		
		String label = aggregates.get(aggregates.size() - 1).getText();
		
		return Collections.singletonList(result.get(0).withLabel(label));
	}
	
	private List<TimeSeries> applyAliases(List<TimeSeries> series) {
		
		if (aliases.isEmpty()) {
			return series;
		}
		
		List<TimeSeries> result = new ArrayList<TimeSeries>(series.size());
		
		for (TimeSeries timeSeries : series) {
			
			String label = timeSeries.label;
			
			for (BoundFunction.Alias alias : aliases) {
				label = alias.apply(label);
			}
			
			result.add(timeSeries.withLabel(label));
		}
		
		return result;
	}
	
	private List<TimeSeries> unshift(List<TimeSeries> series) {
		
		long offset = getTimeOffset();
		
		if (offset == 0) {
			return series;
		}
		
		List<TimeSeries> result = new ArrayList<TimeSeries>(series.size());
		
		for (TimeSeries timeSeries : series) {
			
			List<DataPoint> points = new ArrayList<DataPoint>(timeSeries.datapoints.size());
			
			for (DataPoint point : timeSeries.datapoints) {
				points.add(point.withTime(point.time - offset));
			}
			
			result.add(timeSeries.withPoints(points));
		}
		
		return result;
	}
}
