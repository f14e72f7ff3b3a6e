package org.zabbixds.integrations.grafana.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Joiner;
import org.zabbixds.integrations.grafana.output.DataPoint;
import org.zabbixds.integrations.grafana.output.TimeSeries;

/**
 * A registry function with its parameters validated and defaults filled in.
 */
public abstract class BoundFunction {
	
	protected final MetricFunction function;
	protected final List<String> params;
	
	protected BoundFunction(MetricFunction function, List<String> params) {
		this.function = function;
		this.params = Collections.unmodifiableList(new ArrayList<String>(params));
	}
	
	public MetricFunction getFunction() {
		return function;
	}
	
	public FunctionCategory getCategory() {
		return function.getCategory();
	}
	
	public List<String> getParams() {
		return params;
	}
	
	/**
	 * The display text, e.g. "groupBy(1m, avg)". Aggregated series are labeled with it.
	 */
	public String getText() {
		return function.getName() + "(" + Joiner.on(", ").join(params) + ")";
	}
	
	@Override
	public String toString() {
		return getText();
	}
	
	public static abstract class Transform extends BoundFunction {
		
		protected Transform(MetricFunction function, List<String> params) {
			super(function, params);
		}
		
		public abstract List<DataPoint> apply(List<DataPoint> points);
		
		/**
		 * A single transform applying this one and then the next.
		 */
		public Transform andThen(final Transform next) {
			
			final Transform first = this;
			
			return new Transform(function, params) {
				
				@Override
				public List<DataPoint> apply(List<DataPoint> points) {
					return next.apply(first.apply(points));
				}
				
				@Override
				public String getText() {
					return next.getText() + " . " + first.getText();
				}
			};
		}
	}
	
	public static abstract class Filter extends BoundFunction {
		
		protected Filter(MetricFunction function, List<String> params) {
			super(function, params);
		}
		
		public abstract List<TimeSeries> apply(List<TimeSeries> series);
	}
	
	public static abstract class Aggregate extends BoundFunction {
		
		protected Aggregate(MetricFunction function, List<String> params) {
			super(function, params);
		}
		
		public abstract List<DataPoint> apply(List<TimeSeries> series);
	}
	
	public static abstract class Alias extends BoundFunction {
		
		protected Alias(MetricFunction function, List<String> params) {
			super(function, params);
		}
		
		public abstract String apply(String label);
	}
	
	public static class TimeShift extends BoundFunction {
		
		private final long offset;
		
		protected TimeShift(MetricFunction function, List<String> params, long offset) {
			super(function, params);
			this.offset = offset;
		}
		
		/**
		 * Millis added to the query window, negative to look back.
		 */
		public long getOffset() {
			return offset;
		}
	}
	
	public static class TrendValue extends BoundFunction {
		
		private final TrendField field;
		
		protected TrendValue(MetricFunction function, List<String> params, TrendField field) {
			super(function, params);
			this.field = field;
		}
		
		public TrendField getField() {
			return field;
		}
	}
}
