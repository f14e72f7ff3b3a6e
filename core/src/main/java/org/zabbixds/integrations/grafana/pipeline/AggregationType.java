package org.zabbixds.integrations.grafana.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.zabbixds.integrations.grafana.query.ConfigurationException;

/**
 * Reduces a list of values to one. Nulls are skipped, an empty input gives null except for count.
 */
public enum AggregationType {
	
	avg {
		@Override
		protected Double reduce(List<Double> values) {
			return Double.valueOf(sumOf(values) / values.size());
		}
	},
	
	min {
		@Override
		protected Double reduce(List<Double> values) {
			return Collections.min(values);
		}
	},
	
	max {
		@Override
		protected Double reduce(List<Double> values) {
			return Collections.max(values);
		}
	},
	
	sum {
		@Override
		protected Double reduce(List<Double> values) {
			return Double.valueOf(sumOf(values));
		}
	},
	
	count {
		@Override
		public Double apply(List<Double> values) {
			return Double.valueOf(nonNull(values).size());
		}
		
		@Override
		protected Double reduce(List<Double> values) {
			return Double.valueOf(values.size());
		}
	},
	
	median {
		@Override
		protected Double reduce(List<Double> values) {
			
			List<Double> sorted = new ArrayList<Double>(values);
			Collections.sort(sorted);
			
			int middle = sorted.size() / 2;
			
			if (sorted.size() % 2 == 1) {
				return sorted.get(middle);
			}
			
			return Double.valueOf((sorted.get(middle - 1).doubleValue() + sorted.get(middle).doubleValue()) / 2);
		}
	};
	
	public Double apply(List<Double> values) {
		
		List<Double> nonNullValues = nonNull(values);
		
		if (nonNullValues.isEmpty()) {
			return null;
		}
		
		return reduce(nonNullValues);
	}
	
	protected abstract Double reduce(List<Double> values);
	
	public static AggregationType forName(String name) {
		
		if (name != null) {
			for (AggregationType type : values()) {
				if (type.name().equals(name.trim())) {
					return type;
				}
			}
		}
		
		throw new ConfigurationException("Unknown aggregation function " + name);
	}
	
	private static List<Double> nonNull(List<Double> values) {
		
		List<Double> result = new ArrayList<Double>(values.size());
		
		for (Double value : values) {
			if (value != null) {
				result.add(value);
			}
		}
		
		return result;
	}
	
	private static double sumOf(List<Double> values) {
		
		double result = 0;
		
		for (Double value : values) {
			result += value.doubleValue();
		}
		
		return result;
	}
}
