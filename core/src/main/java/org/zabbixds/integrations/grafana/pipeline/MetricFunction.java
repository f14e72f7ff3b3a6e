package org.zabbixds.integrations.grafana.pipeline;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.google.common.base.Strings;
import org.zabbixds.integrations.grafana.output.DataPoint;
import org.zabbixds.integrations.grafana.output.TimeSeries;
import org.zabbixds.integrations.grafana.query.ConfigurationException;
import org.zabbixds.integrations.grafana.util.TimeUtil;

/**
 * The closed set of functions a target may apply to its series. A null default marks a required
 * parameter.
 */
public enum MetricFunction {
	
	GROUP_BY("groupBy", FunctionCategory.TRANSFORM, "1m", "avg") {
		@Override
		protected BoundFunction doBind(List<String> params) {
			
			final long interval = positiveInterval(params.get(0));
			final AggregationType aggregation = AggregationType.forName(params.get(1));
			
			return new BoundFunction.Transform(this, params) {
				
				@Override
				public List<DataPoint> apply(List<DataPoint> points) {
					return DataProcessor.groupBy(points, interval, aggregation);
				}
			};
		}
	},
	
	SCALE("scale", FunctionCategory.TRANSFORM, "100") {
		@Override
		protected BoundFunction doBind(List<String> params) {
			
			final double factor = parseDouble(params.get(0));
			
			return new BoundFunction.Transform(this, params) {
				
				@Override
				public List<DataPoint> apply(List<DataPoint> points) {
					return DataProcessor.scale(points, factor);
				}
			};
		}
	},
	
	OFFSET("offset", FunctionCategory.TRANSFORM, "0") {
		@Override
		protected BoundFunction doBind(List<String> params) {
			
			final double delta = parseDouble(params.get(0));
			
			return new BoundFunction.Transform(this, params) {
				
				@Override
				public List<DataPoint> apply(List<DataPoint> points) {
					return DataProcessor.offset(points, delta);
				}
			};
		}
	},
	
	DELTA("delta", FunctionCategory.TRANSFORM) {
		@Override
		protected BoundFunction doBind(List<String> params) {
			
			return new BoundFunction.Transform(this, params) {
				
				@Override
				public List<DataPoint> apply(List<DataPoint> points) {
					return DataProcessor.delta(points);
				}
			};
		}
	},
	
	RATE("rate", FunctionCategory.TRANSFORM) {
		@Override
		protected BoundFunction doBind(List<String> params) {
			
			return new BoundFunction.Transform(this, params) {
				
				@Override
				public List<DataPoint> apply(List<DataPoint> points) {
					return DataProcessor.rate(points);
				}
			};
		}
	},
	
	MOVING_AVERAGE("movingAverage", FunctionCategory.TRANSFORM, "10") {
		@Override
		protected BoundFunction doBind(List<String> params) {
			
			final int windowSize = parsePositiveInt(params.get(0));
			
			return new BoundFunction.Transform(this, params) {
				
				@Override
				public List<DataPoint> apply(List<DataPoint> points) {
					return DataProcessor.movingAverage(points, windowSize);
				}
			};
		}
	},
	
	SUM_SERIES("sumSeries", FunctionCategory.AGGREGATE) {
		@Override
		protected BoundFunction doBind(List<String> params) {
			
			return new BoundFunction.Aggregate(this, params) {
				
				@Override
				public List<DataPoint> apply(List<TimeSeries> series) {
					return DataProcessor.sumSeries(series);
				}
			};
		}
	},
	
	AVERAGE("average", FunctionCategory.AGGREGATE, "1m") {
		@Override
		protected BoundFunction doBind(List<String> params) {
			return bindAggregateBy(this, params, params.get(0), AggregationType.avg);
		}
	},
	
	MIN("min", FunctionCategory.AGGREGATE, "1m") {
		@Override
		protected BoundFunction doBind(List<String> params) {
			return bindAggregateBy(this, params, params.get(0), AggregationType.min);
		}
	},
	
	MAX("max", FunctionCategory.AGGREGATE, "1m") {
		@Override
		protected BoundFunction doBind(List<String> params) {
			return bindAggregateBy(this, params, params.get(0), AggregationType.max);
		}
	},
	
	MEDIAN("median", FunctionCategory.AGGREGATE, "1m") {
		@Override
		protected BoundFunction doBind(List<String> params) {
			return bindAggregateBy(this, params, params.get(0), AggregationType.median);
		}
	},
	
	AGGREGATE_BY("aggregateBy", FunctionCategory.AGGREGATE, "1m", "avg") {
		@Override
		protected BoundFunction doBind(List<String> params) {
			return bindAggregateBy(this, params, params.get(0), AggregationType.forName(params.get(1)));
		}
	},
	
	TOP("top", FunctionCategory.FILTER, "5", "avg") {
		@Override
		protected BoundFunction doBind(List<String> params) {
			return bindRank(this, params, true);
		}
	},
	
	BOTTOM("bottom", FunctionCategory.FILTER, "5", "avg") {
		@Override
		protected BoundFunction doBind(List<String> params) {
			return bindRank(this, params, false);
		}
	},
	
	TREND_VALUE("trendValue", FunctionCategory.TREND, "avg") {
		@Override
		protected BoundFunction doBind(List<String> params) {
			return new BoundFunction.TrendValue(this, params, TrendField.forName(params.get(0)));
		}
	},
	
	TIME_SHIFT("timeShift", FunctionCategory.TIME, "24h") {
		@Override
		protected BoundFunction doBind(List<String> params) {
			return new BoundFunction.TimeShift(this, params, TimeUtil.parseTimeShift(params.get(0)));
		}
	},
	
	SET_ALIAS("setAlias", FunctionCategory.ALIAS, (String)null) {
		@Override
		protected BoundFunction doBind(List<String> params) {
			
			final String alias = params.get(0);
			
			return new BoundFunction.Alias(this, params) {
				
				@Override
				public String apply(String label) {
					return alias;
				}
			};
		}
	},
	
	REPLACE_ALIAS("replaceAlias", FunctionCategory.ALIAS, "/(.*)/", "$1") {
		@Override
		protected BoundFunction doBind(List<String> params) {
			
			final String replacement = params.get(1);
			final boolean global;
			final Pattern pattern;
			
			Matcher regexMatcher = REGEX_PARAM.matcher(params.get(0));
			
			if (regexMatcher.matches()) {
				
				String flags = regexMatcher.group(2);
				int patternFlags = (flags.indexOf('i') != -1) ? Pattern.CASE_INSENSITIVE : 0;
				
				try {
					pattern = Pattern.compile(regexMatcher.group(1), patternFlags);
				} catch (PatternSyntaxException e) {
					throw new ConfigurationException("Invalid regex " + params.get(0) + ": " + e.getDescription(), e);
				}
				
				global = flags.indexOf('g') != -1;
			} else {
				pattern = Pattern.compile(Pattern.quote(params.get(0)));
				global = false;
			}
			
			return new BoundFunction.Alias(this, params) {
				
				@Override
				public String apply(String label) {
					
					Matcher matcher = pattern.matcher(Strings.nullToEmpty(label));
					
					try {
						return global ? matcher.replaceAll(replacement) : matcher.replaceFirst(replacement);
					} catch (IllegalArgumentException | IndexOutOfBoundsException e) {
						throw new ConfigurationException("Invalid alias replacement " + replacement + ": " + e.getMessage(), e);
					}
				}
			};
		}
	};
	
	private static final Pattern REGEX_PARAM = Pattern.compile("^/(.*)/([gmi]*)$");
	
	private static final Map<String, MetricFunction> functionsByName;
	
	private final String name;
	private final FunctionCategory category;
	private final List<String> defaults;
	
	private MetricFunction(String name, FunctionCategory category, String... defaults) {
		this.name = name;
		this.category = category;
		this.defaults = Collections.unmodifiableList(Arrays.asList(defaults));
	}
	
	public String getName() {
		return name;
	}
	
	public FunctionCategory getCategory() {
		return category;
	}
	
	public List<String> getDefaults() {
		return defaults;
	}
	
	/**
	 * Validates the params, fills in defaults for missing trailing ones and binds the function.
	 */
	public BoundFunction bind(List<String> params) {
		
		List<String> given = (params != null) ? params : Collections.<String>emptyList();
		
		if (given.size() > defaults.size()) {
			throw new ConfigurationException(name + " takes at most " + defaults.size() 
				+ " parameters, got " + given.size());
		}
		
		List<String> resolved = new ArrayList<String>(defaults.size());
		
		for (int i = 0; i < defaults.size(); i++) {
			
			String value = (i < given.size()) ? given.get(i) : null;
			
			if (Strings.isNullOrEmpty(value)) {
				value = defaults.get(i);
			}
			
			if (value == null) {
				throw new ConfigurationException(name + " is missing required parameter " + (i + 1));
			}
			
			resolved.add(value);
		}
		
		return doBind(resolved);
	}
	
	protected abstract BoundFunction doBind(List<String> params);
	
	public static MetricFunction forName(String name) {
		
		MetricFunction result = (name != null) ? functionsByName.get(name.trim()) : null;
		
		if (result == null) {
			throw new ConfigurationException("Unsupported function " + name);
		}
		
		return result;
	}
	
	private static BoundFunction bindAggregateBy(MetricFunction function, List<String> params,
		String intervalParam, final AggregationType aggregation) {
		
		final long interval = positiveInterval(intervalParam);
		
		return new BoundFunction.Aggregate(function, params) {
			
			@Override
			public List<DataPoint> apply(List<TimeSeries> series) {
				return DataProcessor.aggregateBy(series, interval, aggregation);
			}
		};
	}
	
	private static BoundFunction bindRank(MetricFunction function, List<String> params, final boolean highest) {
		
		final int count = parsePositiveInt(params.get(0));
		final AggregationType aggregation = AggregationType.forName(params.get(1));
		
		return new BoundFunction.Filter(function, params) {
			
			@Override
			public List<TimeSeries> apply(List<TimeSeries> series) {
				return DataProcessor.rank(series, count, aggregation, highest);
			}
		};
	}
	
	private static long positiveInterval(String value) {
		
		long interval = TimeUtil.parseInterval(value);
		
		if (interval <= 0) {
			throw new ConfigurationException("Interval must be positive: " + value);
		}
		
		return interval;
	}
	
	private static double parseDouble(String value) {
		
		try {
			return Double.parseDouble(value.trim());
		} catch (NumberFormatException e) {
			throw new ConfigurationException("Not a number: " + value, e);
		}
	}
	
	private static int parsePositiveInt(String value) {
		
		int result;
		
		try {
			result = Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new ConfigurationException("Not an integer: " + value, e);
		}
		
		if (result <= 0) {
			throw new ConfigurationException("Must be positive: " + value);
		}
		
		return result;
	}
	
	static {
		functionsByName = new HashMap<String, MetricFunction>();
		
		for (MetricFunction function : values()) {
			functionsByName.put(function.name, function);
		}
	}
}
