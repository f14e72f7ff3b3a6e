package org.zabbixds.integrations.grafana.functions;

import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.zabbixds.integrations.grafana.api.ZabbixApi;
import org.zabbixds.integrations.grafana.api.data.Item;
import org.zabbixds.integrations.grafana.api.data.ItemKind;
import org.zabbixds.integrations.grafana.datasource.ZabbixDatasource;
import org.zabbixds.integrations.grafana.input.QueryInput;
import org.zabbixds.integrations.grafana.input.QueryMode;
import org.zabbixds.integrations.grafana.input.Target;
import org.zabbixds.integrations.grafana.input.TimeRange;
import org.zabbixds.integrations.grafana.output.TimeSeries;
import org.zabbixds.integrations.grafana.pipeline.Downsampler;
import org.zabbixds.integrations.grafana.pipeline.FunctionPipeline;
import org.zabbixds.integrations.grafana.query.ResponseNormalizer;
import org.zabbixds.integrations.grafana.query.filter.Filter;
import org.zabbixds.integrations.grafana.query.filter.Filters;
import org.zabbixds.integrations.grafana.settings.DatasourceSettings;
import org.zabbixds.integrations.grafana.util.TimeUtil;

public class NumericDataFunction extends TargetFunction {
	
	private static final Logger logger = LoggerFactory.getLogger(NumericDataFunction.class);
	
	public static class Factory implements FunctionFactory {
		
		@Override
		public TargetFunction create(ZabbixDatasource datasource) {
			return new NumericDataFunction(datasource);
		}
		
		@Override
		public QueryMode getMode() {
			return QueryMode.NUMERIC;
		}
	}
	
	public NumericDataFunction(ZabbixDatasource datasource) {
		super(datasource);
	}
	
	@Override
	public List<TimeSeries> process(Target target, QueryInput input) {
		
		FunctionPipeline pipeline = FunctionPipeline.bind(target.getFunctions());
		
		if (!target.hasItemFilters()) {
			return Collections.emptyList();
		}
		
		Filter hostFilter = Filters.parse(target.host);
		
		List<Item> items = datasource.getResolver().resolve(Filters.parse(target.group), hostFilter,
			Filters.parse(target.application), Filters.parse(target.item), ItemKind.NUMERIC);
		
		if (items.isEmpty()) {
			return Collections.emptyList();
		}
		
		TimeRange range = pipeline.applyTimeFunctions(input.range);
		boolean addHostName = ResponseNormalizer.shouldAddHostName(hostFilter, items);
		
		ZabbixApi api = datasource.getApi();
		List<TimeSeries> series;
		
		if (useTrends(range)) {
			logger.debug("Fetching trends of {} items for {}", items.size(), target);
			
			series = ResponseNormalizer.normalizeTrends(
				api.getTrends(items, range.getFromSeconds(), range.getToSeconds()), 
				items, pipeline.getTrendField(), addHostName);
		} else {
			series = ResponseNormalizer.normalizeHistory(
				api.getHistory(items, range.getFromSeconds(), range.getToSeconds()), 
				items, addHostName);
		}
		
		series = pipeline.apply(series);
		
		return Downsampler.limit(series, input.maxDataPoints, input.intervalMs);
	}
	
	private boolean useTrends(TimeRange range) {
		
		DatasourceSettings settings = datasource.getSettings();
		
		if (!settings.trends) {
			return false;
		}
		
		return range.from <= TimeUtil.now() - settings.getTrendsFromMillis();
	}
}
