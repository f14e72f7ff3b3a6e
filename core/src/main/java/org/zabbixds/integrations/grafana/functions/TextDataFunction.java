package org.zabbixds.integrations.grafana.functions;

import java.util.Collections;
import java.util.List;

import org.zabbixds.integrations.grafana.api.data.Item;
import org.zabbixds.integrations.grafana.api.data.ItemKind;
import org.zabbixds.integrations.grafana.datasource.ZabbixDatasource;
import org.zabbixds.integrations.grafana.input.QueryInput;
import org.zabbixds.integrations.grafana.input.QueryMode;
import org.zabbixds.integrations.grafana.input.Target;
import org.zabbixds.integrations.grafana.input.TimeRange;
import org.zabbixds.integrations.grafana.output.TimeSeries;
import org.zabbixds.integrations.grafana.query.ResponseNormalizer;
import org.zabbixds.integrations.grafana.query.filter.Filter;
import org.zabbixds.integrations.grafana.query.filter.Filters;

/**
 * Raw history of text items. Metric functions are not applied to text values.
 */
public class TextDataFunction extends TargetFunction {
	
	public static class Factory implements FunctionFactory {
		
		@Override
		public TargetFunction create(ZabbixDatasource datasource) {
			return new TextDataFunction(datasource);
		}
		
		@Override
		public QueryMode getMode() {
			return QueryMode.TEXT;
		}
	}
	
	public TextDataFunction(ZabbixDatasource datasource) {
		super(datasource);
	}
	
	@Override
	public List<TimeSeries> process(Target target, QueryInput input) {
		
		if (!target.hasItemFilters()) {
			return Collections.emptyList();
		}
		
		Filter hostFilter = Filters.parse(target.host);
		
		List<Item> items = datasource.getResolver().resolve(Filters.parse(target.group), hostFilter,
			Filters.parse(target.application), Filters.parse(target.item), ItemKind.TEXT);
		
		if (items.isEmpty()) {
			return Collections.emptyList();
		}
		
		TimeRange range = input.range;
		
		List<TimeSeries> series = ResponseNormalizer.normalizeHistory(
			datasource.getApi().getHistory(items, range.getFromSeconds(), range.getToSeconds()), 
			items, ResponseNormalizer.shouldAddHostName(hostFilter, items));
		
		return ResponseNormalizer.extractText(series, target.textFilter, target.useCaptureGroups);
	}
}
