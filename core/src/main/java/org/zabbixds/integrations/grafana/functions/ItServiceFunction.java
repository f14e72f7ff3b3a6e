package org.zabbixds.integrations.grafana.functions;

import java.util.Collections;
import java.util.List;

import com.google.common.base.Strings;
import org.zabbixds.integrations.grafana.api.data.ItService;
import org.zabbixds.integrations.grafana.api.data.ServiceSla;
import org.zabbixds.integrations.grafana.datasource.ZabbixDatasource;
import org.zabbixds.integrations.grafana.input.QueryInput;
import org.zabbixds.integrations.grafana.input.QueryMode;
import org.zabbixds.integrations.grafana.input.Target;
import org.zabbixds.integrations.grafana.input.TimeRange;
import org.zabbixds.integrations.grafana.output.TimeSeries;
import org.zabbixds.integrations.grafana.pipeline.FunctionPipeline;
import org.zabbixds.integrations.grafana.query.ConfigurationException;
import org.zabbixds.integrations.grafana.query.ResponseNormalizer;

/**
 * Reports one SLA figure of an IT service for the query window.
 */
public class ItServiceFunction extends TargetFunction {
	
	public static class Factory implements FunctionFactory {
		
		@Override
		public TargetFunction create(ZabbixDatasource datasource) {
			return new ItServiceFunction(datasource);
		}
		
		@Override
		public QueryMode getMode() {
			return QueryMode.SERVICE;
		}
	}
	
	public ItServiceFunction(ZabbixDatasource datasource) {
		super(datasource);
	}
	
	@Override
	public List<TimeSeries> process(Target target, QueryInput input) {
		
		FunctionPipeline pipeline = FunctionPipeline.bind(target.getFunctions());
		
		if (!target.hasService()) {
			return Collections.emptyList();
		}
		
		ItService service = findService(target);
		TimeRange range = pipeline.applyTimeFunctions(input.range);
		
		ServiceSla sla = datasource.getApi().getSla(service.serviceId, 
			range.getFromSeconds(), range.getToSeconds());
		
		TimeSeries series = ResponseNormalizer.normalizeSla(sla, service.name, 
			target.getSlaProperty(), range.to);
		
		return pipeline.apply(Collections.singletonList(series));
	}
	
	private ItService findService(Target target) {
		
		for (ItService service : datasource.getCache().getItServices()) {
			
			if ((!Strings.isNullOrEmpty(target.itServiceId)) && (target.itServiceId.equals(service.serviceId))) {
				return service;
			}
			
			if ((Strings.isNullOrEmpty(target.itServiceId)) && (target.itServiceName.equals(service.name))) {
				return service;
			}
		}
		
		String id = Strings.isNullOrEmpty(target.itServiceId) ? target.itServiceName : target.itServiceId;
		throw new ConfigurationException("Unknown IT service " + id);
	}
}
