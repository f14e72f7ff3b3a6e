package org.zabbixds.integrations.grafana.functions;

import java.util.List;

import org.zabbixds.integrations.grafana.datasource.ZabbixDatasource;
import org.zabbixds.integrations.grafana.input.QueryInput;
import org.zabbixds.integrations.grafana.input.QueryMode;
import org.zabbixds.integrations.grafana.input.Target;
import org.zabbixds.integrations.grafana.output.TimeSeries;

/**
 * Produces the series of a single target. One implementation per query mode.
 */
public abstract class TargetFunction {
	
	public interface FunctionFactory {
		
		public TargetFunction create(ZabbixDatasource datasource);
		public QueryMode getMode();
	}
	
	protected final ZabbixDatasource datasource;
	
	protected TargetFunction(ZabbixDatasource datasource) {
		this.datasource = datasource;
	}
	
	public abstract List<TimeSeries> process(Target target, QueryInput input);
}
