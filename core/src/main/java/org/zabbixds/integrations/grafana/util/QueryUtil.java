package org.zabbixds.integrations.grafana.util;

import java.util.List;

import org.zabbixds.integrations.grafana.datasource.DatasourceRegistry;
import org.zabbixds.integrations.grafana.datasource.ZabbixDatasource;
import org.zabbixds.integrations.grafana.input.AnnotationInput;
import org.zabbixds.integrations.grafana.input.MetricFindInput;
import org.zabbixds.integrations.grafana.input.QueryInput;
import org.zabbixds.integrations.grafana.output.AnnotationEvent;
import org.zabbixds.integrations.grafana.output.ConnectionTestResult;
import org.zabbixds.integrations.grafana.output.MetricFindValue;
import org.zabbixds.integrations.grafana.output.QueryResult;
import org.zabbixds.integrations.grafana.settings.DatasourceSettings;

/**
 * JSON in, JSON out entry points used by the HTTP host.
 */
public class QueryUtil {
	
	public static String query(DatasourceSettings settings, String json) {
		return query(DatasourceRegistry.getDatasource(settings), json);
	}
	
	public static String query(ZabbixDatasource datasource, String json) {
		
		QueryInput input = JsonUtil.fromJson(json, QueryInput.class);
		QueryResult result = datasource.query(input);
		
		return JsonUtil.toJson(result);
	}
	
	public static String search(DatasourceSettings settings, String json) {
		return search(DatasourceRegistry.getDatasource(settings), json);
	}
	
	public static String search(ZabbixDatasource datasource, String json) {
		
		MetricFindInput input = JsonUtil.fromJson(json, MetricFindInput.class);
		List<MetricFindValue> result = datasource.metricFindQuery(input.query);
		
		return JsonUtil.toJson(result);
	}
	
	public static String annotations(DatasourceSettings settings, String json) {
		return annotations(DatasourceRegistry.getDatasource(settings), json);
	}
	
	public static String annotations(ZabbixDatasource datasource, String json) {
		
		AnnotationInput input = JsonUtil.fromJson(json, AnnotationInput.class);
		List<AnnotationEvent> result = datasource.annotationQuery(input);
		
		return JsonUtil.toJson(result);
	}
	
	public static String test(DatasourceSettings settings) {
		
		ConnectionTestResult result = DatasourceRegistry.getDatasource(settings).testDatasource();
		
		return JsonUtil.toJson(result);
	}
}
