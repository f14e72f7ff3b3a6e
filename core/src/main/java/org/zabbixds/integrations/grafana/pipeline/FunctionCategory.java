package org.zabbixds.integrations.grafana.pipeline;

/**
 * Categories in the order the pipeline applies them. Trends only selects the trend field that is
 * fetched and never touches points.
 */
public enum FunctionCategory {
	TIME,
	TREND,
	TRANSFORM,
	FILTER,
	AGGREGATE,
	ALIAS
}
