package org.zabbixds.integrations.grafana.output;

import java.util.List;

public class QueryResult {
	public List<TargetResult> results;
}
