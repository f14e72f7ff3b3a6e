package org.zabbixds.integrations.grafana.servlet;

import javax.servlet.annotation.WebServlet;

import org.zabbixds.integrations.grafana.settings.DatasourceSettings;
import org.zabbixds.integrations.grafana.util.QueryUtil;

/**
 * Template variable lookups, e.g. {"query":"Linux servers.*"}.
 */
@WebServlet(name="SearchServlet", urlPatterns="/search")
public class SearchServlet extends BaseJsonServlet {
	
	private static final long serialVersionUID = 5213987530263201873L;
	
	@Override
	protected String process(DatasourceSettings settings, String body) {
		return QueryUtil.search(settings, body);
	}
}
