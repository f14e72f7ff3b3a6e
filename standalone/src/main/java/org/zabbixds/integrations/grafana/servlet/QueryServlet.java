package org.zabbixds.integrations.grafana.servlet;

import javax.servlet.annotation.WebServlet;

import org.zabbixds.integrations.grafana.settings.DatasourceSettings;
import org.zabbixds.integrations.grafana.util.QueryUtil;

@WebServlet(name="QueryServlet", urlPatterns="/query")
public class QueryServlet extends BaseJsonServlet {
	
	private static final long serialVersionUID = -8413366001016047591L;
	
	@Override
	protected String process(DatasourceSettings settings, String body) {
		return QueryUtil.query(settings, body);
	}
}
