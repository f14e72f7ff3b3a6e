package org.zabbixds.integrations.grafana.servlet;

import javax.servlet.annotation.WebServlet;

import org.zabbixds.integrations.grafana.settings.DatasourceSettings;
import org.zabbixds.integrations.grafana.util.QueryUtil;

@WebServlet(name="AnnotationsServlet", urlPatterns="/annotations")
public class AnnotationsServlet extends BaseJsonServlet {
	
	private static final long serialVersionUID = -2719306651542960364L;
	
	@Override
	protected String process(DatasourceSettings settings, String body) {
		return QueryUtil.annotations(settings, body);
	}
}
