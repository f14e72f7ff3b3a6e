package org.zabbixds.integrations.grafana.servlet;

import java.io.IOException;

import javax.servlet.ServletException;
import javax.servlet.annotation.WebServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import org.zabbixds.integrations.grafana.settings.DatasourceSettings;
import org.zabbixds.integrations.grafana.util.QueryUtil;

/**
 * Connection test: reports the API version, an authentication error or an unreachable endpoint.
 */
@WebServlet(name="TestServlet", urlPatterns="/test")
public class TestServlet extends BaseJsonServlet {
	
	private static final long serialVersionUID = 7790381846140290718L;
	
	@Override
	protected void doGet(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		doPost(request, response);
	}
	
	@Override
	protected String process(DatasourceSettings settings, String body) {
		return QueryUtil.test(settings);
	}
}
