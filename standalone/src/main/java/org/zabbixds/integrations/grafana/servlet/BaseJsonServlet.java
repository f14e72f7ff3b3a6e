package org.zabbixds.integrations.grafana.servlet;

import java.io.IOException;
import java.text.DecimalFormat;

import javax.servlet.ServletException;
import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.zabbixds.integrations.grafana.query.ConfigurationException;
import org.zabbixds.integrations.grafana.settings.DatasourceSettings;

/**
 * Reads the JSON request body, resolves the datasource settings and writes the JSON result.
 * Honors the logQuery, logResponse and disabled init parameters.
 */
public abstract class BaseJsonServlet extends HttpServlet {
	
	private static final Logger logger = LoggerFactory.getLogger(BaseJsonServlet.class);
	
	private static final long serialVersionUID = 3120457719235447611L;
	
	private static final DecimalFormat df = new DecimalFormat("#.00");
	
	private static final int MAX_LOGGED_RESPONSE = 1000;
	
	private boolean logQuery = false;
	private boolean logResponse = false;
	private boolean disabled = false;
	
	@Override
	public void init() throws ServletException {
		super.init();
		
		logQuery = ServletUtil.getBooleanConfigParam(this, "logQuery");
		logResponse = ServletUtil.getBooleanConfigParam(this, "logResponse");
		disabled = ServletUtil.getBooleanConfigParam(this, "disabled");
	}
	
	@Override
	protected void doPost(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		
		if (disabled) {
			response.sendError(HttpServletResponse.SC_NOT_FOUND);
			return;
		}
		
		String body = ServletUtil.getBody(request);
		
		if (logQuery) {
			logger.info("ZBX-AS-GRAFANA | {}: {} from {}", getServletName(), body, request.getRemoteAddr());
		}
		
		long t1 = System.currentTimeMillis();
		
		String json;
		
		try {
			DatasourceSettings settings = ServletUtil.getSettings(request);
			json = process(settings, body);
		} catch (IllegalArgumentException | ConfigurationException e) {
			logger.warn("ZBX-AS-GRAFANA | Bad {} request: {}", getServletName(), e.getMessage());
			response.sendError(HttpServletResponse.SC_BAD_REQUEST, e.getMessage());
			return;
		}
		
		long t2 = System.currentTimeMillis();
		
		double secs = (double) (t2 - t1) / 1000;
		
		if (logResponse) {
			logger.info("ZBX-AS-GRAFANA | {} ended {} ", getServletName(),
					df.format(secs) + " secs: " + json.substring(0, Math.min(MAX_LOGGED_RESPONSE, json.length())));
		}
		
		response.setContentType("application/json");
		response.setCharacterEncoding("UTF-8");
		
		response.getWriter().append(json);
	}
	
	protected abstract String process(DatasourceSettings settings, String body);
}
