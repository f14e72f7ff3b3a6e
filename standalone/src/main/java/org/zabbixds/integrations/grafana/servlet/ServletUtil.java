package org.zabbixds.integrations.grafana.servlet;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;

import org.apache.commons.io.IOUtils;

import com.google.common.base.Strings;
import org.zabbixds.integrations.grafana.settings.DatasourceSettings;
import org.zabbixds.integrations.grafana.settings.SettingsLoader;

public class ServletUtil {
	
	public static final String ZABBIX_URL_HEADER = "X-ZABBIX-URL";
	
	public static String getConfigParam(HttpServlet servlet, String key) {
		return servlet.getServletConfig().getInitParameter(key);
	}
	
	public static boolean getBooleanConfigParam(HttpServlet servlet, String key) {
		
		String value = getConfigParam(servlet, key);
		
		if (value == null) {
			return false;
		}
		
		return Boolean.parseBoolean(value);
	}
	
	public static String getBody(HttpServletRequest request) throws IOException {
		return IOUtils.toString(request.getInputStream(), StandardCharsets.UTF_8);
	}
	
	/**
	 * The configured settings, with the Zabbix user taken from a Basic Authorization header and the
	 * endpoint from the X-ZABBIX-URL header when the datasource passes them.
	 */
	public static DatasourceSettings getSettings(HttpServletRequest request) {
		
		DatasourceSettings settings = SettingsLoader.getDefaultSettings();
		
		String url = request.getHeader(ZABBIX_URL_HEADER);
		
		if (!Strings.isNullOrEmpty(url)) {
			settings.url = url;
		}
		
		Auth auth = getAuthentication(request);
		
		if (auth != null) {
			settings.username = auth.username;
			settings.password = auth.password;
		}
		
		return settings;
	}
	
	public static Auth getAuthentication(HttpServletRequest request) {
		
		String authorization = request.getHeader("Authorization");
		
		if ((authorization == null) || (!authorization.toLowerCase().startsWith("basic"))) {
			return null;
		}
		
		String base64Credentials = authorization.substring("Basic".length()).trim();
		byte[] credDecoded;
		
		try {
			credDecoded = Base64.getDecoder().decode(base64Credentials);
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Malformed Authorization header", e);
		}
		
		String credentials = new String(credDecoded, StandardCharsets.UTF_8);
		int sep = credentials.indexOf(':');
		
		if (sep == -1) {
			throw new IllegalArgumentException("Malformed Authorization header");
		}
		
		Auth auth = new Auth();
		
		auth.username = credentials.substring(0, sep);
		auth.password = credentials.substring(sep + 1);
		
		return auth;
	}
	
	public static class Auth {
		public String username;
		public String password;
		
		@Override
		public String toString()
		{
			return username + ", password size: " + password.length();
		}
	}
}
