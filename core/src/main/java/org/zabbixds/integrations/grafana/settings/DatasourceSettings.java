package org.zabbixds.integrations.grafana.settings;

import com.google.common.base.Objects;
import com.google.common.base.Strings;
import org.zabbixds.integrations.grafana.api.RemoteZabbixTransport;
import org.zabbixds.integrations.grafana.util.TimeUtil;

/**
 * Connection and behavior settings of one Zabbix datasource.
 */
public class DatasourceSettings {
	
	public static final String DEFAULT_TRENDS_FROM = "7d";
	public static final String DEFAULT_CACHE_TTL = "1h";
	
	/**
	 * The Zabbix API endpoint, e.g. http://zabbix/api_jsonrpc.php
	 */
	public String url;
	
	public String username;
	public String password;
	
	/**
	 * Optional Authorization header value sent with every request, e.g. "Basic dXNlcjpwYXNz".
	 */
	public String basicAuth;
	
	public boolean withCredentials;
	public boolean tlsSkipVerify;
	
	/**
	 * Use trend.get instead of history.get for windows starting at or before now - trendsFrom.
	 */
	public boolean trends;
	public String trendsFrom;
	
	/**
	 * How long metadata (groups, hosts, applications, items) is cached.
	 */
	public String cacheTTL;
	
	/**
	 * HTTP timeout in millis.
	 */
	public int timeout;
	
	public DatasourceSettings copy() {
		
		DatasourceSettings result = new DatasourceSettings();
		
		result.url = url;
		result.username = username;
		result.password = password;
		result.basicAuth = basicAuth;
		result.withCredentials = withCredentials;
		result.tlsSkipVerify = tlsSkipVerify;
		result.trends = trends;
		result.trendsFrom = trendsFrom;
		result.cacheTTL = cacheTTL;
		result.timeout = timeout;
		
		return result;
	}
	
	public long getTrendsFromMillis() {
		return TimeUtil.parseInterval(Strings.isNullOrEmpty(trendsFrom) ? DEFAULT_TRENDS_FROM : trendsFrom);
	}
	
	public long getCacheTTLMillis() {
		return TimeUtil.parseInterval(Strings.isNullOrEmpty(cacheTTL) ? DEFAULT_CACHE_TTL : cacheTTL);
	}
	
	public int getTimeout() {
		
		if (timeout <= 0) {
			return RemoteZabbixTransport.DEFAULT_TIMEOUT;
		}
		
		return Math.max(RemoteZabbixTransport.MIN_TIMEOUT, timeout);
	}
	
	@Override
	public boolean equals(Object obj) {
		
		if (!(obj instanceof DatasourceSettings)) {
			return false;
		}
		
		DatasourceSettings other = (DatasourceSettings)obj;
		
		return Objects.equal(url, other.url) 
			&& Objects.equal(username, other.username)
			&& Objects.equal(password, other.password)
			&& Objects.equal(basicAuth, other.basicAuth)
			&& (withCredentials == other.withCredentials)
			&& (tlsSkipVerify == other.tlsSkipVerify)
			&& (trends == other.trends)
			&& Objects.equal(trendsFrom, other.trendsFrom)
			&& Objects.equal(cacheTTL, other.cacheTTL)
			&& (timeout == other.timeout);
	}
	
	@Override
	public int hashCode() {
		return Objects.hashCode(url, username, password, basicAuth, Boolean.valueOf(withCredentials), 
			Boolean.valueOf(tlsSkipVerify), Boolean.valueOf(trends), trendsFrom, cacheTTL, Integer.valueOf(timeout));
	}
	
	@Override
	public String toString() {
		return username + "@" + url;
	}
}
