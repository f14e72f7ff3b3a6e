package org.zabbixds.integrations.grafana.input;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Strings;

/**
 * A single panel query. Group, host, application and item are filters: an exact name, "*" or
 * empty for everything, "/regex/flags", or the legacy "{a,b,c}" list.
 */
public class Target {
	
	public String refId;
	
	/**
	 * numeric (default), text or service.
	 */
	public QueryMode mode;
	
	public String group;
	public String host;
	public String application;
	public String item;
	
	public List<FunctionCall> functions;
	
	/**
	 * Text mode only: a regex applied to each value, the match replaces the value.
	 */
	public String textFilter;
	
	/**
	 * Text mode only: use the first capture group of textFilter instead of the whole match.
	 */
	public boolean useCaptureGroups;
	
	/**
	 * Service mode only: the IT service id, or a name when the id is not known.
	 */
	public String itServiceId;
	public String itServiceName;
	
	/**
	 * Service mode only: the SLA figure to report, sla by default.
	 */
	public SlaProperty slaProperty;
	
	public boolean hide;
	
	public QueryMode getMode() {
		
		if (mode == null) {
			return QueryMode.NUMERIC;
		}
		
		return mode;
	}
	
	public List<FunctionCall> getFunctions() {
		
		if (functions == null) {
			return new ArrayList<FunctionCall>();
		}
		
		return functions;
	}
	
	public SlaProperty getSlaProperty() {
		
		if (slaProperty == null) {
			return SlaProperty.SLA;
		}
		
		return slaProperty;
	}
	
	/**
	 * A target missing any of group, host or item yields no series. An empty filter is present and
	 * matches everything.
	 */
	public boolean hasItemFilters() {
		return (group != null) && (host != null) && (item != null);
	}
	
	public boolean hasService() {
		return (!Strings.isNullOrEmpty(itServiceId)) || (!Strings.isNullOrEmpty(itServiceName));
	}
	
	@Override
	public String toString() {
		return refId + ": " + group + "." + host + "." + application + "." + item;
	}
}
