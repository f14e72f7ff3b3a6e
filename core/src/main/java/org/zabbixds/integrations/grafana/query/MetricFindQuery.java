package org.zabbixds.integrations.grafana.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.zabbixds.integrations.grafana.api.data.Application;
import org.zabbixds.integrations.grafana.api.data.Group;
import org.zabbixds.integrations.grafana.api.data.Host;
import org.zabbixds.integrations.grafana.api.data.Item;
import org.zabbixds.integrations.grafana.api.data.ItemKind;
import org.zabbixds.integrations.grafana.output.MetricFindValue;
import org.zabbixds.integrations.grafana.query.filter.Filter;
import org.zabbixds.integrations.grafana.query.filter.Filters;

/**
 * Resolves "group.host.application.item" lookups used by template variables. The number of segments
 * selects the level that is returned.
 */
public class MetricFindQuery {
	
	public static final int MAX_DEPTH = 4;
	
	// a /regex/flags or {a,b} segment, which may itself contain dots
	private static final Pattern QUOTED_SEGMENT = Pattern.compile("^(/.*?/[gim]*|\\{[^}]*\\})(?:\\.|$)");
	
	private final QueryResolver resolver;
	
	public MetricFindQuery(QueryResolver resolver) {
		this.resolver = resolver;
	}
	
	public List<MetricFindValue> find(String query) {
		
		if (query == null) {
			return Collections.emptyList();
		}
		
		List<String> parts = splitQuery(query);
		
		if ((parts.isEmpty()) || (parts.size() > MAX_DEPTH)) {
			return Collections.emptyList();
		}
		
		List<Filter> filters = new ArrayList<Filter>();
		
		for (String part : parts) {
			filters.add(Filters.parse(part));
		}
		
		Set<String> names = new LinkedHashSet<String>();
		
		switch (parts.size()) {
			
			case 1:
				for (Group group : resolver.getGroups(filters.get(0))) {
					names.add(group.name);
				}
				break;
				
			case 2:
				for (Host host : resolver.getHosts(filters.get(0), filters.get(1))) {
					names.add(host.name);
				}
				break;
				
			case 3:
				for (Application app : resolver.getApplications(filters.get(0), filters.get(1), filters.get(2))) {
					names.add(app.name);
				}
				break;
				
			default:
				// a wildcard application is resolved by host, so items without an application are listed too
				for (Item item : resolver.resolve(filters.get(0), filters.get(1), filters.get(2),
					filters.get(3), ItemKind.ALL)) {
					names.add(item.getDisplayName());
				}
				break;
		}
		
		List<MetricFindValue> result = new ArrayList<MetricFindValue>();
		
		for (String name : names) {
			result.add(new MetricFindValue(name));
		}
		
		return result;
	}
	
	static List<String> splitQuery(String query) {
		
		List<String> parts = new ArrayList<String>();
		String remaining = query;
		
		while (true) {
			
			Matcher matcher = QUOTED_SEGMENT.matcher(remaining);
			String part;
			int next;
			
			if (matcher.find()) {
				part = matcher.group(1);
				next = matcher.end();
			} else {
				
				int dot = remaining.indexOf('.');
				
				if (dot < 0) {
					parts.add(remaining);
					return parts;
				}
				
				part = remaining.substring(0, dot);
				next = dot + 1;
			}
			
			parts.add(part);
			
			if (next >= remaining.length()) {
				
				if (remaining.endsWith(".")) {
					parts.add("");
				}
				
				return parts;
			}
			
			remaining = remaining.substring(next);
		}
	}
}
