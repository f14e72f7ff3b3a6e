package org.zabbixds.integrations.grafana.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.zabbixds.integrations.grafana.api.data.Application;
import org.zabbixds.integrations.grafana.api.data.Group;
import org.zabbixds.integrations.grafana.api.data.Host;
import org.zabbixds.integrations.grafana.api.data.Item;
import org.zabbixds.integrations.grafana.api.data.ItemKind;
import org.zabbixds.integrations.grafana.cache.MetadataCache;
import org.zabbixds.integrations.grafana.query.filter.Filter;
import org.zabbixds.integrations.grafana.query.filter.Filters;

/**
 * Walks group, host, application and item levels top-down. Every level is narrowed by its
 * filter and scopes the remote query of the next level.
 */
public class QueryResolver {
	
	private final MetadataCache cache;
	
	public QueryResolver(MetadataCache cache) {
		this.cache = cache;
	}
	
	public MetadataCache getCache() {
		return cache;
	}
	
	public List<Group> getGroups(String groupFilter) {
		return getGroups(Filters.parse(groupFilter));
	}
	
	public List<Group> getGroups(Filter groupFilter) {
		
		List<Group> result = new ArrayList<Group>();
		
		for (Group group : cache.getAllGroups()) {
			if (groupFilter.matches(group.name)) {
				result.add(group);
			}
		}
		
		return result;
	}
	
	public List<Host> getHosts(String groupFilter, String hostFilter) {
		return getHosts(Filters.parse(groupFilter), Filters.parse(hostFilter));
	}
	
	public List<Host> getHosts(Filter groupFilter, Filter hostFilter) {
		
		List<Group> groups = getGroups(groupFilter);
		
		if (groups.isEmpty()) {
			return Collections.emptyList();
		}
		
		Set<String> groupIds = new LinkedHashSet<String>();
		
		for (Group group : groups) {
			groupIds.add(group.groupId);
		}
		
		List<Host> result = new ArrayList<Host>();
		
		for (Host host : cache.getAllHosts(groupIds)) {
			if (hostFilter.matches(host.name)) {
				result.add(host);
			}
		}
		
		return result;
	}
	
	public List<Application> getApplications(String groupFilter, String hostFilter, String appFilter) {
		return getApplications(Filters.parse(groupFilter), Filters.parse(hostFilter), Filters.parse(appFilter));
	}
	
	public List<Application> getApplications(Filter groupFilter, Filter hostFilter, Filter appFilter) {
		
		List<Host> hosts = getHosts(groupFilter, hostFilter);
		
		if (hosts.isEmpty()) {
			return Collections.emptyList();
		}
		
		return filterApplications(cache.getAllApplications(getHostIds(hosts)), appFilter);
	}
	
	public List<Item> getItems(String groupFilter, String hostFilter, String appFilter,
		String itemFilter, ItemKind itemKind) {
		
		return resolve(Filters.parse(groupFilter), Filters.parse(hostFilter), Filters.parse(appFilter),
			Filters.parse(itemFilter), itemKind);
	}
	
	/**
	 * Items are scoped by host when the application filter accepts everything or the endpoint has
	 * no application API, otherwise by the matching applications.
	 */
	public List<Item> resolve(Filter groupFilter, Filter hostFilter, Filter appFilter,
		Filter itemFilter, ItemKind itemKind) {
		
		List<Host> hosts = getHosts(groupFilter, hostFilter);
		
		if (hosts.isEmpty()) {
			return Collections.emptyList();
		}
		
		Set<String> hostIds = getHostIds(hosts);
		List<Item> items;
		
		if ((appFilter.matchesAll()) || (!cache.isApplicationsSupported())) {
			items = cache.getAllItems(hostIds, null, itemKind);
		} else {
			List<Application> apps = filterApplications(cache.getAllApplications(hostIds), appFilter);
			
			// the application lookup may have just discovered that the endpoint has none
			if (!cache.isApplicationsSupported()) {
				items = cache.getAllItems(hostIds, null, itemKind);
			} else if (apps.isEmpty()) {
				return Collections.emptyList();
			} else {
				Set<String> appIds = new LinkedHashSet<String>();
				
				for (Application app : apps) {
					appIds.add(app.applicationId);
				}
				
				items = cache.getAllItems(null, appIds, itemKind);
			}
		}
		
		List<Item> result = new ArrayList<Item>();
		
		for (Item item : items) {
			if (itemFilter.matches(item.getDisplayName())) {
				result.add(item);
			}
		}
		
		return result;
	}
	
	public static Set<String> getHostIds(Collection<Host> hosts) {
		
		Set<String> result = new LinkedHashSet<String>();
		
		for (Host host : hosts) {
			result.add(host.hostId);
		}
		
		return result;
	}
	
	private static List<Application> filterApplications(List<Application> apps, Filter appFilter) {
		
		List<Application> result = new ArrayList<Application>();
		
		for (Application app : apps) {
			if (appFilter.matches(app.name)) {
				result.add(app);
			}
		}
		
		return result;
	}
}
