package org.zabbixds.integrations.grafana.functions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.zabbixds.integrations.grafana.api.data.Application;
import org.zabbixds.integrations.grafana.api.data.Event;
import org.zabbixds.integrations.grafana.api.data.Host;
import org.zabbixds.integrations.grafana.api.data.Trigger;
import org.zabbixds.integrations.grafana.datasource.ZabbixDatasource;
import org.zabbixds.integrations.grafana.input.AnnotationInput;
import org.zabbixds.integrations.grafana.output.AnnotationEvent;
import org.zabbixds.integrations.grafana.query.QueryResolver;
import org.zabbixds.integrations.grafana.query.ResponseNormalizer;
import org.zabbixds.integrations.grafana.query.filter.Filter;
import org.zabbixds.integrations.grafana.query.filter.Filters;
import org.zabbixds.integrations.grafana.util.TimeUtil;

/**
 * Turns the problem (and optionally recovery) events of matching triggers into annotations.
 */
public class AnnotationFunction {
	
	private static final Logger logger = LoggerFactory.getLogger(AnnotationFunction.class);
	
	private final ZabbixDatasource datasource;
	
	public AnnotationFunction(ZabbixDatasource datasource) {
		this.datasource = datasource;
	}
	
	public List<AnnotationEvent> process(AnnotationInput input) {
		
		if ((input == null) || (input.range == null)) {
			throw new IllegalArgumentException("Missing annotation range");
		}
		
		QueryResolver resolver = datasource.getResolver();
		
		Filter groupFilter = Filters.parse(input.group);
		Filter hostFilter = Filters.parse(input.host);
		Filter appFilter = Filters.parse(input.application);
		
		List<Host> hosts = resolver.getHosts(groupFilter, hostFilter);
		
		if (hosts.isEmpty()) {
			return Collections.emptyList();
		}
		
		Set<String> applicationIds = null;
		
		if ((!appFilter.matchesAll()) && (datasource.getCache().isApplicationsSupported())) {
			
			List<Application> apps = resolver.getApplications(groupFilter, hostFilter, appFilter);
			
			// the lookup may have found that the endpoint has no applications, triggers are then not scoped by them
			if (datasource.getCache().isApplicationsSupported()) {
				
				if (apps.isEmpty()) {
					return Collections.emptyList();
				}
				
				applicationIds = new LinkedHashSet<String>();
				
				for (Application app : apps) {
					applicationIds.add(app.applicationId);
				}
			}
		}
		
		Filter triggerFilter = Filters.parse(input.trigger);
		Map<String, Trigger> triggersById = new HashMap<String, Trigger>();
		
		for (Trigger trigger : datasource.getApi().getTriggers(QueryResolver.getHostIds(hosts), applicationIds)) {
			
			if ((triggerFilter.matches(trigger.description)) && (trigger.priority >= input.minSeverity)) {
				triggersById.put(trigger.triggerId, trigger);
			}
		}
		
		if (triggersById.isEmpty()) {
			return Collections.emptyList();
		}
		
		List<Event> events = datasource.getApi().getEvents(triggersById.keySet(), 
			input.range.getFromSeconds(), input.range.getToSeconds(), input.showOkEvents);
		
		logger.debug("{} events for {} triggers", events.size(), triggersById.size());
		
		List<AnnotationEvent> result = new ArrayList<AnnotationEvent>(events.size());
		
		for (Event event : events) {
			
			if ((input.hideAcknowledged) && (event.isAcknowledged())) {
				continue;
			}
			
			Trigger trigger = triggersById.get(event.objectId);
			
			if (trigger == null) {
				continue;
			}
			
			result.add(toAnnotation(event, trigger, input.showHostname));
		}
		
		return result;
	}
	
	private static AnnotationEvent toAnnotation(Event event, Trigger trigger, boolean showHostname) {
		
		AnnotationEvent result = new AnnotationEvent();
		
		result.time = TimeUtil.secondsToMillis(event.clock);
		result.title = event.isProblem() ? AnnotationEvent.PROBLEM : AnnotationEvent.OK;
		result.text = trigger.description + ResponseNormalizer.formatAcknowledges(event.acknowledges);
		result.tags = new ArrayList<String>();
		
		if (showHostname) {
			
			List<Host> hosts = (event.hosts != null) ? event.hosts : trigger.hosts;
			
			if (hosts != null) {
				for (Host host : hosts) {
					result.tags.add(host.name);
				}
			}
		}
		
		return result;
	}
}
