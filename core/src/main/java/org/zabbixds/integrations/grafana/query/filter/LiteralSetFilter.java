package org.zabbixds.integrations.grafana.query.filter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Legacy "{a,b,c}" filter matching any of the listed names exactly.
 */
public class LiteralSetFilter implements Filter {
	
	private final Set<String> names;
	
	public LiteralSetFilter(Set<String> names) {
		this.names = Collections.unmodifiableSet(new LinkedHashSet<String>(names));
	}
	
	public Set<String> getNames() {
		return names;
	}
	
	@Override
	public boolean matches(String name) {
		return names.contains(name);
	}
	
	@Override
	public boolean matchesAll() {
		return false;
	}
	
	@Override
	public boolean isPattern() {
		return true;
	}
	
	@Override
	public String toString() {
		return names.toString();
	}
}
