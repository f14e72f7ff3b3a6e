package org.zabbixds.integrations.grafana.query.filter;

public class ExactFilter implements Filter {
	
	private final String name;
	
	public ExactFilter(String name) {
		this.name = name;
	}
	
	public String getName() {
		return name;
	}
	
	@Override
	public boolean matches(String name) {
		return this.name.equals(name);
	}
	
	@Override
	public boolean matchesAll() {
		return false;
	}
	
	@Override
	public boolean isPattern() {
		return false;
	}
	
	@Override
	public String toString() {
		return name;
	}
}
