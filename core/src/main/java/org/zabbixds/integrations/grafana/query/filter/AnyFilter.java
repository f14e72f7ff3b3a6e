package org.zabbixds.integrations.grafana.query.filter;

public class AnyFilter implements Filter {
	
	public static final AnyFilter INSTANCE = new AnyFilter();
	
	private AnyFilter() {
	}
	
	@Override
	public boolean matches(String name) {
		return true;
	}
	
	@Override
	public boolean matchesAll() {
		return true;
	}
	
	@Override
	public boolean isPattern() {
		return true;
	}
	
	@Override
	public String toString() {
		return "*";
	}
}
