package org.zabbixds.integrations.grafana.input;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.common.base.Joiner;

/**
 * A metric function applied to the series of a target, e.g. {"name":"groupBy","params":["1m","avg"]}.
 */
public class FunctionCall {
	
	/**
	 * The registered function name, e.g. groupBy, sumSeries, setAlias.
	 */
	public String name;
	
	/**
	 * Positional parameters. Missing trailing parameters take the function defaults.
	 */
	public List<String> params;
	
	public FunctionCall() {
		this.params = new ArrayList<String>();
	}
	
	public FunctionCall(String name, String... params) {
		this.name = name;
		this.params = new ArrayList<String>(Arrays.asList(params));
	}
	
	@Override
	public String toString() {
		return name + "(" + Joiner.on(", ").useForNull("").join(params != null ? params : new ArrayList<String>()) + ")";
	}
}
