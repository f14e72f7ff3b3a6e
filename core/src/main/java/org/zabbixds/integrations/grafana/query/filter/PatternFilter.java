package org.zabbixds.integrations.grafana.query.filter;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.zabbixds.integrations.grafana.query.ConfigurationException;

/**
 * A "/regex/flags" filter. The regex may match anywhere in the name. Supported flags are
 * i (case insensitive) and m (multiline), g is accepted and has no effect on matching.
 */
public class PatternFilter implements Filter {
	
	private final Pattern pattern;
	
	public PatternFilter(String regex, String flags) {
		
		int patternFlags = 0;
		
		if (flags != null) {
			if (flags.indexOf('i') != -1) {
				patternFlags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
			}
			
			if (flags.indexOf('m') != -1) {
				patternFlags |= Pattern.MULTILINE;
			}
		}
		
		try {
			this.pattern = Pattern.compile(regex, patternFlags);
		} catch (PatternSyntaxException e) {
			throw new ConfigurationException("Invalid regex filter /" + regex + "/: " + e.getDescription(), e);
		}
	}
	
	public Pattern getPattern() {
		return pattern;
	}
	
	@Override
	public boolean matches(String name) {
		
		if (name == null) {
			return false;
		}
		
		return pattern.matcher(name).find();
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
		return "/" + pattern.pattern() + "/";
	}
}
