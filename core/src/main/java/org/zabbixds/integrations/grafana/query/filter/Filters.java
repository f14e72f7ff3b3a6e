package org.zabbixds.integrations.grafana.query.filter;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Strings;

public class Filters {
	
	public static final String WILDCARD = "*";
	public static final String MATCH_ALL_REGEX = "/.*/";
	
	private static final Pattern REGEX_FILTER = Pattern.compile("^/(.*)/([gmi]*)$");
	
	public static Filter parse(String filter) {
		
		if (Strings.isNullOrEmpty(filter)) {
			return AnyFilter.INSTANCE;
		}
		
		String value = filter.trim();
		
		if ((value.isEmpty()) || (WILDCARD.equals(value)) || (MATCH_ALL_REGEX.equals(value))) {
			return AnyFilter.INSTANCE;
		}
		
		Matcher matcher = REGEX_FILTER.matcher(value);
		
		if (matcher.matches()) {
			return new PatternFilter(matcher.group(1), matcher.group(2));
		}
		
		if ((value.length() > 1) && (value.startsWith("{")) && (value.endsWith("}"))) {
			return new LiteralSetFilter(splitLiteralSet(value));
		}
		
		return new ExactFilter(value);
	}
	
	public static boolean isRegex(String filter) {
		return (filter != null) && (REGEX_FILTER.matcher(filter.trim()).matches());
	}
	
	private static Set<String> splitLiteralSet(String value) {
		
		Set<String> result = new LinkedHashSet<String>();
		
		for (String name : value.substring(1, value.length() - 1).split(",")) {
			
			String trimmed = name.trim();
			
			if (!trimmed.isEmpty()) {
				result.add(trimmed);
			}
		}
		
		return result;
	}
}
