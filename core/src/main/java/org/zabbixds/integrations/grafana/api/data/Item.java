package org.zabbixds.integrations.grafana.api.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.gson.annotations.SerializedName;

public class Item {
	
	private static final Pattern KEY_PARAM_REF = Pattern.compile("\\$(\\d+)");
	
	@SerializedName("itemid")
	public String itemId;
	
	public String name;
	
	@SerializedName("key_")
	public String key;
	
	@SerializedName("value_type")
	public int valueType;
	
	@SerializedName("hostid")
	public String hostId;
	
	public String status;
	public String state;
	
	public List<Host> hosts;
	
	public ItemKind getKind() {
		return ItemKind.fromValueType(valueType);
	}
	
	public Host getFirstHost() {
		
		if ((hosts == null) || (hosts.isEmpty())) {
			return null;
		}
		
		return hosts.get(0);
	}
	
	/**
	 * Item name with $1..$N replaced by the positional parameters of the item key.
	 * A reference past the last parameter is left as is.
	 */
	public String getDisplayName() {
		
		if ((name == null) || (name.indexOf('$') == -1)) {
			return name;
		}
		
		List<String> keyParams = getKeyParams(key);
		
		Matcher matcher = KEY_PARAM_REF.matcher(name);
		StringBuffer result = new StringBuffer();
		
		while (matcher.find()) {
			int index = Integer.parseInt(matcher.group(1)) - 1;
			
			String replacement;
			
			if ((index >= 0) && (index < keyParams.size())) {
				replacement = keyParams.get(index);
			} else {
				replacement = matcher.group();
			}
			
			matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
		}
		
		matcher.appendTail(result);
		
		return result.toString();
	}
	
	/**
	 * Splits the bracketed part of an item key, "system.cpu.util[,system,avg1]" gives ["", "system", "avg1"].
	 */
	public static List<String> getKeyParams(String key) {
		
		if (key == null) {
			return Collections.emptyList();
		}
		
		int start = key.indexOf('[');
		int end = key.lastIndexOf(']');
		
		if ((start == -1) || (end <= start)) {
			return Collections.emptyList();
		}
		
		String params = key.substring(start + 1, end);
		List<String> result = new ArrayList<String>();
		
		for (String param : params.split(",", -1)) {
			result.add(param.trim());
		}
		
		return result;
	}
	
	@Override
	public String toString() {
		return getDisplayName();
	}
}
