package org.zabbixds.integrations.grafana.api.data;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public enum ItemKind {
	
	NUMERIC(0, 3),
	TEXT(1, 2, 4),
	ALL;
	
	private final List<Integer> valueTypes;
	
	private ItemKind(Integer... valueTypes) {
		this.valueTypes = Collections.unmodifiableList(Arrays.asList(valueTypes));
	}
	
	/**
	 * The remote value_type codes of this kind, empty for ALL.
	 */
	public List<Integer> getValueTypes() {
		return valueTypes;
	}
	
	public static ItemKind fromValueType(int valueType) {
		
		if (NUMERIC.valueTypes.contains(valueType)) {
			return NUMERIC;
		}
		
		return TEXT;
	}
}
