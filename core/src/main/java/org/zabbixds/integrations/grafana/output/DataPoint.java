package org.zabbixds.integrations.grafana.output;

import java.lang.reflect.Type;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;

/**
 * A single (value, timestamp) pair. The value is a Double for numeric series, a String for text
 * series, or null for a gap.
 */
public class DataPoint {
	
	public final Object value;
	public final long time;
	
	public DataPoint(Object value, long time) {
		this.value = value;
		this.time = time;
	}
	
	public boolean isNumeric() {
		return value instanceof Number;
	}
	
	/**
	 * The numeric value, or null for gaps and text values.
	 */
	public Double doubleValue() {
		
		if (value instanceof Number) {
			return Double.valueOf(((Number)value).doubleValue());
		}
		
		return null;
	}
	
	public DataPoint withValue(Object newValue) {
		return new DataPoint(newValue, time);
	}
	
	public DataPoint withTime(long newTime) {
		return new DataPoint(value, newTime);
	}
	
	@Override
	public String toString() {
		return "[" + value + ", " + time + "]";
	}
	
	/**
	 * Writes a point as the [value, timestamp] array the panels expect.
	 */
	public static class Serializer implements JsonSerializer<DataPoint> {
		
		@Override
		public JsonElement serialize(DataPoint src, Type typeOfSrc, JsonSerializationContext context) {
			
			JsonArray result = new JsonArray();
			
			if (src.value == null) {
				result.add(JsonNull.INSTANCE);
			} else if (src.value instanceof Number) {
				result.add(new JsonPrimitive((Number)src.value));
			} else {
				result.add(new JsonPrimitive(src.value.toString()));
			}
			
			result.add(new JsonPrimitive(Long.valueOf(src.time)));
			
			return result;
		}
	}
}
