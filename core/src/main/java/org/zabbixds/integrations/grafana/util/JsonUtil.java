package org.zabbixds.integrations.grafana.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.zabbixds.integrations.grafana.output.DataPoint;

public class JsonUtil {
	
	private static final Gson gson = new GsonBuilder()
		.registerTypeAdapter(DataPoint.class, new DataPoint.Serializer())
		.disableHtmlEscaping()
		.create();
	
	public static Gson getGson() {
		return gson;
	}
	
	public static String toJson(Object value) {
		return gson.toJson(value);
	}
	
	public static <T> T fromJson(String json, Class<T> clazz) {
		
		T result;
		
		try {
			result = gson.fromJson(json, clazz);
		} catch (JsonParseException e) {
			throw new IllegalArgumentException("Could not parse " + clazz.getSimpleName() + ": " + e.getMessage(), e);
		}
		
		if (result == null) {
			throw new IllegalArgumentException("Missing " + clazz.getSimpleName());
		}
		
		return result;
	}
}
