package org.zabbixds.integrations.grafana.settings;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;

/**
 * Loads datasource settings from the bundled defaults, or from the file named by the
 * zabbix.settings system property.
 */
public class SettingsLoader {
	
	private static final Logger logger = LoggerFactory.getLogger(SettingsLoader.class);
	
	public static final String SETTINGS_PROPERTY = "zabbix.settings";
	public static final String DEFAULT = "/settings/zabbix_datasource_default_settings.json";
	
	private static final Object defaultSettingsLock = new Object();
	private static DatasourceSettings defaultSettings;
	
	public static DatasourceSettings getDefaultSettings() {
		
		if (defaultSettings != null) {
			return defaultSettings.copy();
		}
		
		synchronized (defaultSettingsLock) {
			
			if (defaultSettings == null) {
				defaultSettings = loadDefaultSettings();
			}
			
			return defaultSettings.copy();
		}
	}
	
	private static DatasourceSettings loadDefaultSettings() {
		
		String settingsFile = System.getProperty(SETTINGS_PROPERTY);
		
		if (!Strings.isNullOrEmpty(settingsFile)) {
			logger.info("Loading datasource settings from {}", settingsFile);
			return loadFile(new File(settingsFile));
		}
		
		return loadBundled();
	}
	
	public static DatasourceSettings loadBundled() {
		
		try (InputStream stream = SettingsLoader.class.getResourceAsStream(DEFAULT)) {
			
			if (stream == null) {
				throw new IllegalStateException("Missing bundled settings " + DEFAULT);
			}
			
			return parse(IOUtils.toString(stream, StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new IllegalStateException("Could not read bundled settings " + DEFAULT, e);
		}
	}
	
	public static DatasourceSettings loadFile(File file) {
		
		try {
			return parse(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new IllegalStateException("Could not read settings file " + file, e);
		}
	}
	
	public static DatasourceSettings parse(String json) {
		
		DatasourceSettings result;
		
		try {
			result = new Gson().fromJson(json, DatasourceSettings.class);
		} catch (JsonParseException e) {
			throw new IllegalArgumentException("Could not parse settings: " + e.getMessage(), e);
		}
		
		if (result == null) {
			throw new IllegalArgumentException("Empty settings");
		}
		
		return result;
	}
}
