package org.zabbixds.integrations.grafana.settings;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class SettingsLoaderTest {
	
	@Test
	public void bundledDefaults() {
		
		DatasourceSettings settings = SettingsLoader.loadBundled();
		
		assertEquals("http://localhost/zabbix/api_jsonrpc.php", settings.url);
		assertEquals("Admin", settings.username);
		assertTrue(settings.trends);
		assertEquals(7 * 86400000L, settings.getTrendsFromMillis());
		assertEquals(3600000L, settings.getCacheTTLMillis());
		assertEquals(30000, settings.getTimeout());
	}
	
	@Test
	public void defaultSettingsAreCopies() {
		
		DatasourceSettings first = SettingsLoader.getDefaultSettings();
		first.url = "http://elsewhere/api_jsonrpc.php";
		
		assertNotEquals(first.url, SettingsLoader.getDefaultSettings().url);
	}
	
	@Test
	public void loadsFile(@TempDir Path dir) throws IOException {
		
		File file = dir.resolve("zabbix.json").toFile();
		FileUtils.writeStringToFile(file, 
			"{\"url\":\"https://zbx.example.com/api_jsonrpc.php\",\"username\":\"grafana\",\"trends\":false,\"timeout\":1000}", 
			StandardCharsets.UTF_8);
		
		DatasourceSettings settings = SettingsLoader.loadFile(file);
		
		assertEquals("https://zbx.example.com/api_jsonrpc.php", settings.url);
		assertEquals("grafana", settings.username);
		assertFalse(settings.trends);
		
		// unset and too small values fall back to defaults
		assertEquals(7 * 86400000L, settings.getTrendsFromMillis());
		assertEquals(5000, settings.getTimeout());
	}
	
	@Test
	public void missingFileIsReported(@TempDir Path dir) {
		assertThrows(IllegalStateException.class, () -> SettingsLoader.loadFile(dir.resolve("none.json").toFile()));
	}
	
	@Test
	public void malformedJsonIsRejected() {
		
		assertThrows(IllegalArgumentException.class, () -> SettingsLoader.parse("{\"url\": [}"));
		assertThrows(IllegalArgumentException.class, () -> SettingsLoader.parse(""));
	}
	
	@Test
	public void copiesAreEqual() {
		
		DatasourceSettings a = SettingsLoader.loadBundled();
		DatasourceSettings b = a.copy();
		
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
		
		b.password = "other";
		assertNotEquals(a, b);
	}
}
