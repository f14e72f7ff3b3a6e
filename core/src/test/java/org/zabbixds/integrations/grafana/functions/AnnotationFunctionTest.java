package org.zabbixds.integrations.grafana.functions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.zabbixds.integrations.grafana.api.ZabbixFixture;
import org.zabbixds.integrations.grafana.datasource.ZabbixDatasource;
import org.zabbixds.integrations.grafana.input.AnnotationInput;
import org.zabbixds.integrations.grafana.input.TimeRange;
import org.zabbixds.integrations.grafana.output.AnnotationEvent;

public class AnnotationFunctionTest {
	
	private ZabbixFixture fixture;
	private ZabbixDatasource datasource;
	
	private static JsonArray acknowledges() {
		
		JsonObject ack = new JsonObject();
		ack.addProperty("clock", "1520258531");
		ack.addProperty("message", "Looking into it");
		ack.addProperty("alias", "admin");
		ack.addProperty("name", "Zabbix");
		ack.addProperty("surname", "Administrator");
		
		JsonArray result = new JsonArray();
		result.add(ack);
		
		return result;
	}
	
	private ZabbixDatasource datasource(ZabbixFixture fixture) {
		
		this.fixture = fixture
			.trigger("5000", "High CPU load on web-01", 4, "10")
			.trigger("5001", "Disk full on web-02", 2, "11")
			.event("1", "5000", 1000, 1, new JsonArray())
			.event("2", "5000", 1100, 0, acknowledges())
			.event("3", "5001", 1050, 1, new JsonArray());
		
		this.datasource = new ZabbixDatasource(TargetProcessorTest.settings(), fixture.getTransport());
		
		return datasource;
	}
	
	private static AnnotationInput input() {
		
		AnnotationInput input = new AnnotationInput();
		input.group = "Linux servers";
		input.host = "*";
		input.range = new TimeRange(900000L, 1200000L);
		
		return input;
	}
	
	@AfterEach
	public void tearDown() throws IOException {
		
		if (datasource != null) {
			datasource.close();
		}
	}
	
	@Test
	public void problemsAboveMinSeverity() {
		
		AnnotationInput input = input();
		input.minSeverity = 3;
		
		List<AnnotationEvent> events = datasource(ZabbixFixture.linuxServers()).annotationQuery(input);
		
		assertEquals(1, events.size());
		assertEquals(1000000L, events.get(0).time);
		assertEquals(AnnotationEvent.PROBLEM, events.get(0).title);
		assertEquals("High CPU load on web-01", events.get(0).text);
		assertTrue(events.get(0).tags.isEmpty());
	}
	
	@Test
	public void okEventsCarryAcknowledgesAndHostTags() {
		
		AnnotationInput input = input();
		input.minSeverity = 3;
		input.showOkEvents = true;
		input.showHostname = true;
		
		List<AnnotationEvent> events = datasource(ZabbixFixture.linuxServers()).annotationQuery(input);
		
		assertEquals(2, events.size());
		
		AnnotationEvent ok = events.get(1);
		
		assertEquals(AnnotationEvent.OK, ok.title);
		assertTrue(ok.text.startsWith("High CPU load on web-01<br><br>Acknowledges:"));
		assertTrue(ok.text.contains("admin (Zabbix Administrator)"));
		assertEquals(Collections.singletonList("web-01"), ok.tags);
	}
	
	@Test
	public void acknowledgedEventsCanBeHidden() {
		
		AnnotationInput input = input();
		input.showOkEvents = true;
		input.hideAcknowledged = true;
		
		List<AnnotationEvent> events = datasource(ZabbixFixture.linuxServers()).annotationQuery(input);
		
		assertEquals(2, events.size());
		
		for (AnnotationEvent event : events) {
			assertEquals(AnnotationEvent.PROBLEM, event.title);
		}
	}
	
	@Test
	public void triggerDescriptionFilter() {
		
		AnnotationInput input = input();
		input.trigger = "/Disk/";
		
		List<AnnotationEvent> events = datasource(ZabbixFixture.linuxServers()).annotationQuery(input);
		
		assertEquals(1, events.size());
		assertEquals("Disk full on web-02", events.get(0).text);
		assertEquals(Arrays.asList("5001"), objectIds());
	}
	
	@Test
	public void triggersScopedByApplication() {
		
		AnnotationInput input = input();
		input.application = "Memory";
		
		datasource(ZabbixFixture.linuxServers()).annotationQuery(input);
		
		JsonObject params = fixture.getTransport().lastCall("trigger.get").params.getAsJsonObject();
		
		assertEquals("110", params.getAsJsonArray("applicationids").get(0).getAsString());
	}
	
	@Test
	public void applicationFilterIgnoredWithoutApplicationApi() {
		
		AnnotationInput input = input();
		input.application = "Memory";
		
		List<AnnotationEvent> events = datasource(ZabbixFixture.linuxServers().withoutApplications())
			.annotationQuery(input);
		
		JsonObject params = fixture.getTransport().lastCall("trigger.get").params.getAsJsonObject();
		
		assertFalse(params.has("applicationids"));
		assertEquals(2, events.size());
	}
	
	@Test
	public void unmatchedHostsGiveNoEvents() {
		
		AnnotationInput input = input();
		input.host = "mail-01";
		
		assertTrue(datasource(ZabbixFixture.linuxServers()).annotationQuery(input).isEmpty());
		assertEquals(0, fixture.getTransport().count("trigger.get"));
	}
	
	@Test
	public void missingRangeIsRejected() {
		
		AnnotationInput input = input();
		input.range = null;
		
		assertThrows(IllegalArgumentException.class, () -> datasource(ZabbixFixture.linuxServers()).annotationQuery(input));
	}
	
	private List<String> objectIds() {
		
		JsonObject params = fixture.getTransport().lastCall("event.get").params.getAsJsonObject();
		
		return Arrays.asList(params.getAsJsonArray("objectids").get(0).getAsString());
	}
}
