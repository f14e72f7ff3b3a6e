package org.zabbixds.integrations.grafana.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import org.zabbixds.integrations.grafana.api.ZabbixFixture;
import org.zabbixds.integrations.grafana.api.ZabbixSession;
import org.zabbixds.integrations.grafana.cache.MetadataCache;
import org.zabbixds.integrations.grafana.output.MetricFindValue;

public class MetricFindQueryTest {
	
	private MetricFindQuery query;
	
	@BeforeEach
	public void setUp() {
		
		ZabbixFixture fixture = ZabbixFixture.linuxServers();
		ZabbixSession session = new ZabbixSession(fixture.getTransport(), "Admin", "zabbix");
		
		query = new MetricFindQuery(new QueryResolver(new MetadataCache(session, 60000)));
	}
	
	private List<String> find(String text) {
		
		List<String> result = new ArrayList<String>();
		
		for (MetricFindValue value : query.find(text)) {
			result.add(value.text);
		}
		
		return result;
	}
	
	@Test
	public void groups() {
		assertEquals(Arrays.asList("Linux servers", "Databases"), find("*"));
	}
	
	@Test
	public void hosts() {
		
		assertEquals(Arrays.asList("web-01", "web-02", "db-01"), find("Linux servers.*"));
		assertEquals(Arrays.asList("db-01"), find("/Data/.*"));
	}
	
	@Test
	public void applicationsAreDeduplicated() {
		assertEquals(Arrays.asList("CPU", "Memory"), find("*.*.*"));
	}
	
	@Test
	public void itemsOfAnyKind() {
		
		assertEquals(Arrays.asList("CPU load", "Free memory", "Agent version"), find("Linux servers.web-01.*.*"));
		assertEquals(Arrays.asList("CPU load"), find("Linux servers./web/.CPU.*"));
	}
	
	@Test
	public void regexSegmentMayContainDots() {
		
		assertEquals(Arrays.asList("web-01", "web-02"), find("Linux servers./web-.*/"));
		assertEquals(Arrays.asList("CPU load", "Free memory"), find("Linux servers./web-.*/i.*./.*load|.*memory/"));
	}
	
	@Test
	public void splitsOutsideRegexAndLiteralSets() {
		
		assertEquals(Arrays.asList("Linux servers", "/web-.*/", "*"), MetricFindQuery.splitQuery("Linux servers./web-.*/.*"));
		assertEquals(Arrays.asList("{a.b,c}", "x"), MetricFindQuery.splitQuery("{a.b,c}.x"));
		assertEquals(Arrays.asList("a", ""), MetricFindQuery.splitQuery("a."));
		assertEquals(Arrays.asList("/a"), MetricFindQuery.splitQuery("/a"));
	}
	
	@Test
	public void tooManySegmentsGivesNothing() {
		assertTrue(find("a.b.c.d.e").isEmpty());
	}
	
	@Test
	public void nullQueryGivesNothing() {
		assertTrue(query.find(null).isEmpty());
	}
}
