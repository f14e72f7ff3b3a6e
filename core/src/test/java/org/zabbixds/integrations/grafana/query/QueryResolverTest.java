package org.zabbixds.integrations.grafana.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import org.zabbixds.integrations.grafana.api.ZabbixFixture;
import org.zabbixds.integrations.grafana.api.ZabbixSession;
import org.zabbixds.integrations.grafana.api.data.Group;
import org.zabbixds.integrations.grafana.api.data.Host;
import org.zabbixds.integrations.grafana.api.data.Item;
import org.zabbixds.integrations.grafana.api.data.ItemKind;
import org.zabbixds.integrations.grafana.cache.MetadataCache;

public class QueryResolverTest {
	
	private static QueryResolver newResolver(ZabbixFixture fixture) {
		
		ZabbixSession session = new ZabbixSession(fixture.getTransport(), "Admin", "zabbix");
		
		return new QueryResolver(new MetadataCache(session, 60000));
	}
	
	private static List<String> itemIds(List<Item> items) {
		
		List<String> result = new ArrayList<String>();
		
		for (Item item : items) {
			result.add(item.itemId);
		}
		
		return result;
	}
	
	private static List<String> hostNames(List<Host> hosts) {
		
		List<String> result = new ArrayList<String>();
		
		for (Host host : hosts) {
			result.add(host.name);
		}
		
		return result;
	}
	
	@Test
	public void regexHostAndExactItem() {
		
		ZabbixFixture fixture = ZabbixFixture.linuxServers();
		QueryResolver resolver = newResolver(fixture);
		
		List<Item> items = resolver.getItems("Linux servers", "/web/", "", "CPU load", ItemKind.NUMERIC);
		
		assertEquals(Arrays.asList("1000", "1001"), itemIds(items));
		
		// an empty application filter scopes items by host
		JsonObject params = fixture.getTransport().lastCall("item.get").params.getAsJsonObject();
		assertTrue(params.has("hostids"));
		assertFalse(params.has("applicationids"));
		assertEquals(0, fixture.getTransport().count("application.get"));
	}
	
	@Test
	public void wildcardGroupsReturnAll() {
		
		QueryResolver resolver = newResolver(ZabbixFixture.linuxServers());
		
		List<Group> groups = resolver.getGroups("*");
		
		assertEquals(2, groups.size());
		assertEquals("Linux servers", groups.get(0).name);
	}
	
	@Test
	public void hostsAreScopedByGroup() {
		
		QueryResolver resolver = newResolver(ZabbixFixture.linuxServers());
		
		assertEquals(Arrays.asList("db-01"), hostNames(resolver.getHosts("Databases", "*")));
		assertEquals(Arrays.asList("web-01", "web-02"), hostNames(resolver.getHosts("*", "/WEB/i")));
	}
	
	@Test
	public void unknownGroupStopsResolution() {
		
		ZabbixFixture fixture = ZabbixFixture.linuxServers();
		QueryResolver resolver = newResolver(fixture);
		
		assertTrue(resolver.getItems("Windows servers", "*", "", "*", ItemKind.NUMERIC).isEmpty());
		
		assertEquals(0, fixture.getTransport().count("host.get"));
		assertEquals(0, fixture.getTransport().count("item.get"));
	}
	
	@Test
	public void malformedRegexIsConfigurationError() {
		
		QueryResolver resolver = newResolver(ZabbixFixture.linuxServers());
		
		assertThrows(ConfigurationException.class, () -> resolver.getHosts("*", "/web(/"));
	}
	
	@Test
	public void itemsAreScopedByApplication() {
		
		ZabbixFixture fixture = ZabbixFixture.linuxServers();
		QueryResolver resolver = newResolver(fixture);
		
		List<Item> items = resolver.getItems("Linux servers", "web-01", "Memory", "*", ItemKind.ALL);
		
		assertEquals(Arrays.asList("1010"), itemIds(items));
		
		JsonObject params = fixture.getTransport().lastCall("item.get").params.getAsJsonObject();
		assertEquals("110", params.getAsJsonArray("applicationids").get(0).getAsString());
		assertFalse(params.has("hostids"));
	}
	
	@Test
	public void unmatchedApplicationGivesNoItems() {
		
		ZabbixFixture fixture = ZabbixFixture.linuxServers();
		QueryResolver resolver = newResolver(fixture);
		
		assertTrue(resolver.getItems("Linux servers", "*", "Disk", "*", ItemKind.ALL).isEmpty());
		assertEquals(0, fixture.getTransport().count("item.get"));
	}
	
	@Test
	public void itemKindSelectsValueTypes() {
		
		QueryResolver resolver = newResolver(ZabbixFixture.linuxServers());
		
		assertEquals(Arrays.asList("1000", "1010"), 
			itemIds(resolver.getItems("Linux servers", "web-01", "", "*", ItemKind.NUMERIC)));
		assertEquals(Arrays.asList("1020"), 
			itemIds(resolver.getItems("Linux servers", "web-01", "", "*", ItemKind.TEXT)));
	}
	
	@Test
	public void applicationFilterIgnoredWithoutApplicationApi() {
		
		ZabbixFixture fixture = ZabbixFixture.linuxServers().withoutApplications();
		QueryResolver resolver = newResolver(fixture);
		
		List<Item> items = resolver.getItems("Linux servers", "web-01", "CPU", "*", ItemKind.NUMERIC);
		
		assertEquals(Arrays.asList("1000", "1010"), itemIds(items));
		assertFalse(resolver.getCache().isApplicationsSupported());
		
		// later lookups skip the application level altogether
		resolver.getItems("Linux servers", "web-02", "CPU", "*", ItemKind.NUMERIC);
		assertEquals(1, fixture.getTransport().count("application.get"));
	}
	
	@Test
	public void itemFilterSeesExpandedNames() {
		
		ZabbixFixture fixture = new ZabbixFixture()
			.group("1", "Linux servers")
			.host("10", "web-01", "1")
			.item("1000", "Load average ($2)", "system.cpu.load[percpu,avg5]", 0, "10");
		
		QueryResolver resolver = newResolver(fixture);
		
		assertEquals(Arrays.asList("1000"), 
			itemIds(resolver.getItems("*", "*", "", "Load average (avg5)", ItemKind.NUMERIC)));
		assertEquals(Arrays.asList("1000"), 
			itemIds(resolver.getItems("*", "*", "", "/avg5/", ItemKind.NUMERIC)));
	}
	
	@Test
	public void braceListSelectsHosts() {
		
		QueryResolver resolver = newResolver(ZabbixFixture.linuxServers());
		
		assertEquals(Arrays.asList("web-01", "db-01"), hostNames(resolver.getHosts("*", "{web-01,db-01}")));
	}
}
