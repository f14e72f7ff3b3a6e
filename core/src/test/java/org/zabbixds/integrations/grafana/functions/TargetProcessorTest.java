package org.zabbixds.integrations.grafana.functions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import org.zabbixds.integrations.grafana.api.ZabbixFixture;
import org.zabbixds.integrations.grafana.datasource.ZabbixDatasource;
import org.zabbixds.integrations.grafana.input.FunctionCall;
import org.zabbixds.integrations.grafana.input.QueryInput;
import org.zabbixds.integrations.grafana.input.QueryMode;
import org.zabbixds.integrations.grafana.input.SlaProperty;
import org.zabbixds.integrations.grafana.input.Target;
import org.zabbixds.integrations.grafana.input.TimeRange;
import org.zabbixds.integrations.grafana.output.QueryResult;
import org.zabbixds.integrations.grafana.output.TargetResult;
import org.zabbixds.integrations.grafana.output.TimeSeries;
import org.zabbixds.integrations.grafana.settings.DatasourceSettings;

public class TargetProcessorTest {
	
	private ZabbixFixture fixture;
	private ZabbixDatasource datasource;
	
	static DatasourceSettings settings() {
		
		DatasourceSettings settings = new DatasourceSettings();
		settings.url = "http://zabbix.test/api_jsonrpc.php";
		settings.username = "Admin";
		settings.password = "zabbix";
		settings.cacheTTL = "1h";
		
		return settings;
	}
	
	static Target target(String refId, String group, String host, String item, FunctionCall... functions) {
		
		Target target = new Target();
		target.refId = refId;
		target.group = group;
		target.host = host;
		target.item = item;
		target.functions = new ArrayList<FunctionCall>(Arrays.asList(functions));
		
		return target;
	}
	
	static QueryInput input(Target... targets) {
		
		QueryInput input = new QueryInput();
		input.range = new TimeRange(1000000L, 1200000L);
		input.targets = Arrays.asList(targets);
		
		return input;
	}
	
	private static List<String> labels(TargetResult result) {
		
		List<String> labels = new ArrayList<String>();
		
		for (TimeSeries series : result.series) {
			labels.add(series.label);
		}
		
		return labels;
	}
	
	@BeforeEach
	public void setUp() {
		
		fixture = ZabbixFixture.linuxServers()
			.history("1000", 1000, "1")
			.history("1000", 1060, "2")
			.history("1001", 1000, "3")
			.history("1020", 1000, "Zabbix agent 4.0.1")
			.service("7", "Web shop", 99.5, 3500, 100, 0);
		
		datasource = new ZabbixDatasource(settings(), fixture.getTransport());
	}
	
	@AfterEach
	public void tearDown() throws IOException {
		datasource.close();
	}
	
	@Test
	public void numericTargetGivesSeriesPerItem() {
		
		QueryResult result = datasource.query(input(target("A", "Linux servers", "/web/", "CPU load")));
		
		TargetResult target = result.results.get(0);
		
		assertEquals("A", target.refId);
		assertNull(target.error);
		assertEquals(Arrays.asList("web-01: CPU load", "web-02: CPU load"), labels(target));
		assertEquals(2, target.series.get(0).size());
		assertEquals(1000000L, target.series.get(0).datapoints.get(0).time);
	}
	
	@Test
	public void failingTargetDoesNotAffectOthers() {
		
		QueryResult result = datasource.query(input(
			target("A", "Linux servers", "web-01", "CPU load"),
			target("B", "Linux servers", "web-01", "CPU load", new FunctionCall("percentile", "95")),
			target("C", "Linux servers", "/web-0[12]/", "/(/")));
		
		assertEquals(3, result.results.size());
		
		assertEquals("A", result.results.get(0).refId);
		assertNull(result.results.get(0).error);
		assertEquals(Arrays.asList("CPU load"), labels(result.results.get(0)));
		
		assertEquals("B", result.results.get(1).refId);
		assertEquals("Unsupported function percentile", result.results.get(1).error);
		assertTrue(result.results.get(1).series.isEmpty());
		
		assertEquals("C", result.results.get(2).refId);
		assertTrue(result.results.get(2).error.startsWith("Invalid regex filter"));
	}
	
	@Test
	public void hiddenTargetIsNotFetched() {
		
		Target target = target("A", "Linux servers", "web-01", "CPU load");
		target.hide = true;
		
		TargetResult result = datasource.query(input(target)).results.get(0);
		
		assertNull(result.error);
		assertTrue(result.series.isEmpty());
		assertEquals(0, fixture.getTransport().count("history.get"));
	}
	
	@Test
	public void incompleteTargetGivesNoSeries() {
		
		TargetResult result = datasource.query(input(target("A", "Linux servers", "web-01", null))).results.get(0);
		
		assertNull(result.error);
		assertTrue(result.series.isEmpty());
		assertEquals(0, fixture.getTransport().count("hostgroup.get"));
	}
	
	@Test
	public void emptyFilterMatchesLikeWildcard() {
		
		TargetResult wildcard = datasource.query(input(target("A", "Linux servers", "/web/", "*"))).results.get(0);
		TargetResult empty = datasource.query(input(target("A", "", "/web/", ""))).results.get(0);
		
		assertNull(empty.error);
		assertEquals(Arrays.asList("web-01: CPU load", "web-02: CPU load"), labels(wildcard));
		assertEquals(labels(wildcard), labels(empty));
	}
	
	@Test
	public void functionsApplyToFetchedSeries() {
		
		QueryResult result = datasource.query(input(target("A", "Linux servers", "/web/", "CPU load", 
			new FunctionCall("sumSeries"), new FunctionCall("setAlias", "CPU total"))));
		
		TimeSeries series = result.results.get(0).series.get(0);
		
		assertEquals("CPU total", series.label);
		assertEquals(Double.valueOf(4.0), series.datapoints.get(0).doubleValue());
	}
	
	@Test
	public void textTargetExtractsValues() {
		
		Target target = target("A", "Linux servers", "web-01", "Agent version");
		target.mode = QueryMode.TEXT;
		target.textFilter = "\\d+\\.\\d+\\.\\d+";
		
		TargetResult result = datasource.query(input(target)).results.get(0);
		
		assertEquals("4.0.1", result.series.get(0).datapoints.get(0).value);
	}
	
	@Test
	public void serviceTargetReportsSla() {
		
		Target byName = new Target();
		byName.refId = "A";
		byName.mode = QueryMode.SERVICE;
		byName.itServiceName = "Web shop";
		
		Target byId = new Target();
		byId.refId = "B";
		byId.mode = QueryMode.SERVICE;
		byId.itServiceId = "7";
		byId.slaProperty = SlaProperty.OK_TIME;
		
		Target unknown = new Target();
		unknown.refId = "C";
		unknown.mode = QueryMode.SERVICE;
		unknown.itServiceId = "99";
		
		QueryResult result = datasource.query(input(byName, byId, unknown));
		
		TimeSeries sla = result.results.get(0).series.get(0);
		
		assertEquals("Web shop SLA", sla.label);
		assertEquals(Double.valueOf(99.5), sla.datapoints.get(0).doubleValue());
		assertEquals(1200000L, sla.datapoints.get(0).time);
		
		assertEquals("Web shop OK time", result.results.get(1).series.get(0).label);
		assertEquals(Double.valueOf(3500), result.results.get(1).series.get(0).datapoints.get(0).doubleValue());
		
		assertEquals("Unknown IT service 99", result.results.get(2).error);
	}
	
	@Test
	public void missingRangeIsRejected() {
		
		QueryInput input = input(target("A", "Linux servers", "web-01", "CPU load"));
		input.range = null;
		
		assertThrows(IllegalArgumentException.class, () -> datasource.query(input));
	}
	
	@Test
	public void noTargetsGiveNoResults() {
		assertTrue(datasource.query(input()).results.isEmpty());
	}
}
