package org.zabbixds.integrations.grafana.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import org.zabbixds.integrations.grafana.api.data.Acknowledge;
import org.zabbixds.integrations.grafana.api.data.HistoryPoint;
import org.zabbixds.integrations.grafana.api.data.Host;
import org.zabbixds.integrations.grafana.api.data.Item;
import org.zabbixds.integrations.grafana.api.data.ServiceSla;
import org.zabbixds.integrations.grafana.api.data.TrendPoint;
import org.zabbixds.integrations.grafana.input.SlaProperty;
import org.zabbixds.integrations.grafana.output.DataPoint;
import org.zabbixds.integrations.grafana.output.TimeSeries;
import org.zabbixds.integrations.grafana.pipeline.TrendField;
import org.zabbixds.integrations.grafana.query.filter.Filters;

public class ResponseNormalizerTest {
	
	private static Item item(String id, String name, int valueType, String hostId, String hostName) {
		
		Host host = new Host();
		host.hostId = hostId;
		host.name = hostName;
		
		Item item = new Item();
		item.itemId = id;
		item.name = name;
		item.key = "key";
		item.valueType = valueType;
		item.hostId = hostId;
		item.hosts = Collections.singletonList(host);
		
		return item;
	}
	
	private static HistoryPoint point(String itemId, long clock, String value) {
		
		HistoryPoint point = new HistoryPoint();
		point.itemId = itemId;
		point.clock = clock;
		point.value = value;
		
		return point;
	}
	
	private static TrendPoint trend(String itemId, long clock, String min, String avg, String max, String num) {
		
		TrendPoint point = new TrendPoint();
		point.itemId = itemId;
		point.clock = clock;
		point.valueMin = min;
		point.valueAvg = avg;
		point.valueMax = max;
		point.num = num;
		
		return point;
	}
	
	@Test
	public void historyIsGroupedPerItemInItemOrder() {
		
		List<Item> items = Arrays.asList(item("2", "CPU load", 0, "10", "web-01"), 
			item("1", "CPU load", 0, "11", "web-02"), item("3", "Idle", 0, "10", "web-01"));
		
		List<HistoryPoint> history = Arrays.asList(point("1", 120, "0.5"), point("2", 60, "1.5"),
			point("1", 60, "0.25"), point("2", 120, "2"));
		
		List<TimeSeries> series = ResponseNormalizer.normalizeHistory(history, items, true);
		
		assertEquals(2, series.size());
		
		assertEquals("web-01: CPU load", series.get(0).label);
		assertEquals(60000L, series.get(0).datapoints.get(0).time);
		assertEquals(1.5, series.get(0).datapoints.get(0).doubleValue(), 0.0);
		assertEquals(2.0, series.get(0).datapoints.get(1).doubleValue(), 0.0);
		
		// out of order points are sorted by clock
		assertEquals("web-02: CPU load", series.get(1).label);
		assertEquals(Arrays.asList(Double.valueOf(0.25), Double.valueOf(0.5)), 
			Arrays.asList(series.get(1).datapoints.get(0).value, series.get(1).datapoints.get(1).value));
	}
	
	@Test
	public void textValuesAreKept() {
		
		List<Item> items = Collections.singletonList(item("1", "Agent version", 1, "10", "web-01"));
		
		List<TimeSeries> series = ResponseNormalizer.normalizeHistory(
			Collections.singletonList(point("1", 60, "4.0.1")), items, false);
		
		assertEquals("Agent version", series.get(0).label);
		assertEquals("4.0.1", series.get(0).datapoints.get(0).value);
	}
	
	@Test
	public void unparseableNumbersBecomeGaps() {
		
		List<Item> items = Collections.singletonList(item("1", "CPU load", 0, "10", "web-01"));
		
		List<TimeSeries> series = ResponseNormalizer.normalizeHistory(
			Collections.singletonList(point("1", 60, "n/a")), items, false);
		
		assertNull(series.get(0).datapoints.get(0).value);
	}
	
	@Test
	public void trendsUseSelectedField() {
		
		List<Item> items = Collections.singletonList(item("1", "CPU load", 0, "10", "web-01"));
		List<TrendPoint> trends = Arrays.asList(trend("1", 7200, "1", "2", "3", "60"), 
			trend("1", 3600, "0.5", "1", "1.5", "59"));
		
		List<TimeSeries> max = ResponseNormalizer.normalizeTrends(trends, items, TrendField.max, false);
		List<TimeSeries> count = ResponseNormalizer.normalizeTrends(trends, items, TrendField.count, false);
		
		assertEquals(3600000L, max.get(0).datapoints.get(0).time);
		assertEquals(1.5, max.get(0).datapoints.get(0).doubleValue(), 0.0);
		assertEquals(3.0, max.get(0).datapoints.get(1).doubleValue(), 0.0);
		assertEquals(59.0, count.get(0).datapoints.get(0).doubleValue(), 0.0);
	}
	
	@Test
	public void hostNameOnlyForPatternsSpanningHosts() {
		
		List<Item> twoHosts = Arrays.asList(item("1", "CPU load", 0, "10", "web-01"), 
			item("2", "CPU load", 0, "11", "web-02"));
		List<Item> oneHost = Arrays.asList(item("1", "CPU load", 0, "10", "web-01"), 
			item("3", "Idle", 0, "10", "web-01"));
		
		assertTrue(ResponseNormalizer.shouldAddHostName(Filters.parse("/web/"), twoHosts));
		assertTrue(ResponseNormalizer.shouldAddHostName(Filters.parse("*"), twoHosts));
		assertFalse(ResponseNormalizer.shouldAddHostName(Filters.parse("/web/"), oneHost));
		assertFalse(ResponseNormalizer.shouldAddHostName(Filters.parse("web-01"), twoHosts));
	}
	
	@Test
	public void extractsFirstMatchOrCaptureGroup() {
		
		List<DataPoint> points = Arrays.asList(new DataPoint("Zabbix 4.0.1 rev 1", 1000), 
			new DataPoint("unknown", 2000), new DataPoint(null, 3000));
		List<TimeSeries> series = Collections.singletonList(new TimeSeries("Agent version", points));
		
		List<TimeSeries> match = ResponseNormalizer.extractText(series, "\\d+\\.\\d+", false);
		List<TimeSeries> group = ResponseNormalizer.extractText(series, "Zabbix (\\d+)", true);
		
		assertEquals(1, match.get(0).size());
		assertEquals("4.0", match.get(0).datapoints.get(0).value);
		assertEquals(1000L, match.get(0).datapoints.get(0).time);
		
		assertEquals("4", group.get(0).datapoints.get(0).value);
		
		assertEquals(3, ResponseNormalizer.extractText(series, "", false).get(0).size());
	}
	
	@Test
	public void invalidTextFilterIsConfigurationError() {
		
		List<TimeSeries> series = Collections.singletonList(new TimeSeries("x", new ArrayList<DataPoint>()));
		
		assertThrows(ConfigurationException.class, () -> ResponseNormalizer.extractText(series, "(", false));
	}
	
	@Test
	public void slaSeriesHasOnePointAtWindowEnd() {
		
		ServiceSla.SlaInterval interval = new ServiceSla.SlaInterval();
		interval.sla = 99.5;
		interval.okTime = 3500;
		interval.problemTime = 100;
		interval.downtimeTime = 0;
		
		ServiceSla sla = new ServiceSla();
		sla.sla = Collections.singletonList(interval);
		
		TimeSeries value = ResponseNormalizer.normalizeSla(sla, "Web shop", SlaProperty.SLA, 3600000);
		TimeSeries problem = ResponseNormalizer.normalizeSla(sla, "Web shop", SlaProperty.PROBLEM_TIME, 3600000);
		
		assertEquals("Web shop SLA", value.label);
		assertEquals(1, value.size());
		assertEquals(99.5, value.datapoints.get(0).doubleValue(), 0.0);
		assertEquals(3600000L, value.datapoints.get(0).time);
		
		assertEquals("Web shop Problem time", problem.label);
		assertEquals(100.0, problem.datapoints.get(0).doubleValue(), 0.0);
		
		assertEquals(0, ResponseNormalizer.normalizeSla(null, "Web shop", SlaProperty.SLA, 0).size());
	}
	
	@Test
	public void formatsAcknowledgeTable() {
		
		Acknowledge ack = new Acknowledge();
		ack.clock = 1520258531;
		ack.alias = "admin";
		ack.name = "Zabbix";
		ack.surname = "Administrator";
		ack.message = "Looking into it";
		
		String expected = "<br><br>Acknowledges:<br><table><tr><td><b>Time</b></td>"
			+ "<td><b>User</b></td><td><b>Comments</b></td></tr>"
			+ "<tr><td><i>05 Mar 2018 14:02:11</i></td><td>admin (Zabbix Administrator)</td>"
			+ "<td>Looking into it</td></tr></table>";
		
		assertEquals(expected, ResponseNormalizer.formatAcknowledges(Collections.singletonList(ack)));
		assertEquals("", ResponseNormalizer.formatAcknowledges(null));
	}
}
