package org.zabbixds.integrations.grafana.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import org.zabbixds.integrations.grafana.input.MetricFindInput;
import org.zabbixds.integrations.grafana.input.QueryInput;
import org.zabbixds.integrations.grafana.input.QueryMode;
import org.zabbixds.integrations.grafana.input.SlaProperty;
import org.zabbixds.integrations.grafana.output.ConnectionTestResult;
import org.zabbixds.integrations.grafana.output.DataPoint;
import org.zabbixds.integrations.grafana.output.TargetResult;
import org.zabbixds.integrations.grafana.output.TimeSeries;

public class JsonUtilTest {
	
	@Test
	public void writesPointsAsPairs() {
		
		TimeSeries series = new TimeSeries("web-01: CPU load", 
			Arrays.asList(new DataPoint(Double.valueOf(1.5), 1000), new DataPoint(null, 2000), new DataPoint("up", 3000)));
		
		TargetResult result = TargetResult.of("A", Collections.singletonList(series));
		
		assertEquals("{\"refId\":\"A\",\"series\":[{\"target\":\"web-01: CPU load\","
			+ "\"datapoints\":[[1.5,1000],[null,2000],[\"up\",3000]]}]}", JsonUtil.toJson(result));
	}
	
	@Test
	public void writesErrors() {
		assertEquals("{\"refId\":\"B\",\"series\":[],\"error\":\"Unsupported function x\"}", 
			JsonUtil.toJson(TargetResult.error("B", "Unsupported function x")));
	}
	
	@Test
	public void connectionStateIsNotWritten() {
		assertEquals("{\"status\":\"error\",\"title\":\"Connection failed\",\"message\":\"Could not connect to given url\"}", 
			JsonUtil.toJson(ConnectionTestResult.unreachable()));
	}
	
	@Test
	public void readsQueryInput() {
		
		QueryInput input = JsonUtil.fromJson("{\"range\":{\"from\":1000,\"to\":2000},\"maxDataPoints\":500,"
			+ "\"targets\":[{\"refId\":\"A\",\"mode\":\"service\",\"itServiceId\":\"7\",\"slaProperty\":\"problemTime\","
			+ "\"functions\":[{\"name\":\"setAlias\",\"params\":[\"shop\"]}]}]}", QueryInput.class);
		
		assertEquals(1000L, input.range.from);
		assertEquals(500, input.maxDataPoints);
		assertEquals(QueryMode.SERVICE, input.targets.get(0).getMode());
		assertEquals(SlaProperty.PROBLEM_TIME, input.targets.get(0).getSlaProperty());
		assertEquals("setAlias", input.targets.get(0).getFunctions().get(0).name);
	}
	
	@Test
	public void metricFindAcceptsTargetAlias() {
		assertEquals("*.*", JsonUtil.fromJson("{\"target\":\"*.*\"}", MetricFindInput.class).query);
	}
	
	@Test
	public void rejectsBadJson() {
		
		assertThrows(IllegalArgumentException.class, () -> JsonUtil.fromJson("{", QueryInput.class));
		assertThrows(IllegalArgumentException.class, () -> JsonUtil.fromJson("", QueryInput.class));
	}
}
