package org.zabbixds.integrations.grafana.api.data;

import java.util.List;

public class ServiceSla {
	
	public static class SlaInterval {
		
		public long from;
		public long to;
		
		public double sla;
		public long okTime;
		public long problemTime;
		public long downtimeTime;
	}
	
	public String status;
	
	public List<SlaInterval> sla;
}
