package org.zabbixds.integrations.grafana.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.google.common.base.Strings;
import org.zabbixds.integrations.grafana.api.data.Acknowledge;
import org.zabbixds.integrations.grafana.api.data.HistoryPoint;
import org.zabbixds.integrations.grafana.api.data.Host;
import org.zabbixds.integrations.grafana.api.data.Item;
import org.zabbixds.integrations.grafana.api.data.ItemKind;
import org.zabbixds.integrations.grafana.api.data.ServiceSla;
import org.zabbixds.integrations.grafana.api.data.TrendPoint;
import org.zabbixds.integrations.grafana.input.SlaProperty;
import org.zabbixds.integrations.grafana.output.DataPoint;
import org.zabbixds.integrations.grafana.output.TimeSeries;
import org.zabbixds.integrations.grafana.pipeline.TrendField;
import org.zabbixds.integrations.grafana.query.filter.Filter;
import org.zabbixds.integrations.grafana.util.TimeUtil;

/**
 * Turns raw history, trend, SLA and acknowledgement payloads into panel series and text.
 */
public class ResponseNormalizer {
	
	public static final String HOST_SEPERATOR = ": ";
	
	private static final Comparator<HistoryPoint> HISTORY_ORDER = new Comparator<HistoryPoint>() {
		
		@Override
		public int compare(HistoryPoint o1, HistoryPoint o2) {
			return Long.compare(o1.clock, o2.clock);
		}
	};
	
	private static final Comparator<TrendPoint> TREND_ORDER = new Comparator<TrendPoint>() {
		
		@Override
		public int compare(TrendPoint o1, TrendPoint o2) {
			return Long.compare(o1.clock, o2.clock);
		}
	};
	
	/**
	 * One series per item that has points, in item order. Values of numeric items become numbers,
	 * text item values are kept as is.
	 */
	public static List<TimeSeries> normalizeHistory(List<HistoryPoint> history, List<Item> items,
		boolean addHostName) {
		
		Map<String, List<HistoryPoint>> pointsByItem = new LinkedHashMap<String, List<HistoryPoint>>();
		
		for (HistoryPoint point : history) {
			
			List<HistoryPoint> points = pointsByItem.get(point.itemId);
			
			if (points == null) {
				points = new ArrayList<HistoryPoint>();
				pointsByItem.put(point.itemId, points);
			}
			
			points.add(point);
		}
		
		List<TimeSeries> result = new ArrayList<TimeSeries>();
		
		for (Item item : items) {
			
			List<HistoryPoint> points = pointsByItem.get(item.itemId);
			
			if (points == null) {
				continue;
			}
			
			Collections.sort(points, HISTORY_ORDER);
			
			boolean numeric = item.getKind() == ItemKind.NUMERIC;
			List<DataPoint> datapoints = new ArrayList<DataPoint>(points.size());
			
			for (HistoryPoint point : points) {
				Object value = numeric ? toNumber(point.value) : point.value;
				datapoints.add(new DataPoint(value, TimeUtil.secondsToMillis(point.clock)));
			}
			
			result.add(new TimeSeries(getLabel(item, addHostName), datapoints));
		}
		
		return result;
	}
	
	public static List<TimeSeries> normalizeTrends(List<TrendPoint> trends, List<Item> items,
		TrendField field, boolean addHostName) {
		
		Map<String, List<TrendPoint>> pointsByItem = new LinkedHashMap<String, List<TrendPoint>>();
		
		for (TrendPoint point : trends) {
			
			List<TrendPoint> points = pointsByItem.get(point.itemId);
			
			if (points == null) {
				points = new ArrayList<TrendPoint>();
				pointsByItem.put(point.itemId, points);
			}
			
			points.add(point);
		}
		
		List<TimeSeries> result = new ArrayList<TimeSeries>();
		
		for (Item item : items) {
			
			List<TrendPoint> points = pointsByItem.get(item.itemId);
			
			if (points == null) {
				continue;
			}
			
			Collections.sort(points, TREND_ORDER);
			
			List<DataPoint> datapoints = new ArrayList<DataPoint>(points.size());
			
			for (TrendPoint point : points) {
				datapoints.add(new DataPoint(getTrendValue(point, field), TimeUtil.secondsToMillis(point.clock)));
			}
			
			result.add(new TimeSeries(getLabel(item, addHostName), datapoints));
		}
		
		return result;
	}
	
	private static Double getTrendValue(TrendPoint point, TrendField field) {
		
		switch (field) {
			case min:
				return toNumber(point.valueMin);
			case max:
				return toNumber(point.valueMax);
			case count:
				return toNumber(point.num);
			default:
				return toNumber(point.valueAvg);
		}
	}
	
	/**
	 * Host names are added when the host filter could select several hosts and the items actually
	 * span more than one.
	 */
	public static boolean shouldAddHostName(Filter hostFilter, Collection<Item> items) {
		
		if (!hostFilter.isPattern()) {
			return false;
		}
		
		Set<String> hostIds = new HashSet<String>();
		
		for (Item item : items) {
			
			Host host = item.getFirstHost();
			hostIds.add((host != null) ? host.hostId : item.hostId);
			
			if (hostIds.size() > 1) {
				return true;
			}
		}
		
		return false;
	}
	
	public static String getLabel(Item item, boolean addHostName) {
		
		String name = item.getDisplayName();
		Host host = item.getFirstHost();
		
		if ((addHostName) && (host != null)) {
			return host.name + HOST_SEPERATOR + name;
		}
		
		return name;
	}
	
	/**
	 * Replaces each text value by the first match of the filter, or its first capture group.
	 * Values without a match are dropped.
	 */
	public static List<TimeSeries> extractText(List<TimeSeries> series, String textFilter, 
		boolean useCaptureGroups) {
		
		if (Strings.isNullOrEmpty(textFilter)) {
			return series;
		}
		
		Pattern pattern;
		
		try {
			pattern = Pattern.compile(textFilter);
		} catch (PatternSyntaxException e) {
			throw new ConfigurationException("Invalid text filter " + textFilter + ": " + e.getDescription(), e);
		}
		
		List<TimeSeries> result = new ArrayList<TimeSeries>(series.size());
		
		for (TimeSeries timeSeries : series) {
			
			List<DataPoint> datapoints = new ArrayList<DataPoint>();
			
			for (DataPoint point : timeSeries.datapoints) {
				
				if (point.value == null) {
					continue;
				}
				
				Matcher matcher = pattern.matcher(point.value.toString());
				
				if (!matcher.find()) {
					continue;
				}
				
				String value;
				
				if ((useCaptureGroups) && (matcher.groupCount() > 0)) {
					value = matcher.group(1);
				} else {
					value = matcher.group();
				}
				
				datapoints.add(point.withValue(value));
			}
			
			result.add(timeSeries.withPoints(datapoints));
		}
		
		return result;
	}
	
	/**
	 * A single point series at the end of the window holding the selected SLA figure.
	 */
	public static TimeSeries normalizeSla(ServiceSla sla, String serviceName, SlaProperty property, long toMillis) {
		
		String label = serviceName + " " + property.getDisplayName();
		
		if ((sla == null) || (sla.sla == null) || (sla.sla.isEmpty())) {
			return new TimeSeries(label, new ArrayList<DataPoint>());
		}
		
		ServiceSla.SlaInterval interval = sla.sla.get(0);
		double value;
		
		switch (property) {
			case OK_TIME:
				value = interval.okTime;
				break;
			case PROBLEM_TIME:
				value = interval.problemTime;
				break;
			case DOWNTIME_TIME:
				value = interval.downtimeTime;
				break;
			default:
				value = interval.sla;
				break;
		}
		
		List<DataPoint> datapoints = new ArrayList<DataPoint>(1);
		datapoints.add(new DataPoint(Double.valueOf(value), toMillis));
		
		return new TimeSeries(label, datapoints);
	}
	
	public static String formatAcknowledges(List<Acknowledge> acknowledges) {
		
		if ((acknowledges == null) || (acknowledges.isEmpty())) {
			return "";
		}
		
		StringBuilder result = new StringBuilder();
		
		result.append("<br><br>Acknowledges:<br><table><tr><td><b>Time</b></td>");
		result.append("<td><b>User</b></td><td><b>Comments</b></td></tr>");
		
		for (Acknowledge ack : acknowledges) {
			
			result.append("<tr><td><i>");
			result.append(TimeUtil.formatAcknowledgeTime(ack.clock));
			result.append("</i></td><td>");
			result.append(Strings.nullToEmpty(ack.alias));
			result.append(" (");
			result.append(Strings.nullToEmpty(ack.name));
			result.append(" ");
			result.append(Strings.nullToEmpty(ack.surname));
			result.append(")</td><td>");
			result.append(Strings.nullToEmpty(ack.message));
			result.append("</td></tr>");
		}
		
		result.append("</table>");
		
		return result.toString();
	}
	
	private static Double toNumber(String value) {
		
		if (value == null) {
			return null;
		}
		
		try {
			return Double.valueOf(value.trim());
		} catch (NumberFormatException e) {
			return null;
		}
	}
}
