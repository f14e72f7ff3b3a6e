package org.zabbixds.integrations.grafana.input;

import java.util.concurrent.TimeUnit;

/**
 * A query window in epoch millis.
 */
public class TimeRange {
	
	public long from;
	public long to;
	
	public TimeRange() {
	}
	
	public TimeRange(long from, long to) {
		this.from = from;
		this.to = to;
	}
	
	public long getFromSeconds() {
		return TimeUnit.MILLISECONDS.toSeconds(from);
	}
	
	/**
	 * Rounded up so that the last partial second is inside the window.
	 */
	public long getToSeconds() {
		return (long)Math.ceil(to / 1000.0);
	}
	
	public TimeRange shift(long offsetMillis) {
		return new TimeRange(from + offsetMillis, to + offsetMillis);
	}
	
	public long getSpan() {
		return to - from;
	}
	
	@Override
	public String toString() {
		return "[" + from + ", " + to + "]";
	}
}
