package org.zabbixds.integrations.grafana.util;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.joda.time.DateTime;
import org.joda.time.DateTimeConstants;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.ISODateTimeFormat;

import org.zabbixds.integrations.grafana.query.ConfigurationException;

public class TimeUtil {
	
	public static final String SECOND_POSTFIX = "s";
	public static final String MINUTE_POSTFIX = "m";
	public static final String HOUR_POSTFIX = "h";
	public static final String DAY_POSTFIX = "d";
	public static final String WEEK_POSTFIX = "w";
	public static final String MONTH_POSTFIX = "M";
	public static final String YEAR_POSTFIX = "y";
	
	private static final String FORWARD_SHIFT_PREFIX = "+";
	
	private static final Pattern INTERVAL_PATTERN = Pattern.compile("^(\\d+)([yMwdhms])$");
	
	private static final DateTimeFormatter fmt = ISODateTimeFormat.dateTime().withZoneUTC();
	private static final DateTimeFormatter ackFmt = DateTimeFormat.forPattern("dd MMM yyyy HH:mm:ss")
		.withLocale(Locale.ENGLISH).withZoneUTC();
	
	public static String getDateTimeFromEpoch(long epoch) {
		return new DateTime(epoch).toString(fmt);
	}
	
	/**
	 * Formats an acknowledgement time given in epoch seconds, e.g. "05 Mar 2018 14:02:11".
	 */
	public static String formatAcknowledgeTime(long epochSeconds) {
		return new DateTime(epochSeconds * DateTimeConstants.MILLIS_PER_SECOND).toString(ackFmt);
	}
	
	/**
	 * Parses a duration such as "30s", "5m", "1h", "7d", "2w", "1M" or "1y" into millis.
	 * A month counts as 30 days and a year as 365 days.
	 */
	public static long parseInterval(String interval) {
		
		if (interval == null) {
			throw new ConfigurationException("Missing interval");
		}
		
		Matcher matcher = INTERVAL_PATTERN.matcher(interval.trim());
		
		if (!matcher.matches()) {
			throw new ConfigurationException("Invalid interval " + interval);
		}
		
		long delta;
		
		try {
			delta = Long.parseLong(matcher.group(1));
		} catch (NumberFormatException e) {
			throw new ConfigurationException("Invalid interval " + interval, e);
		}
		
		try {
			return Math.multiplyExact(delta, getUnitMillis(matcher.group(2)));
		} catch (ArithmeticException e) {
			throw new ConfigurationException("Interval out of range " + interval, e);
		}
	}
	
	private static long getUnitMillis(String timeUnit) {
		
		switch (timeUnit) {
			case YEAR_POSTFIX:
				return 365L * DateTimeConstants.MILLIS_PER_DAY;
			case MONTH_POSTFIX:
				return 30L * DateTimeConstants.MILLIS_PER_DAY;
			case WEEK_POSTFIX:
				return DateTimeConstants.MILLIS_PER_WEEK;
			case DAY_POSTFIX:
				return DateTimeConstants.MILLIS_PER_DAY;
			case HOUR_POSTFIX:
				return DateTimeConstants.MILLIS_PER_HOUR;
			case MINUTE_POSTFIX:
				return DateTimeConstants.MILLIS_PER_MINUTE;
			default:
				return DateTimeConstants.MILLIS_PER_SECOND;
		}
	}
	
	/**
	 * Returns the offset to add to a query window: "24h" moves it back a day, "+24h" moves it forward.
	 */
	public static long parseTimeShift(String shift) {
		
		if (shift == null) {
			throw new ConfigurationException("Missing time shift");
		}
		
		String trimmed = shift.trim();
		
		if (trimmed.startsWith(FORWARD_SHIFT_PREFIX)) {
			return parseInterval(trimmed.substring(FORWARD_SHIFT_PREFIX.length()));
		}
		
		if (trimmed.startsWith("-")) {
			return -parseInterval(trimmed.substring(1));
		}
		
		return -parseInterval(trimmed);
	}
	
	public static long secondsToMillis(long seconds) {
		return seconds * DateTimeConstants.MILLIS_PER_SECOND;
	}
	
	public static long millisToSeconds(long millis) {
		return millis / DateTimeConstants.MILLIS_PER_SECOND;
	}
	
	public static long now() {
		return DateTime.now().getMillis();
	}
}
