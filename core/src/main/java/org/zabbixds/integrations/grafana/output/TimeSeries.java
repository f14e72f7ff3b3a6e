package org.zabbixds.integrations.grafana.output;

import java.util.ArrayList;
import java.util.List;

import com.google.gson.annotations.SerializedName;

public class TimeSeries {
	
	@SerializedName("target")
	public String label;
	
	public List<DataPoint> datapoints;
	
	public TimeSeries() {
		this.datapoints = new ArrayList<DataPoint>();
	}
	
	public TimeSeries(String label, List<DataPoint> datapoints) {
		this.label = label;
		this.datapoints = datapoints;
	}
	
	public TimeSeries withPoints(List<DataPoint> newPoints) {
		return new TimeSeries(label, newPoints);
	}
	
	public TimeSeries withLabel(String newLabel) {
		return new TimeSeries(newLabel, datapoints);
	}
	
	public int size() {
		return datapoints.size();
	}
	
	@Override
	public String toString() {
		return label + " (" + datapoints.size() + " points)";
	}
}
