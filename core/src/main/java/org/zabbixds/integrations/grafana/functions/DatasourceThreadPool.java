package org.zabbixds.integrations.grafana.functions;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Creates the worker pool owned by one datasource. Targets of a query run on it concurrently.
 */
public class DatasourceThreadPool {
	
	private static final Logger logger = LoggerFactory.getLogger(DatasourceThreadPool.class);
	
	public static final String THREADS_PROPERTY = "zabbix.threads";
	public static final int DEFAULT_THREADS = 10;
	
	public static int getThreadCount() {
		
		String value = System.getProperty(THREADS_PROPERTY);
		
		if (Strings.isNullOrEmpty(value)) {
			return DEFAULT_THREADS;
		}
		
		try {
			return Math.max(1, Integer.parseInt(value.trim()));
		} catch (NumberFormatException e) {
			logger.warn("Invalid {} value {}, using {}", THREADS_PROPERTY, value, DEFAULT_THREADS);
			return DEFAULT_THREADS;
		}
	}
	
	public static ExecutorService newExecutor(String name) {
		
		// the name ends up in a format string
		String safeName = Strings.nullToEmpty(name).replaceAll("[^A-Za-z0-9.-]", "_");
		
		return Executors.newFixedThreadPool(getThreadCount(), new ThreadFactoryBuilder()
			.setNameFormat("zabbix-" + safeName + "-%d")
			.setDaemon(true)
			.build());
	}
}
