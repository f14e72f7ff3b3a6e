package org.zabbixds.integrations.grafana.datasource;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Throwables;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;
import org.zabbixds.integrations.grafana.settings.DatasourceSettings;

/**
 * Shares one datasource per distinct settings. Idle datasources are closed.
 */
public class DatasourceRegistry {
	
	private static final Logger logger = LoggerFactory.getLogger(DatasourceRegistry.class);
	
	private static final int CACHE_SIZE = 100;
	private static final int CACHE_RETENTION_MIN = 30;
	
	private static final LoadingCache<DatasourceSettings, ZabbixDatasource> datasourceCache = CacheBuilder
			.newBuilder()
			.maximumSize(CACHE_SIZE)
			.expireAfterAccess(CACHE_RETENTION_MIN, TimeUnit.MINUTES)
			.<DatasourceSettings, ZabbixDatasource> removalListener(notification -> {
				try {
					notification.getValue().close();
				} catch (IOException e) {
					logger.error("Error closing datasource {}", notification.getKey(), e);
				}
			})
			.build(new CacheLoader<DatasourceSettings, ZabbixDatasource>() {
				
				@Override
				public ZabbixDatasource load(DatasourceSettings key) {
					return ZabbixDatasource.create(key);
				}
			});
	
	public static ZabbixDatasource getDatasource(DatasourceSettings settings) {
		
		try {
			return datasourceCache.getUnchecked(settings.copy());
		} catch (UncheckedExecutionException e) {
			Throwables.throwIfUnchecked(e.getCause());
			throw new IllegalStateException("Could not create datasource for " + settings, e.getCause());
		}
	}
	
	public static void invalidateAll() {
		datasourceCache.invalidateAll();
	}
}
