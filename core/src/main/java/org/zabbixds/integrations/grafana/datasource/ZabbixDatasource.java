package org.zabbixds.integrations.grafana.datasource;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Ticker;
import org.zabbixds.integrations.grafana.api.RemoteZabbixTransport;
import org.zabbixds.integrations.grafana.api.ZabbixApi;
import org.zabbixds.integrations.grafana.api.ZabbixSession;
import org.zabbixds.integrations.grafana.api.ZabbixTransport;
import org.zabbixds.integrations.grafana.cache.MetadataCache;
import org.zabbixds.integrations.grafana.functions.AnnotationFunction;
import org.zabbixds.integrations.grafana.functions.DatasourceThreadPool;
import org.zabbixds.integrations.grafana.functions.TargetProcessor;
import org.zabbixds.integrations.grafana.input.AnnotationInput;
import org.zabbixds.integrations.grafana.input.QueryInput;
import org.zabbixds.integrations.grafana.output.AnnotationEvent;
import org.zabbixds.integrations.grafana.output.ConnectionTestResult;
import org.zabbixds.integrations.grafana.output.MetricFindValue;
import org.zabbixds.integrations.grafana.output.QueryResult;
import org.zabbixds.integrations.grafana.query.MetricFindQuery;
import org.zabbixds.integrations.grafana.query.QueryResolver;
import org.zabbixds.integrations.grafana.settings.DatasourceSettings;

/**
 * One configured Zabbix endpoint: its session, metadata cache, resolver and worker pool.
 */
public class ZabbixDatasource implements Closeable
{
	private static final Logger logger = LoggerFactory.getLogger(ZabbixDatasource.class);

	private final DatasourceSettings settings;
	private final ZabbixTransport transport;
	private final ZabbixSession session;
	private final ZabbixApi api;
	private final MetadataCache cache;
	private final QueryResolver resolver;
	private final ExecutorService executor;

	public ZabbixDatasource(DatasourceSettings settings, ZabbixTransport transport)
	{
		this(settings, transport, Ticker.systemTicker());
	}

	public ZabbixDatasource(DatasourceSettings settings, ZabbixTransport transport, Ticker ticker)
	{
		this.settings = settings;
		this.transport = transport;
		this.session = new ZabbixSession(transport, settings.username, settings.password);
		this.api = new ZabbixApi(session);
		this.cache = new MetadataCache(session, settings.getCacheTTLMillis(), ticker);
		this.resolver = new QueryResolver(cache);
		this.executor = DatasourceThreadPool.newExecutor(transport.getUrl());
	}

	public static ZabbixDatasource create(DatasourceSettings settings)
	{
		RemoteZabbixTransport transport = RemoteZabbixTransport.newBuilder()
				.setUrl(settings.url)
				.setBasicAuth(settings.basicAuth)
				.setWithCredentials(settings.withCredentials)
				.setTlsSkipVerify(settings.tlsSkipVerify)
				.setTimeout(settings.getTimeout())
				.build();

		logger.info("Created datasource for {}", settings);

		return new ZabbixDatasource(settings, transport);
	}

	public String getHostname()
	{
		return transport.getUrl();
	}

	public DatasourceSettings getSettings()
	{
		return settings;
	}

	public ZabbixSession getSession()
	{
		return session;
	}

	public ZabbixApi getApi()
	{
		return api;
	}

	public MetadataCache getCache()
	{
		return cache;
	}

	public QueryResolver getResolver()
	{
		return resolver;
	}

	public ExecutorService getExecutor()
	{
		return executor;
	}

	public QueryResult query(QueryInput input)
	{
		return TargetProcessor.processQuery(this, input);
	}

	public List<MetricFindValue> metricFindQuery(String query)
	{
		return new MetricFindQuery(resolver).find(query);
	}

	public List<AnnotationEvent> annotationQuery(AnnotationInput input)
	{
		return new AnnotationFunction(this).process(input);
	}

	public ConnectionTestResult testDatasource()
	{
		return session.testConnection();
	}

	@Override
	public void close() throws IOException
	{
		executor.shutdown();
		cache.invalidateAll();

		if (transport instanceof Closeable)
		{
			((Closeable)transport).close();
		}
	}
}
