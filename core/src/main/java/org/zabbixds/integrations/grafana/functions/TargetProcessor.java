package org.zabbixds.integrations.grafana.functions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import org.zabbixds.integrations.grafana.datasource.ZabbixDatasource;
import org.zabbixds.integrations.grafana.functions.TargetFunction.FunctionFactory;
import org.zabbixds.integrations.grafana.input.QueryInput;
import org.zabbixds.integrations.grafana.input.QueryMode;
import org.zabbixds.integrations.grafana.input.Target;
import org.zabbixds.integrations.grafana.output.QueryResult;
import org.zabbixds.integrations.grafana.output.TargetResult;
import org.zabbixds.integrations.grafana.output.TimeSeries;

/**
 * Runs the targets of a query. A single target runs on the caller thread, several run as tasks on
 * the datasource pool. A failing target only fails its own result.
 */
public class TargetProcessor {
	
	private static final Logger logger = LoggerFactory.getLogger(TargetProcessor.class);
	
	private static final Map<QueryMode, FunctionFactory> factories;
	
	protected static class TargetAsyncTask extends BaseAsyncTask<TargetTaskResult> {
		
		protected final ZabbixDatasource datasource;
		protected final Target target;
		protected final QueryInput input;
		protected final int index;
		
		protected TargetAsyncTask(ZabbixDatasource datasource, Target target, QueryInput input, int index) {
			this.datasource = datasource;
			this.target = target;
			this.input = input;
			this.index = index;
		}
		
		@Override
		protected TargetTaskResult doCall() {
			return new TargetTaskResult(processSingleTarget(datasource, target, input), index);
		}
		
		@Override
		public String toString() {
			return "target " + target.refId;
		}
	}
	
	protected static class TargetTaskResult {
		
		protected final TargetResult result;
		protected final int index;
		
		protected TargetTaskResult(TargetResult result, int index) {
			this.result = result;
			this.index = index;
		}
	}
	
	/**
	 * Never throws: a failure is reported in the error member of the returned result.
	 */
	public static TargetResult processSingleTarget(ZabbixDatasource datasource, Target target, QueryInput input) {
		
		if (target.hide) {
			return TargetResult.of(target.refId, Collections.<TimeSeries>emptyList());
		}
		
		FunctionFactory factory = factories.get(target.getMode());
		
		if (factory == null) {
			return TargetResult.error(target.refId, "Unsupported query mode " + target.getMode());
		}
		
		try {
			TargetFunction function = factory.create(datasource);
			
			logger.debug("About to process {} with {}", target, function.getClass().getSimpleName());
			
			return TargetResult.of(target.refId, function.process(target, input));
		} catch (RuntimeException e) {
			logger.error("Could not process target {} on {}", target, datasource.getHostname(), e);
			return TargetResult.error(target.refId, Strings.nullToEmpty(e.getMessage()));
		}
	}
	
	public static QueryResult processSync(ZabbixDatasource datasource, Target target, QueryInput input) {
		
		QueryResult result = new QueryResult();
		result.results = Collections.singletonList(processSingleTarget(datasource, target, input));
		
		return result;
	}
	
	public static QueryResult processAsync(ZabbixDatasource datasource, List<Target> targets, QueryInput input) {
		
		CompletionService<TargetTaskResult> completionService = 
			new ExecutorCompletionService<TargetTaskResult>(datasource.getExecutor());
		
		int index = 0;
		
		for (Target target : targets) {
			completionService.submit(new TargetAsyncTask(datasource, target, input, index++));
		}
		
		List<TargetTaskResult> taskResults = new ArrayList<TargetTaskResult>(targets.size());
		int received = 0;
		
		while (received < targets.size()) {
			try {
				Future<TargetTaskResult> future = completionService.take();
				taskResults.add(future.get());
				
				received++;
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new IllegalStateException("Interrupted while waiting for targets", e);
			} catch (ExecutionException e) {
				throw new IllegalStateException(e.getCause());
			}
		}
		
		sortResults(taskResults);
		
		QueryResult result = new QueryResult();
		result.results = new ArrayList<TargetResult>(taskResults.size());
		
		for (TargetTaskResult taskResult : taskResults) {
			result.results.add(taskResult.result);
		}
		
		return result;
	}
	
	public static QueryResult processQuery(ZabbixDatasource datasource, QueryInput input) {
		
		if ((input == null) || (input.range == null)) {
			throw new IllegalArgumentException("Missing query range");
		}
		
		List<Target> targets = (input.targets != null) ? input.targets : Collections.<Target>emptyList();
		
		if (targets.size() == 1) {
			return processSync(datasource, targets.get(0), input);
		}
		
		return processAsync(datasource, targets, input);
	}
	
	private static void sortResults(List<TargetTaskResult> results) {
		results.sort(new Comparator<TargetTaskResult>() {
			
			@Override
			public int compare(TargetTaskResult o1, TargetTaskResult o2) {
				return o1.index - o2.index;
			}
		});
	}
	
	public static void registerFunction(FunctionFactory factory) {
		factories.put(factory.getMode(), factory);
	}
	
	static {
		factories = new EnumMap<QueryMode, FunctionFactory>(QueryMode.class);
		
		registerFunction(new NumericDataFunction.Factory());
		registerFunction(new TextDataFunction.Factory());
		registerFunction(new ItServiceFunction.Factory());
	}
}
