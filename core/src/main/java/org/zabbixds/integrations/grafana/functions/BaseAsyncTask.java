package org.zabbixds.integrations.grafana.functions;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs under a thread name describing the task, so pool threads show what they are working on.
 */
public abstract class BaseAsyncTask<T> implements Callable<T> {
	
	private static final Logger logger = LoggerFactory.getLogger(BaseAsyncTask.class);
	
	private String oldName;
	private long startTime;
	
	@Override
	public T call() throws Exception {
		
		beforeCall();
		
		try {
			return doCall();
		} finally {
			afterCall();
		}
	}
	
	protected abstract T doCall() throws Exception;
	
	protected void beforeCall() {
		oldName = Thread.currentThread().getName();
		Thread.currentThread().setName(this.toString());
		
		logger.debug("Task {} beforeCall", this);
		startTime = System.currentTimeMillis();
	}
	
	protected void afterCall() {
		double sec = (double)(System.currentTimeMillis() - startTime) / 1000;
		logger.debug("Task {} afterCall {} sec", this, sec);
		
		Thread.currentThread().setName(oldName);
	}
}
