package com.fxanalytics.resilience;

import java.util.List;

/** Processes one batch of items, returning any results produced for it. */
@FunctionalInterface
public interface BatchProcessor<T, R> {

    List<R> process(List<T> batch) throws Exception;
}
