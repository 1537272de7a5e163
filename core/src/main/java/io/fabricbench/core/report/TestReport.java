package io.fabricbench.core.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.fabricbench.core.benchmark.BenchmarkResult;

/**
 * Outcome of one orchestration run: benchmark results in execution order and the error that aborted the run, if any.
 */
public class TestReport {
   public static final String ERROR_FIELD = "error";

   private final Map<String, BenchmarkResult> results = new LinkedHashMap<>();
   private String error;

   public void record(BenchmarkResult result) {
      if (ERROR_FIELD.equals(result.name)) {
         throw new IllegalArgumentException("'" + ERROR_FIELD + "' is reserved and cannot name a benchmark");
      }
      results.put(result.name, result);
   }

   public void error(String error) {
      this.error = error;
   }

   public Map<String, BenchmarkResult> results() {
      return Collections.unmodifiableMap(results);
   }

   public String error() {
      return error;
   }

   public boolean isSuccess() {
      return error == null;
   }

   public int exitCode() {
      return isSuccess() ? 0 : 1;
   }
}
