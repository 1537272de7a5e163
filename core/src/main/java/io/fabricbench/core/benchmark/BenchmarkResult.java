package io.fabricbench.core.benchmark;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * Decoded JSON output of one benchmark invocation. A failed invocation is represented by an empty result.
 */
public class BenchmarkResult {
   public final String name;
   private final JsonObject data;

   private BenchmarkResult(String name, JsonObject data) {
      this.name = name;
      this.data = data;
   }

   public static BenchmarkResult empty(String name) {
      return new BenchmarkResult(name, new JsonObject());
   }

   /**
    * @throws DecodeException if the output is not a JSON object.
    */
   public static BenchmarkResult parse(String name, String output) {
      if (output == null || output.isBlank()) {
         throw new DecodeException("No output");
      }
      return new BenchmarkResult(name, new JsonObject(output));
   }

   public boolean isEmpty() {
      return data.isEmpty();
   }

   /**
    * @return Copy of the decoded output.
    */
   public JsonObject data() {
      return data.copy();
   }

   public String encode() {
      return data.encode();
   }

   public List<JobSummary> jobs() {
      Object jobs = data.getValue("jobs");
      if (!(jobs instanceof JsonArray)) {
         return Collections.emptyList();
      }
      List<JobSummary> summaries = new ArrayList<>();
      for (Object job : (JsonArray) jobs) {
         if (job instanceof JsonObject) {
            summaries.add(JobSummary.from((JsonObject) job));
         }
      }
      return summaries;
   }

   @Override
   public String toString() {
      return "BenchmarkResult{" + name + (isEmpty() ? ", empty}" : ", " + jobs().size() + " jobs}");
   }
}
