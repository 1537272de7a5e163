package io.fabricbench.core.benchmark;

import io.vertx.core.json.JsonObject;

public class JobSummary {
   public final String jobName;
   public final IoStats read;
   public final IoStats write;

   public JobSummary(String jobName, IoStats read, IoStats write) {
      this.jobName = jobName;
      this.read = read;
      this.write = write;
   }

   static JobSummary from(JsonObject job) {
      return new JobSummary(job.getString("jobname", "unknown"),
            IoStats.from(subRecord(job, "read")), IoStats.from(subRecord(job, "write")));
   }

   private static JsonObject subRecord(JsonObject job, String field) {
      Object value = job.getValue(field);
      return value instanceof JsonObject ? (JsonObject) value : null;
   }
}
