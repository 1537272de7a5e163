package io.fabricbench.core.report;

import java.util.Locale;

import io.fabricbench.core.benchmark.BenchmarkResult;
import io.fabricbench.core.benchmark.IoStats;
import io.fabricbench.core.benchmark.JobSummary;

/**
 * Human readable bandwidth and IOPS per job; empty results are left out.
 */
public class ReportSummary {

   public static String format(TestReport report) {
      StringBuilder sb = new StringBuilder();
      for (BenchmarkResult result : report.results().values()) {
         if (result.isEmpty()) {
            continue;
         }
         for (JobSummary job : result.jobs()) {
            sb.append('\n').append(job.jobName).append(":\n");
            line(sb, "Read: ", job.read);
            line(sb, "Write:", job.write);
         }
      }
      return sb.toString();
   }

   private static void line(StringBuilder sb, String label, IoStats stats) {
      if (stats != null && stats.hasTraffic()) {
         sb.append(String.format(Locale.ROOT, "  %s %.2f MB/s, %.0f IOPS\n", label, stats.megabytesPerSecond(), stats.iops));
      }
   }
}
