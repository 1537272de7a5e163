package io.fabricbench.core.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.StringWriter;
import java.nio.file.Path;
import java.util.Iterator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.fabricbench.core.TestConfigs;
import io.fabricbench.core.benchmark.BenchmarkResult;

public class ReportWriterTest {

   @Test
   public void testWritesResultsInExecutionOrder() throws Exception {
      TestReport report = new TestReport();
      report.record(BenchmarkResult.parse("seq_read", TestConfigs.resource("fio-read.json")));
      report.record(BenchmarkResult.empty("rand_read"));
      report.record(BenchmarkResult.parse("randrw", TestConfigs.resource("fio-randrw.json")));

      StringWriter writer = new StringWriter();
      ReportWriter.write(report, writer);

      JsonNode root = new ObjectMapper().readTree(writer.toString());
      Iterator<String> names = root.fieldNames();
      assertEquals("seq_read", names.next());
      assertEquals("rand_read", names.next());
      assertEquals("randrw", names.next());
      assertFalse(names.hasNext());
      assertEquals(0, root.path("rand_read").size());
      assertEquals(12800.0, root.path("randrw").path("jobs").get(0).path("read").path("iops").asDouble(), 0.001);
      assertTrue(report.isSuccess());
   }

   @Test
   public void testWritesError(@TempDir Path dir) throws Exception {
      TestReport report = new TestReport();
      report.record(BenchmarkResult.parse("seq_read", TestConfigs.resource("fio-read.json")));
      report.error("Connection failed");

      Path file = dir.resolve(ReportWriter.DEFAULT_FILE);
      ReportWriter.write(report, file);

      JsonNode root = new ObjectMapper().readTree(file.toFile());
      assertEquals("Connection failed", root.path(TestReport.ERROR_FIELD).asText());
      assertEquals("seq_read", root.path("seq_read").path("jobs").get(0).path("jobname").asText());
      assertEquals(1, report.exitCode());
   }

   @Test
   public void testSummaryLines() {
      TestReport report = new TestReport();
      report.record(BenchmarkResult.parse("seq_read", TestConfigs.resource("fio-read.json")));

      assertEquals("\nseq_read:\n  Read:  1024.00 MB/s, 1024 IOPS\n", ReportSummary.format(report));
   }

   @Test
   public void testSummarySkipsEmptyResultsAndIdleDirections() {
      TestReport report = new TestReport();
      report.record(BenchmarkResult.parse("seq_read", TestConfigs.resource("fio-read.json")));
      report.record(BenchmarkResult.empty("rand_read"));
      report.record(BenchmarkResult.parse("randrw", TestConfigs.resource("fio-randrw.json")));

      String summary = ReportSummary.format(report);

      assertTrue(summary.contains("seq_read:"));
      assertTrue(summary.contains("Read:  1024.00 MB/s, 1024 IOPS"));
      assertFalse(summary.contains("rand_read"));
      assertTrue(summary.contains("randrw:"));
      assertTrue(summary.contains("Read:  50.00 MB/s, 12800 IOPS"));
      assertTrue(summary.contains("Write: 21.33 MB/s, 5461 IOPS"));
      // seq_read wrote nothing, randrw is the only job with a write line
      assertEquals(summary.indexOf("Write:"), summary.lastIndexOf("Write:"));
   }
}
