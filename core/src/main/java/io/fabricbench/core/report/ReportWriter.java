package io.fabricbench.core.report;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.fabricbench.core.benchmark.BenchmarkResult;

/**
 * Serializes a {@link TestReport} as a JSON object holding one field per benchmark with the raw <code>fio</code>
 * output, followed by the {@value TestReport#ERROR_FIELD} field when the run failed.
 */
public class ReportWriter {
   public static final String DEFAULT_FILE = "nvmeof_test_results.json";

   private static final ObjectMapper MAPPER = new ObjectMapper();

   public static void write(TestReport report, Path file) throws IOException {
      try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
         write(report, writer);
      }
   }

   public static void write(TestReport report, Writer writer) throws IOException {
      JsonFactory jfactory = new JsonFactory();
      jfactory.setCodec(MAPPER);
      try (JsonGenerator jGenerator = jfactory.createGenerator(writer)) {
         jGenerator.useDefaultPrettyPrinter();
         jGenerator.writeStartObject();
         for (Map.Entry<String, BenchmarkResult> entry : report.results().entrySet()) {
            jGenerator.writeFieldName(entry.getKey());
            jGenerator.writeTree(MAPPER.readTree(entry.getValue().encode()));
         }
         if (report.error() != null) {
            jGenerator.writeStringField(TestReport.ERROR_FIELD, report.error());
         }
         jGenerator.writeEndObject();
      }
   }
}
