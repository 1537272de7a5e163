package io.fabricbench.core;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.fabricbench.api.config.InitiatorConfig;
import io.fabricbench.api.config.TargetConfig;
import io.fabricbench.api.session.ConnectionException;
import io.fabricbench.api.session.RemoteSession;
import io.fabricbench.core.benchmark.BenchmarkResult;
import io.fabricbench.core.benchmark.BenchmarkSpec;
import io.fabricbench.core.initiator.InitiatorController;
import io.fabricbench.core.report.ReportSummary;
import io.fabricbench.core.report.TestReport;
import io.fabricbench.core.target.TargetController;

/**
 * Runs the whole test: target setup and verification, discovery and connection from the initiator, the
 * benchmark battery and disconnection. The first required phase that fails ends the run; the target is
 * cleaned up exactly once afterwards, whatever the outcome.
 */
public class Orchestrator {
   private static final Logger log = LogManager.getLogger(Orchestrator.class);
   private static final String SEPARATOR = "=".repeat(60);

   private final TargetController target;
   private final InitiatorController initiator;
   private final List<BenchmarkSpec> battery;
   private OrchestrationPhase phase = OrchestrationPhase.NOT_STARTED;
   private String summary = "";

   public Orchestrator(TargetController target, InitiatorController initiator, List<BenchmarkSpec> battery) {
      for (BenchmarkSpec spec : battery) {
         if (TestReport.ERROR_FIELD.equals(spec.name)) {
            throw new IllegalArgumentException("'" + TestReport.ERROR_FIELD + "' is reserved and cannot name a benchmark");
         }
      }
      this.target = target;
      this.initiator = initiator;
      this.battery = List.copyOf(battery);
   }

   public static Orchestrator create(TargetConfig targetConfig, InitiatorConfig initiatorConfig, RemoteSession.Factory sessionFactory) {
      TargetController target = new TargetController(targetConfig, sessionFactory.create(targetConfig.connection));
      InitiatorController initiator = new InitiatorController(initiatorConfig, targetConfig, sessionFactory.create(initiatorConfig.connection));
      return new Orchestrator(target, initiator, BenchmarkSpec.DEFAULT_BATTERY);
   }

   public OrchestrationPhase phase() {
      return phase;
   }

   /**
    * @return Summary built in the last phase; empty if the run did not get that far.
    */
   public String summary() {
      return summary;
   }

   public TestReport run() {
      TestReport report = new TestReport();
      log.info(SEPARATOR);
      log.info("Starting NVMe-oF Remote Test Suite");
      log.info(SEPARATOR);
      try {
         phase(OrchestrationPhase.TARGET_SETUP);
         require(target.setup(), "Target setup failed");

         phase(OrchestrationPhase.TARGET_VERIFY);
         require(target.verify(), "Target verification failed");

         phase(OrchestrationPhase.DISCOVER);
         require(initiator.discover(), "Target discovery failed");

         phase(OrchestrationPhase.CONNECT);
         require(initiator.connect(), "Connection failed");

         try {
            phase(OrchestrationPhase.BENCHMARK);
            for (BenchmarkSpec spec : battery) {
               BenchmarkResult result = initiator.runBenchmark(spec);
               report.record(result);
            }
         } finally {
            phase(OrchestrationPhase.DISCONNECT);
            initiator.disconnect();
         }

         phase(OrchestrationPhase.SUMMARY);
         summary = ReportSummary.format(report);
         log.info("Test results:{}", summary);
      } catch (OrchestrationException | ConnectionException e) {
         log.error("Test suite failed: {}", e.getMessage());
         report.error(e.getMessage());
      } catch (RuntimeException e) {
         log.error("Test suite failed in {}", phase, e);
         report.error(String.valueOf(e));
      } finally {
         phase(OrchestrationPhase.CLEANUP);
         try {
            initiator.close();
         } finally {
            target.cleanup();
         }
      }
      log.info(SEPARATOR);
      log.info("Test Suite Completed{}", report.isSuccess() ? "" : " with error: " + report.error());
      log.info(SEPARATOR);
      return report;
   }

   private void require(boolean phaseResult, String message) throws OrchestrationException {
      if (!phaseResult) {
         throw new OrchestrationException(phase, message);
      }
   }

   private void phase(OrchestrationPhase phase) {
      this.phase = phase;
      log.info("{}...", phase);
   }
}
