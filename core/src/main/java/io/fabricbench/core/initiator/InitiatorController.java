package io.fabricbench.core.initiator;

import java.util.List;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.fabricbench.api.config.InitiatorConfig;
import io.fabricbench.api.config.TargetConfig;
import io.fabricbench.api.session.CommandResult;
import io.fabricbench.api.session.ConnectionException;
import io.fabricbench.api.session.RemoteCommand;
import io.fabricbench.api.session.RemoteSession;
import io.fabricbench.core.benchmark.BenchmarkResult;
import io.fabricbench.core.benchmark.BenchmarkSpec;
import io.fabricbench.internal.Properties;
import io.vertx.core.json.DecodeException;

/**
 * Discovers and connects the target's subsystem from the initiator host and runs benchmarks against the
 * block device that appears. The initiator host is expected to have no other NVMe/TCP devices attached.
 */
public class InitiatorController {
   private static final Logger log = LogManager.getLogger(InitiatorController.class);
   static final String TRANSPORT = "tcp";
   static final long DEFAULT_SETTLE_DELAY = 2000;

   private final InitiatorConfig config;
   private final TargetConfig target;
   private final RemoteSession session;
   private final long settleDelay;
   private String device;

   public InitiatorController(InitiatorConfig config, TargetConfig target, RemoteSession session) {
      this(config, target, session, Properties.getLong(Properties.SETTLE_DELAY, DEFAULT_SETTLE_DELAY));
   }

   public InitiatorController(InitiatorConfig config, TargetConfig target, RemoteSession session, long settleDelay) {
      this.config = config;
      this.target = target;
      this.session = session;
      this.settleDelay = settleDelay;
   }

   /**
    * @return Path of the connected device or <code>null</code> before a successful {@link #connect()}.
    */
   public String device() {
      return device;
   }

   public boolean discover() throws ConnectionException {
      log.info("Discovering NVMe-oF targets at {}:{} from {}", target.dataIp, target.servicePort, config.connection.host);
      session.connect();
      CommandResult result = session.execute(RemoteCommand.fabricDiscover(TRANSPORT, target.dataIp, target.servicePort));
      if (!result.isSuccess()) {
         log.error("Target discovery failed: {}", result.stderr.trim());
         return false;
      }
      if (!result.stdout.contains(target.subsystemNqn)) {
         log.error("Target discovery failed: {} not advertised by {}:{}", target.subsystemNqn, target.dataIp, target.servicePort);
         return false;
      }
      log.info("Target discovered: {}", target.subsystemNqn);
      return true;
   }

   public boolean connect() {
      log.info("Connecting to {}", target.subsystemNqn);
      CommandResult result = session.execute(RemoteCommand.fabricConnect(TRANSPORT, target.subsystemNqn, target.dataIp, target.servicePort));
      if (!result.isSuccess()) {
         log.error("Connection failed: {}", result.stderr.trim());
         return false;
      }
      if (settleDelay > 0) {
         try {
            Thread.sleep(settleDelay);
         } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while waiting for the device to appear");
            return false;
         }
      }
      CommandResult devices = session.execute(RemoteCommand.listDevices());
      if (!devices.isSuccess()) {
         log.error("Failed to list devices: {}", devices.stderr.trim());
         return false;
      }
      List<String> candidates = devices.stdout.lines()
            .filter(line -> line.contains(TRANSPORT))
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .map(line -> line.split("\\s+")[0])
            .collect(Collectors.toList());
      if (candidates.isEmpty()) {
         log.error("Failed to find connected device");
         return false;
      }
      if (candidates.size() > 1) {
         log.warn("Found {} fabric-attached devices {}, using the first one; was the initiator cleaned up after a previous run?",
               candidates.size(), candidates);
      }
      device = candidates.get(0);
      log.info("Connected to device: {}", device);
      return true;
   }

   /**
    * Runs one benchmark against the connected device. Never fails: a failed invocation or unparseable output
    * yields an {@link BenchmarkResult#empty(String) empty result}.
    *
    * @throws IllegalStateException if no device has been connected.
    */
   public BenchmarkResult runBenchmark(BenchmarkSpec spec) {
      if (device == null) {
         throw new IllegalStateException("No device connected");
      }
      log.info("Running FIO test: {}", spec);
      CommandResult result = session.execute(RemoteCommand.benchmark(spec.fioOptions(device)), spec.timeoutMillis());
      if (!result.isSuccess()) {
         log.error("FIO test {} failed: {}", spec.name, result.stderr.trim());
         return BenchmarkResult.empty(spec.name);
      }
      try {
         BenchmarkResult benchmarkResult = BenchmarkResult.parse(spec.name, result.stdout);
         log.info("Test {} completed", spec.name);
         return benchmarkResult;
      } catch (DecodeException e) {
         log.error("Failed to parse FIO output for {}: {}", spec.name, e.getMessage());
         return BenchmarkResult.empty(spec.name);
      }
   }

   public void disconnect() {
      log.info("Disconnecting from {}", target.subsystemNqn);
      try {
         CommandResult result = session.execute(RemoteCommand.fabricDisconnect(target.subsystemNqn));
         if (result.isSuccess()) {
            log.info("Disconnected");
         } else {
            log.warn("Disconnect had issues: {}", result.stderr.trim());
         }
      } finally {
         device = null;
         session.close();
      }
   }

   /**
    * Releases the session without touching fabric connections.
    */
   public void close() {
      session.close();
   }
}
