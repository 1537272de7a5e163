package io.fabricbench.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.aesh.command.Command;
import org.aesh.command.CommandDefinition;
import org.aesh.command.CommandResult;
import org.aesh.command.invocation.CommandInvocation;
import org.aesh.command.option.Option;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.fabricbench.api.config.ConfigurationException;
import io.fabricbench.api.config.ConnectionConfig;
import io.fabricbench.api.config.InitiatorConfig;
import io.fabricbench.api.config.TargetConfig;
import io.fabricbench.api.session.RemoteSession;
import io.fabricbench.core.Orchestrator;
import io.fabricbench.core.report.ReportWriter;
import io.fabricbench.core.report.TestReport;
import io.fabricbench.internal.Properties;

@CommandDefinition(name = NvmeofTestCommand.NAME, description = "Sets up an NVMe-oF TCP target, benchmarks it from an initiator and cleans the target up")
public class NvmeofTestCommand implements Command<CommandInvocation> {
   private static final Logger log = LogManager.getLogger(NvmeofTestCommand.class);
   static final String NAME = "nvmeof-test";

   @Option(name = "target-host", required = true, description = "Management address of the target host")
   String targetHost;

   @Option(name = "target-user", description = "SSH user on the target host", defaultValue = "root")
   String targetUser;

   @Option(name = "target-password", description = "SSH password on the target host; defaults to IO_FABRICBENCH_TARGET_PASSWORD")
   String targetPassword;

   @Option(name = "target-ssh-port", description = "SSH port of the target host", defaultValue = "22")
   int targetSshPort;

   @Option(name = "data-ip", required = true, description = "Fabric address the target listens on")
   String dataIp;

   @Option(name = "nqn", required = true, description = "Qualified name of the exported subsystem")
   String nqn;

   @Option(name = "service-port", description = "NVMe/TCP service port", defaultValue = "4420")
   int servicePort;

   @Option(name = "backend-device", description = "Block device exported by the target", defaultValue = TargetConfig.DEFAULT_BACKEND_DEVICE)
   String backendDevice;

   @Option(name = "namespaces", description = "Number of namespaces to create", defaultValue = "1")
   int namespaces;

   @Option(name = "port-id", description = "Id of the nvmet port", defaultValue = "1")
   int portId;

   @Option(name = "address-family", description = "ipv4 or ipv6", defaultValue = TargetConfig.DEFAULT_ADDRESS_FAMILY)
   String addressFamily;

   @Option(name = "skip-firewall", description = "Do not open the service port in firewalld", hasValue = false)
   boolean skipFirewall;

   @Option(name = "initiator-host", required = true, description = "Management address of the initiator host")
   String initiatorHost;

   @Option(name = "initiator-user", description = "SSH user on the initiator host", defaultValue = "root")
   String initiatorUser;

   @Option(name = "initiator-password", description = "SSH password on the initiator host; defaults to IO_FABRICBENCH_INITIATOR_PASSWORD")
   String initiatorPassword;

   @Option(name = "initiator-ssh-port", description = "SSH port of the initiator host", defaultValue = "22")
   int initiatorSshPort;

   @Option(name = "identity", description = "Private key file used to authenticate to both hosts")
   String identity;

   @Option(shortName = 'o', name = "output", description = "Where to write the JSON results")
   String output;

   @Option(shortName = 'h', hasValue = false, overrideRequired = true)
   boolean help;

   @Override
   public CommandResult execute(CommandInvocation invocation) {
      if (help) {
         System.out.println(invocation.getHelpInfo(NAME));
         return CommandResult.SUCCESS;
      }
      TargetConfig targetConfig;
      InitiatorConfig initiatorConfig;
      try {
         targetConfig = targetConfig();
         initiatorConfig = initiatorConfig();
      } catch (ConfigurationException e) {
         System.out.println("Invalid configuration: " + e.getMessage());
         return CommandResult.FAILURE;
      }

      Orchestrator orchestrator = Orchestrator.create(targetConfig, initiatorConfig, RemoteSession.Factory.fromProperties());
      TestReport report = orchestrator.run();
      if (!orchestrator.summary().isEmpty()) {
         System.out.println(orchestrator.summary());
      }

      Path resultsFile = resultsFile();
      try {
         ReportWriter.write(report, resultsFile);
         log.info("Results saved to: {}", resultsFile);
      } catch (IOException e) {
         log.error("Failed to write results to {}", resultsFile, e);
         return CommandResult.FAILURE;
      }
      if (!report.isSuccess()) {
         System.out.println("Test suite failed: " + report.error());
      }
      return CommandResult.valueOf(report.exitCode());
   }

   TargetConfig targetConfig() {
      ConnectionConfig connection = connection(targetHost, targetUser,
            targetPassword != null ? targetPassword : Properties.get(Properties.TARGET_PASSWORD, null), targetSshPort);
      return TargetConfig.builder()
            .connection(connection)
            .dataIp(dataIp)
            .subsystemNqn(nqn)
            .servicePort(servicePort)
            .backendDevice(backendDevice)
            .namespaceCount(namespaces)
            .portId(portId)
            .addressFamily(addressFamily)
            .openFirewall(!skipFirewall)
            .build();
   }

   InitiatorConfig initiatorConfig() {
      return new InitiatorConfig(connection(initiatorHost, initiatorUser,
            initiatorPassword != null ? initiatorPassword : Properties.get(Properties.INITIATOR_PASSWORD, null), initiatorSshPort));
   }

   private ConnectionConfig connection(String host, String user, String password, int port) {
      return ConnectionConfig.builder()
            .host(host)
            .username(user)
            .password(password)
            .port(port)
            .identity(identity == null ? null : Paths.get(identity))
            .build();
   }

   Path resultsFile() {
      if (output != null) {
         return Paths.get(output);
      }
      return Paths.get(Properties.get(Properties.RESULTS_FILE, ReportWriter.DEFAULT_FILE));
   }
}
