package io.fabricbench.core.target;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.fabricbench.api.config.TargetConfig;
import io.fabricbench.api.session.CommandResult;
import io.fabricbench.api.session.ConnectionException;
import io.fabricbench.api.session.RemoteCommand;
import io.fabricbench.api.session.RemoteSession;

/**
 * Brings the kernel NVMe-oF TCP target online through configfs, verifies it and tears it down again.
 * <p>
 * {@link #setup()} and {@link #verify()} stop at the first failing step and report it with <code>false</code>;
 * nothing is rolled back there. {@link #cleanup()} removes whatever part of the configuration exists and never
 * fails, so it is safe to call after any outcome of the other two.
 */
public class TargetController {
   private static final Logger log = LogManager.getLogger(TargetController.class);
   static final List<String> MODULES = List.of("nvmet", "nvmet-tcp");
   static final List<String> LOADED_MODULES = List.of("nvmet", "nvmet_tcp");
   static final String TRANSPORT = "tcp";
   static final String FIREWALL_SERVICE = "firewalld";

   private final TargetConfig config;
   private final RemoteSession session;
   private final NvmetLayout layout;
   private TargetState state = TargetState.UNCONFIGURED;

   public TargetController(TargetConfig config, RemoteSession session) {
      this.config = config;
      this.session = session;
      this.layout = new NvmetLayout(config);
   }

   public TargetState state() {
      return state;
   }

   public boolean setup() throws ConnectionException {
      log.info("Setting up NVMe-oF target {} on {}", config.subsystemNqn, config.connection.host);
      session.connect();

      for (String module : MODULES) {
         if (!step("Load module " + module, RemoteCommand.loadModule(module))) {
            return false;
         }
      }
      state(TargetState.MODULES_LOADED);

      bestEffort("Mount configfs", RemoteCommand.mountConfigfs());

      String subsystem = layout.subsystem();
      if (!step("Create subsystem", RemoteCommand.makeDirectory(subsystem))
            || !step("Allow any host", RemoteCommand.writeAttribute(subsystem + "/attr_allow_any_host", "1"))) {
         return false;
      }
      state(TargetState.SUBSYSTEM_CREATED);

      for (int id = 1; id <= config.namespaceCount; ++id) {
         String namespace = layout.namespace(id);
         if (!step("Create namespace " + id, RemoteCommand.makeDirectory(namespace))
               || !step("Set device path of namespace " + id, RemoteCommand.writeAttribute(namespace + "/device_path", layout.namespaceDevice(id)))
               || !step("Enable namespace " + id, RemoteCommand.writeAttribute(namespace + "/enable", "1"))) {
            return false;
         }
      }
      state(TargetState.NAMESPACES_ENABLED);

      String port = layout.port();
      if (!step("Create port " + config.portId, RemoteCommand.makeDirectory(port))
            || !step("Set transport type", RemoteCommand.writeAttribute(port + "/addr_trtype", TRANSPORT))
            || !step("Set address family", RemoteCommand.writeAttribute(port + "/addr_adrfam", config.addressFamily))
            || !step("Set transport address", RemoteCommand.writeAttribute(port + "/addr_traddr", config.dataIp))
            || !step("Set service port", RemoteCommand.writeAttribute(port + "/addr_trsvcid", String.valueOf(config.servicePort)))) {
         return false;
      }
      String link = layout.portLink();
      if (exists(RemoteCommand.linkExists(link))) {
         log.info("Subsystem already bound to port {}", config.portId);
      } else if (!step("Bind subsystem to port " + config.portId, RemoteCommand.symlink(subsystem, link))) {
         return false;
      }
      state(TargetState.PORT_BOUND);

      if (config.openFirewall) {
         openFirewall();
      }
      log.info("Target setup completed: {} on {}:{}", config.subsystemNqn, config.dataIp, config.servicePort);
      return true;
   }

   private void openFirewall() {
      if (!session.execute(RemoteCommand.serviceActive(FIREWALL_SERVICE)).isSuccess()) {
         log.info("{} not active, skipping firewall configuration", FIREWALL_SERVICE);
         return;
      }
      if (bestEffort("Open firewall port", RemoteCommand.firewallOpenPort(config.servicePort, TRANSPORT))) {
         bestEffort("Reload firewall", RemoteCommand.firewallReload());
      }
   }

   public boolean verify() {
      log.info("Verifying target configuration...");
      CommandResult modules = session.execute(RemoteCommand.listModules());
      if (!modules.isSuccess() || !LOADED_MODULES.stream().allMatch(modules.stdout::contains)) {
         log.error("Verification failed: Module loaded");
         return false;
      }
      log.info("Check passed: Module loaded");
      if (!check("Subsystem exists", RemoteCommand.directoryExists(layout.subsystem()))
            || !check("Port configured", RemoteCommand.directoryExists(layout.port()))) {
         return false;
      }
      state(TargetState.VERIFIED);
      log.info("Target verification passed");
      return true;
   }

   /**
    * Removes the port link, the namespaces, the subsystem and the port, in this order, skipping whatever does
    * not exist. Failures are logged and the teardown continues. The session is closed afterwards.
    */
   public void cleanup() {
      log.info("Cleaning up target configuration on {}", config.connection.host);
      try {
         try {
            session.connect();
         } catch (ConnectionException e) {
            log.error("Cannot clean up target configuration: {}", e.getMessage());
            return;
         }
         String link = layout.portLink();
         if (exists(RemoteCommand.linkExists(link))) {
            bestEffort("Unbind subsystem from port " + config.portId, RemoteCommand.unlink(link));
         }
         for (int id = config.namespaceCount; id >= 1; --id) {
            String namespace = layout.namespace(id);
            if (exists(RemoteCommand.directoryExists(namespace))) {
               bestEffort("Disable namespace " + id, RemoteCommand.writeAttribute(namespace + "/enable", "0"));
               bestEffort("Remove namespace " + id, RemoteCommand.removeDirectory(namespace));
            }
         }
         String subsystem = layout.subsystem();
         if (exists(RemoteCommand.directoryExists(subsystem))) {
            bestEffort("Remove subsystem", RemoteCommand.removeDirectory(subsystem));
         }
         String port = layout.port();
         if (exists(RemoteCommand.directoryExists(port))) {
            bestEffort("Remove port " + config.portId, RemoteCommand.removeDirectory(port));
         }
         log.info("Target cleanup completed");
      } catch (RuntimeException e) {
         log.error("Target cleanup interrupted", e);
      } finally {
         session.close();
         state(TargetState.CLEANED_UP);
      }
   }

   private boolean step(String name, RemoteCommand command) {
      CommandResult result = session.execute(command);
      if (!result.isSuccess()) {
         log.error("Target setup failed at '{}': {}", name, result.stderr.trim());
         return false;
      }
      return true;
   }

   private boolean check(String name, RemoteCommand command) {
      if (!session.execute(command).isSuccess()) {
         log.error("Verification failed: {}", name);
         return false;
      }
      log.info("Check passed: {}", name);
      return true;
   }

   private boolean bestEffort(String name, RemoteCommand command) {
      CommandResult result = session.execute(command);
      if (!result.isSuccess()) {
         log.warn("{} failed, continuing: {}", name, result.stderr.trim());
      }
      return result.isSuccess();
   }

   private boolean exists(RemoteCommand test) {
      return session.execute(test).isSuccess();
   }

   private void state(TargetState state) {
      log.info("{} changing state {} to {}", config.connection.host, this.state, state);
      this.state = state;
   }
}
