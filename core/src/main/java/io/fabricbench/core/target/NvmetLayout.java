package io.fabricbench.core.target;

import io.fabricbench.api.config.TargetConfig;

/**
 * Locations in the nvmet configfs tree that belong to one target configuration.
 */
public class NvmetLayout {
   public static final String ROOT = "/sys/kernel/config/nvmet";

   private final TargetConfig config;

   public NvmetLayout(TargetConfig config) {
      this.config = config;
   }

   public String subsystem() {
      return ROOT + "/subsystems/" + config.subsystemNqn;
   }

   public String namespace(int id) {
      return subsystem() + "/namespaces/" + id;
   }

   public String port() {
      return ROOT + "/ports/" + config.portId;
   }

   public String portLink() {
      return port() + "/subsystems/" + config.subsystemNqn;
   }

   /**
    * With a single namespace the backend device is exported as is. With more namespaces, the trailing
    * number of the backend device is replaced by the namespace id, e.g. <code>/dev/nvme0n1</code> becomes
    * <code>/dev/nvme0n2</code> for namespace 2.
    */
   public String namespaceDevice(int id) {
      if (config.namespaceCount == 1) {
         return config.backendDevice;
      }
      return config.backendDevice.replaceFirst("\\d+$", "") + id;
   }
}
