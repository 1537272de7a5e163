package io.fabricbench.api.config;

import java.io.Serializable;
import java.util.Objects;

/**
 * Addressing of the NVMe-oF target: how to reach the host over SSH and what it exports on the fabric.
 */
public class TargetConfig implements Serializable {
   public static final int DEFAULT_SERVICE_PORT = 4420;
   public static final String DEFAULT_BACKEND_DEVICE = "/dev/nvme0n1";
   public static final String DEFAULT_ADDRESS_FAMILY = "ipv4";

   public final ConnectionConfig connection;
   public final String dataIp;
   public final String subsystemNqn;
   public final int servicePort;
   public final String backendDevice;
   public final int namespaceCount;
   public final int portId;
   public final String addressFamily;
   public final boolean openFirewall;

   private TargetConfig(Builder builder) {
      this.connection = builder.connection;
      this.dataIp = builder.dataIp;
      this.subsystemNqn = builder.subsystemNqn;
      this.servicePort = builder.servicePort;
      this.backendDevice = builder.backendDevice;
      this.namespaceCount = builder.namespaceCount;
      this.portId = builder.portId;
      this.addressFamily = builder.addressFamily;
      this.openFirewall = builder.openFirewall;
   }

   public static Builder builder() {
      return new Builder();
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (o == null || getClass() != o.getClass()) {
         return false;
      }
      TargetConfig that = (TargetConfig) o;
      return servicePort == that.servicePort && namespaceCount == that.namespaceCount && portId == that.portId
            && openFirewall == that.openFirewall && connection.equals(that.connection) && dataIp.equals(that.dataIp)
            && subsystemNqn.equals(that.subsystemNqn) && backendDevice.equals(that.backendDevice)
            && addressFamily.equals(that.addressFamily);
   }

   @Override
   public int hashCode() {
      return Objects.hash(connection, dataIp, subsystemNqn, servicePort, backendDevice, namespaceCount, portId);
   }

   @Override
   public String toString() {
      return "TargetConfig{" + connection + ", " + subsystemNqn + " @ " + dataIp + ":" + servicePort + "}";
   }

   public static class Builder {
      private ConnectionConfig connection;
      private String dataIp;
      private String subsystemNqn;
      private int servicePort = DEFAULT_SERVICE_PORT;
      private String backendDevice = DEFAULT_BACKEND_DEVICE;
      private int namespaceCount = 1;
      private int portId = 1;
      private String addressFamily = DEFAULT_ADDRESS_FAMILY;
      private boolean openFirewall = true;

      Builder() {
      }

      public Builder connection(ConnectionConfig connection) {
         this.connection = connection;
         return this;
      }

      public Builder dataIp(String dataIp) {
         this.dataIp = dataIp;
         return this;
      }

      public Builder subsystemNqn(String subsystemNqn) {
         this.subsystemNqn = subsystemNqn;
         return this;
      }

      public Builder servicePort(int servicePort) {
         this.servicePort = servicePort;
         return this;
      }

      public Builder backendDevice(String backendDevice) {
         this.backendDevice = backendDevice;
         return this;
      }

      public Builder namespaceCount(int namespaceCount) {
         this.namespaceCount = namespaceCount;
         return this;
      }

      public Builder portId(int portId) {
         this.portId = portId;
         return this;
      }

      public Builder addressFamily(String addressFamily) {
         this.addressFamily = addressFamily;
         return this;
      }

      public Builder openFirewall(boolean openFirewall) {
         this.openFirewall = openFirewall;
         return this;
      }

      public TargetConfig build() {
         if (connection == null) {
            throw new ConfigurationException("Target connection must be set");
         }
         if (dataIp == null || dataIp.isEmpty()) {
            throw new ConfigurationException("Target data IP must be set");
         }
         if (subsystemNqn == null || subsystemNqn.isEmpty()) {
            throw new ConfigurationException("Subsystem NQN must be set");
         }
         // the NQN names a configfs directory
         if (subsystemNqn.indexOf('/') >= 0) {
            throw new ConfigurationException("Subsystem NQN must not contain '/': " + subsystemNqn);
         }
         if (servicePort <= 0 || servicePort > 65535) {
            throw new ConfigurationException("Invalid service port: " + servicePort);
         }
         if (backendDevice == null || backendDevice.isEmpty()) {
            throw new ConfigurationException("Backend device must be set");
         }
         if (namespaceCount < 1) {
            throw new ConfigurationException("At least one namespace is required, got " + namespaceCount);
         }
         if (portId < 1) {
            throw new ConfigurationException("Invalid configfs port id: " + portId);
         }
         if (!"ipv4".equals(addressFamily) && !"ipv6".equals(addressFamily)) {
            throw new ConfigurationException("Unsupported address family: " + addressFamily);
         }
         return new TargetConfig(this);
      }
   }
}
