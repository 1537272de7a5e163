package io.fabricbench.api.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class TargetConfigTest {
   private static final ConnectionConfig CONNECTION = ConnectionConfig.builder().host("10.0.0.1").username("root").password("pw").build();

   private TargetConfig.Builder builder() {
      return TargetConfig.builder().connection(CONNECTION).dataIp("192.168.1.49").subsystemNqn("nqn.2026-01.lab:target1");
   }

   @Test
   public void testDefaults() {
      TargetConfig config = builder().build();
      assertEquals(4420, config.servicePort);
      assertEquals("/dev/nvme0n1", config.backendDevice);
      assertEquals(1, config.namespaceCount);
      assertEquals(1, config.portId);
      assertEquals("ipv4", config.addressFamily);
      assertTrue(config.openFirewall);
      assertEquals(22, config.connection.port);
   }

   @Test
   public void testInvalidValues() {
      assertThrows(ConfigurationException.class, () -> builder().subsystemNqn("nqn/../../etc").build());
      assertThrows(ConfigurationException.class, () -> builder().subsystemNqn("").build());
      assertThrows(ConfigurationException.class, () -> builder().dataIp(null).build());
      assertThrows(ConfigurationException.class, () -> builder().servicePort(70000).build());
      assertThrows(ConfigurationException.class, () -> builder().namespaceCount(0).build());
      assertThrows(ConfigurationException.class, () -> builder().portId(0).build());
      assertThrows(ConfigurationException.class, () -> builder().addressFamily("fc").build());
      assertThrows(ConfigurationException.class, () -> builder().connection(null).build());
   }

   @Test
   public void testConnection() {
      assertThrows(ConfigurationException.class, () -> ConnectionConfig.builder().build());
      assertThrows(ConfigurationException.class, () -> ConnectionConfig.builder().host("h").port(0).build());
      ConnectionConfig defaultUser = ConnectionConfig.builder().host("h").build();
      assertEquals(System.getProperty("user.name"), defaultUser.username);
      assertFalse(defaultUser.hasPassword());
   }

   @Test
   public void testIdentityHidesPassword() {
      assertEquals("root@10.0.0.1:22", CONNECTION.identity());
      assertFalse(CONNECTION.toString().contains("pw"));
      assertFalse(builder().build().toString().contains("pw"));
   }
}
