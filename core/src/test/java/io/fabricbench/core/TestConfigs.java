package io.fabricbench.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import io.fabricbench.api.config.ConnectionConfig;
import io.fabricbench.api.config.InitiatorConfig;
import io.fabricbench.api.config.TargetConfig;

public final class TestConfigs {
   public static final String NQN = "nqn.test:unit1";
   public static final String LSMOD_OUTPUT = "Module                  Size  Used by\n"
         + "nvmet_tcp              36864  1\n"
         + "nvmet                 135168  7 nvmet_tcp\n";
   public static final String NVME_LIST_OUTPUT = "Node             Generic     SN                   Model     Namespace  Usage  Format\n"
         + "---------------- ----------- -------------------- --------- ---------- ------ ------\n"
         + "nvme0            ng0n1       tcp   traddr=192.168.1.49,trsvcid=4420\n";

   private TestConfigs() {
   }

   public static TargetConfig.Builder targetBuilder() {
      return TargetConfig.builder()
            .connection(ConnectionConfig.builder().host("10.0.0.1").username("root").password("secret").build())
            .dataIp("192.168.1.49")
            .subsystemNqn(NQN)
            .servicePort(4420);
   }

   public static TargetConfig target() {
      return targetBuilder().build();
   }

   public static InitiatorConfig initiator() {
      return new InitiatorConfig(ConnectionConfig.builder().host("10.0.0.2").username("root").password("secret").build());
   }

   public static String resource(String name) {
      try (InputStream stream = TestConfigs.class.getClassLoader().getResourceAsStream(name)) {
         if (stream == null) {
            throw new IllegalArgumentException("Missing test resource " + name);
         }
         return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
      } catch (IOException e) {
         throw new UncheckedIOException(e);
      }
   }
}
