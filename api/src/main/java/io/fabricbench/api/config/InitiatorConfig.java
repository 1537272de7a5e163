package io.fabricbench.api.config;

import java.io.Serializable;
import java.util.Objects;

public class InitiatorConfig implements Serializable {
   public final ConnectionConfig connection;

   public InitiatorConfig(ConnectionConfig connection) {
      this.connection = Objects.requireNonNull(connection, "connection");
   }

   @Override
   public String toString() {
      return "InitiatorConfig{" + connection + "}";
   }
}
