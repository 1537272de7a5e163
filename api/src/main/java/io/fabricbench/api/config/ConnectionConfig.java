package io.fabricbench.api.config;

import java.io.Serializable;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reachability and credentials for one remote host.
 */
public class ConnectionConfig implements Serializable {
   public static final int DEFAULT_PORT = 22;

   public final String host;
   public final String username;
   public final transient String password;
   public final int port;
   public final Path identity;

   private ConnectionConfig(String host, String username, String password, int port, Path identity) {
      this.host = host;
      this.username = username;
      this.password = password;
      this.port = port;
      this.identity = identity;
   }

   public static Builder builder() {
      return new Builder();
   }

   public boolean hasPassword() {
      return password != null && !password.isEmpty();
   }

   /**
    * @return <code>user@host:port</code>, never containing the secret.
    */
   public String identity() {
      return username + "@" + host + ":" + port;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (o == null || getClass() != o.getClass()) {
         return false;
      }
      ConnectionConfig that = (ConnectionConfig) o;
      return port == that.port && host.equals(that.host) && username.equals(that.username)
            && Objects.equals(password, that.password) && Objects.equals(identity, that.identity);
   }

   @Override
   public int hashCode() {
      return Objects.hash(host, username, port, identity);
   }

   @Override
   public String toString() {
      return identity();
   }

   public static class Builder {
      private String host;
      private String username;
      private String password;
      private int port = DEFAULT_PORT;
      private Path identity;

      Builder() {
      }

      public Builder host(String host) {
         this.host = host;
         return this;
      }

      public Builder username(String username) {
         this.username = username;
         return this;
      }

      public Builder password(String password) {
         this.password = password;
         return this;
      }

      public Builder port(int port) {
         this.port = port;
         return this;
      }

      public Builder identity(Path identity) {
         this.identity = identity;
         return this;
      }

      public ConnectionConfig build() {
         if (host == null || host.isEmpty()) {
            throw new ConfigurationException("Host must be set");
         }
         if (port <= 0 || port > 65535) {
            throw new ConfigurationException("Invalid SSH port for " + host + ": " + port);
         }
         String user = username;
         if (user == null || user.isEmpty()) {
            user = System.getProperty("user.name");
         }
         return new ConnectionConfig(host, user, password, port, identity);
      }
   }
}
