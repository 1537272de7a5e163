package io.fabricbench.api.session;

/**
 * Raised when a session to a remote host cannot be established. The message always names the host.
 */
public class ConnectionException extends Exception {
   private final String host;

   public ConnectionException(String host, String message, Throwable cause) {
      super("Cannot connect to " + host + ": " + message, cause);
      this.host = host;
   }

   public String host() {
      return host;
   }
}
