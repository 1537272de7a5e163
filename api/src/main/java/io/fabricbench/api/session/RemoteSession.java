package io.fabricbench.api.session;

import java.io.Closeable;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

import io.fabricbench.api.config.ConfigurationException;
import io.fabricbench.api.config.ConnectionConfig;
import io.fabricbench.internal.Properties;

/**
 * Command-execution channel to a single host. A session is owned by exactly one controller and used
 * from one thread; it must be {@link #connect() connected} before any {@link #execute(RemoteCommand, long)}.
 */
public interface RemoteSession extends Closeable {
   long DEFAULT_TIMEOUT = Properties.getLong(Properties.COMMAND_TIMEOUT, 300_000);

   ConnectionConfig config();

   /**
    * Establishes the channel. Does nothing while the channel is open and establishes a new one when it
    * was dropped. Never retries.
    *
    * @throws ConnectionException if the host cannot be reached or authentication fails.
    */
   void connect() throws ConnectionException;

   /**
    * @return <code>true</code> from a successful {@link #connect()} until {@link #close()}, even when the channel
    * has dropped in between.
    */
   boolean isConnected();

   /**
    * Runs the command and waits for its completion. Any failure of the execution itself is returned
    * as an unsuccessful {@link CommandResult} rather than thrown.
    *
    * @throws IllegalStateException when the session was never connected or has been closed.
    */
   CommandResult execute(RemoteCommand command, long timeoutMillis);

   default CommandResult execute(RemoteCommand command) {
      return execute(command, DEFAULT_TIMEOUT);
   }

   /**
    * Releases the channel; safe to call repeatedly and on a session that was never connected.
    */
   @Override
   void close();

   interface Factory {
      String name();

      RemoteSession create(ConnectionConfig config);

      static Factory byName(String name) {
         return ServiceLoader.load(Factory.class).stream()
               .map(ServiceLoader.Provider::get)
               .filter(f -> f.name().equals(name))
               .findFirst()
               .orElseThrow(() -> new ConfigurationException("No session transport '" + name + "', available: "
                     + ServiceLoader.load(Factory.class).stream().map(p -> p.get().name()).collect(Collectors.joining(", "))));
      }

      static Factory fromProperties() {
         return byName(Properties.get(Properties.SESSION_TRANSPORT, "ssh"));
      }
   }
}
