package io.fabricbench.core.session;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.util.EnumSet;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.channel.ChannelExec;
import org.apache.sshd.client.channel.ClientChannelEvent;
import org.apache.sshd.client.future.AuthFuture;
import org.apache.sshd.client.future.ConnectFuture;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.io.resource.URLResource;
import org.apache.sshd.common.util.security.SecurityUtils;
import org.apache.sshd.core.CoreModuleProperties;
import org.kohsuke.MetaInfServices;

import io.fabricbench.api.config.ConnectionConfig;
import io.fabricbench.api.session.CommandResult;
import io.fabricbench.api.session.ConnectionException;
import io.fabricbench.api.session.RemoteCommand;
import io.fabricbench.api.session.RemoteSession;
import io.fabricbench.internal.Properties;

/**
 * {@link RemoteSession} running each command in its own SSH exec channel. Authenticates with the configured
 * password and/or private key; without either, <code>~/.ssh/id_rsa</code> is tried. Host keys are not verified.
 */
public class SshRemoteSession implements RemoteSession {
   private static final Logger log = LogManager.getLogger(SshRemoteSession.class);
   static final long CONNECT_TIMEOUT = Properties.getLong(Properties.CONNECT_TIMEOUT, 15000);

   private final ConnectionConfig config;
   private SshClient client;
   private ClientSession session;
   private boolean connected;

   public SshRemoteSession(ConnectionConfig config) {
      this.config = config;
   }

   @Override
   public ConnectionConfig config() {
      return config;
   }

   @Override
   public void connect() throws ConnectionException {
      if (connected) {
         if (session.isOpen()) {
            return;
         }
         log.warn("Session to {} was closed, reconnecting", config.identity());
         close();
      }
      SshClient client = SshClient.setUpDefaultClient();
      CoreModuleProperties.NIO_WORKERS.set(client, 1);
      client.setServerKeyVerifier((clientSession, remoteAddress, serverKey) -> true);
      client.start();
      ClientSession clientSession = null;
      try {
         ConnectFuture connect = client.connect(config.username, config.host, config.port).verify(CONNECT_TIMEOUT);
         clientSession = connect.getSession();
         if (config.hasPassword()) {
            clientSession.addPasswordIdentity(config.password);
         }
         Path identity = identityFile();
         if (identity != null) {
            addKeyIdentity(clientSession, identity);
         }
         AuthFuture auth = clientSession.auth();
         if (!auth.await(CONNECT_TIMEOUT)) {
            throw new ConnectionException(config.identity(), "Not authenticated within timeout", null);
         }
         if (!auth.isSuccess()) {
            throw new ConnectionException(config.identity(), "Failed to authenticate", auth.getException());
         }
      } catch (IOException | GeneralSecurityException e) {
         abort(client, clientSession);
         ConnectionException exception = new ConnectionException(config.identity(), String.valueOf(e.getMessage()), e);
         log.error("Failed to connect to {}", config.identity(), exception);
         throw exception;
      } catch (ConnectionException e) {
         abort(client, clientSession);
         log.error("Failed to connect to {}", config.identity(), e);
         throw e;
      }
      this.client = client;
      this.session = clientSession;
      this.connected = true;
      log.info("Connected to {}", config.identity());
   }

   private Path identityFile() {
      if (config.identity != null) {
         return config.identity;
      }
      if (config.hasPassword()) {
         return null;
      }
      Path defaultKey = Paths.get(System.getProperty("user.home"), ".ssh", "id_rsa");
      return Files.isReadable(defaultKey) ? defaultKey : null;
   }

   private void addKeyIdentity(ClientSession clientSession, Path identity) throws IOException, GeneralSecurityException, ConnectionException {
      URLResource resource = new URLResource(identity.toUri().toURL());
      try (InputStream inputStream = resource.openInputStream()) {
         KeyPair keyPair = GenericUtils.head(SecurityUtils.loadKeyPairIdentities(
               clientSession,
               resource,
               inputStream,
               (s, resourceKey, retryIndex) -> null
         ));
         if (keyPair == null) {
            throw new ConnectionException(config.identity(), "No key found in " + identity, null);
         }
         clientSession.addPublicKeyIdentity(keyPair);
      }
   }

   private void abort(SshClient client, ClientSession clientSession) {
      if (clientSession != null) {
         try {
            clientSession.close();
         } catch (IOException e) {
            log.error("Failed closing SSH session to {}", config.identity(), e);
         }
      }
      client.stop();
   }

   @Override
   public boolean isConnected() {
      return connected;
   }

   @Override
   public CommandResult execute(RemoteCommand command, long timeoutMillis) {
      if (!connected) {
         throw new IllegalStateException("Not connected to " + config.identity());
      }
      String commandLine = ShellCommandRenderer.render(command);
      if (!session.isOpen()) {
         log.error("{}: cannot run '{}', session was closed", config.host, commandLine);
         return CommandResult.failed("Session to " + config.identity() + " was closed");
      }
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      ByteArrayOutputStream err = new ByteArrayOutputStream();
      try (ChannelExec channel = session.createExecChannel(commandLine)) {
         channel.setOut(out);
         channel.setErr(err);
         channel.open().verify(timeoutMillis);
         Set<ClientChannelEvent> events = channel.waitFor(EnumSet.of(ClientChannelEvent.CLOSED), timeoutMillis);
         if (events.contains(ClientChannelEvent.TIMEOUT)) {
            log.error("{}: '{}' timed out after {} ms", config.host, commandLine, timeoutMillis);
            return new CommandResult(decode(out), "Timed out after " + timeoutMillis + " ms", CommandResult.FAILED_EXIT_CODE);
         }
         Integer exitStatus = channel.getExitStatus();
         if (exitStatus == null) {
            log.error("{}: '{}' finished without exit status", config.host, commandLine);
            return new CommandResult(decode(out), "No exit status received", CommandResult.FAILED_EXIT_CODE);
         }
         CommandResult result = new CommandResult(decode(out), decode(err), exitStatus);
         if (result.isSuccess()) {
            log.info("{}: '{}' succeeded", config.host, commandLine);
         } else {
            log.error("{}: '{}' exited with {}: {}", config.host, commandLine, exitStatus, result.stderr.trim());
         }
         return result;
      } catch (IOException | IllegalStateException e) {
         // SSHD throws IllegalStateException when the session is closing under the channel
         log.error("{}: command execution failed: '{}'", config.host, commandLine, e);
         return CommandResult.failed(String.valueOf(e.getMessage()));
      }
   }

   private static String decode(ByteArrayOutputStream stream) {
      // malformed input is replaced, not rejected
      return new String(stream.toByteArray(), StandardCharsets.UTF_8);
   }

   @Override
   public void close() {
      connected = false;
      if (session != null) {
         try {
            session.close();
         } catch (IOException e) {
            log.error("Failed closing SSH session to {}", config.identity(), e);
         }
         session = null;
      }
      if (client != null) {
         client.stop();
         client = null;
         log.info("Disconnected from {}", config.identity());
      }
   }

   @MetaInfServices(RemoteSession.Factory.class)
   public static class Factory implements RemoteSession.Factory {
      @Override
      public String name() {
         return "ssh";
      }

      @Override
      public SshRemoteSession create(ConnectionConfig config) {
         return new SshRemoteSession(config);
      }
   }
}
