package io.fabricbench.api.session;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Typed request for a remote operation. Values are kept apart from the operation until a session
 * renders the request for its transport, so configuration values never become part of the command syntax.
 */
public final class RemoteCommand {
   private final Kind kind;
   private final List<String> arguments;

   private RemoteCommand(Kind kind, String... arguments) {
      this.kind = kind;
      for (String argument : arguments) {
         Objects.requireNonNull(argument, () -> "Null argument for " + kind);
      }
      if (kind.arity >= 0 && arguments.length != kind.arity) {
         throw new IllegalArgumentException(kind + " expects " + kind.arity + " arguments, got " + arguments.length);
      }
      this.arguments = Collections.unmodifiableList(Arrays.asList(arguments));
   }

   public static RemoteCommand loadModule(String module) {
      return new RemoteCommand(Kind.LOAD_MODULE, module);
   }

   public static RemoteCommand listModules() {
      return new RemoteCommand(Kind.LIST_MODULES);
   }

   public static RemoteCommand mountConfigfs() {
      return new RemoteCommand(Kind.MOUNT_CONFIGFS);
   }

   public static RemoteCommand makeDirectory(String path) {
      return new RemoteCommand(Kind.MAKE_DIRECTORY, path);
   }

   public static RemoteCommand writeAttribute(String path, String value) {
      return new RemoteCommand(Kind.WRITE_ATTRIBUTE, path, value);
   }

   public static RemoteCommand symlink(String target, String link) {
      return new RemoteCommand(Kind.SYMLINK, target, link);
   }

   public static RemoteCommand unlink(String link) {
      return new RemoteCommand(Kind.UNLINK, link);
   }

   public static RemoteCommand removeDirectory(String path) {
      return new RemoteCommand(Kind.REMOVE_DIRECTORY, path);
   }

   public static RemoteCommand directoryExists(String path) {
      return new RemoteCommand(Kind.DIRECTORY_EXISTS, path);
   }

   public static RemoteCommand linkExists(String path) {
      return new RemoteCommand(Kind.LINK_EXISTS, path);
   }

   public static RemoteCommand serviceActive(String service) {
      return new RemoteCommand(Kind.SERVICE_ACTIVE, service);
   }

   public static RemoteCommand firewallOpenPort(int port, String protocol) {
      return new RemoteCommand(Kind.FIREWALL_OPEN_PORT, port + "/" + protocol);
   }

   public static RemoteCommand firewallReload() {
      return new RemoteCommand(Kind.FIREWALL_RELOAD);
   }

   public static RemoteCommand fabricDiscover(String transport, String address, int servicePort) {
      return new RemoteCommand(Kind.FABRIC_DISCOVER, transport, address, String.valueOf(servicePort));
   }

   public static RemoteCommand fabricConnect(String transport, String nqn, String address, int servicePort) {
      return new RemoteCommand(Kind.FABRIC_CONNECT, transport, nqn, address, String.valueOf(servicePort));
   }

   public static RemoteCommand fabricDisconnect(String nqn) {
      return new RemoteCommand(Kind.FABRIC_DISCONNECT, nqn);
   }

   public static RemoteCommand listDevices() {
      return new RemoteCommand(Kind.LIST_DEVICES);
   }

   /**
    * @param options Complete option tokens, e.g. <code>--rw=randread</code>.
    */
   public static RemoteCommand benchmark(List<String> options) {
      return new RemoteCommand(Kind.BENCHMARK, options.toArray(new String[0]));
   }

   public Kind kind() {
      return kind;
   }

   public List<String> arguments() {
      return arguments;
   }

   public String argument(int index) {
      return arguments.get(index);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (o == null || getClass() != o.getClass()) {
         return false;
      }
      RemoteCommand that = (RemoteCommand) o;
      return kind == that.kind && arguments.equals(that.arguments);
   }

   @Override
   public int hashCode() {
      return Objects.hash(kind, arguments);
   }

   @Override
   public String toString() {
      return kind + arguments.toString();
   }

   public enum Kind {
      LOAD_MODULE(1),
      LIST_MODULES(0),
      MOUNT_CONFIGFS(0),
      MAKE_DIRECTORY(1),
      WRITE_ATTRIBUTE(2),
      SYMLINK(2),
      UNLINK(1),
      REMOVE_DIRECTORY(1),
      DIRECTORY_EXISTS(1),
      LINK_EXISTS(1),
      SERVICE_ACTIVE(1),
      FIREWALL_OPEN_PORT(1),
      FIREWALL_RELOAD(0),
      FABRIC_DISCOVER(3),
      FABRIC_CONNECT(4),
      FABRIC_DISCONNECT(1),
      LIST_DEVICES(0),
      // variable number of options
      BENCHMARK(-1);

      final int arity;

      Kind(int arity) {
         this.arity = arity;
      }
   }
}
