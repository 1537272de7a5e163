package io.fabricbench.core.session;

import java.util.regex.Pattern;
import java.util.stream.Collectors;

import io.fabricbench.api.session.RemoteCommand;

/**
 * Translates {@link RemoteCommand} requests into POSIX shell command lines. Every argument is quoted
 * unless it consists only of characters that the shell never interprets.
 */
public final class ShellCommandRenderer {
   static final String CONFIGFS = "/sys/kernel/config";
   private static final Pattern SAFE = Pattern.compile("[A-Za-z0-9_./:=,+@%-]+");

   private ShellCommandRenderer() {
   }

   public static String render(RemoteCommand command) {
      switch (command.kind()) {
         case LOAD_MODULE:
            return "modprobe " + quote(command.argument(0));
         case LIST_MODULES:
            return "lsmod";
         case MOUNT_CONFIGFS:
            return "mountpoint -q " + CONFIGFS + " || mount -t configfs none " + CONFIGFS;
         case MAKE_DIRECTORY:
            return "mkdir -p " + quote(command.argument(0));
         case WRITE_ATTRIBUTE:
            return "printf '%s\\n' " + quote(command.argument(1)) + " > " + quote(command.argument(0));
         case SYMLINK:
            return "ln -s " + quote(command.argument(0)) + " " + quote(command.argument(1));
         case UNLINK:
            return "unlink " + quote(command.argument(0));
         case REMOVE_DIRECTORY:
            return "rmdir " + quote(command.argument(0));
         case DIRECTORY_EXISTS:
            return "test -d " + quote(command.argument(0));
         case LINK_EXISTS:
            return "test -L " + quote(command.argument(0));
         case SERVICE_ACTIVE:
            return "systemctl is-active --quiet " + quote(command.argument(0));
         case FIREWALL_OPEN_PORT:
            return "firewall-cmd " + quote("--add-port=" + command.argument(0)) + " --permanent";
         case FIREWALL_RELOAD:
            return "firewall-cmd --reload";
         case FABRIC_DISCOVER:
            return "nvme discover -t " + quote(command.argument(0)) + " -a " + quote(command.argument(1))
                  + " -s " + quote(command.argument(2));
         case FABRIC_CONNECT:
            return "nvme connect -t " + quote(command.argument(0)) + " -n " + quote(command.argument(1))
                  + " -a " + quote(command.argument(2)) + " -s " + quote(command.argument(3));
         case FABRIC_DISCONNECT:
            return "nvme disconnect -n " + quote(command.argument(0));
         case LIST_DEVICES:
            return "nvme list";
         case BENCHMARK:
            return command.arguments().stream().map(ShellCommandRenderer::quote)
                  .collect(Collectors.joining(" ", "fio ", ""));
         default:
            throw new IllegalArgumentException("Unknown command kind " + command.kind());
      }
   }

   static String quote(String argument) {
      if (!argument.isEmpty() && SAFE.matcher(argument).matches()) {
         return argument;
      }
      return "'" + argument.replace("'", "'\\''") + "'";
   }
}
