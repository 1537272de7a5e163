package io.fabricbench.cli;

import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.aesh.command.AeshCommandRuntimeBuilder;
import org.aesh.command.CommandNotFoundException;
import org.aesh.command.CommandResult;
import org.aesh.command.CommandRuntime;
import org.aesh.command.impl.registry.AeshCommandRegistryBuilder;
import org.aesh.command.invocation.CommandInvocation;

import io.fabricbench.internal.Properties;

public class FabricbenchCli {

   public static void main(String[] args) {
      System.exit(new FabricbenchCli().exec(args));
   }

   public int exec(String[] args) {
      CommandRuntime<CommandInvocation> cr = null;
      CommandResult result = null;
      try {
         AeshCommandRuntimeBuilder<CommandInvocation> runtime = AeshCommandRuntimeBuilder.builder();
         @SuppressWarnings("unchecked")
         AeshCommandRegistryBuilder<CommandInvocation> registry = AeshCommandRegistryBuilder
               .<CommandInvocation> builder()
               .commands(NvmeofTestCommand.class);
         runtime.commandRegistry(registry.create());
         cr = runtime.build();
         // Passwords could contain a whitespace so we have to escape it.
         String optionsCollected = Stream.of(args).map(arg -> arg.replaceAll(" ", "\\\\ ")).collect(Collectors.joining(" "));
         result = cr.executeCommand(NvmeofTestCommand.NAME + " " + optionsCollected);
      } catch (Exception e) {
         System.out.println("Failed to execute command: " + e.getMessage());
         if (Properties.getBoolean(Properties.FABRICBENCH_STACKTRACE)) {
            e.printStackTrace();
         }
         if (cr != null) {
            try {
               System.out.println(cr.getCommandRegistry().getCommand(NvmeofTestCommand.NAME, NvmeofTestCommand.NAME)
                     .printHelp(NvmeofTestCommand.NAME));
            } catch (CommandNotFoundException ex) {
               throw new IllegalStateException(ex);
            }
         }
      }
      return result == null ? CommandResult.FAILURE.getResultValue() : result.getResultValue();
   }
}
