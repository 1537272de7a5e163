package io.fabricbench.api.session;

/**
 * Outcome of a single remote execution. Failures of the execution itself (dropped channel, timeout)
 * are represented with {@link #FAILED_EXIT_CODE} and the error message in {@link #stderr}.
 */
public class CommandResult {
   public static final int FAILED_EXIT_CODE = -1;

   public final String stdout;
   public final String stderr;
   public final int exitCode;

   public CommandResult(String stdout, String stderr, int exitCode) {
      this.stdout = stdout == null ? "" : stdout;
      this.stderr = stderr == null ? "" : stderr;
      this.exitCode = exitCode;
   }

   public static CommandResult ok(String stdout) {
      return new CommandResult(stdout, "", 0);
   }

   public static CommandResult failed(String error) {
      return new CommandResult("", error, FAILED_EXIT_CODE);
   }

   public boolean isSuccess() {
      return exitCode == 0;
   }

   @Override
   public String toString() {
      return "CommandResult{exitCode=" + exitCode + ", stdout=" + stdout.length() + " chars, stderr='" + stderr.trim() + "'}";
   }
}
