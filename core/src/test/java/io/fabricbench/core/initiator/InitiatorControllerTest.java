package io.fabricbench.core.initiator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.fabricbench.api.config.InitiatorConfig;
import io.fabricbench.api.config.TargetConfig;
import io.fabricbench.api.session.CommandResult;
import io.fabricbench.api.session.RemoteCommand;
import io.fabricbench.api.session.RemoteSession;
import io.fabricbench.core.TestConfigs;
import io.fabricbench.core.benchmark.BenchmarkResult;
import io.fabricbench.core.benchmark.BenchmarkSpec;
import io.fabricbench.core.session.FakeRemoteSession;

public class InitiatorControllerTest {
   private static final String DISCOVERY_LOG = "Discovery Log Number of Records 1, Generation counter 2\n"
         + "=====Discovery Log Entry 0======\n"
         + "trtype:  tcp\n"
         + "adrfam:  ipv4\n"
         + "trsvcid: 4420\n"
         + "subnqn:  nqn.test:unit1\n"
         + "traddr:  192.168.1.49\n";

   private final TargetConfig target = TestConfigs.target();
   private final InitiatorConfig initiator = TestConfigs.initiator();

   private InitiatorController controller(FakeRemoteSession session) {
      return new InitiatorController(initiator, target, session, 0);
   }

   @Test
   public void testDiscoverFindsSubsystem() throws Exception {
      FakeRemoteSession session = new FakeRemoteSession(initiator.connection)
            .when(RemoteCommand.Kind.FABRIC_DISCOVER, CommandResult.ok(DISCOVERY_LOG));

      assertTrue(controller(session).discover());
      assertEquals(List.of(RemoteCommand.fabricDiscover("tcp", "192.168.1.49", 4420)), session.executed());
   }

   @Test
   public void testDiscoverRequiresSubsystemInOutput() throws Exception {
      FakeRemoteSession session = new FakeRemoteSession(initiator.connection)
            .when(RemoteCommand.Kind.FABRIC_DISCOVER, CommandResult.ok(DISCOVERY_LOG.replace("nqn.test:unit1", "nqn.test:other")));

      assertFalse(controller(session).discover());
   }

   @Test
   public void testDiscoverFailsOnCommandFailure() throws Exception {
      FakeRemoteSession session = new FakeRemoteSession(initiator.connection)
            .when(RemoteCommand.Kind.FABRIC_DISCOVER, new CommandResult(DISCOVERY_LOG, "Failed to write to /dev/nvme-fabrics", 1));

      assertFalse(controller(session).discover());
   }

   @Test
   public void testConnectFindsDevice() throws Exception {
      FakeRemoteSession session = new FakeRemoteSession(initiator.connection)
            .when(RemoteCommand.listDevices(), CommandResult.ok(TestConfigs.NVME_LIST_OUTPUT));
      InitiatorController controller = controller(session);
      session.connect();

      assertTrue(controller.connect());
      assertEquals("nvme0", controller.device());
      assertEquals(List.of(RemoteCommand.fabricConnect("tcp", "nqn.test:unit1", "192.168.1.49", 4420), RemoteCommand.listDevices()),
            session.executed());
   }

   @Test
   public void testConnectTakesFirstFabricDevice() throws Exception {
      FakeRemoteSession session = new FakeRemoteSession(initiator.connection)
            .when(RemoteCommand.listDevices(), CommandResult.ok("/dev/nvme0n1   local pcie\n/dev/nvme1n1   tcp  traddr=a\n/dev/nvme2n1   tcp  traddr=b\n"));
      InitiatorController controller = controller(session);
      session.connect();

      assertTrue(controller.connect());
      assertEquals("/dev/nvme1n1", controller.device());
   }

   @Test
   public void testConnectWithoutDeviceFails() throws Exception {
      FakeRemoteSession session = new FakeRemoteSession(initiator.connection)
            .when(RemoteCommand.listDevices(), CommandResult.ok("Node  SN  Model\n/dev/nvme0n1  S4EVNF0M  Samsung pcie\n"));
      InitiatorController controller = controller(session);
      session.connect();

      assertFalse(controller.connect());
      assertNull(controller.device());
   }

   @Test
   public void testFailedConnectSkipsEnumeration() throws Exception {
      FakeRemoteSession session = new FakeRemoteSession(initiator.connection)
            .when(RemoteCommand.Kind.FABRIC_CONNECT, new CommandResult("", "could not add new controller", 1));
      InitiatorController controller = controller(session);
      session.connect();

      assertFalse(controller.connect());
      assertTrue(session.executed(RemoteCommand.Kind.LIST_DEVICES).isEmpty());
   }

   @Test
   public void testBenchmarkRequiresDevice() throws Exception {
      FakeRemoteSession session = new FakeRemoteSession(initiator.connection);
      session.connect();

      assertThrows(IllegalStateException.class, () -> controller(session).runBenchmark(BenchmarkSpec.DEFAULT_BATTERY.get(0)));
      assertTrue(session.executed().isEmpty());
   }

   @Test
   public void testBenchmarkParsesOutput() throws Exception {
      FakeRemoteSession session = connected(CommandResult.ok(TestConfigs.resource("fio-randrw.json")));
      InitiatorController controller = controller(session);
      assertTrue(controller.connect());

      BenchmarkResult result = controller.runBenchmark(BenchmarkSpec.DEFAULT_BATTERY.get(3));

      assertFalse(result.isEmpty());
      assertEquals("randrw", result.name);
      assertEquals(1, result.jobs().size());
      RemoteCommand fio = session.executed(RemoteCommand.Kind.BENCHMARK).get(0);
      assertEquals(List.of("--name=randrw", "--filename=nvme0", "--rw=randrw", "--bs=4k", "--direct=1",
            "--output-format=json", "--runtime=60", "--rwmixread=70"), fio.arguments());
      assertEquals(120_000L, (long) session.timeouts().get(session.timeouts().size() - 1));
   }

   @Test
   public void testBenchmarkWithoutRuntimeUsesDefaultTimeout() throws Exception {
      FakeRemoteSession session = connected(CommandResult.ok(TestConfigs.resource("fio-read.json")));
      InitiatorController controller = controller(session);
      assertTrue(controller.connect());

      controller.runBenchmark(BenchmarkSpec.DEFAULT_BATTERY.get(0));

      assertEquals(RemoteSession.DEFAULT_TIMEOUT, (long) session.timeouts().get(session.timeouts().size() - 1));
   }

   @Test
   public void testMalformedOutputGivesEmptyResult() throws Exception {
      FakeRemoteSession session = connected(CommandResult.ok("fio: pid=1234, err=5/file:io_u.c:1889, func=io_u error"));
      InitiatorController controller = controller(session);
      assertTrue(controller.connect());

      BenchmarkResult result = controller.runBenchmark(BenchmarkSpec.DEFAULT_BATTERY.get(1));

      assertTrue(result.isEmpty());
      assertEquals("rand_read", result.name);
   }

   @Test
   public void testFailedBenchmarkGivesEmptyResult() throws Exception {
      FakeRemoteSession session = connected(CommandResult.failed("Timed out after 120000 ms"));
      InitiatorController controller = controller(session);
      assertTrue(controller.connect());

      assertTrue(controller.runBenchmark(BenchmarkSpec.DEFAULT_BATTERY.get(2)).isEmpty());
   }

   @Test
   public void testDisconnectClosesSessionOnFailure() throws Exception {
      FakeRemoteSession session = new FakeRemoteSession(initiator.connection)
            .when(RemoteCommand.Kind.FABRIC_DISCONNECT, new CommandResult("", "no controllers found", 1));
      session.connect();
      InitiatorController controller = controller(session);

      controller.disconnect();

      assertEquals(List.of(RemoteCommand.fabricDisconnect("nqn.test:unit1")), session.executed());
      assertFalse(session.isConnected());
   }

   private FakeRemoteSession connected(CommandResult benchmarkResult) throws Exception {
      FakeRemoteSession session = new FakeRemoteSession(initiator.connection)
            .when(RemoteCommand.listDevices(), CommandResult.ok(TestConfigs.NVME_LIST_OUTPUT))
            .when(RemoteCommand.Kind.BENCHMARK, benchmarkResult);
      session.connect();
      return session;
   }
}
