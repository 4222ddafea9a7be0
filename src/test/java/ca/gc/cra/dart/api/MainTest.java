package ca.gc.cra.dart.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void noCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: dart <analyze>"));
  }

  @Test
  void globalHelpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("analyze"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture", "iface=en0"}));
  }

  @Test
  void dispatchesToAnalyze() throws Exception {
    Path logs = Files.createDirectory(tempDir.resolve("logs"));

    ExitCode code = Main.run(new String[] {"ANALYZE", "logs=" + logs});

    assertEquals(ExitCode.NO_INPUT, code);
  }

  @Test
  void commandHelpIsDelegated() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"analyze", "--help"}));
    assertTrue(buffer.toString().startsWith("DART analyze"));
  }
}
