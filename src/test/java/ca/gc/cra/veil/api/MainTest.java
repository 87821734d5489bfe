package ca.gc.cra.veil.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.veil.infrastructure.image.ImageIoCodecAdapter;
import ca.gc.cra.veil.testutil.TestImages;
import java.io.PrintWriter;
import java.io.StringWriter;
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
  void noArgumentsIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: veil"));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"help"}));
    assertTrue(buffer.toString().contains("capacity    Report how much a carrier image can hold"));
  }

  @Test
  void unknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"assemble", "in=x"}));
  }

  @Test
  void delegatesToSubcommandWithRemainingArguments() throws Exception {
    Path carrier = tempDir.resolve("c.png");
    new ImageIoCodecAdapter().write(TestImages.filled(16, 16, 0), carrier);

    ExitCode code = Main.run(new String[] {"--json", "CAPACITY", "in=" + carrier, "type=text"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("\"text\""));
  }

  @Test
  void subcommandHelpIsForwarded() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"extract", "--help"}));
    assertTrue(buffer.toString().contains("extract"));
  }
}
