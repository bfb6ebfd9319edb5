package ca.gc.cra.framescope.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter out;

  @BeforeEach
  void captureOutput() {
    out = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(out, true));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpWithoutCommandSucceeds() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(out.toString().contains("FrameScope command dispatcher"));
  }

  @Test
  void missingOrUnknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
    assertTrue(out.toString().contains("usage: framescope"));
  }

  @Test
  void replayCommandReceivesRemainingArguments() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"replay", "--help"}));
    assertTrue(out.toString().contains("FrameScope replay"));

    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"replay", "workers=1"}));
  }
}
