package integration.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class MainTest {
  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

  private int execute(String... args) {
    PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    return Main.execute(args, out);
  }

  private String output() {
    return buffer.toString(StandardCharsets.UTF_8);
  }

  @Test
  void exitCodeFollowsTheOutcome() {
    assertEquals(CliParsers.EXIT_CLOSED, execute("run", "--expr", "1/(x^2+1)"));
    assertEquals(CliParsers.EXIT_PARTIAL, execute("run", "--expr", "exp(x^2)"));
    assertEquals(CliParsers.EXIT_FAILED, execute("run", "--expr", "sqrt(x)"));
  }

  @Test
  void runIsTheDefaultCommand() {
    assertEquals(CliParsers.EXIT_CLOSED, execute("--expr", "1/x", "--check"));
    String output = output();
    assertTrue(output.contains("log(x)"), output);
    assertTrue(output.contains("check: verified"), output);
  }

  @Test
  void strictModeReportsUnsupportedConstructs() {
    assertEquals(CliParsers.EXIT_FAILED, execute("run", "--expr", "sqrt(x)", "--strict"));
    assertTrue(output().contains("unsupported_construct"), output());
  }

  @Test
  void usageErrors() {
    assertEquals(CliParsers.EXIT_USAGE, execute());
    assertEquals(CliParsers.EXIT_USAGE, execute("run", "--bogus"));
    assertEquals(CliParsers.EXIT_USAGE, execute("run", "--var", "x"));
    assertEquals(CliParsers.EXIT_USAGE, execute("run", "--expr", "foo(x)"));
    assertEquals(CliParsers.EXIT_USAGE, execute("run", "--expr", "x", "--trig", "sideways"));
  }

  @Test
  void jsonReport() {
    assertEquals(CliParsers.EXIT_PARTIAL, execute("run", "--expr", "x+exp(x^2)", "--json"));
    JsonObject report = JsonParser.parseString(output()).getAsJsonObject();
    assertEquals("partial", report.get("outcome").getAsString());
    assertEquals("x", report.get("variable").getAsString());
    assertTrue(report.has("residual"));
    assertTrue(report.getAsJsonObject("meta").has("field"));
  }

  @Test
  void batchReturnsTheWorstExitCode(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("integrands.txt");
    Files.writeString(file, "# warm-up\n1/x\n\nexp(x^2)\n", StandardCharsets.UTF_8);
    assertEquals(CliParsers.EXIT_PARTIAL, execute("batch", "--file", file.toString()));
    assertTrue(output().contains("1/x => log(x)"), output());
  }

  @Test
  void batchSkipsCommentsAndBlankLines() {
    assertEquals(
        List.of("1/x", "exp(x)"), BatchCommand.integrands("# header\n 1/x \r\n\n#exp\nexp(x)\n"));
  }

  @Test
  void missingBatchFile(@TempDir Path dir) {
    assertEquals(
        CliParsers.EXIT_USAGE,
        execute("batch", "--file", dir.resolve("missing.txt").toString()));
  }
}
