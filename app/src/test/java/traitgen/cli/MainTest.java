package traitgen.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class MainTest {
  @TempDir Path dir;

  @Test
  void usageAndHelp() {
    assertEquals(GenerateCommand.EXIT_REJECTED, Main.run(new String[0]));
    assertEquals(0, Main.run(new String[] {"--help"}));
  }

  @Test
  void badArgumentsAreRejected() {
    assertEquals(GenerateCommand.EXIT_REJECTED, Main.run(new String[] {"--count", "3"}));
    assertEquals(
        GenerateCommand.EXIT_REJECTED,
        Main.run(
            new String[] {
              "--catalog", dir.resolve("missing.json").toString(),
              "--out", dir.resolve("out").toString(),
              "--count", "1"
            }));
  }
}
