package ca.gc.cra.dart.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void requireReadableDirAcceptsExistingDirectory() {
    assertEquals(tempDir.toAbsolutePath().normalize(), Paths.requireReadableDir("logs", tempDir));
  }

  @Test
  void requireReadableDirRejectsMissingOrFile() throws IOException {
    Path file = Files.createFile(tempDir.resolve("client.log"));

    IllegalArgumentException missing = assertThrows(IllegalArgumentException.class,
        () -> Paths.requireReadableDir("logs", tempDir.resolve("absent")));
    assertTrue(missing.getMessage().startsWith("logs directory does not exist"));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableDir("logs", file));
  }

  @Test
  void validateOutputFileRefusesOverwriteByDefault() throws IOException {
    Path existing = Files.createFile(tempDir.resolve("report.txt"));

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Paths.validateOutputFile("report", existing, false, true));
    assertTrue(ex.getMessage().contains("--allow-overwrite"));
    assertEquals(existing, Paths.validateOutputFile("report", existing, true, true));
  }

  @Test
  void validateOutputFileCreatesParentsWhenRequested() {
    Path target = tempDir.resolve("out/nested/metrics.json");

    Paths.validateOutputFile("metricsOut", target, false, true);

    assertTrue(Files.isDirectory(target.getParent()));
  }

  @Test
  void validateOutputFileLeavesFilesystemAloneForDryRun() {
    Path target = tempDir.resolve("future/timeline.json");

    Path validated = Paths.validateOutputFile("timelineOut", target, false, false);

    assertEquals(target.toAbsolutePath().normalize(), validated);
    assertFalse(Files.exists(target.getParent()));
  }

  @Test
  void validateOutputFileRejectsDirectory() {
    assertThrows(IllegalArgumentException.class,
        () -> Paths.validateOutputFile("report", tempDir, true, true));
  }
}
