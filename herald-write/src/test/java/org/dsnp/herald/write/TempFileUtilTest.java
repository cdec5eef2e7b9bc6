package org.dsnp.herald.write;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.base.Strings;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;

public class TempFileUtilTest {

  @Test
  public void spoolNames() {
    assertEquals("a.batch", TempFileUtil.spoolName("batches/2024/a.batch"));
    assertEquals("we_rd_name", TempFileUtil.spoolName("we?rd name"));
    assertEquals("object", TempFileUtil.spoolName("batches/"));
    assertEquals(32, TempFileUtil.spoolName("x" + Strings.repeat("y", 60)).length());
  }

  @Test
  public void spoolFilesLandInTheGivenDirectory() throws IOException {
    Path directory = Files.createTempDirectory("spool");
    try {
      Path spool = TempFileUtil.createSpoolFile(directory.resolve("nested"), "batches/a.batch");
      assertEquals(directory.resolve("nested"), spool.getParent());
      assertTrue(spool.getFileName().toString().startsWith("herald-a.batch-"));
      TempFileUtil.deleteQuietly(spool);
      assertTrue(Files.notExists(spool));
    } finally {
      MoreFiles.deleteRecursively(directory, RecursiveDeleteOption.ALLOW_INSECURE);
    }
  }

  @Test
  public void defaultsToTheJvmTempDirectory() {
    assertEquals(Paths.get(System.getProperty("java.io.tmpdir")), TempFileUtil.defaultSpoolDirectory());
  }
}
