package net.larse.tsod.pipeline;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import net.larse.tsod.algorithms.DetectorType;
import net.larse.tsod.models.ModelType;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ConfigGeneratorTest {
  @Rule public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testDefaultEntries() throws Exception {
    DetectionConfig config =
        new ConfigGenerator().generate(ImmutableList.of("date_time", "b", "a"));
    assertEquals(ImmutableList.of("b", "a"), ImmutableList.copyOf(config.keys()));

    ColumnConfig entry = config.get("a");
    assertEquals(ModelType.AR, entry.toModelSpec("a").getType());
    assertEquals(2, entry.toModelSpec("a").getArOrder());
    assertEquals(DetectorType.DIFF, entry.toDetectorSpec("a").getType());
    assertEquals(12.0, entry.toDetectorSpec("a").getDiffArgs().lambdaCentrada, 0);
    assertEquals(0.0, entry.toDetectorSpec("a").getDiffArgs().k, 0);
  }

  @Test
  public void testPresets() throws Exception {
    ColumnConfig preset = new ColumnConfig();
    preset.tsModel = "MA";
    DetectionConfig config = new ConfigGenerator(ImmutableMap.of("a", preset))
        .generate(ImmutableList.of("a", "b"));
    assertEquals("MA", config.get("a").getTsModel());
    assertEquals("AR", config.get("b").getTsModel());
  }

  @Test
  public void testRefusesToOverwrite() throws Exception {
    CsvTable table = CsvTable.parse("date_time,x\n2024-01-01,1\n");
    Path output = folder.getRoot().toPath().resolve("config.json");
    Files.write(output, "{}".getBytes(StandardCharsets.UTF_8));

    try {
      new ConfigGenerator().generate(table, output, false);
      fail();
    } catch (FileAlreadyExistsException e) {
      assertEquals("{}", new String(Files.readAllBytes(output), StandardCharsets.UTF_8));
    }

    new ConfigGenerator().generate(table, output, true);
    DetectionConfig written = DetectionConfig.load(output);
    assertEquals(1, written.size());
    assertTrue(written.findKey("x").isPresent());
  }
}
