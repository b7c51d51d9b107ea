package net.larse.tsod.pipeline;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class MainTest {
  @Rule public TemporaryFolder folder = new TemporaryFolder();

  private Path input;
  private Path config;
  private Path output;

  @Before
  public void setUp() throws Exception {
    Map<String, double[]> columns = new LinkedHashMap<>();
    columns.put("spiky", TableFixtures.spiky(200));
    columns.put("shifted", TableFixtures.shifted(200));
    input = folder.getRoot().toPath().resolve("data.csv");
    Files.write(input, TableFixtures.csv(columns, true).getBytes(StandardCharsets.UTF_8));
    config = folder.getRoot().toPath().resolve("config.json");
    output = folder.getRoot().toPath().resolve("out");
  }

  @Test
  public void testGenerateThenDetect() throws Exception {
    assertEquals(Main.EXIT_OK,
        Main.run(new String[] {"generate-config", input.toString(), "-o", config.toString()}));
    assertEquals(2, DetectionConfig.load(config).size());

    assertEquals(Main.EXIT_OK, Main.run(new String[] {"detect", input.toString(), "--config",
        config.toString(), "--output-dir", output.toString(), "--all", "--fill", "interpolate",
        "--threads", "2"}));
    List<String> lines =
        Files.readAllLines(output.resolve("spiky_labeled.csv"), StandardCharsets.UTF_8);
    assertEquals(201, lines.size());
    assertEquals("date_time,index,value,corrected_value,label", lines.get(0));
    assertTrue(Files.exists(output.resolve("shifted_labeled.csv")));
  }

  @Test
  public void testDetectSelectedColumns() throws Exception {
    Files.write(config, ("{\"shifted\": {\"ts_model\": \"AR\"}, \"spiky\": {}}")
        .getBytes(StandardCharsets.UTF_8));
    assertEquals(Main.EXIT_OK, Main.run(new String[] {"detect", input.toString(), "--config",
        config.toString(), "--output-dir", output.toString(), "--columns", "shifted, missing"}));
    assertTrue(Files.exists(output.resolve("shifted_labeled.csv")));
    assertFalse(Files.exists(output.resolve("spiky_labeled.csv")));
    assertEquals("date_time,index,value,residual,outlier_score,change_score,label",
        Files.readAllLines(output.resolve("shifted_labeled.csv"), StandardCharsets.UTF_8)
            .get(0));
  }

  @Test
  public void testDetectWithNothingProcessed() throws Exception {
    Files.write(config, "{\"other\": {}}".getBytes(StandardCharsets.UTF_8));
    assertEquals(Main.EXIT_FAILURE, Main.run(new String[] {"detect", input.toString(),
        "--config", config.toString(), "--output-dir", output.toString()}));
  }

  @Test
  public void testGenerateConfigRefusesToOverwrite() throws Exception {
    String[] args = {"generate-config", input.toString(), "--output", config.toString()};
    assertEquals(Main.EXIT_OK, Main.run(args));
    assertEquals(Main.EXIT_FAILURE, Main.run(args));
    assertEquals(Main.EXIT_OK, Main.run(new String[] {"generate-config", input.toString(),
        "--output", config.toString(), "--overwrite"}));
  }

  @Test
  public void testAnalyzeThresholds() throws Exception {
    Main.run(new String[] {"generate-config", input.toString(), "-o", config.toString()});
    Path analysis = folder.getRoot().toPath().resolve("analysis");
    assertEquals(Main.EXIT_OK, Main.run(new String[] {"analyze-thresholds", input.toString(),
        "--config", config.toString(), "--output-dir", analysis.toString(), "--output-prefix",
        "run1"}));
    assertTrue(Files.exists(analysis.resolve("run1_summary.csv")));
    assertTrue(Files.exists(analysis.resolve("run1_details.json")));
  }

  @Test
  public void testEditConfig() throws Exception {
    Main.run(new String[] {"generate-config", input.toString(), "-o", config.toString()});
    Path edited = folder.getRoot().toPath().resolve("edited.json");

    assertEquals(Main.EXIT_OK, Main.run(new String[] {"edit-config", config.toString(),
        "--set", "spiky", "outlier_params.lambda_centrada", "5",
        "--set", "shifted", "outlier_detector", "adaptive_variance",
        "--bulk-set", "ts_params.q", "3", "spiky,shifted",
        "--save-as", edited.toString(), "--backup"}));

    DetectionConfig result = DetectionConfig.load(edited);
    assertEquals("adaptive_variance", result.get("shifted").getOutlierDetector());
    assertEquals(3, result.get("spiky").toModelSpec("spiky").getArOrder());
    assertEquals("diff", DetectionConfig.load(config).get("shifted").getOutlierDetector());
    assertTrue(Files.exists(folder.getRoot().toPath().resolve("config.bak.json")));

    assertEquals(Main.EXIT_FAILURE, Main.run(new String[] {"edit-config", config.toString(),
        "--set", "spiky", "ts_params.unknown", "1", "--save-as", edited.toString()}));
    assertEquals(Main.EXIT_FAILURE, Main.run(new String[] {"edit-config", config.toString(),
        "--copy", "spiky", "shifted", "--save-as", config.toString()}));
  }

  @Test
  public void testUsageListsDetectorParameters() {
    String usage = Main.usage();
    assertTrue(usage, usage.contains("edit-config"));
    assertTrue(usage, usage.contains("lambda_centrada = 0.0"));
    assertTrue(usage, usage.contains("factor_olvido = 0.02"));
    assertTrue(usage, usage.contains("change_quantile = 0.99"));
  }

  @Test
  public void testBadInvocations() {
    assertEquals(Main.EXIT_FAILURE, Main.run(new String[0]));
    assertEquals(Main.EXIT_FAILURE, Main.run(new String[] {"cluster", input.toString()}));
    assertEquals(Main.EXIT_FAILURE, Main.run(new String[] {"detect", input.toString()}));
    assertEquals(Main.EXIT_FAILURE, Main.run(new String[] {"detect", "--config",
        config.toString()}));
    assertEquals(Main.EXIT_FAILURE, Main.run(new String[] {"detect", input.toString(),
        "--config", config.toString(), "--fill", "median"}));
    assertEquals(Main.EXIT_OK, Main.run(new String[] {"help"}));
  }
}
