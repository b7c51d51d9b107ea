package net.larse.tsod.pipeline;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import net.larse.tsod.timeseries.TimeSeries;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ThresholdAnalysisTest {
  @Rule public TemporaryFolder folder = new TemporaryFolder();

  private final ThresholdAnalysis analysis = new ThresholdAnalysis();

  private static double[] noise(int n) {
    Random random = new Random(3);
    double[] v = new double[n];
    for (int t = 0; t < n; t++) {
      v[t] = 10 + random.nextGaussian() + (t % 50 == 25 ? 8 : 0);
    }
    return v;
  }

  @Test
  public void testDiffRecommendsFirstSettingInBand() {
    ThresholdAnalysis.ColumnAnalysis result =
        analysis.analyzeDiff(TimeSeries.of("spiky", TableFixtures.spiky(200)));

    assertEquals(ThresholdAnalysis.IN_TARGET_BAND, result.getNote());
    assertEquals(ThresholdAnalysis.DIFF_LAMBDA_GRID.length * ThresholdAnalysis.DIFF_K_GRID.length,
        result.getGrid().size());
    ThresholdAnalysis.GridPoint best = result.getRecommendation();
    assertEquals(5.0, best.getLambdaCentrada(), 0);
    assertEquals(2.0, best.getK(), 0);
    assertEquals(0.025, best.getOutlierRatio(), 1e-12);
    assertNull(best.getAlpha());
  }

  @Test
  public void testAdaptiveGrid() {
    ThresholdAnalysis.ColumnAnalysis result =
        analysis.analyzeAdaptive(TimeSeries.of("noise", noise(200)));

    assertTrue(result.getNote(), result.getNote().equals(ThresholdAnalysis.IN_TARGET_BAND)
        || result.getNote().equals(ThresholdAnalysis.CLOSEST_TO_TARGET));
    assertEquals(20, result.getGrid().size());
    ThresholdAnalysis.GridPoint best = result.getRecommendation();
    assertNotNull(best.getAlpha());
    assertNotNull(best.getChangeRatio());
    assertNull(best.getLambdaCentrada());
  }

  @Test
  public void testTooFewPoints() {
    double[] shortSeries = TableFixtures.spiky(29);
    assertEquals(ThresholdAnalysis.TOO_FEW_POINTS,
        analysis.analyzeDiff(TimeSeries.of("x", shortSeries)).getNote());
    assertEquals(ThresholdAnalysis.TOO_FEW_POINTS,
        analysis.analyzeAdaptive(TimeSeries.of("x", noise(79))).getNote());

    double[] gappy = noise(100);
    for (int t = 0; t < 30; t++) {
      gappy[t] = Double.NaN;
    }
    ThresholdAnalysis.ColumnAnalysis result = analysis.analyzeAdaptive(TimeSeries.of("x", gappy));
    assertEquals(ThresholdAnalysis.TOO_FEW_POINTS, result.getNote());
    assertNull(result.getRecommendation());
  }

  @Test
  public void testRunAndWrite() throws Exception {
    Map<String, double[]> columns = new LinkedHashMap<>();
    columns.put("spiky", TableFixtures.spiky(200));
    columns.put("noise", noise(200));
    columns.put("short", TableFixtures.spiky(200));
    CsvTable table = TableFixtures.table(columns, true);
    DetectionConfig config = DetectionConfig.parse(
        "{\"spiky\": {\"outlier_detector\": \"diff\"}, \"noise\": {}, \"other\": {}}");

    List<ThresholdAnalysis.ColumnAnalysis> analyses = analysis.run(table, config, null);
    assertEquals(2, analyses.size());
    assertEquals("diff", analyses.get(0).detector);
    assertEquals("adaptive_variance", analyses.get(1).detector);

    Path out = folder.getRoot().toPath().resolve("analysis");
    analysis.write(out, "report", analyses);
    List<String> summary =
        Files.readAllLines(out.resolve("report_summary.csv"), StandardCharsets.UTF_8);
    assertEquals(3, summary.size());
    assertTrue(summary.get(1).startsWith("spiky,diff,in_target_band,5.0,2.0,,,"));

    String json = new String(Files.readAllBytes(out.resolve("report_details.json")),
        StandardCharsets.UTF_8);
    JsonObject report = JsonParser.parseString(json).getAsJsonObject();
    assertEquals(2, report.getAsJsonArray("target_band").size());
    assertTrue(report.getAsJsonObject("details").has("noise"));
  }

  @Test
  public void testRequestedColumns() throws Exception {
    Map<String, double[]> columns = new LinkedHashMap<>();
    columns.put("spiky", TableFixtures.spiky(200));
    CsvTable table = TableFixtures.table(columns, false);
    DetectionConfig config = DetectionConfig.parse("{\"spiky\": {\"outlier_detector\": \"diff\"}}");

    List<ThresholdAnalysis.ColumnAnalysis> analyses =
        analysis.run(table, config, ImmutableList.of("spiky", "absent"));
    assertEquals(1, analyses.size());
    assertEquals("spiky", analyses.get(0).getColumn());
  }

  @Test
  public void testNullEntryGetsTheAdaptiveGrid() throws Exception {
    Map<String, double[]> columns = new LinkedHashMap<>();
    columns.put("noise", noise(200));
    CsvTable table = TableFixtures.table(columns, false);
    DetectionConfig config = DetectionConfig.parse("{\"noise\": null}");

    List<ThresholdAnalysis.ColumnAnalysis> analyses = analysis.run(table, config, null);
    assertEquals(1, analyses.size());
    assertEquals("adaptive_variance", analyses.get(0).detector);
  }
}
