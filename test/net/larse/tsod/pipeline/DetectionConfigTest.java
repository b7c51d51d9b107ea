package net.larse.tsod.pipeline;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.nio.file.Path;
import net.larse.tsod.algorithms.DetectorSpec;
import net.larse.tsod.algorithms.DetectorType;
import net.larse.tsod.errors.ConfigMismatchException;
import net.larse.tsod.errors.DetectionException.Stage;
import net.larse.tsod.models.ModelSpec;
import net.larse.tsod.models.ModelType;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DetectionConfigTest {
  @Rule public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testMissingKeysTakeDefaults() throws Exception {
    DetectionConfig config = DetectionConfig.parse("{\"a\": {}}");
    ColumnConfig entry = config.get("a");
    assertEquals("MA", entry.getTsModel());
    assertEquals("adaptive_variance", entry.getOutlierDetector());

    ModelSpec model = entry.toModelSpec("a");
    assertEquals(ModelType.MA, model.getType());
    assertEquals(2, model.getMaOrder());
    assertEquals(ModelSpec.DEFAULT_MAX_ITERATIONS, model.getMaxIterations());

    DetectorSpec detector = entry.toDetectorSpec("a");
    assertEquals(DetectorType.ADAPTIVE_VARIANCE, detector.getType());
    assertEquals(0.005, detector.getAdaptiveArgs().alpha, 0);
  }

  @Test
  public void testParams() throws Exception {
    DetectionConfig config = DetectionConfig.parse("{\"a\": {\"ts_model\": \"ARMA\", "
        + "\"ts_params\": {\"p\": 2, \"q\": 1, \"alpha\": 0.01, \"lag_cambio\": 3, "
        + "\"max_iterations\": 50}, \"outlier_detector\": \"diff\", "
        + "\"outlier_params\": {\"lambda_centrada\": null, \"k\": 3}}}");
    ColumnConfig entry = config.get("a");

    ModelSpec model = entry.toModelSpec("a");
    assertEquals(ModelType.ARMA, model.getType());
    assertEquals(2, model.getArOrder());
    assertEquals(1, model.getMaOrder());
    assertEquals(50, model.getMaxIterations());

    DetectorSpec detector = entry.toDetectorSpec("a");
    assertEquals(DetectorType.DIFF, detector.getType());
    assertEquals(0.0, detector.getDiffArgs().lambdaCentrada, 0);
    assertEquals(3.0, detector.getDiffArgs().k, 0);
  }

  @Test
  public void testUnknownModel() throws Exception {
    ColumnConfig entry = DetectionConfig.parse("{\"a\": {\"ts_model\": \"GARCH\"}}").get("a");
    try {
      entry.toModelSpec("a");
      fail();
    } catch (ConfigMismatchException e) {
      assertEquals("a", e.getColumn());
      assertEquals(Stage.CONFIGURATION, e.getStage());
    }
  }

  @Test(expected = ConfigMismatchException.class)
  public void testUnknownDetector() throws Exception {
    DetectionConfig.parse("{\"a\": {\"outlier_detector\": \"lof\"}}").get("a")
        .toDetectorSpec("a");
  }

  @Test(expected = ConfigMismatchException.class)
  public void testInvalidParams() throws Exception {
    DetectionConfig.parse("{\"a\": {\"ts_params\": {\"quantile\": 1.5}}}").get("a")
        .toDetectorSpec("a");
  }

  @Test(expected = IOException.class)
  public void testMalformed() throws Exception {
    DetectionConfig.parse("{\"a\": [1, 2");
  }

  @Test
  public void testSaveAndLoad() throws Exception {
    DetectionConfig config = DetectionConfig.parse("{\"b\": {\"ts_model\": \"AR\"}, "
        + "\"a\": {\"outlier_detector\": \"diff\", \"outlier_params\": {\"k\": 2.0}}}");
    Path path = folder.getRoot().toPath().resolve("config.json");
    config.save(path);

    DetectionConfig loaded = DetectionConfig.load(path);
    assertEquals(config.toJson(), loaded.toJson());
    assertEquals("b", loaded.keys().iterator().next());
    assertTrue(loaded.findKey("a").isPresent());
  }
}
