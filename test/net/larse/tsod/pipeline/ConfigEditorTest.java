package net.larse.tsod.pipeline;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ConfigEditorTest {
  @Rule public TemporaryFolder folder = new TemporaryFolder();

  private ConfigEditor editor;

  @Before
  public void setUp() throws Exception {
    String generated = new ConfigGenerator()
        .generate(ImmutableList.of("date_time", "flow", "level", "pressure")).toJson();
    editor = ConfigEditor.parse(generated);
  }

  @Test
  public void testListAndShow() {
    assertEquals(ImmutableList.of("flow", "level", "pressure"), editor.list());
    JsonObject shown = JsonParser.parseString(editor.show("level")).getAsJsonObject();
    assertEquals("diff", shown.get("outlier_detector").getAsString());
  }

  @Test
  public void testSetKeepsNumberKinds() throws Exception {
    editor.set("flow", "ts_params.q", "3");
    editor.set("flow", "outlier_params.lambda_centrada", "5");
    editor.set("flow", "outlier_detector", "adaptive_variance");

    ColumnConfig flow = editor.toConfig().get("flow");
    assertEquals(3, flow.toModelSpec("flow").getArOrder());
    assertEquals("adaptive_variance", flow.getOutlierDetector());
    JsonObject shown = JsonParser.parseString(editor.show("flow")).getAsJsonObject();
    assertEquals("3", shown.getAsJsonObject("ts_params").get("q").getAsString());
    assertEquals("5.0",
        shown.getAsJsonObject("outlier_params").get("lambda_centrada").getAsString());
  }

  @Test
  public void testSetRejectsUnknownPathsAndBadNumbers() {
    for (String[] edit : new String[][] {
        {"flow", "ts_params.order", "3"},
        {"flow", "model_params.q", "3"},
        {"missing", "ts_params.q", "3"},
        {"flow", "ts_params.q", "2.5"},
        {"flow", "ts_params.alpha", "small"}}) {
      try {
        editor.set(edit[0], edit[1], edit[2]);
        fail("accepted " + String.join(" ", edit));
      } catch (IllegalArgumentException expected) {
        assertTrue(expected.getMessage(), expected.getMessage().contains(edit[0]));
      }
    }
  }

  @Test
  public void testBulkSetSkipsAbsentColumns() throws Exception {
    int updated =
        editor.bulkSet("ts_params.alpha", "0.05", ImmutableList.of("flow", "absent", "pressure"));
    assertEquals(2, updated);
    JsonObject pressure = JsonParser.parseString(editor.show("pressure")).getAsJsonObject();
    assertEquals(0.05, pressure.getAsJsonObject("ts_params").get("alpha").getAsDouble(), 0);
    JsonObject level = JsonParser.parseString(editor.show("level")).getAsJsonObject();
    assertEquals(0.005, level.getAsJsonObject("ts_params").get("alpha").getAsDouble(), 0);
  }

  @Test
  public void testCopyIsIndependent() {
    editor.set("flow", "ts_params.suavizado", "9");
    editor.copy("flow", "level");
    editor.set("flow", "ts_params.suavizado", "3");

    JsonObject level = JsonParser.parseString(editor.show("level")).getAsJsonObject();
    assertEquals(9, level.getAsJsonObject("ts_params").get("suavizado").getAsInt());
  }

  @Test
  public void testInvalidValueIsNotSaved() throws Exception {
    editor.set("flow", "outlier_detector", "adaptive_variance");
    editor.set("flow", "ts_params.alpha", "1.5");
    Path output = folder.getRoot().toPath().resolve("edited.json");
    try {
      editor.save(output, null, false);
      fail();
    } catch (IllegalArgumentException expected) {
      assertTrue(expected.getMessage(), expected.getMessage().contains("flow"));
    }
    assertFalse(Files.exists(output));
  }

  @Test
  public void testSaveWithBackup() throws Exception {
    Path original = folder.getRoot().toPath().resolve("config.json");
    Files.write(original, "{\"flow\": {\"ts_model\": \"AR\", \"note\": \"kept\"}}"
        .getBytes(StandardCharsets.UTF_8));
    ConfigEditor loaded = ConfigEditor.load(original);
    loaded.set("flow", "ts_model", "MA");

    Path output = folder.getRoot().toPath().resolve("edited.json");
    loaded.save(output, original, true);

    assertEquals("MA", DetectionConfig.load(output).get("flow").getTsModel());
    JsonObject saved = JsonParser.parseString(
        new String(Files.readAllBytes(output), StandardCharsets.UTF_8)).getAsJsonObject();
    assertEquals("kept", saved.getAsJsonObject("flow").get("note").getAsString());
    Path backup = folder.getRoot().toPath().resolve("config.bak.json");
    assertEquals("AR", DetectionConfig.load(backup).get("flow").getTsModel());
    assertEquals("AR", DetectionConfig.load(original).get("flow").getTsModel());
  }
}
