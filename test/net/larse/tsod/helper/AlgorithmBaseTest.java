package net.larse.tsod.helper;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AlgorithmBaseTest {
  public static class SampleArgs extends AlgorithmBase.ArgsBase {
    @Doc(help = "How many.")
    @Optional
    public int sampleCount = 3;

    public String note = "undocumented";
  }

  @Test
  public void testDescribeUsesConfigurationKeys() {
    List<String> lines = new SampleArgs().describe();
    assertEquals(1, lines.size());
    assertEquals("sample_count = 3: How many.", lines.get(0));
  }

  @Test
  public void testToStringListsEveryField() {
    SampleArgs args = new SampleArgs();
    args.sampleCount = 5;
    String text = args.toString();
    assertTrue(text, text.contains("sampleCount=5"));
    assertTrue(text, text.contains("note=undocumented"));
  }
}
