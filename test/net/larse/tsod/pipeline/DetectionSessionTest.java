package net.larse.tsod.pipeline;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import net.larse.tsod.algorithms.AdaptiveVarianceDetector;
import net.larse.tsod.algorithms.DetectionResult;
import net.larse.tsod.algorithms.DetectorSpec;
import net.larse.tsod.algorithms.DiffDetector;
import net.larse.tsod.errors.DetectionException;
import net.larse.tsod.errors.DetectionException.Stage;
import net.larse.tsod.errors.InsufficientDataException;
import net.larse.tsod.models.ModelSpec;
import net.larse.tsod.timeseries.TimeSeries;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DetectionSessionTest {
  private static final DetectorSpec ADAPTIVE =
      DetectorSpec.adaptiveVariance(new AdaptiveVarianceDetector.Args());

  @Test
  public void testAdaptiveRun() throws Exception {
    DetectionSession session = new DetectionSession(
        TimeSeries.of("x", TableFixtures.shifted(200)), ModelSpec.ar(2), ADAPTIVE);
    assertEquals(DetectionSession.State.CONFIGURED, session.getState());

    DetectionResult result = session.run();
    assertEquals(DetectionSession.State.DONE, session.getState());
    assertEquals(200, result.size());
    assertNotNull(session.getFittedModel());
    assertNull(session.getFailure());
  }

  @Test
  public void testDiffFitsNoModel() throws Exception {
    DetectionSession session = new DetectionSession(
        TimeSeries.of("x", TableFixtures.spiky(100)), null,
        DetectorSpec.diff(new DiffDetector.Args()));
    session.run();
    assertEquals(DetectionSession.State.DONE, session.getState());
    assertNull(session.getFittedModel());
  }

  @Test
  public void testFittingFailure() {
    DetectionSession session =
        new DetectionSession(TimeSeries.of("x", 1, 2, 4), ModelSpec.ar(2), ADAPTIVE);
    try {
      session.run();
      fail();
    } catch (DetectionException e) {
      assertEquals(InsufficientDataException.class, e.getClass());
      assertEquals(Stage.FITTING, e.getStage());
      assertEquals(DetectionSession.State.FAILED, session.getState());
      assertSame(e, session.getFailure());
    }
  }

  @Test(expected = IllegalStateException.class)
  public void testRunsOnce() throws Exception {
    DetectionSession session = new DetectionSession(
        TimeSeries.of("x", TableFixtures.spiky(50)), null,
        DetectorSpec.diff(new DiffDetector.Args()));
    session.run();
    session.run();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingValuesRejected() {
    new DetectionSession(TimeSeries.of("x", 1, Double.NaN, 3), ModelSpec.ar(1), ADAPTIVE);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testAdaptiveNeedsModel() {
    new DetectionSession(TimeSeries.of("x", TableFixtures.spiky(50)), null, ADAPTIVE);
  }
}
