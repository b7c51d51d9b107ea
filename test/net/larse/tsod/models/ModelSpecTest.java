package net.larse.tsod.models;

import static org.junit.Assert.assertEquals;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ModelSpecTest {
  @Test
  public void testOrders() {
    assertEquals(3, ModelSpec.ar(3).getArOrder());
    assertEquals(0, ModelSpec.ar(3).getMaOrder());
    assertEquals(0, ModelSpec.ma(2).getArOrder());
    assertEquals(2, ModelSpec.ma(2).getOrder());
    ModelSpec arma = ModelSpec.arma(1, 3);
    assertEquals(1, arma.getArOrder());
    assertEquals(3, arma.getMaOrder());
    assertEquals(3, arma.getOrder());
  }

  @Test
  public void testFromName() {
    assertEquals(ModelType.ARMA, ModelType.fromName("arma"));
    assertEquals(ModelType.AR, ModelSpec.of(ModelType.AR, 5, 2).getType());
    assertEquals(50, ModelSpec.ma(1).withMaxIterations(50).getMaxIterations());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownModel() {
    ModelType.fromName("GARCH");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroOrder() {
    ModelSpec.ar(0);
  }
}
