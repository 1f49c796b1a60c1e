package io.github.themoah.hydrocp.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for SensorPair.
 */
public class SensorPairTest {

  @Test
  void of_canonicalizesOrder() {
    SensorPair forward = SensorPair.of("J1", "J2");
    SensorPair reverse = SensorPair.of("J2", "J1");

    assertEquals(forward, reverse);
    assertEquals("J1", reverse.x());
    assertEquals("J2", reverse.y());
  }

  @Test
  void of_sameSensor_rejected() {
    assertThrows(IllegalArgumentException.class, () -> SensorPair.of("J1", "J1"));
  }

  @Test
  void constructor_nonCanonical_rejected() {
    assertThrows(IllegalArgumentException.class, () -> new SensorPair("J2", "J1"));
  }

  @Test
  void enumerate_producesAllPairsOnce() {
    List<SensorPair> pairs = SensorPair.enumerate(List.of("c", "a", "d", "b"));

    assertEquals(6, pairs.size());
    assertEquals(6, new HashSet<>(pairs).size());
    assertEquals(SensorPair.of("a", "b"), pairs.get(0));
    assertEquals(SensorPair.of("c", "d"), pairs.get(5));
    assertEquals(new TreeSet<>(pairs).stream().toList(), pairs, "pairs come in natural order");
  }

  @Test
  void enumerate_fewerThanTwoSensors_empty() {
    assertTrue(SensorPair.enumerate(List.of()).isEmpty());
    assertTrue(SensorPair.enumerate(List.of("only")).isEmpty());
  }

  @Test
  void key_joinsWithUnderscore() {
    assertEquals("Node 1 Pressure_Node 2 Pressure",
      SensorPair.of("Node 2 Pressure", "Node 1 Pressure").key());
  }

  @Test
  void fromKey_separatorInsideSensorIds() {
    Set<String> sensors = Set.of("tank_a", "tank_b", "pump");

    assertEquals(SensorPair.of("tank_a", "tank_b"), SensorPair.fromKey("tank_a_tank_b", sensors));
    assertEquals(SensorPair.of("pump", "tank_a"), SensorPair.fromKey("pump_tank_a", sensors));
  }

  @Test
  void fromKey_unknownKey_rejected() {
    Set<String> sensors = Set.of("a", "b");

    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
      () -> SensorPair.fromKey("a_c", sensors));
    assertTrue(e.getMessage().startsWith("Unknown pair key"));
  }

  @Test
  void fromKey_ambiguousKey_rejected() {
    // "a_b_c" splits into (a, b_c) and (a_b, c)
    Set<String> sensors = Set.of("a", "b_c", "a_b", "c");

    assertEquals(2, SensorPair.matchKey("a_b_c", sensors).size());
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
      () -> SensorPair.fromKey("a_b_c", sensors));
    assertTrue(e.getMessage().startsWith("Ambiguous pair key"));
  }

  @Test
  void compareTo_ordersByXThenY() {
    assertTrue(SensorPair.of("a", "c").compareTo(SensorPair.of("b", "c")) < 0);
    assertTrue(SensorPair.of("a", "b").compareTo(SensorPair.of("a", "c")) < 0);
    assertEquals(0, SensorPair.of("a", "b").compareTo(SensorPair.of("b", "a")));
  }
}
