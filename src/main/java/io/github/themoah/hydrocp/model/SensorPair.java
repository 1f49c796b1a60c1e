package io.github.themoah.hydrocp.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Unordered pair of distinct pressure sensors.
 *
 * <p>Pairs are canonicalized so that {@code x} sorts lexicographically before {@code y};
 * {@code (a, b)} and {@code (b, a)} therefore produce the same pair. The x-sensor is the
 * predictor and the y-sensor the response of the pair's linear model.
 *
 * @param x predictor sensor id (lexicographically smaller)
 * @param y response sensor id (lexicographically larger)
 */
public record SensorPair(String x, String y) implements Comparable<SensorPair> {

  public static final String KEY_SEPARATOR = "_";

  private static final Comparator<SensorPair> ORDER =
    Comparator.comparing(SensorPair::x).thenComparing(SensorPair::y);

  public SensorPair {
    Objects.requireNonNull(x, "x");
    Objects.requireNonNull(y, "y");
    if (x.compareTo(y) >= 0) {
      throw new IllegalArgumentException(
        "Sensor pair must be canonical (x < y) and distinct: " + x + ", " + y);
    }
  }

  /**
   * Creates the canonical pair for two distinct sensors, in either order.
   */
  public static SensorPair of(String a, String b) {
    if (a.equals(b)) {
      throw new IllegalArgumentException("Sensor pair requires two distinct sensors: " + a);
    }
    return a.compareTo(b) < 0 ? new SensorPair(a, b) : new SensorPair(b, a);
  }

  /**
   * Enumerates all C(n,2) pairs of the given sensors in natural pair order.
   * Duplicate sensor ids are collapsed.
   */
  public static List<SensorPair> enumerate(Collection<String> sensors) {
    List<String> sorted = new ArrayList<>(new TreeSet<>(sensors));
    List<SensorPair> pairs = new ArrayList<>(sorted.size() * Math.max(0, sorted.size() - 1) / 2);
    for (int i = 0; i < sorted.size(); i++) {
      for (int j = i + 1; j < sorted.size(); j++) {
        pairs.add(new SensorPair(sorted.get(i), sorted.get(j)));
      }
    }
    return pairs;
  }

  /**
   * Presentation key used by exported artifacts: {@code "{x}_{y}"}.
   */
  public String key() {
    return x + KEY_SEPARATOR + y;
  }

  /**
   * Parses a presentation key back into a pair.
   *
   * <p>Sensor ids may themselves contain the separator, so every split position is tried and
   * exactly one must yield two known sensors.
   *
   * @param key the {@code "{x}_{y}"} key
   * @param sensors the known sensor ids
   * @return the matching pair
   * @throws IllegalArgumentException if no split or more than one split matches
   */
  public static SensorPair fromKey(String key, Set<String> sensors) {
    List<SensorPair> matches = matchKey(key, sensors);
    if (matches.isEmpty()) {
      throw new IllegalArgumentException("Unknown pair key: " + key);
    }
    if (matches.size() > 1) {
      throw new IllegalArgumentException("Ambiguous pair key: " + key + " matches " + matches);
    }
    return matches.get(0);
  }

  /**
   * Every pair of known sensors that {@code key} splits into, in split-position order.
   */
  public static List<SensorPair> matchKey(String key, Set<String> sensors) {
    List<SensorPair> matches = new ArrayList<>(1);
    int idx = key.indexOf(KEY_SEPARATOR);
    while (idx >= 0) {
      String left = key.substring(0, idx);
      String right = key.substring(idx + KEY_SEPARATOR.length());
      if (!left.equals(right) && sensors.contains(left) && sensors.contains(right)) {
        matches.add(SensorPair.of(left, right));
      }
      idx = key.indexOf(KEY_SEPARATOR, idx + 1);
    }
    return matches;
  }

  @Override
  public int compareTo(SensorPair other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return "(" + x + ", " + y + ")";
  }
}
