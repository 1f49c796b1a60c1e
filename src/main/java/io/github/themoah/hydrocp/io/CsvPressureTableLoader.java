package io.github.themoah.hydrocp.io;

import io.github.themoah.hydrocp.error.InsufficientDataException;
import io.github.themoah.hydrocp.error.InvalidDataException;
import io.github.themoah.hydrocp.model.PressureTable;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads pressure readings from hydraulic simulation output (EPANET-style CSV).
 *
 * <p>The header must contain a {@code Time} column holding seconds. Every column whose
 * header contains {@code Pressure} becomes a sensor, in file order; flow, demand and head
 * columns are ignored.
 */
public class CsvPressureTableLoader {

  private static final Logger log = LoggerFactory.getLogger(CsvPressureTableLoader.class);

  static final String TIME_COLUMN = "Time";
  static final String PRESSURE_MARKER = "Pressure";
  private static final String DELIMITER = ",";

  private final TimeUnit timeUnit;

  public CsvPressureTableLoader(TimeUnit timeUnit) {
    this.timeUnit = timeUnit;
  }

  /**
   * Unit the time column is converted to.
   */
  public enum TimeUnit {
    HOURS("hours", 3600.0),
    MINUTES("minutes", 60.0),
    SECONDS("seconds", 1.0);

    private final String value;
    private final double secondsPerUnit;

    TimeUnit(String value, double secondsPerUnit) {
      this.value = value;
      this.secondsPerUnit = secondsPerUnit;
    }

    public String getValue() {
      return value;
    }

    public double secondsPerUnit() {
      return secondsPerUnit;
    }

    /**
     * Resolves a unit by name, case-insensitively.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static TimeUnit fromValue(String value) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (TimeUnit unit : values()) {
        if (unit.value.equals(normalized)) {
          return unit;
        }
      }
      throw new IllegalArgumentException("Unknown time unit: " + value);
    }
  }

  /**
   * Loads a table from a file.
   *
   * @throws IOException if the file cannot be read
   * @throws InvalidDataException if the content is malformed or has missing readings
   * @throws InsufficientDataException if the file has no data rows
   */
  public PressureTable load(Path path) throws IOException {
    log.info("Loading pressure readings from {}", path);
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      PressureTable table = load(reader);
      log.info("Loaded {} sensors x {} readings from {} (mean time step {} {})",
        table.sensors().size(), table.length(), path.getFileName(),
        String.format("%.4f", table.meanTimeStep()), timeUnit.getValue());
      return table;
    }
  }

  /**
   * Loads a table from CSV content.
   */
  public PressureTable load(Reader source) throws IOException {
    BufferedReader reader = source instanceof BufferedReader buffered
      ? buffered
      : new BufferedReader(source);

    String headerLine = reader.readLine();
    if (headerLine == null || headerLine.isBlank()) {
      throw new InvalidDataException("CSV input has no header");
    }
    String[] header = splitLine(headerLine);

    int timeColumn = -1;
    List<Integer> pressureColumns = new ArrayList<>();
    for (int i = 0; i < header.length; i++) {
      if (header[i].equals(TIME_COLUMN)) {
        timeColumn = i;
      } else if (header[i].contains(PRESSURE_MARKER)) {
        pressureColumns.add(i);
      }
    }
    if (timeColumn < 0) {
      throw new InvalidDataException("CSV header has no '" + TIME_COLUMN + "' column");
    }
    if (pressureColumns.size() < 2) {
      log.warn("Only {} pressure columns found, no sensor pairs can be formed", pressureColumns.size());
    }

    List<Double> times = new ArrayList<>();
    List<double[]> rows = new ArrayList<>();
    String line;
    int lineNumber = 1;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      if (line.isBlank()) {
        continue;
      }
      String[] cells = splitLine(line);
      if (cells.length != header.length) {
        throw new InvalidDataException(String.format(
          "Line %d has %d cells, header has %d", lineNumber, cells.length, header.length));
      }

      times.add(parseCell(cells[timeColumn], TIME_COLUMN, lineNumber) / timeUnit.secondsPerUnit());
      double[] row = new double[pressureColumns.size()];
      for (int c = 0; c < pressureColumns.size(); c++) {
        int column = pressureColumns.get(c);
        row[c] = parseCell(cells[column], header[column], lineNumber);
      }
      rows.add(row);
    }

    if (rows.isEmpty()) {
      throw new InsufficientDataException("CSV input has a header but no data rows");
    }

    double[] timeIndex = times.stream().mapToDouble(Double::doubleValue).toArray();
    Map<String, double[]> series = new LinkedHashMap<>();
    for (int c = 0; c < pressureColumns.size(); c++) {
      double[] values = new double[rows.size()];
      for (int r = 0; r < rows.size(); r++) {
        values[r] = rows.get(r)[c];
      }
      String sensor = header[pressureColumns.get(c)];
      if (series.put(sensor, values) != null) {
        throw new InvalidDataException("Duplicate sensor column: " + sensor);
      }
    }

    try {
      return PressureTable.of(timeIndex, series);
    } catch (IllegalArgumentException e) {
      throw new InvalidDataException(e.getMessage());
    }
  }

  public TimeUnit timeUnit() {
    return timeUnit;
  }

  private static String[] splitLine(String line) {
    String[] cells = line.split(DELIMITER, -1);
    for (int i = 0; i < cells.length; i++) {
      String cell = cells[i].trim();
      if (cell.length() >= 2 && cell.startsWith("\"") && cell.endsWith("\"")) {
        cell = cell.substring(1, cell.length() - 1);
      }
      cells[i] = cell;
    }
    return cells;
  }

  private static double parseCell(String cell, String column, int lineNumber) {
    if (cell.isEmpty()) {
      throw new InvalidDataException(String.format(
        "Missing value in column %s at line %d", column, lineNumber));
    }
    double value;
    try {
      value = Double.parseDouble(cell);
    } catch (NumberFormatException e) {
      throw new InvalidDataException(String.format(
        "Non-numeric value '%s' in column %s at line %d", cell, column, lineNumber));
    }
    if (!Double.isFinite(value)) {
      throw new InvalidDataException(String.format(
        "Missing value '%s' in column %s at line %d", cell, column, lineNumber));
    }
    return value;
  }
}
