package com.exemplar.regex.service.data_processing;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.springframework.stereotype.Service;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import lombok.extern.slf4j.Slf4j;

/** Reads example strings from uploaded text or CSV files. */
@Slf4j
@Service
public class ExampleFileParsingService {

  /**
   * Reads one example per line. A trailing carriage return is removed from each line and an empty
   * last line is ignored; other empty lines are kept as empty examples.
   */
  public List<String> parseLines(InputStream stream) throws IOException {
    String content = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
    List<String> examples = new ArrayList<>();
    for (String line : content.split("\n", -1)) {
      examples.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
    }
    if (!examples.isEmpty() && examples.get(examples.size() - 1).isEmpty()) {
      examples.remove(examples.size() - 1);
    }
    log.debug("Read {} examples from text file", examples.size());
    return examples;
  }

  /**
   * Reads one column of a CSV file. The first row is the header.
   *
   * @param column header of the column to read, or {@code null} for the first column
   */
  public List<String> parseCsvColumn(InputStream stream, String column) throws IOException {
    List<String> examples = new ArrayList<>();
    try (CSVReader reader =
        new CSVReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      String[] headers = reader.readNext();
      if (headers == null || headers.length == 0) {
        throw new IllegalArgumentException("CSV file has no headers");
      }

      int index = column == null ? 0 : Arrays.asList(headers).indexOf(column);
      if (index < 0) {
        throw new IllegalArgumentException(
            "Column '" + column + "' not found. Available columns: " + Arrays.toString(headers));
      }

      String[] row;
      while ((row = reader.readNext()) != null) {
        if (row.length <= index) {
          log.debug("Skipping row with {} cells, column index is {}", row.length, index);
          continue;
        }
        examples.add(row[index]);
      }
    } catch (CsvValidationException e) {
      throw new IllegalArgumentException("Malformed CSV file: " + e.getMessage(), e);
    }
    log.debug("Read {} examples from CSV column {}", examples.size(), columnLabel(column));
    return examples;
  }

  private static String columnLabel(String column) {
    return column == null ? "#0" : "'" + column + "'";
  }
}
