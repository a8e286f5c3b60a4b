package com.codeheadsystems.gplot.dropwizard.tasks;

import java.util.List;
import java.util.Map;

final class TaskParameters {

  private TaskParameters() {
  }

  static String value(Map<String, List<String>> parameters, String name) {
    List<String> values = parameters.get(name);
    if (values == null || values.size() != 1 || values.get(0).isBlank()) {
      return null;
    }
    return values.get(0).trim();
  }

  /**
   * The parameter as an int, or null when absent. Unparseable values are reported as -1 so
   * callers print their usage line.
   */
  static Integer intValue(Map<String, List<String>> parameters, String name) {
    String value = value(parameters, name);
    if (value == null) {
      return null;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      return -1;
    }
  }
}
