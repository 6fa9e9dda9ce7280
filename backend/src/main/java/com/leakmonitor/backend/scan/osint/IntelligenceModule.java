package com.leakmonitor.backend.scan.osint;

import java.util.List;
import java.util.Map;

/**
 * Pluggable reconnaissance step that may widen the keyword set before code search. Each module is
 * enabled and configured independently through its module setting.
 */
public interface IntelligenceModule {

  String key();

  String displayName();

  String description();

  default Map<String, String> defaultConfig() {
    return Map.of();
  }

  /**
   * @param keywords the current keyword set, OSINT additions from earlier modules included
   * @param config the operator configuration stored for this module
   */
  IntelligenceResult run(List<String> keywords, Map<String, String> config);
}
