package com.leakmonitor.backend.scan.osint;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

final class KeywordHeuristics {

  private static final Pattern DOMAIN =
      Pattern.compile("^(?:[a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?\\.)+[a-z]{2,}$");
  private static final Pattern COMPANY = Pattern.compile("^[\\p{L}][\\p{L}0-9 &.-]{2,}$");

  private KeywordHeuristics() {}

  static boolean isDomain(String keyword) {
    return keyword != null && DOMAIN.matcher(keyword.trim().toLowerCase(Locale.ROOT)).matches();
  }

  static boolean isCompanyName(String keyword) {
    return keyword != null
        && !keyword.contains("@")
        && !isDomain(keyword)
        && COMPANY.matcher(keyword.trim()).matches();
  }

  static List<String> domains(List<String> keywords) {
    return keywords.stream().filter(KeywordHeuristics::isDomain).map(String::trim).toList();
  }

  static List<String> companies(List<String> keywords) {
    return keywords.stream().filter(KeywordHeuristics::isCompanyName).map(String::trim).toList();
  }

  static int intConfig(Map<String, String> config, String key, int fallback) {
    String value = config.get(key);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      return fallback;
    }
  }
}
