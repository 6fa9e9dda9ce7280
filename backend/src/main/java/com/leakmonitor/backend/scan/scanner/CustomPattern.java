package com.leakmonitor.backend.scan.scanner;

import com.leakmonitor.backend.scan.domain.FindingSeverity;
import java.util.regex.Pattern;

public record CustomPattern(String name, Pattern regex, FindingSeverity severity) {

  /** Case-insensitive literal match for an operator-defined keyword. */
  public static CustomPattern forKeyword(String term) {
    return new CustomPattern(
        "Custom: " + term,
        Pattern.compile(Pattern.quote(term), Pattern.CASE_INSENSITIVE),
        FindingSeverity.MEDIUM);
  }
}
