package com.leakmonitor.backend.scan.domain;

public enum KeywordCategory {
  GENERAL,
  DOMAIN,
  COMPANY,
  EMAIL,
  CUSTOM
}
