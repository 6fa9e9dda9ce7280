package com.leakmonitor.backend.scan.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "app_settings")
public class AppSetting {

  public static final String FINDING_PROMPT = "finding_prompt";

  @Id
  @Column(name = "setting_key", nullable = false, length = 128)
  private String key;

  @Column(name = "setting_value", columnDefinition = "text")
  private String value;

  protected AppSetting() {}

  public AppSetting(String key, String value) {
    this.key = key;
    this.value = value;
  }

  public String getKey() {
    return key;
  }

  public String getValue() {
    return value;
  }

  public void setValue(String value) {
    this.value = value;
  }
}
