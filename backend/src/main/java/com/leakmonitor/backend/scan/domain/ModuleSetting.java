package com.leakmonitor.backend.scan.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.HashMap;
import java.util.Map;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** Operator-controlled switch and configuration for one intelligence module. */
@Entity
@Table(name = "module_settings")
public class ModuleSetting {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "module_key", nullable = false, unique = true, length = 64)
  private String moduleKey;

  @Column(name = "display_name", nullable = false, length = 128)
  private String displayName;

  @Column(name = "description", columnDefinition = "text")
  private String description;

  @Column(name = "enabled", nullable = false)
  private boolean enabled;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "config", nullable = false, columnDefinition = "jsonb")
  private Map<String, String> config = new HashMap<>();

  protected ModuleSetting() {}

  public ModuleSetting(String moduleKey, String displayName, String description) {
    this.moduleKey = moduleKey;
    this.displayName = displayName;
    this.description = description;
  }

  public Long getId() {
    return id;
  }

  public String getModuleKey() {
    return moduleKey;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getDescription() {
    return description;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Map<String, String> getConfig() {
    return config == null ? Map.of() : Map.copyOf(config);
  }

  public void setConfig(Map<String, String> config) {
    this.config = config == null ? new HashMap<>() : new HashMap<>(config);
  }
}
