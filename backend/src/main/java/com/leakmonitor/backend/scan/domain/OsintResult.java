package com.leakmonitor.backend.scan.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "osint_results")
public class OsintResult {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "scan_id")
  private Scan scan;

  @Column(name = "module_key", nullable = false, length = 64)
  private String moduleKey;

  @Column(name = "result_type", nullable = false, length = 64)
  private String resultType;

  @Column(name = "value", nullable = false, columnDefinition = "text")
  private String value;

  @Column(name = "source", length = 255)
  private String source;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "metadata", nullable = false, columnDefinition = "jsonb")
  private Map<String, String> metadata = new HashMap<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected OsintResult() {}

  public OsintResult(
      Scan scan,
      String moduleKey,
      String resultType,
      String value,
      String source,
      Map<String, String> metadata) {
    this.scan = scan;
    this.moduleKey = moduleKey;
    this.resultType = resultType;
    this.value = value;
    this.source = source;
    this.metadata = metadata == null ? new HashMap<>() : new HashMap<>(metadata);
  }

  @PrePersist
  void onPersist() {
    createdAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public Scan getScan() {
    return scan;
  }

  public String getModuleKey() {
    return moduleKey;
  }

  public String getResultType() {
    return resultType;
  }

  public String getValue() {
    return value;
  }

  public String getSource() {
    return source;
  }

  public Map<String, String> getMetadata() {
    return metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
