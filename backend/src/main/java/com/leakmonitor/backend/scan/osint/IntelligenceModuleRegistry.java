package com.leakmonitor.backend.scan.osint;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Modules keyed by {@link IntelligenceModule#key()}, fixed at startup. */
@Component
public class IntelligenceModuleRegistry {

  private final Map<String, IntelligenceModule> modules;

  public IntelligenceModuleRegistry(List<IntelligenceModule> modules) {
    Map<String, IntelligenceModule> byKey = new LinkedHashMap<>();
    for (IntelligenceModule module : modules) {
      IntelligenceModule previous = byKey.putIfAbsent(module.key(), module);
      if (previous != null) {
        throw new IllegalStateException("Duplicate intelligence module key: " + module.key());
      }
    }
    this.modules = Map.copyOf(byKey);
  }

  public Optional<IntelligenceModule> find(String key) {
    return Optional.ofNullable(modules.get(key));
  }

  public Collection<IntelligenceModule> modules() {
    return modules.values();
  }
}
