package com.leakmonitor.backend.scan.osint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import org.junit.jupiter.api.Test;

class IntelligenceModuleRegistryTest {

  @Test
  void findsModulesByKey() {
    IntelligenceModule dns = named("dns");
    IntelligenceModuleRegistry registry = new IntelligenceModuleRegistry(List.of(dns, named("whois")));

    assertThat(registry.find("dns")).containsSame(dns);
    assertThat(registry.find("nope")).isEmpty();
    assertThat(registry.modules()).hasSize(2);
  }

  @Test
  void rejectsDuplicateKeys() {
    List<IntelligenceModule> modules = List.of(named("dns"), named("dns"));

    assertThatThrownBy(() -> new IntelligenceModuleRegistry(modules))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("dns");
  }

  private static IntelligenceModule named(String key) {
    IntelligenceModule module = mock(IntelligenceModule.class);
    when(module.key()).thenReturn(key);
    return module;
  }
}
