package com.leakmonitor.backend.scan.osint;

import com.leakmonitor.backend.scan.domain.ModuleSetting;
import com.leakmonitor.backend.scan.persistence.ModuleSettingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Creates a disabled setting row for every registered module that has none yet. */
@Component
public class ModuleSettingSeeder {

  private static final Logger log = LoggerFactory.getLogger(ModuleSettingSeeder.class);

  private final IntelligenceModuleRegistry registry;
  private final ModuleSettingRepository repository;

  public ModuleSettingSeeder(IntelligenceModuleRegistry registry, ModuleSettingRepository repository) {
    this.registry = registry;
    this.repository = repository;
  }

  @EventListener(ApplicationReadyEvent.class)
  @Transactional
  public void seed() {
    int created = 0;
    for (IntelligenceModule module : registry.modules()) {
      if (repository.findByModuleKey(module.key()).isPresent()) {
        continue;
      }
      ModuleSetting setting =
          new ModuleSetting(module.key(), module.displayName(), module.description());
      setting.setConfig(module.defaultConfig());
      repository.save(setting);
      created++;
    }
    if (created > 0) {
      log.info("Seeded {} intelligence module settings", created);
    }
  }
}
