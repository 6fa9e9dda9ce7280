package com.leakmonitor.backend.scan.persistence;

import com.leakmonitor.backend.scan.domain.ModuleSetting;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ModuleSettingRepository extends JpaRepository<ModuleSetting, Long> {

  Optional<ModuleSetting> findByModuleKey(String moduleKey);

  List<ModuleSetting> findByEnabledTrueOrderByIdAsc();
}
