package com.leakmonitor.backend.scan.persistence;

import com.leakmonitor.backend.scan.domain.AppSetting;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AppSettingRepository extends JpaRepository<AppSetting, String> {}
