package com.cyberx.vpnpool.api.repository;

import com.cyberx.vpnpool.api.entity.AppSetting;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AppSettingRepository extends JpaRepository<AppSetting, String> {

    List<AppSetting> findByKeyIn(List<String> keys);
}
