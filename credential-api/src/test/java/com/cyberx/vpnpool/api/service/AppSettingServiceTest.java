package com.cyberx.vpnpool.api.service;

import com.cyberx.vpnpool.api.config.PoolPolicyProperties;
import com.cyberx.vpnpool.api.config.VpnServerProperties;
import com.cyberx.vpnpool.api.entity.AppSetting;
import com.cyberx.vpnpool.api.exception.BadRequestException;
import com.cyberx.vpnpool.api.repository.AppSettingRepository;
import com.cyberx.vpnpool.common.wireguard.ServerDefaults;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AppSettingServiceTest {

    @Mock
    private AppSettingRepository appSettingRepository;

    private VpnServerProperties serverProperties;
    private AppSettingService appSettingService;

    @BeforeEach
    void setUp() {
        serverProperties = new VpnServerProperties();
        serverProperties.setPublicKey("cHJvcGVydHkta2V5");
        appSettingService = new AppSettingService(appSettingRepository, serverProperties, new PoolPolicyProperties());
    }

    @Test
    void testGetNamingPattern_NothingStored_ReturnsDefault() {
        when(appSettingRepository.findById(AppSettingService.NAMING_PATTERN_KEY)).thenReturn(Optional.empty());

        assertEquals("simnet_{ipv4_address}.conf", appSettingService.getNamingPattern());
    }

    @Test
    void testGetNamingPattern_Stored_ReturnsStoredValue() {
        when(appSettingRepository.findById(AppSettingService.NAMING_PATTERN_KEY))
            .thenReturn(Optional.of(new AppSetting(AppSettingService.NAMING_PATTERN_KEY, "{username}_{index}", null)));

        assertEquals("{username}_{index}", appSettingService.getNamingPattern());
    }

    @Test
    void testSetNamingPattern_NewSetting_IsInserted() {
        when(appSettingRepository.findById(AppSettingService.NAMING_PATTERN_KEY)).thenReturn(Optional.empty());

        String stored = appSettingService.setNamingPattern("  vpn_{id}  ", "admin");

        assertEquals("vpn_{id}", stored);
        ArgumentCaptor<AppSetting> saved = ArgumentCaptor.forClass(AppSetting.class);
        verify(appSettingRepository).save(saved.capture());
        assertEquals("vpn_{id}", saved.getValue().getValue());
        assertEquals("admin", saved.getValue().getCreatedBy());
    }

    @Test
    void testSetNamingPattern_Blank_ThrowsBadRequest() {
        assertThrows(BadRequestException.class, () -> appSettingService.setNamingPattern("  ", "admin"));
        verify(appSettingRepository, never()).save(any());
    }

    @Test
    void testResolveServerDefaults_LayersPropertiesSettingsAndOverrides() {
        when(appSettingRepository.findByKeyIn(anyList())).thenReturn(List.of(
            new AppSetting(AppSettingService.DNS_SERVERS_KEY, "1.1.1.1", null),
            new AppSetting(AppSettingService.MTU_KEY, "", null)
        ));

        ServerDefaults defaults = appSettingService.resolveServerDefaults(
            new ServerDefaults(null, null, "0.0.0.0/0", null));

        assertEquals("cHJvcGVydHkta2V5", defaults.publicKey());
        assertEquals("1.1.1.1", defaults.dnsServers());
        assertEquals("0.0.0.0/0", defaults.allowedIps());
        assertNull(defaults.mtu());
    }

    @Test
    void testUpdateServerDefaults_NonNumericMtu_ThrowsBadRequest() {
        assertThrows(BadRequestException.class,
            () -> appSettingService.updateServerDefaults(new ServerDefaults(null, null, null, "large"), "admin"));
    }
}
