package com.cyberx.vpnpool.api.config;

import com.cyberx.vpnpool.common.naming.FilenamePatternFormatter;
import com.cyberx.vpnpool.common.wireguard.WireGuardConfigCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CodecConfig {

    @Bean
    public WireGuardConfigCodec wireGuardConfigCodec() {
        return new WireGuardConfigCodec();
    }

    @Bean
    public FilenamePatternFormatter filenamePatternFormatter() {
        return new FilenamePatternFormatter();
    }
}
