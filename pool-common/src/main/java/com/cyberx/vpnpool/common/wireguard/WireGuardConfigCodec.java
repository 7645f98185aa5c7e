package com.cyberx.vpnpool.common.wireguard;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parses and regenerates WireGuard {@code .conf} text.
 *
 * <p>Parsing is line based: {@code Key = Value} pairs, split on the first
 * {@code =} so base64 padding survives. Section headers and comments are
 * skipped, key names match case-insensitively.</p>
 *
 * <p>Generation always writes {@code [Interface]} before {@code [Peer]}, in the
 * fixed field order below, and writes an optional line only when a value is
 * resolved from the config itself or from the supplied {@link ServerDefaults}.</p>
 *
 * <pre>
 * [Interface]
 * PrivateKey, Address, DNS, MTU, Table, SaveConfig, FwMark
 *
 * [Peer]
 * PublicKey, PresharedKey, Endpoint, AllowedIPs, PersistentKeepalive
 * </pre>
 *
 * Stateless and thread-safe.
 */
@Slf4j
public class WireGuardConfigCodec {

    public static final String DEFAULT_PERSISTENT_KEEPALIVE = "25";

    private static final String LINE_END = "\n";

    // An empty optional value ("DNS =") is kept as "" so regeneration neither writes nor defaults it
    private static final Set<String> REQUIRED_KEYS = Set.of("privatekey", "endpoint");

    public WireGuardConfig parse(String text) {
        return parse(text, null);
    }

    /**
     * Parse config text.
     *
     * @param text raw config text
     * @param endpointOverride endpoint to use instead of the one in the text, may be null
     * @return parsed config with derived address fields populated
     * @throws MalformedConfigException if PrivateKey, Address or Endpoint cannot be resolved
     */
    public WireGuardConfig parse(String text, String endpointOverride) {
        WireGuardConfig config = new WireGuardConfig();
        List<String> addresses = new ArrayList<>();

        String source = text == null ? "" : text;
        for (String rawLine : source.split("\n")) {
            String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";") || line.startsWith("[")) {
                continue;
            }
            int separator = line.indexOf('=');
            if (separator <= 0) {
                continue;
            }
            String key = line.substring(0, separator).strip().toLowerCase(Locale.ROOT);
            String value = line.substring(separator + 1).strip();
            if (value.isEmpty() && REQUIRED_KEYS.contains(key)) {
                continue;
            }

            switch (key) {
                case "privatekey" -> config.setPrivateKey(value);
                case "address" -> {
                    for (String part : value.split(",")) {
                        String address = part.strip();
                        if (!address.isEmpty()) {
                            addresses.add(address);
                        }
                    }
                }
                case "dns" -> config.setDns(value);
                case "mtu" -> config.setMtu(value);
                case "table" -> config.setTable(value);
                case "saveconfig" -> config.setSaveConfig(value);
                case "fwmark" -> config.setFwMark(value);
                case "publickey" -> config.setPublicKey(value);
                case "presharedkey" -> config.setPresharedKey(value);
                case "endpoint" -> config.setEndpoint(value);
                case "allowedips" -> config.setAllowedIps(value);
                case "persistentkeepalive" -> config.setPersistentKeepalive(value);
                default -> log.debug("Ignoring unrecognized WireGuard key: {}", key);
            }
        }

        if (endpointOverride != null && !endpointOverride.isBlank()) {
            config.setEndpoint(endpointOverride.strip());
        }
        config.setAddresses(addresses);

        List<String> missing = new ArrayList<>();
        if (config.getPrivateKey() == null) {
            missing.add("PrivateKey");
        }
        if (addresses.isEmpty()) {
            missing.add("Address");
        }
        if (config.getEndpoint() == null) {
            missing.add("Endpoint");
        }
        if (!missing.isEmpty()) {
            throw new MalformedConfigException(missing);
        }

        classifyAddresses(config);
        return config;
    }

    /**
     * Regenerate config text.
     *
     * @param config credential values; non-null optional fields always win, an empty one suppresses its line
     * @param defaults fallback for PublicKey, DNS, AllowedIPs and MTU, may be null
     * @return config text terminated by a newline
     */
    public String generate(WireGuardConfig config, ServerDefaults defaults) {
        ServerDefaults fallback = defaults != null ? defaults : ServerDefaults.none();
        StringBuilder out = new StringBuilder();

        out.append("[Interface]").append(LINE_END);
        appendLine(out, "PrivateKey", config.getPrivateKey());
        appendLine(out, "Address", config.getInterfaceIp());
        appendLine(out, "DNS", resolve(config.getDns(), fallback.dnsServers()));
        appendLine(out, "MTU", resolve(config.getMtu(), fallback.mtu()));
        appendLine(out, "Table", config.getTable());
        appendLine(out, "SaveConfig", config.getSaveConfig());
        appendLine(out, "FwMark", config.getFwMark());

        out.append(LINE_END);
        out.append("[Peer]").append(LINE_END);
        appendLine(out, "PublicKey", resolve(config.getPublicKey(), fallback.publicKey()));
        appendLine(out, "PresharedKey", config.getPresharedKey());
        appendLine(out, "Endpoint", config.getEndpoint());
        appendLine(out, "AllowedIPs", resolve(config.getAllowedIps(), fallback.allowedIps()));
        appendLine(out, "PersistentKeepalive",
            resolve(config.getPersistentKeepalive(), DEFAULT_PERSISTENT_KEEPALIVE));

        return out.toString();
    }

    /**
     * SHA-256 of the config text as lowercase hex. Used as the dedup key.
     */
    public static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static void classifyAddresses(WireGuardConfig config) {
        config.setIpv4Address(null);
        config.setIpv6Local(null);
        config.setIpv6Global(null);
        for (String address : config.getAddresses()) {
            int slash = address.indexOf('/');
            String ip = slash >= 0 ? address.substring(0, slash) : address;
            String lower = ip.toLowerCase(Locale.ROOT);
            if (ip.contains(".")) {
                if (config.getIpv4Address() == null) {
                    config.setIpv4Address(ip);
                }
            } else if (lower.startsWith("fd00:") || lower.startsWith("fe80:")) {
                if (config.getIpv6Local() == null) {
                    config.setIpv6Local(ip);
                }
            } else if (ip.contains(":")) {
                if (config.getIpv6Global() == null) {
                    config.setIpv6Global(ip);
                }
            }
        }
    }

    private static String resolve(String own, String fallback) {
        return own != null ? own : fallback;
    }

    private static void appendLine(StringBuilder out, String key, String value) {
        if (value == null || value.isEmpty()) {
            return;
        }
        out.append(key).append(" = ").append(value).append(LINE_END);
    }
}
