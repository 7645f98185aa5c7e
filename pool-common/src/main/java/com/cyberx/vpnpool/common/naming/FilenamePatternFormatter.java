package com.cyberx.vpnpool.common.naming;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders config filenames from a user-configurable pattern.
 *
 * <p>Supported placeholders:</p>
 * <ul>
 *   <li>{@code {id}} - credential id</li>
 *   <li>{@code {ipv4_address}} - IPv4 address, {@code unknown} if absent</li>
 *   <li>{@code {endpoint}} - endpoint with {@code :} replaced by {@code _}</li>
 *   <li>{@code {batch_id}} - first 8 characters of the request batch id</li>
 *   <li>{@code {username}}, {@code {user_id}} - from the requester</li>
 *   <li>{@code {index}} - position in a multi-file download, {@code 1} by default</li>
 * </ul>
 *
 * The result only contains {@code [A-Za-z0-9._-{}]} and always ends with {@code .conf}.
 */
public class FilenamePatternFormatter {

    public static final String EXTENSION = ".conf";

    private static final String UNKNOWN = "unknown";

    public String format(String pattern, NamedCredential credential, Requester requester, Integer index) {
        Map<String, String> replacements = new LinkedHashMap<>();
        replacements.put("id", credential.getId() != null ? String.valueOf(credential.getId()) : UNKNOWN);
        replacements.put("ipv4_address", orUnknown(credential.getIpv4Address()));
        replacements.put("endpoint", credential.getEndpoint() != null
            ? credential.getEndpoint().replace(':', '_')
            : UNKNOWN);
        String batchId = credential.getRequestBatchId();
        replacements.put("batch_id", batchId != null && !batchId.isEmpty()
            ? batchId.substring(0, Math.min(8, batchId.length()))
            : UNKNOWN);

        if (requester != null) {
            String username = requester.username();
            replacements.put("username", username != null && !username.isBlank()
                ? username
                : "user" + requester.userId());
            replacements.put("user_id", requester.userId() != null ? String.valueOf(requester.userId()) : UNKNOWN);
        } else {
            replacements.put("username", UNKNOWN);
            replacements.put("user_id", UNKNOWN);
        }
        replacements.put("index", index != null ? String.valueOf(index) : "1");

        String filename = pattern != null ? pattern : "";
        for (Map.Entry<String, String> entry : replacements.entrySet()) {
            filename = filename.replace("{" + entry.getKey() + "}", entry.getValue());
        }

        filename = sanitize(filename);
        if (!filename.endsWith(EXTENSION)) {
            filename += EXTENSION;
        }
        return filename;
    }

    private static String sanitize(String filename) {
        StringBuilder clean = new StringBuilder(filename.length());
        for (int i = 0; i < filename.length(); i++) {
            char c = filename.charAt(i);
            clean.append(isAllowed(c) ? c : '_');
        }
        return clean.toString();
    }

    private static boolean isAllowed(char c) {
        return (c >= 'A' && c <= 'Z')
            || (c >= 'a' && c <= 'z')
            || (c >= '0' && c <= '9')
            || c == '.' || c == '_' || c == '-' || c == '{' || c == '}';
    }

    private static String orUnknown(String value) {
        return value != null && !value.isEmpty() ? value : UNKNOWN;
    }
}
