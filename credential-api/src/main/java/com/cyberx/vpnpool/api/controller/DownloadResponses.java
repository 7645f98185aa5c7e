package com.cyberx.vpnpool.api.controller;

import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.nio.charset.StandardCharsets;

final class DownloadResponses {

    private DownloadResponses() {
    }

    static ResponseEntity<byte[]> config(String filename, String content) {
        return attachment(filename, MediaType.TEXT_PLAIN, content.getBytes(StandardCharsets.UTF_8));
    }

    static ResponseEntity<byte[]> zip(String filename, byte[] archive) {
        return attachment(filename, MediaType.parseMediaType("application/zip"), archive);
    }

    private static ResponseEntity<byte[]> attachment(String filename, MediaType type, byte[] body) {
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION,
                ContentDisposition.attachment().filename(filename).build().toString())
            .contentType(type)
            .body(body);
    }
}
