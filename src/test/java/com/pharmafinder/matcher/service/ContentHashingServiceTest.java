package com.pharmafinder.matcher.service;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ContentHashingServiceTest {

    private final ContentHashingService hashingService = new ContentHashingService();

    @Test
    void hashesWithSha256() {
        assertThat(hashingService.hash("abc".getBytes(StandardCharsets.UTF_8)))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void nullContentHasNoHash() {
        assertThat(hashingService.hash(null)).isNull();
    }
}
