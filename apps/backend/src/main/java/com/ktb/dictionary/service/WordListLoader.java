package com.ktb.dictionary.service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * 줄 단위 단어 목록 로더.
 * location 은 Spring 리소스 경로 (classpath:, file:, 상대 경로).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WordListLoader {

    private final ResourceLoader resourceLoader;

    public List<String> load(String location, Charset charset) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new WordListLoadException("단어 목록을 찾을 수 없습니다: " + location);
        }

        List<String> words = new ArrayList<>();
        int skipped = 0;

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), charset))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    skipped++;
                    continue;
                }
                words.add(line);
            }
        } catch (IOException e) {
            throw new WordListLoadException("단어 목록을 읽을 수 없습니다: " + location, e);
        }

        if (skipped > 0) {
            log.debug("Skipped {} empty lines in {}", skipped, location);
        }
        log.info("Loaded {} words from {}", words.size(), location);
        return words;
    }
}
