package com.ktb.dictionary.config;

import com.ktb.dictionary.service.DictionaryService;
import com.ktb.dictionary.service.WordListLoader;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.Charset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class DictionaryConfig {

    @Value("${dictionary.word-list:classpath:words.txt}")
    private String wordListLocation;

    @Value("${dictionary.charset:UTF-8}")
    private String charset;

    /**
     * 기동 시 단어 목록을 읽어 오토마톤을 만든다. 목록이 잘못되면 기동 실패.
     */
    @Bean(initMethod = "init")
    public DictionaryService dictionaryService(WordListLoader wordListLoader, MeterRegistry meterRegistry) {
        log.info("Dictionary source: {} ({})", wordListLocation, charset);
        return new DictionaryService(wordListLoader, meterRegistry, wordListLocation, Charset.forName(charset));
    }
}
