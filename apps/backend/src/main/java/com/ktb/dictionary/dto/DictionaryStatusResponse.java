package com.ktb.dictionary.dto;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DictionaryStatusResponse {

    private boolean success;

    private boolean loaded;

    /** 서로 다른 단어 수 */
    private int wordCount;

    /** root 포함 트라이 노드 수 */
    private int nodeCount;

    private String source;

    private Instant loadedAt;
}
