package com.ktb.dictionary.automaton;

import lombok.Value;

/**
 * 입력 문자열 안에서 발견된 사전 단어 하나. end 는 exclusive.
 */
@Value
public class WordMatch {
    String word;
    int start;
    int end;
}
