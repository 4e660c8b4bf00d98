package com.ktb.dictionary.automaton;

import lombok.Getter;

/**
 * 사전에 넣을 수 없는 단어(null, 빈 문자열)가 들어왔을 때.
 */
@Getter
public class InvalidWordException extends IllegalArgumentException {

    private final int index;

    public InvalidWordException(String message) {
        super(message);
        this.index = -1;
    }

    public InvalidWordException(int index, String message) {
        super(message + " (index=" + index + ")");
        this.index = index;
    }
}
