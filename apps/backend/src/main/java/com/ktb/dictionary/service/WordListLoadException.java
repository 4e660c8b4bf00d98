package com.ktb.dictionary.service;

public class WordListLoadException extends RuntimeException {

    public WordListLoadException(String message) {
        super(message);
    }

    public WordListLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
