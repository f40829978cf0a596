package com.example.filingcontacts.service;

/**
 * Every pause in the pipeline goes through this so tests can record delays instead of waiting.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;
}
