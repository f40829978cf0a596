package com.example.filingcontacts.service.storage;

import com.example.filingcontacts.dto.StoredObject;

import java.io.IOException;
import java.util.List;

/**
 * Where filings live before extraction.
 */
public interface DocumentStore {

    byte[] fetchBytes(String key) throws IOException;

    List<StoredObject> list(String prefix) throws IOException;

    void upload(String key, byte[] bytes) throws IOException;

    void delete(String key) throws IOException;

    /**
     * Bucket or container name, used by services that address objects directly.
     */
    String getLocation();
}
